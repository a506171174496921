package com.gentoro.graphrag.retrieval.search;

import java.time.LocalDate;
import java.util.Objects;

/** Closed date interval; open-ended ranges use {@link #OPEN_START} or {@link #OPEN_END}. */
public record TemporalRange(LocalDate start, LocalDate end) {
  public static final LocalDate OPEN_START = LocalDate.of(1, 1, 1);
  public static final LocalDate OPEN_END = LocalDate.of(9999, 12, 31);

  public TemporalRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Range ends before it starts: " + start + ".." + end);
    }
  }

  public static TemporalRange day(LocalDate date) {
    return new TemporalRange(date, date);
  }

  public static TemporalRange month(int year, int month) {
    LocalDate first = LocalDate.of(year, month, 1);
    return new TemporalRange(first, first.withDayOfMonth(first.lengthOfMonth()));
  }

  public static TemporalRange quarter(int year, int quarter) {
    LocalDate first = LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
    return new TemporalRange(first, first.plusMonths(3).minusDays(1));
  }

  public static TemporalRange year(int year) {
    return new TemporalRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
  }

  public boolean intersects(TemporalRange other) {
    return !start.isAfter(other.end) && !other.start.isAfter(end);
  }

  /** Latest concrete year the range touches, ignoring open ends. */
  public int latestYear() {
    return end.equals(OPEN_END) ? start.getYear() : end.getYear();
  }
}
