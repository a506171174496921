package com.gentoro.graphrag.retrieval.search;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TemporalParserTest {

  @Test
  @DisplayName("ISO dates and written dates become single days")
  void days() {
    assertEquals(
        List.of(TemporalRange.day(LocalDate.of(2024, 3, 15))),
        TemporalParser.parse("signed 2024-03-15"));
    assertEquals(
        List.of(TemporalRange.day(LocalDate.of(2024, 1, 1))),
        TemporalParser.parse("entered into on January 1, 2024."));
    assertEquals(
        List.of(TemporalRange.day(LocalDate.of(2024, 6, 30))),
        TemporalParser.parse("no later than 30th of June 2024"));
  }

  @Test
  @DisplayName("Months, quarters and fiscal years cover their whole period")
  void periods() {
    assertEquals(List.of(TemporalRange.month(2024, 2)), TemporalParser.parse("in Feb 2024"));
    assertEquals(
        new TemporalRange(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 9, 30)),
        TemporalParser.parse("revenue for Q3 2024").get(0));
    assertEquals(List.of(TemporalRange.year(2024)), TemporalParser.parse("budget for FY24"));
    assertEquals(List.of(TemporalRange.year(2023)), TemporalParser.parse("the 2023 renewal"));
  }

  @Test
  @DisplayName("Open-ended operators at the calendar bounds yield nothing")
  void openEndedAtCalendarBounds() {
    assertEquals(List.of(), TemporalParser.parse("after December 31, 9999"));
    assertEquals(List.of(), TemporalParser.parse("before 0001-01-01"));
    assertEquals(List.of(), TemporalParser.parse("until 0000-06-01"));
    assertEquals(
        List.of(new TemporalRange(LocalDate.of(9999, 12, 31), TemporalRange.OPEN_END)),
        TemporalParser.parse("since December 31, 9999"));
    assertEquals(
        List.of(TemporalRange.year(2024)),
        TemporalParser.parse("after December 31, 9999 and in 2024"));
  }

  @Test
  @DisplayName("between ... and ... joins two mentions into one range")
  void betweenRange() {
    List<TemporalRange> ranges =
        TemporalParser.parse("payments between January 2024 and March 2024");

    assertEquals(
        List.of(new TemporalRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31))), ranges);
  }

  @Test
  @DisplayName("Open-ended operators extend the range to either end")
  void openEnded() {
    assertEquals(
        new TemporalRange(LocalDate.of(2024, 1, 1), TemporalRange.OPEN_END),
        TemporalParser.parse("anything after 2023").get(0));
    assertEquals(
        new TemporalRange(TemporalRange.OPEN_START, LocalDate.of(2023, 12, 31)),
        TemporalParser.parse("obligations before 2024").get(0));
    assertEquals(
        new TemporalRange(LocalDate.of(2022, 1, 1), TemporalRange.OPEN_END),
        TemporalParser.parse("in force since 2022").get(0));
  }

  @Test
  @DisplayName("Invalid calendar dates are skipped")
  void invalidDateSkipped() {
    List<TemporalRange> ranges = TemporalParser.parse("on 2024-02-30");

    assertEquals(List.of(TemporalRange.year(2024)), ranges);
  }

  @Test
  @DisplayName("Temporal cues are detected without concrete dates")
  void cues() {
    assertTrue(TemporalParser.hasTemporalCue("When is the payment due?"));
    assertTrue(TemporalParser.hasTemporalCue("What is the contract duration?"));
    assertFalse(TemporalParser.hasTemporalCue("Who supplies the software?"));
    assertTrue(TemporalParser.parse("Who supplies the software?").isEmpty());
    assertTrue(TemporalParser.parse(null).isEmpty());
  }

  @Test
  @DisplayName("Ranges intersect when they share at least one day")
  void intersects() {
    TemporalRange q1 = TemporalRange.quarter(2024, 1);

    assertTrue(q1.intersects(TemporalRange.day(LocalDate.of(2024, 3, 31))));
    assertFalse(q1.intersects(TemporalRange.day(LocalDate.of(2024, 4, 1))));
    TemporalRange open = new TemporalRange(LocalDate.of(2024, 5, 1), TemporalRange.OPEN_END);

    assertEquals(2024, open.latestYear());
    assertThrows(
        IllegalArgumentException.class,
        () -> new TemporalRange(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
  }
}
