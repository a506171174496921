package com.gentoro.graphrag.retrieval.search;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads date ranges out of free text: ISO and US dates, "March 15, 2024", "15 March 2024", "March
 * 2024", "Q3 2024", "FY2024", bare years, and the connectives between/and, from/to, after, since,
 * before and until. Fiscal years are treated as calendar years.
 */
public final class TemporalParser {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(TemporalParser.class);

  private static final String MONTH =
      "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
          + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";

  private static final List<AtomPattern> ATOMS =
      List.of(
          new AtomPattern(
              "\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b",
              m -> TemporalRange.day(date(m.group(1), m.group(2), m.group(3)))),
          new AtomPattern(
              "\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b",
              m -> TemporalRange.day(date(m.group(3), m.group(1), m.group(2)))),
          new AtomPattern(
              "\\b" + MONTH + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
              m -> TemporalRange.day(date(m.group(3), month(m.group(1)), m.group(2)))),
          new AtomPattern(
              "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH + ",?\\s+(\\d{4})\\b",
              m -> TemporalRange.day(date(m.group(3), month(m.group(2)), m.group(1)))),
          new AtomPattern(
              "\\b" + MONTH + ",?\\s+(\\d{4})\\b",
              m -> TemporalRange.month(Integer.parseInt(m.group(2)), month(m.group(1)))),
          new AtomPattern(
              "\\bQ([1-4])\\s*(?:of\\s+)?(?:FY\\s*)?(\\d{4})\\b",
              m ->
                  TemporalRange.quarter(
                      Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)))),
          new AtomPattern(
              "\\b(?:FY|fiscal\\s+year)\\s*'?(\\d{4}|\\d{2})\\b",
              m -> TemporalRange.year(fullYear(m.group(1)))),
          new AtomPattern(
              "\\b(1[89]\\d{2}|2[01]\\d{2})\\b",
              m -> TemporalRange.year(Integer.parseInt(m.group(1)))));

  private static final Pattern OPERATOR =
      Pattern.compile(
          "(?:^|\\W)(between|from|after|since|starting|before|prior to|until|through|by)\\s*$");
  private static final Pattern RANGE_JOIN =
      Pattern.compile("^\\s*(?:and|to|through|until|-|–)\\s*$");
  private static final Pattern TEMPORAL_CUE =
      Pattern.compile(
          "\\b(when|deadlines?|due|dates?|dated|how long|duration|expir\\w*|timeline|schedule"
              + "|period|renew\\w*|terminat\\w*|effective)\\b",
          Pattern.CASE_INSENSITIVE);

  private TemporalParser() {}

  private record AtomPattern(Pattern pattern, Function<Matcher, TemporalRange> factory) {
    AtomPattern(String regex, Function<Matcher, TemporalRange> factory) {
      this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), factory);
    }
  }

  private record Atom(int start, int end, TemporalRange range) {}

  /** Ranges mentioned in {@code text}, in order of appearance. */
  public static List<TemporalRange> parse(String text) {
    List<TemporalRange> out = new ArrayList<>();
    if (text == null || text.isBlank()) return out;
    List<Atom> atoms = atoms(text);
    String lower = text.toLowerCase(Locale.ROOT);
    int previousEnd = 0;
    for (int i = 0; i < atoms.size(); i++) {
      Atom atom = atoms.get(i);
      Matcher op = OPERATOR.matcher(lower.substring(previousEnd, atom.start()));
      String operator = op.find() ? op.group(1) : "";
      TemporalRange r = atom.range();
      if ((operator.equals("between") || operator.equals("from")) && i + 1 < atoms.size()) {
        Atom next = atoms.get(i + 1);
        if (RANGE_JOIN.matcher(lower.substring(atom.end(), next.start())).matches()
            && !next.range().end().isBefore(r.start())) {
          out.add(new TemporalRange(r.start(), next.range().end()));
          previousEnd = next.end();
          i++;
          continue;
        }
      }
      TemporalRange bounded = applyOperator(operator, r);
      if (bounded != null) {
        out.add(bounded);
      } else {
        log.trace("Skipping '{} {}': nothing lies beyond the calendar bounds", operator, r);
      }
      previousEnd = atom.end();
    }
    return out;
  }

  /** The range an operator makes of {@code r}, or null when it would lie outside the calendar. */
  private static TemporalRange applyOperator(String operator, TemporalRange r) {
    return switch (operator) {
      case "after" -> r.end().isBefore(TemporalRange.OPEN_END)
          ? new TemporalRange(r.end().plusDays(1), TemporalRange.OPEN_END)
          : null;
      case "since", "from", "starting" -> new TemporalRange(r.start(), TemporalRange.OPEN_END);
      case "before", "prior to" -> r.start().isAfter(TemporalRange.OPEN_START)
          ? new TemporalRange(TemporalRange.OPEN_START, r.start().minusDays(1))
          : null;
      case "until", "through", "by" -> new TemporalRange(TemporalRange.OPEN_START, r.end());
      default -> r;
    };
  }

  /** Whether the text asks about time without necessarily naming a date. */
  public static boolean hasTemporalCue(String text) {
    return text != null && TEMPORAL_CUE.matcher(text).find();
  }

  private static List<Atom> atoms(String text) {
    List<Atom> found = new ArrayList<>();
    for (AtomPattern p : ATOMS) {
      Matcher m = p.pattern().matcher(text);
      while (m.find()) {
        try {
          TemporalRange range = p.factory().apply(m);
          if (range.start().isBefore(TemporalRange.OPEN_START)) {
            log.trace("Skipping '{}': before year 1", m.group());
            continue;
          }
          found.add(new Atom(m.start(), m.end(), range));
        } catch (DateTimeException | IllegalArgumentException e) {
          log.trace("Skipping '{}': {}", m.group(), e.getMessage());
        }
      }
    }
    found.sort(Comparator.comparingInt(Atom::start).thenComparingInt(a -> a.start() - a.end()));
    List<Atom> out = new ArrayList<>();
    int covered = 0;
    for (Atom a : found) {
      if (a.start() >= covered) {
        out.add(a);
        covered = a.end();
      }
    }
    return out;
  }

  private static LocalDate date(String year, String month, String day) {
    return date(year, Integer.parseInt(month), day);
  }

  private static LocalDate date(String year, int month, String day) {
    return LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day));
  }

  private static int fullYear(String digits) {
    int y = Integer.parseInt(digits);
    return digits.length() == 2 ? 2000 + y : y;
  }

  private static int month(String name) {
    String n = name.toLowerCase(Locale.ROOT);
    return switch (n.substring(0, 3)) {
      case "jan" -> 1;
      case "feb" -> 2;
      case "mar" -> 3;
      case "apr" -> 4;
      case "may" -> 5;
      case "jun" -> 6;
      case "jul" -> 7;
      case "aug" -> 8;
      case "sep" -> 9;
      case "oct" -> 10;
      case "nov" -> 11;
      case "dec" -> 12;
      default -> throw new IllegalArgumentException("Unknown month: " + name);
    };
  }
}
