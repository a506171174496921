package com.gentoro.graphrag.ingestion.metadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based detection of dates, durations and relative temporal phrases. Overlapping matches
 * are collapsed to the longer one.
 */
public final class TemporalReferenceExtractor {
  static final String MONTHS =
      "(?:January|February|March|April|May|June|July|August|September|October|November|December"
          + "|Jan|Feb|Mar|Apr|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)";

  private static final List<Pattern> DATE_PATTERNS =
      compile(
          "\\b" + MONTHS + "[.\\s]+\\d{1,2}[,\\s]+\\d{4}\\b",
          "\\b\\d{1,2}[.\\s]+" + MONTHS + "[,\\s]+\\d{4}\\b",
          "\\b\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}\\b",
          "\\b\\d{1,2}[-/]\\d{1,2}[-/]\\d{4}\\b",
          "\\b[Qq][1-4]\\s+\\d{4}\\b",
          "\\b[Ff][Yy]\\s*\\d{4}\\b");

  private static final List<Pattern> DURATION_PATTERNS =
      compile(
          "\\b(?:(?:\\w+\\s+)?\\(?\\d+\\)?\\s+)?(?:calendar\\s+|business\\s+|working\\s+)?"
              + "(?:days?|weeks?|months?|quarters?|years?)\\b",
          "\\b(?:one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve)\\s+"
              + "(?:days?|weeks?|months?|quarters?|years?)\\b",
          "\\ba\\s+(?:day|week|month|quarter|year)\\b");

  private static final List<Pattern> RELATIVE_PATTERNS =
      compile(
          "\\b(?:effective\\s+date|commencement\\s+date|termination\\s+date|closing\\s+date"
              + "|execution\\s+date)\\b",
          "\\b(?:upon|after|before|prior\\s+to|following|within)\\s+"
              + "(?:signing|execution|termination|closing|expiration)\\b",
          "\\b(?:immediately|promptly|forthwith)\\s+(?:upon|after|following)\\b",
          "\\b(?:at\\s+any\\s+time|from\\s+time\\s+to\\s+time)\\b",
          "\\b(?:until|unless|so\\s+long\\s+as)\\b");

  private final boolean dates;
  private final boolean durations;
  private final boolean relative;

  public TemporalReferenceExtractor(boolean dates, boolean durations, boolean relative) {
    this.dates = dates;
    this.durations = durations;
    this.relative = relative;
  }

  private record Span(int start, int end, String text) {}

  /** Distinct references in order of appearance. */
  public List<String> extract(String text) {
    if (text == null || text.isBlank()) return List.of();
    List<Span> spans = new ArrayList<>();
    if (dates) collect(text, DATE_PATTERNS, spans);
    if (durations) collect(text, DURATION_PATTERNS, spans);
    if (relative) collect(text, RELATIVE_PATTERNS, spans);
    spans.sort(Comparator.comparingInt(Span::start));

    List<Span> kept = new ArrayList<>();
    for (Span s : spans) {
      if (!kept.isEmpty() && s.start() < kept.get(kept.size() - 1).end()) {
        if (s.text().length() > kept.get(kept.size() - 1).text().length()) {
          kept.set(kept.size() - 1, s);
        }
      } else {
        kept.add(s);
      }
    }
    Set<String> out = new LinkedHashSet<>();
    kept.forEach(s -> out.add(s.text()));
    return List.copyOf(out);
  }

  private static void collect(String text, List<Pattern> patterns, List<Span> sink) {
    for (Pattern p : patterns) {
      Matcher m = p.matcher(text);
      while (m.find()) {
        String value = m.group().strip();
        if (!value.isEmpty()) sink.add(new Span(m.start(), m.end(), value));
      }
    }
  }

  private static List<Pattern> compile(String... regexes) {
    List<Pattern> out = new ArrayList<>(regexes.length);
    for (String r : regexes) {
      out.add(Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }
    return List.copyOf(out);
  }
}
