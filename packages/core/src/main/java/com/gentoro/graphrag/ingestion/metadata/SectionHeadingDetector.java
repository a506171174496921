package com.gentoro.graphrag.ingestion.metadata;

import com.gentoro.graphrag.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Finds the first line of a chunk that looks like a section heading. */
public final class SectionHeadingDetector {
  static final int MAX_HEADING_LENGTH = 120;

  private final List<Pattern> patterns;

  public SectionHeadingDetector(List<String> patterns) {
    this.patterns = new ArrayList<>(patterns.size());
    for (String p : patterns) {
      try {
        this.patterns.add(Pattern.compile(p, Pattern.MULTILINE));
      } catch (PatternSyntaxException e) {
        throw new ValidationException(
            "Invalid section heading pattern", Map.of("pattern", p, "reason", e.getDescription()));
      }
    }
  }

  /** The heading line nearest to the start of {@code text}, if any pattern matches. */
  public Optional<String> detect(String text) {
    if (text == null || text.isBlank()) return Optional.empty();
    int best = -1;
    for (Pattern p : patterns) {
      Matcher m = p.matcher(text);
      if (m.find() && (best < 0 || m.start() < best)) {
        best = m.start();
      }
    }
    if (best < 0) return Optional.empty();
    int lineStart = text.lastIndexOf('\n', best) + 1;
    int lineEnd = text.indexOf('\n', best);
    String line = text.substring(lineStart, lineEnd < 0 ? text.length() : lineEnd).strip();
    if (line.length() > MAX_HEADING_LENGTH) {
      line = line.substring(0, MAX_HEADING_LENGTH).strip();
    }
    return line.isEmpty() ? Optional.empty() : Optional.of(line);
  }
}
