package com.gentoro.graphrag.ingestion.metadata;

import com.gentoro.graphrag.strategy.KeyTermMethod;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts key terms from chunk text. Explicitly defined terms (quoted, parenthesized or introduced
 * by "means") come first; with {@link KeyTermMethod#SIMPLE} the rest is filled with the most
 * frequent non-stopword words.
 */
public final class KeyTermExtractor {
  private static final List<Pattern> DEFINED_TERM_PATTERNS =
      List.of(
          Pattern.compile("\"([A-Z][^\"]{2,50})\""),
          Pattern.compile("'([A-Z][^']{2,50})'"),
          Pattern.compile("\\(the\\s+\"([^\"]+)\"\\)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\(\"([^\"]+)\"\\)"),
          Pattern.compile(
              "(?:means|refers\\s+to|shall\\s+mean)\\s+([A-Za-z][^.,]{3,50})",
              Pattern.CASE_INSENSITIVE));

  private static final Pattern WORD = Pattern.compile("\\b[A-Za-z]+(?:\\s+[A-Z][a-z]+)*\\b");

  private final KeyTermMethod method;
  private final int maxTerms;

  public KeyTermExtractor(KeyTermMethod method, int maxTerms) {
    this.method = method;
    this.maxTerms = maxTerms;
  }

  public List<String> extract(String text) {
    if (text == null || text.isBlank() || maxTerms <= 0) return List.of();
    List<String> terms = new ArrayList<>();
    List<String> defined = definedTerms(text);
    int definedCap = method == KeyTermMethod.REGEX ? maxTerms : Math.max(1, maxTerms / 2);
    terms.addAll(defined.subList(0, Math.min(definedCap, defined.size())));
    if (method != KeyTermMethod.REGEX && terms.size() < maxTerms) {
      Set<String> exclude = new HashSet<>();
      terms.forEach(t -> exclude.add(t.toLowerCase(Locale.ROOT)));
      terms.addAll(byFrequency(text, maxTerms - terms.size(), exclude));
    }
    return List.copyOf(terms.subList(0, Math.min(maxTerms, terms.size())));
  }

  static List<String> definedTerms(String text) {
    List<String> out = new ArrayList<>();
    for (Pattern p : DEFINED_TERM_PATTERNS) {
      Matcher m = p.matcher(text);
      while (m.find()) {
        String term = m.group(1).strip().replaceAll("\\s+", " ");
        if (term.length() > 2 && !out.contains(term)) {
          out.add(term);
        }
      }
    }
    return out;
  }

  private static List<String> byFrequency(String text, int limit, Set<String> exclude) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    Matcher m = WORD.matcher(text);
    while (m.find()) {
      String word = m.group();
      String lower = word.toLowerCase(Locale.ROOT);
      if (word.length() <= 2
          || StringUtility.STOPWORDS.contains(lower)
          || exclude.contains(lower)) {
        continue;
      }
      boolean properNoun =
          Character.isUpperCase(word.charAt(0)) && Character.isLowerCase(word.charAt(1));
      counts.merge(properNoun ? word : lower, 1, Integer::sum);
    }
    // Stable by first appearance on equal counts
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(limit)
        .map(Map.Entry::getKey)
        .toList();
  }
}
