package com.gentoro.graphrag.utility;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'_-]*");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(\\s|$)");

  /** English stopwords plus the boilerplate vocabulary of legal and business documents. */
  public static final Set<String> STOPWORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "these", "those", "such", "have", "had", "been", "being", "their", "they", "them",
          "which", "who", "whom", "would", "could", "should", "may", "shall", "must", "can", "any",
          "all", "each", "every", "other", "some", "no", "not", "only", "same", "so", "than", "too",
          "very", "just", "also", "now", "here", "there", "when", "where", "why", "how", "what",
          "if", "then", "else", "but", "however", "therefore", "hereby", "herein", "hereto",
          "hereof", "thereof", "thereto", "wherein", "whereas", "whereof", "hereunder",
          "thereunder", "pursuant", "notwithstanding", "provided", "including", "without", "upon",
          "between", "among", "under", "above", "below", "during", "before", "after", "until",
          "unless", "except", "regarding", "do", "does", "did", "about", "tell", "me", "show",
          "find", "list", "give", "i", "we", "you", "our", "your");

  /**
   * Extract the body of a fenced code block ({@code ```json ... ```}); returns {@code null} when
   * text has no such block.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }
    Pattern pattern = Pattern.compile("(?s)```%s\\s*(.+?)\\s*```".formatted(Pattern.quote(type)));
    Matcher matcher = pattern.matcher(text);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return null;
  }

  /** Lower-cased word tokens in order of appearance. */
  public static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    if (text == null) return out;
    Matcher m = WORD.matcher(text);
    while (m.find()) {
      out.add(m.group().toLowerCase(Locale.ROOT));
    }
    return out;
  }

  /** Distinct, lower-cased, non-stopword terms of at least three characters. */
  public static Set<String> significantTerms(String text) {
    Set<String> out = new LinkedHashSet<>();
    for (String w : words(text)) {
      if (w.length() >= 3 && !STOPWORDS.contains(w)) {
        out.add(w);
      }
    }
    return out;
  }

  /** Number of non-overlapping, case-insensitive occurrences of {@code needle}. */
  public static int countOccurrences(String haystack, String needle) {
    if (haystack == null || needle == null || needle.isEmpty()) return 0;
    String h = haystack.toLowerCase(Locale.ROOT);
    String n = needle.toLowerCase(Locale.ROOT);
    int count = 0;
    int idx = h.indexOf(n);
    while (idx >= 0) {
      count++;
      idx = h.indexOf(n, idx + n.length());
    }
    return count;
  }

  public static boolean containsIgnoreCase(String haystack, String needle) {
    return countOccurrences(haystack, needle) > 0;
  }

  public static int countSentences(String text) {
    if (text == null || text.isBlank()) return 0;
    Matcher m = SENTENCE_END.matcher(text.trim());
    int count = 0;
    int lastEnd = 0;
    while (m.find()) {
      count++;
      lastEnd = m.end();
    }
    return lastEnd < text.trim().length() ? count + 1 : count;
  }
}
