package com.gentoro.graphrag.retrieval.intent;

import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.schema.SchemaDescriptor;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based analysis that needs no model.
 *
 * <ul>
 *   <li>entity types: schema types named in the question, singular or plural
 *   <li>keywords: significant terms of the question
 *   <li>search text: a quoted phrase, else the longest run of capitalized words after the first
 *       word, else the keywords joined by spaces
 * </ul>
 *
 * Temporal hints are left empty; the temporal signal reads the question itself when auto
 * detection is on.
 */
public class HeuristicIntentAnalyzer implements IntentAnalyzer {
  static final int MAX_KEYWORDS = 10;

  private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"”]{2,})[\"”]");
  private static final Pattern CAPITALIZED_RUN =
      Pattern.compile("\\b([A-Z][\\w&.-]*(?:\\s+[A-Z][\\w&.-]*)*)");
  private static final Pattern TEMPORAL_QUESTION =
      Pattern.compile("\\b(when|deadline|how long|until|expire\\w*)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern AGGREGATE_QUESTION =
      Pattern.compile("\\b(how many|how much|total|count|sum)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHO_QUESTION =
      Pattern.compile("^\\s*(who|which party|which parties)\\b", Pattern.CASE_INSENSITIVE);

  private final SchemaDescriptor schema;

  public HeuristicIntentAnalyzer(SchemaDescriptor schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  public QueryIntent analyze(String question) {
    String q = question == null ? "" : question.trim();
    List<String> keywords =
        StringUtility.significantTerms(q).stream().limit(MAX_KEYWORDS).toList();
    return new QueryIntent(
        classify(q),
        entityTypes(q),
        keywords,
        null,
        null,
        searchText(q, keywords),
        null,
        null,
        question);
  }

  static String classify(String question) {
    if (TEMPORAL_QUESTION.matcher(question).find()) return "temporal";
    if (AGGREGATE_QUESTION.matcher(question).find()) return "aggregation";
    if (WHO_QUESTION.matcher(question).find()) return "entity_lookup";
    return QueryIntent.GENERAL;
  }

  private List<String> entityTypes(String question) {
    List<String> words = StringUtility.words(question);
    List<String> out = new ArrayList<>();
    for (String type : schema.entityTypes()) {
      String t = type.toLowerCase(Locale.ROOT);
      if (words.contains(t) || words.contains(t + "s") || words.contains(t + "es")) {
        out.add(type);
      } else if (t.endsWith("y") && words.contains(t.substring(0, t.length() - 1) + "ies")) {
        out.add(type);
      }
    }
    return out;
  }

  static String searchText(String question, List<String> keywords) {
    Matcher quoted = QUOTED.matcher(question);
    if (quoted.find()) {
      return quoted.group(1).trim();
    }
    String best = null;
    Matcher caps = CAPITALIZED_RUN.matcher(question);
    while (caps.find()) {
      if (caps.start() == firstWordStart(question)) continue;
      String run = caps.group(1).replaceAll("[.]+$", "");
      if (best == null || run.length() > best.length()) best = run;
    }
    if (best != null) return best;
    return keywords.isEmpty() ? null : String.join(" ", keywords);
  }

  private static int firstWordStart(String question) {
    for (int i = 0; i < question.length(); i++) {
      if (Character.isLetterOrDigit(question.charAt(i))) return i;
    }
    return -1;
  }
}
