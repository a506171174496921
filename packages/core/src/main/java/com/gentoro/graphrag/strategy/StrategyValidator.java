package com.gentoro.graphrag.strategy;

import com.gentoro.graphrag.exception.StrategyValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Range checks for strategy trees. Every violation is collected before failing. */
public final class StrategyValidator {
  private static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warning");

  private StrategyValidator() {}

  public static ExtractionStrategy validate(ExtractionStrategy s) {
    List<String> v = new ArrayList<>();
    range(v, "chunking.chunk_size", s.chunking().chunkSize(), 100, 10_000);
    range(v, "chunking.chunk_overlap", s.chunking().chunkOverlap(), 0, 500);
    if (s.chunking().chunkOverlap() >= s.chunking().chunkSize()) {
      v.add("chunking.chunk_overlap must be smaller than chunking.chunk_size");
    }
    if (s.chunks().maxTextLength() < 0) {
      v.add("chunks.max_text_length must be >= 0 (0 means unlimited)");
    }
    range(v, "metadata.key_terms.max_terms", s.metadata().keyTerms().maxTerms(), 1, 50);
    for (String p : s.metadata().sectionHeadings().patterns()) {
      try {
        Pattern.compile(p);
      } catch (PatternSyntaxException e) {
        v.add("metadata.section_headings.patterns contains an invalid regex: " + p);
      }
    }
    if (!LOG_LEVELS.contains(s.validation().logLevel())) {
      v.add("validation.log_level must be one of " + LOG_LEVELS);
    }
    return failIfAny("extraction", s, v);
  }

  public static RetrievalStrategy validate(RetrievalStrategy s) {
    List<String> v = new ArrayList<>();
    range(v, "search.graph_traversal.max_depth", s.search().graphTraversal().maxDepth(), 1, 5);
    unit(
        v,
        "search.keyword_matching.match_threshold",
        s.search().keywordMatching().matchThreshold());
    range(v, "context.expand_neighbors.before", s.context().expandNeighbors().before(), 0, 5);
    range(v, "context.expand_neighbors.after", s.context().expandNeighbors().after(), 0, 5);
    RetrievalStrategy.Scoring sc = s.scoring();
    unit(v, "scoring.entity_confidence_min", sc.entityConfidenceMin());
    nonNegative(v, "scoring.graph_match_weight", sc.graphMatchWeight());
    nonNegative(v, "scoring.text_match_weight", sc.textMatchWeight());
    nonNegative(v, "scoring.keyword_match_weight", sc.keywordMatchWeight());
    nonNegative(v, "scoring.temporal_match_weight", sc.temporalMatchWeight());
    range(v, "limits.max_chunks", s.limits().maxChunks(), 1, 50);
    range(v, "limits.max_entities", s.limits().maxEntities(), 1, 100);
    range(v, "limits.max_context_tokens", s.limits().maxContextTokens(), 500, 32_000);
    return failIfAny("retrieval", s, v);
  }

  public static StrategyPair validate(StrategyPair pair) {
    validate(pair.extraction());
    validate(pair.retrieval());
    return pair;
  }

  private static void range(List<String> v, String key, int value, int min, int max) {
    if (value < min || value > max) {
      v.add("%s must be between %d and %d (was %d)".formatted(key, min, max, value));
    }
  }

  private static void unit(List<String> v, String key, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      v.add("%s must be between 0.0 and 1.0 (was %s)".formatted(key, value));
    }
  }

  private static void nonNegative(List<String> v, String key, double value) {
    if (Double.isNaN(value) || value < 0.0) {
      v.add("%s must be >= 0 (was %s)".formatted(key, value));
    }
  }

  private static <T> T failIfAny(String kind, T strategy, List<String> violations) {
    if (!violations.isEmpty()) {
      throw new StrategyValidationException(
          "Invalid %s strategy: %s".formatted(kind, String.join("; ", violations)), violations);
    }
    return strategy;
  }
}
