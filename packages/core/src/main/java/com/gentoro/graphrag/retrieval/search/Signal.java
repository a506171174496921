package com.gentoro.graphrag.retrieval.search;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.graphrag.strategy.RetrievalStrategy;

/**
 * The four retrieval signals in priority order. Declaration order is the tie-break order used
 * when merged scores are equal, and the order in which used signals are reported.
 */
public enum Signal {
  GRAPH_TRAVERSAL("graph_traversal"),
  CHUNK_TEXT_SEARCH("chunk_text_search"),
  KEYWORD_MATCHING("keyword_matching"),
  TEMPORAL_FILTERING("temporal_filtering");

  private final String id;

  Signal(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  /** Lower is stronger. */
  public int priority() {
    return ordinal();
  }

  public boolean isEnabled(RetrievalStrategy strategy) {
    RetrievalStrategy.Search s = strategy.search();
    return switch (this) {
      case GRAPH_TRAVERSAL -> s.graphTraversal().enabled();
      case CHUNK_TEXT_SEARCH -> s.chunkTextSearch().enabled();
      case KEYWORD_MATCHING -> s.keywordMatching().enabled();
      case TEMPORAL_FILTERING -> s.temporalFiltering().enabled();
    };
  }

  public double weight(RetrievalStrategy.Scoring scoring) {
    return switch (this) {
      case GRAPH_TRAVERSAL -> scoring.graphMatchWeight();
      case CHUNK_TEXT_SEARCH -> scoring.textMatchWeight();
      case KEYWORD_MATCHING -> scoring.keywordMatchWeight();
      case TEMPORAL_FILTERING -> scoring.temporalMatchWeight();
    };
  }

  @Override
  public String toString() {
    return id;
  }
}
