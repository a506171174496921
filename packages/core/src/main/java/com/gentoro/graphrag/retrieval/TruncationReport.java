package com.gentoro.graphrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the limits removed from a retrieval, and the size of what remained. */
public record TruncationReport(
    @JsonProperty("entities_dropped_by_cap") int entitiesDroppedByCap,
    @JsonProperty("chunks_dropped_by_cap") int chunksDroppedByCap,
    @JsonProperty("entities_dropped_by_tokens") int entitiesDroppedByTokens,
    @JsonProperty("chunks_dropped_by_tokens") int chunksDroppedByTokens,
    @JsonProperty("estimated_tokens") int estimatedTokens) {

  public static TruncationReport none(int estimatedTokens) {
    return new TruncationReport(0, 0, 0, 0, estimatedTokens);
  }

  @JsonProperty("truncated")
  public boolean truncated() {
    return totalDropped() > 0;
  }

  public int totalDropped() {
    return entitiesDroppedByCap
        + chunksDroppedByCap
        + entitiesDroppedByTokens
        + chunksDroppedByTokens;
  }
}
