package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/** An extraction and a retrieval strategy bundled together; the unit a preset defines. */
@JsonPropertyOrder({"extraction", "retrieval"})
public record StrategyPair(
    @JsonProperty("extraction") ExtractionStrategy extraction,
    @JsonProperty("retrieval") RetrievalStrategy retrieval) {
  public StrategyPair {
    extraction = Objects.requireNonNullElseGet(extraction, ExtractionStrategy::defaults);
    retrieval = Objects.requireNonNullElseGet(retrieval, RetrievalStrategy::defaults);
  }
}
