package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Immutable view of the strategy store at one instant. {@code activePreset} is {@code null} once
 * any manual update has been applied on top of a preset.
 */
@JsonPropertyOrder({"extraction", "retrieval", "active_preset"})
public record StrategySnapshot(
    @JsonProperty("extraction") ExtractionStrategy extraction,
    @JsonProperty("retrieval") RetrievalStrategy retrieval,
    @JsonProperty("active_preset") String activePreset) {

  public StrategySnapshot {
    Objects.requireNonNull(extraction, "extraction");
    Objects.requireNonNull(retrieval, "retrieval");
  }

  static StrategySnapshot of(StrategyPair pair, String activePreset) {
    return new StrategySnapshot(pair.extraction(), pair.retrieval(), activePreset);
  }

  @JsonIgnore
  public StrategyPair pair() {
    return new StrategyPair(extraction, retrieval);
  }

  @JsonIgnore
  public boolean isCustom() {
    return activePreset == null;
  }
}
