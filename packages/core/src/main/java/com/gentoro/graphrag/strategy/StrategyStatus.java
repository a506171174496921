package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Compact summary of the active strategies, suitable for a status endpoint or a log line. */
public record StrategyStatus(
    @JsonProperty("active_preset") String activePreset,
    @JsonProperty("extraction_name") String extractionName,
    @JsonProperty("retrieval_name") String retrievalName,
    @JsonProperty("validation_mode") ValidationMode validationMode,
    @JsonProperty("available_presets") List<String> availablePresets) {}
