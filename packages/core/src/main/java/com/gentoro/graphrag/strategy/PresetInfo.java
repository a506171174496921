package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PresetInfo(
    @JsonProperty("name") String name,
    @JsonProperty("extraction_description") String extractionDescription,
    @JsonProperty("retrieval_description") String retrievalDescription) {}
