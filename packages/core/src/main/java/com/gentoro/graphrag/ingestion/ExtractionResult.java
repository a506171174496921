package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Entities and relationships extracted from one document. */
public record ExtractionResult(
    @JsonProperty("entities") List<ExtractedEntity> entities,
    @JsonProperty("relationships") List<ExtractedRelationship> relationships) {

  public ExtractionResult {
    entities = entities == null ? List.of() : List.copyOf(entities);
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
  }

  public static ExtractionResult empty() {
    return new ExtractionResult(List.of(), List.of());
  }
}
