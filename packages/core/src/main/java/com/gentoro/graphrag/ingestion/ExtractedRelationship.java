package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.graph.EntityKey;
import java.util.Map;
import java.util.Objects;

public record ExtractedRelationship(
    @JsonProperty("type") String type,
    @JsonProperty("source") EntityKey source,
    @JsonProperty("target") EntityKey target,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("properties") Map<String, Object> properties) {

  public ExtractedRelationship {
    if (type == null || type.isBlank()) {
      throw new ValidationException("Relationship type cannot be null or empty");
    }
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    confidence = confidence == null ? 1.0 : confidence;
    properties = properties == null ? Map.of() : properties;
  }

  public static ExtractedRelationship of(String type, EntityKey source, EntityKey target) {
    return new ExtractedRelationship(type, source, target, 1.0, Map.of());
  }
}
