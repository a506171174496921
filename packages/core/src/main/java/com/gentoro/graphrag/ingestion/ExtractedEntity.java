package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.graph.EntityKey;
import java.util.Map;

/**
 * Entity produced by the upstream extractor.
 *
 * @param chunkIndex index of the chunk the entity was extracted from; {@code null} when unknown
 * @param sourceText text span the entity was read from
 */
public record ExtractedEntity(
    @JsonProperty("type") String type,
    @JsonProperty("id") String id,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("chunk_index") Integer chunkIndex,
    @JsonProperty("source_text") String sourceText) {

  public ExtractedEntity {
    if (type == null || type.isBlank()) {
      throw new ValidationException("Entity type cannot be null or empty");
    }
    if (id == null || id.isBlank()) {
      throw new ValidationException("Entity id cannot be null or empty", Map.of("type", type));
    }
    properties = properties == null ? Map.of() : properties;
    confidence = confidence == null ? 1.0 : confidence;
    if (confidence < 0.0 || confidence > 1.0) {
      throw new ValidationException(
          "Entity confidence must be within [0, 1]", Map.of("type", type, "id", id));
    }
  }

  public static ExtractedEntity of(
      String type, String id, Map<String, Object> properties, Integer chunkIndex) {
    return new ExtractedEntity(type, id, properties, 1.0, chunkIndex, null);
  }

  public EntityKey key() {
    return EntityKey.of(type, id);
  }
}
