package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphrag.schema.ValidationIssue;
import java.util.List;

/**
 * Result of ingesting one document. Counts refer to what was written by this ingestion; {@code
 * issues} lists the schema findings that did not abort the batch.
 */
public record IngestionSummary(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("entity_count") int entityCount,
    @JsonProperty("relationship_count") int relationshipCount,
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("skipped_entities") int skippedEntities,
    @JsonProperty("skipped_relationships") int skippedRelationships,
    @JsonProperty("issues") List<ValidationIssue> issues) {

  public IngestionSummary {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
