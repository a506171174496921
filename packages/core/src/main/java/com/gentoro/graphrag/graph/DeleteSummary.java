package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteSummary(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("found") boolean found,
    @JsonProperty("chunks_deleted") int chunksDeleted,
    @JsonProperty("entities_deleted") int entitiesDeleted,
    @JsonProperty("relationships_deleted") int relationshipsDeleted) {

  public static DeleteSummary notFound(String documentId) {
    return new DeleteSummary(documentId, false, 0, 0, 0);
  }
}
