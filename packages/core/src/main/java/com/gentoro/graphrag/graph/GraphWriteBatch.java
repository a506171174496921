package com.gentoro.graphrag.graph;

import java.util.List;
import java.util.Objects;

/**
 * Every graph write produced by ingesting one document. A driver applies a batch all-or-nothing:
 * either every node and edge becomes visible, or none does.
 *
 * @param document the document node
 * @param chunks chunk nodes in chunk_index order (empty when chunk storage is disabled)
 * @param chunkEdges NEXT_CHUNK, PREV_CHUNK and FROM_DOCUMENT edges
 * @param entities entities to upsert by (type, id)
 * @param relationships relationships whose endpoints are in {@code entities} or already stored
 * @param provenance EXTRACTED_FROM edges
 */
public record GraphWriteBatch(
    DocumentRecord document,
    List<ChunkRecord> chunks,
    List<GraphEdge> chunkEdges,
    List<EntityRecord> entities,
    List<RelationshipRecord> relationships,
    List<ProvenanceLink> provenance) {

  public GraphWriteBatch {
    Objects.requireNonNull(document, "document");
    chunks = List.copyOf(chunks == null ? List.of() : chunks);
    chunkEdges = List.copyOf(chunkEdges == null ? List.of() : chunkEdges);
    entities = List.copyOf(entities == null ? List.of() : entities);
    relationships = List.copyOf(relationships == null ? List.of() : relationships);
    provenance = List.copyOf(provenance == null ? List.of() : provenance);
  }

  public boolean containsChain() {
    return chunkEdges.stream().anyMatch(GraphEdge::isChain);
  }
}
