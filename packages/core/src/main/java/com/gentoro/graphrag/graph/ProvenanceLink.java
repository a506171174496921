package com.gentoro.graphrag.graph;

import java.util.Objects;

/** EXTRACTED_FROM edge: the chunk an entity was extracted from. */
public record ProvenanceLink(EntityKey entity, String chunkId) {
  public ProvenanceLink {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(chunkId, "chunkId");
  }
}
