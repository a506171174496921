package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts of what is stored, split between infrastructure (documents, chunks and their edges) and
 * schema-defined entities and relationships.
 */
public record GraphStats(
    @JsonProperty("documents") long documents,
    @JsonProperty("chunks") long chunks,
    @JsonProperty("entities_by_type") Map<String, Long> entitiesByType,
    @JsonProperty("relationships_by_type") Map<String, Long> relationshipsByType,
    @JsonProperty("infrastructure_edges") Map<String, Long> infrastructureEdges) {

  public GraphStats {
    entitiesByType = Collections.unmodifiableMap(new TreeMap<>(entitiesByType));
    relationshipsByType = Collections.unmodifiableMap(new TreeMap<>(relationshipsByType));
    infrastructureEdges = Collections.unmodifiableMap(new TreeMap<>(infrastructureEdges));
  }

  public long entityCount() {
    return entitiesByType.values().stream().mapToLong(Long::longValue).sum();
  }

  public long relationshipCount() {
    return relationshipsByType.values().stream().mapToLong(Long::longValue).sum();
  }

  public long edgeCount(String type) {
    return infrastructureEdges.getOrDefault(type, 0L);
  }
}
