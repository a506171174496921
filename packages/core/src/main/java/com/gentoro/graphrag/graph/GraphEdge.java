package com.gentoro.graphrag.graph;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Directed infrastructure edge between two nodes addressed by id: chunk to chunk for the reading
 * chain, chunk to document for ownership.
 */
public record GraphEdge(String type, String fromId, String toId) {
  public GraphEdge {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Edge type cannot be null or empty");
    }
    type = type.trim().toUpperCase(Locale.ROOT);
    Objects.requireNonNull(fromId, "fromId");
    Objects.requireNonNull(toId, "toId");
  }

  public static GraphEdge next(String fromChunk, String toChunk) {
    return new GraphEdge(EdgeTypes.NEXT_CHUNK, fromChunk, toChunk);
  }

  public static GraphEdge prev(String fromChunk, String toChunk) {
    return new GraphEdge(EdgeTypes.PREV_CHUNK, fromChunk, toChunk);
  }

  public static GraphEdge fromDocument(String chunkId, String documentId) {
    return new GraphEdge(EdgeTypes.FROM_DOCUMENT, chunkId, documentId);
  }

  public boolean isChain() {
    return EdgeTypes.isChain(type);
  }

  /** Storage representation. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("edge_type", type);
    map.put("from_id", fromId);
    map.put("to_id", toId);
    return map;
  }
}
