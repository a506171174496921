package com.gentoro.graphrag.graph;

import java.util.ArrayList;
import java.util.List;

/** Chunks around a center chunk, each list ordered by chunk_index. */
public record NeighborWindow(
    List<ChunkRecord> before, ChunkRecord center, List<ChunkRecord> after) {
  public NeighborWindow {
    before = List.copyOf(before);
    after = List.copyOf(after);
  }

  public static NeighborWindow empty() {
    return new NeighborWindow(List.of(), null, List.of());
  }

  public boolean isEmpty() {
    return center == null;
  }

  /** Before, center and after in reading order. */
  public List<ChunkRecord> all() {
    List<ChunkRecord> out = new ArrayList<>(before);
    if (center != null) out.add(center);
    out.addAll(after);
    return out;
  }
}
