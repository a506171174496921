package com.gentoro.graphrag.retrieval;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.NeighborWindow;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the chunks surrounding each matched chunk. A neighbor scores its origin's score minus
 * {@value #NEIGHBOR_DECAY} per position of distance, floored at zero. Directly matched chunks
 * keep their direct flag and the higher of the two scores.
 */
public class ContextExpander {
  public static final double NEIGHBOR_DECAY = 0.05;

  public List<MergedCandidate> expand(
      List<MergedCandidate> chunks, RetrievalStrategy strategy, GraphDriver driver) {
    RetrievalStrategy.ExpandNeighbors cfg = strategy.context().expandNeighbors();
    if (!cfg.enabled() || (cfg.before() == 0 && cfg.after() == 0) || chunks.isEmpty()) {
      return chunks;
    }
    Map<String, MergedCandidate> byId = new LinkedHashMap<>();
    for (MergedCandidate c : chunks) {
      byId.put(c.id(), c);
    }
    for (MergedCandidate origin : chunks) {
      if (!origin.direct()) continue;
      NeighborWindow window = driver.neighbors(origin.id(), cfg.before(), cfg.after());
      if (window.isEmpty()) continue;
      int center = origin.chunk().chunkIndex();
      List<ChunkRecord> around = new ArrayList<>(window.before());
      around.addAll(window.after());
      for (ChunkRecord n : around) {
        int distance = Math.abs(n.chunkIndex() - center);
        double score = Math.max(0.0, origin.score() - NEIGHBOR_DECAY * distance);
        byId.merge(n.id(), MergedCandidate.neighbor(n, score), ContextExpander::keepBest);
      }
    }
    List<MergedCandidate> out = new ArrayList<>(byId.values());
    out.sort(ResultMerger.RANKING);
    return out;
  }

  private static MergedCandidate keepBest(MergedCandidate existing, MergedCandidate incoming) {
    return incoming.score() > existing.score() ? existing.withScore(incoming.score()) : existing;
  }
}
