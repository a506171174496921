package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps chunks whose temporal references overlap the date ranges of the query. When the query
 * asks about time without naming a concrete range, every chunk carrying temporal references
 * matches. Scores are binary.
 */
public class TemporalFilterSearch implements SignalSearcher {

  @Override
  public Signal signal() {
    return Signal.TEMPORAL_FILTERING;
  }

  @Override
  public boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy) {
    if (!intent.temporalHints().isEmpty()) return true;
    if (!strategy.search().temporalFiltering().autoDetect() || intent.question() == null) {
      return false;
    }
    return TemporalParser.hasTemporalCue(intent.question())
        || !TemporalParser.parse(intent.question()).isEmpty();
  }

  @Override
  public List<ScoredCandidate> search(
      QueryIntent intent, RetrievalStrategy strategy, GraphDriver driver) {
    List<TemporalRange> wanted = queryRanges(intent, strategy);
    List<ScoredCandidate> out = new ArrayList<>();
    for (ChunkRecord chunk :
        driver.chunksWithTemporalRefs(intent.documentId(), GraphDriver.UNLIMITED)) {
      if (wanted.isEmpty() || overlaps(chunk, wanted)) {
        out.add(ScoredCandidate.chunk(signal(), chunk, 1.0));
        if (out.size() == CANDIDATE_LIMIT) break;
      }
    }
    return out;
  }

  static List<TemporalRange> queryRanges(QueryIntent intent, RetrievalStrategy strategy) {
    List<TemporalRange> ranges = new ArrayList<>();
    for (String hint : intent.temporalHints()) {
      ranges.addAll(TemporalParser.parse(hint));
    }
    if (strategy.search().temporalFiltering().autoDetect() && intent.question() != null) {
      for (TemporalRange r : TemporalParser.parse(intent.question())) {
        if (!ranges.contains(r)) ranges.add(r);
      }
    }
    return ranges;
  }

  private static boolean overlaps(ChunkRecord chunk, List<TemporalRange> wanted) {
    for (String ref : chunk.temporalRefsOrEmpty()) {
      for (TemporalRange have : TemporalParser.parse(ref)) {
        for (TemporalRange w : wanted) {
          if (have.intersects(w)) return true;
        }
      }
    }
    return false;
  }
}
