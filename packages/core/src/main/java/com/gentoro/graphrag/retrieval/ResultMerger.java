package com.gentoro.graphrag.retrieval;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.retrieval.search.CandidateKind;
import com.gentoro.graphrag.retrieval.search.ScoredCandidate;
import com.gentoro.graphrag.retrieval.search.Signal;
import com.gentoro.graphrag.retrieval.search.TemporalParser;
import com.gentoro.graphrag.retrieval.search.TemporalRange;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Folds the candidates of all signals into one ranking.
 *
 * <p>Candidates are deduplicated by (kind, id); the combined score is the weighted sum of the
 * per-signal raw scores. Entities under the confidence floor and candidates of signals disabled in
 * the strategy are dropped. Ordering: score descending, then the best contributing signal's
 * priority, then id, then kind.
 */
public class ResultMerger {
  public static final double RECENCY_BOOST = 0.1;

  public static final Comparator<MergedCandidate> RANKING =
      Comparator.comparingDouble(MergedCandidate::score)
          .reversed()
          .thenComparingInt(MergedCandidate::bestPriority)
          .thenComparing(MergedCandidate::id)
          .thenComparing(MergedCandidate::kind);

  private record Key(CandidateKind kind, String id) {}

  public List<MergedCandidate> merge(
      Collection<ScoredCandidate> candidates, RetrievalStrategy strategy) {
    RetrievalStrategy.Scoring scoring = strategy.scoring();
    Map<Key, Map<Signal, Double>> perSignal = new LinkedHashMap<>();
    Map<Key, Object> payloads = new HashMap<>();
    for (ScoredCandidate c : candidates) {
      if (!c.signal().isEnabled(strategy)) continue;
      Key key = new Key(c.kind(), c.id());
      perSignal
          .computeIfAbsent(key, k -> new EnumMap<>(Signal.class))
          .merge(c.signal(), c.rawScore(), Math::max);
      payloads.putIfAbsent(key, c.payload());
    }

    List<MergedCandidate> merged = new ArrayList<>();
    for (Map.Entry<Key, Map<Signal, Double>> e : perSignal.entrySet()) {
      Key key = e.getKey();
      Object payload = payloads.get(key);
      if (key.kind() == CandidateKind.ENTITY
          && payload instanceof EntityRecord entity
          && entity.confidence() < scoring.entityConfidenceMin()) {
        continue;
      }
      double combined = 0.0;
      for (Map.Entry<Signal, Double> s : e.getValue().entrySet()) {
        combined += s.getKey().weight(scoring) * s.getValue();
      }
      merged.add(new MergedCandidate(key.kind(), key.id(), combined, e.getValue(), true, payload));
    }

    if (scoring.recencyBoost()) {
      merged = applyRecencyBoost(merged);
    }
    merged.sort(RANKING);
    return merged;
  }

  /** Multiplies the chunks whose temporal references reach the newest year by 1 + boost. */
  static List<MergedCandidate> applyRecencyBoost(List<MergedCandidate> merged) {
    Map<String, Integer> latest = new HashMap<>();
    int newest = Integer.MIN_VALUE;
    for (MergedCandidate c : merged) {
      if (c.kind() != CandidateKind.CHUNK || !(c.payload() instanceof ChunkRecord chunk)) continue;
      OptionalInt year = latestYear(chunk);
      if (year.isPresent()) {
        latest.put(c.id(), year.getAsInt());
        newest = Math.max(newest, year.getAsInt());
      }
    }
    List<MergedCandidate> out = new ArrayList<>(merged.size());
    for (MergedCandidate c : merged) {
      Integer year = c.kind() == CandidateKind.CHUNK ? latest.get(c.id()) : null;
      out.add(
          year != null && year == newest ? c.withScore(c.score() * (1 + RECENCY_BOOST)) : c);
    }
    return out;
  }

  private static OptionalInt latestYear(ChunkRecord chunk) {
    return chunk.temporalRefsOrEmpty().stream()
        .flatMap(ref -> TemporalParser.parse(ref).stream())
        .mapToInt(TemporalRange::latestYear)
        .max();
  }
}
