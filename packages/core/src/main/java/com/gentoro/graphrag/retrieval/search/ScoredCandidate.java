package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityRecord;
import java.util.Objects;

/**
 * One match produced by one signal. {@code payload} is the matched {@link EntityRecord} or {@link
 * ChunkRecord}; {@code rawScore} lies in [0, 1].
 */
public record ScoredCandidate(
    CandidateKind kind, String id, Signal signal, double rawScore, Object payload) {

  public ScoredCandidate {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(signal, "signal");
    if (Double.isNaN(rawScore) || rawScore < 0.0 || rawScore > 1.0) {
      throw new IllegalArgumentException("raw score out of [0,1]: " + rawScore);
    }
  }

  public static ScoredCandidate entity(Signal signal, EntityRecord entity, double score) {
    return new ScoredCandidate(
        CandidateKind.ENTITY, entity.key().toString(), signal, score, entity);
  }

  public static ScoredCandidate chunk(Signal signal, ChunkRecord chunk, double score) {
    return new ScoredCandidate(CandidateKind.CHUNK, chunk.id(), signal, score, chunk);
  }
}
