package com.gentoro.graphrag.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.retrieval.search.CandidateKind;
import com.gentoro.graphrag.retrieval.search.Signal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A deduplicated, ranked candidate. {@code signalScores} keeps the raw score each signal gave it;
 * it is empty for chunks that were only reached by neighbor expansion ({@code direct == false}).
 */
@JsonPropertyOrder({"kind", "id", "score", "direct", "signal_scores", "payload"})
public record MergedCandidate(
    @JsonProperty("kind") CandidateKind kind,
    @JsonProperty("id") String id,
    @JsonProperty("score") double score,
    @JsonProperty("signal_scores") Map<Signal, Double> signalScores,
    @JsonProperty("direct") boolean direct,
    @JsonProperty("payload") Object payload) {

  public MergedCandidate {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(id, "id");
    signalScores =
        signalScores == null || signalScores.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(signalScores));
  }

  @JsonIgnore
  public EntityRecord entity() {
    return (EntityRecord) payload;
  }

  @JsonIgnore
  public ChunkRecord chunk() {
    return (ChunkRecord) payload;
  }

  /** Priority of the strongest contributing signal; expansion-only chunks rank last. */
  @JsonIgnore
  public int bestPriority() {
    return signalScores.keySet().stream()
        .mapToInt(Signal::priority)
        .min()
        .orElse(Signal.values().length);
  }

  public MergedCandidate withScore(double newScore) {
    return new MergedCandidate(kind, id, newScore, signalScores, direct, payload);
  }

  static MergedCandidate neighbor(ChunkRecord chunk, double score) {
    return new MergedCandidate(CandidateKind.CHUNK, chunk.id(), score, Map.of(), false, chunk);
  }
}
