package com.gentoro.graphrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.RelationshipRecord;
import java.util.List;

/**
 * Ranked, bounded retrieval output. {@code entities} and {@code chunks} are in rank order; {@code
 * context} is the formatted text handed to answer generation.
 */
@JsonPropertyOrder({
  "entities",
  "chunks",
  "relationships",
  "search_methods_used",
  "context",
  "intent",
  "failures",
  "truncation",
  "strategy_name"
})
public record RetrievalResult(
    @JsonProperty("entities") List<MergedCandidate> entities,
    @JsonProperty("chunks") List<MergedCandidate> chunks,
    @JsonProperty("relationships") List<RelationshipRecord> relationships,
    @JsonProperty("search_methods_used") List<String> searchMethodsUsed,
    @JsonProperty("context") String context,
    @JsonProperty("intent") QueryIntent intent,
    @JsonProperty("failures") List<SignalFailure> failures,
    @JsonProperty("truncation") TruncationReport truncation,
    @JsonProperty("strategy_name") String strategyName) {

  public RetrievalResult {
    entities = List.copyOf(entities);
    chunks = List.copyOf(chunks);
    relationships = List.copyOf(relationships);
    searchMethodsUsed = List.copyOf(searchMethodsUsed);
    failures = List.copyOf(failures);
  }

  public List<EntityRecord> entityRecords() {
    return entities.stream().map(MergedCandidate::entity).toList();
  }

  public List<ChunkRecord> chunkRecords() {
    return chunks.stream().map(MergedCandidate::chunk).toList();
  }

  public List<String> chunkIds() {
    return chunks.stream().map(MergedCandidate::id).toList();
  }

  public boolean isDegraded() {
    return !failures.isEmpty();
  }
}
