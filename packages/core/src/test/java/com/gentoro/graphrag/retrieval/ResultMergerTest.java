package com.gentoro.graphrag.retrieval;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.retrieval.search.ScoredCandidate;
import com.gentoro.graphrag.retrieval.search.Signal;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.strategy.StrategyKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultMergerTest {

  private final ResultMerger merger = new ResultMerger();
  private final RetrievalStrategy balanced = presets().get("balanced").retrieval();

  private static ChunkRecord chunk(int index, List<String> temporalRefs) {
    return new ChunkRecord(
        "doc_chunk_" + index,
        DOC_ID,
        index,
        "text " + index,
        1,
        null,
        temporalRefs,
        null,
        null,
        null,
        null);
  }

  private static ChunkRecord chunk(int index) {
    return chunk(index, null);
  }

  private static EntityRecord acme(double confidence) {
    return new EntityRecord(ACME, Map.of("name", "Acme Corporation"), confidence, Map.of());
  }

  private static List<String> ids(List<MergedCandidate> merged) {
    return merged.stream().map(MergedCandidate::id).toList();
  }

  @Test
  @DisplayName("Combined score is the weighted sum of per-signal scores")
  void weightedSum() {
    ChunkRecord c = chunk(1);

    List<MergedCandidate> merged =
        merger.merge(
            List.of(
                ScoredCandidate.chunk(Signal.GRAPH_TRAVERSAL, c, 1.0),
                ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, c, 0.5),
                ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, c, 0.25)),
            balanced);

    assertEquals(1, merged.size());
    MergedCandidate only = merged.get(0);
    assertEquals(1.5 * 1.0 + 1.0 * 0.5, only.score(), 1e-9);
    assertEquals(
        Map.of(Signal.GRAPH_TRAVERSAL, 1.0, Signal.CHUNK_TEXT_SEARCH, 0.5), only.signalScores());
    assertTrue(only.direct());
  }

  @Test
  @DisplayName("Entities and chunks with the same id stay separate")
  void kindIsPartOfIdentity() {
    EntityRecord entity = acme(0.9);
    ChunkRecord lookalike =
        new ChunkRecord(ACME.toString(), DOC_ID, 0, "x", null, null, null, null, null, null, null);

    List<MergedCandidate> merged =
        merger.merge(
            List.of(
                ScoredCandidate.entity(Signal.GRAPH_TRAVERSAL, entity, 1.0),
                ScoredCandidate.chunk(Signal.GRAPH_TRAVERSAL, lookalike, 1.0)),
            balanced);

    assertEquals(2, merged.size());
  }

  @Test
  @DisplayName("Candidates of disabled signals are ignored")
  void disabledSignals() {
    RetrievalStrategy minimal = presets().get("minimal").retrieval();

    List<MergedCandidate> merged =
        merger.merge(
            List.of(
                ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(0), 1.0),
                ScoredCandidate.chunk(Signal.GRAPH_TRAVERSAL, chunk(1), 0.5)),
            minimal);

    assertEquals(List.of("doc_chunk_1"), ids(merged));
  }

  @Test
  @DisplayName("Entities under the confidence floor are dropped")
  void confidenceFloor() {
    ScoredCandidate weak = ScoredCandidate.entity(Signal.GRAPH_TRAVERSAL, acme(0.4), 1.0);
    ScoredCandidate atFloor = ScoredCandidate.entity(Signal.GRAPH_TRAVERSAL, acme(0.5), 1.0);

    assertTrue(merger.merge(List.of(weak), balanced).isEmpty());
    assertEquals(1, merger.merge(List.of(atFloor), balanced).size());
  }

  @Test
  @DisplayName("Ties are broken by signal priority and then by id")
  void tieBreaks() {
    List<MergedCandidate> merged =
        merger.merge(
            List.of(
                ScoredCandidate.chunk(Signal.KEYWORD_MATCHING, chunk(1), 1.0),
                ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(9), 1.0),
                ScoredCandidate.chunk(Signal.KEYWORD_MATCHING, chunk(0), 1.0),
                ScoredCandidate.chunk(Signal.GRAPH_TRAVERSAL, chunk(5), 0.5)),
            balanced);

    assertEquals(List.of("doc_chunk_9", "doc_chunk_0", "doc_chunk_1", "doc_chunk_5"), ids(merged));
  }

  @Test
  @DisplayName("Recency boost lifts chunks that reference the newest year")
  void recencyBoost() {
    RetrievalStrategy boosted =
        strategies("balanced")
            .update(StrategyKind.RETRIEVAL, Map.of("scoring", Map.of("recency_boost", true)))
            .retrieval();
    List<ScoredCandidate> candidates =
        List.of(
            ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(0, List.of("March 2023")), 1.0),
            ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(1, List.of("Q2 2024")), 1.0),
            ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(2), 1.0));

    List<MergedCandidate> merged = merger.merge(candidates, boosted);

    assertEquals(List.of("doc_chunk_1", "doc_chunk_0", "doc_chunk_2"), ids(merged));
    assertEquals(1.0 + ResultMerger.RECENCY_BOOST, merged.get(0).score(), 1e-9);
    assertEquals(
        List.of("doc_chunk_0", "doc_chunk_1", "doc_chunk_2"),
        ids(merger.merge(candidates, balanced)));
  }

  @Test
  @DisplayName("Recency boost ignores references that name no usable range")
  void recencyBoostSkipsUnboundedReference() {
    RetrievalStrategy boosted =
        strategies("balanced")
            .update(StrategyKind.RETRIEVAL, Map.of("scoring", Map.of("recency_boost", true)))
            .retrieval();
    List<ScoredCandidate> candidates =
        List.of(
            ScoredCandidate.chunk(
                Signal.CHUNK_TEXT_SEARCH, chunk(0, List.of("after December 31, 9999")), 1.0),
            ScoredCandidate.chunk(Signal.CHUNK_TEXT_SEARCH, chunk(1, List.of("Q2 2024")), 1.0));

    List<MergedCandidate> merged = merger.merge(candidates, boosted);

    assertEquals(List.of("doc_chunk_1", "doc_chunk_0"), ids(merged));
    assertEquals(1.0, merged.get(1).score(), 1e-9);
  }
}
