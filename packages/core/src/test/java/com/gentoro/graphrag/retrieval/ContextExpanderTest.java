package com.gentoro.graphrag.retrieval;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.ingestion.ChunkInput;
import com.gentoro.graphrag.ingestion.DocumentInput;
import com.gentoro.graphrag.ingestion.ExtractionResult;
import com.gentoro.graphrag.ingestion.IngestionService;
import com.gentoro.graphrag.retrieval.search.CandidateKind;
import com.gentoro.graphrag.retrieval.search.Signal;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextExpanderTest {

  private final ContextExpander expander = new ContextExpander();
  private final RetrievalStrategy balanced = presets().get("balanced").retrieval();
  private InMemoryGraphDriver driver;

  @BeforeEach
  void setUp() {
    driver = driver();
    List<ChunkInput> chunks =
        IntStream.range(0, 10).mapToObj(i -> ChunkInput.of(i, "Clause " + i + ".", 1)).toList();
    new IngestionService(driver, strategies("balanced"), validator(), CLOCK)
        .ingest(new DocumentInput("long", "long.pdf", 1), chunks, ExtractionResult.empty());
  }

  private MergedCandidate direct(int index, double score) {
    String id = "long_chunk_" + index;
    return new MergedCandidate(
        CandidateKind.CHUNK,
        id,
        score,
        Map.of(Signal.CHUNK_TEXT_SEARCH, 1.0),
        true,
        driver.getChunk(id).orElseThrow());
  }

  private static List<String> ids(List<MergedCandidate> candidates) {
    return candidates.stream().map(MergedCandidate::id).toList();
  }

  @Test
  @DisplayName("One chunk before and after a match are added with a decayed score")
  void oneEachSide() {
    List<MergedCandidate> expanded = expander.expand(List.of(direct(5, 2.0)), balanced, driver);

    assertEquals(List.of("long_chunk_5", "long_chunk_4", "long_chunk_6"), ids(expanded));
    assertEquals(2.0 - ContextExpander.NEIGHBOR_DECAY, expanded.get(1).score(), 1e-9);
    assertFalse(expanded.get(1).direct());
    assertTrue(expanded.get(1).signalScores().isEmpty());
  }

  @Test
  @DisplayName("The first chunk has no predecessor")
  void documentStart() {
    List<MergedCandidate> expanded = expander.expand(List.of(direct(0, 1.0)), balanced, driver);

    assertEquals(List.of("long_chunk_0", "long_chunk_1"), ids(expanded));
  }

  @Test
  @DisplayName("The last chunk has no successor")
  void documentEnd() {
    List<MergedCandidate> expanded = expander.expand(List.of(direct(9, 1.0)), balanced, driver);

    assertEquals(List.of("long_chunk_9", "long_chunk_8"), ids(expanded));
  }

  @Test
  @DisplayName("Wider windows decay with distance")
  void widerWindow() {
    RetrievalStrategy comprehensive = presets().get("comprehensive").retrieval();

    List<MergedCandidate> expanded =
        expander.expand(List.of(direct(5, 2.0)), comprehensive, driver);

    assertEquals(
        List.of("long_chunk_5", "long_chunk_4", "long_chunk_6", "long_chunk_3", "long_chunk_7"),
        ids(expanded));
    assertEquals(2.0 - 2 * ContextExpander.NEIGHBOR_DECAY, expanded.get(4).score(), 1e-9);
  }

  @Test
  @DisplayName("A direct match reached as a neighbor keeps its flag and the higher score")
  void directNeighbor() {
    List<MergedCandidate> expanded =
        expander.expand(List.of(direct(5, 2.0), direct(4, 1.0)), balanced, driver);

    MergedCandidate four =
        expanded.stream().filter(c -> c.id().equals("long_chunk_4")).findFirst().orElseThrow();
    assertTrue(four.direct());
    assertEquals(2.0 - ContextExpander.NEIGHBOR_DECAY, four.score(), 1e-9);
    assertEquals(Map.of(Signal.CHUNK_TEXT_SEARCH, 1.0), four.signalScores());
    assertTrue(ids(expanded).contains("long_chunk_3"));
  }

  @Test
  @DisplayName("Neighbor scores never go below zero")
  void scoreFloor() {
    List<MergedCandidate> expanded = expander.expand(List.of(direct(3, 0.01)), balanced, driver);

    assertEquals(0.0, expanded.get(1).score());
    assertEquals(0.0, expanded.get(2).score());
  }

  @Test
  @DisplayName("Disabled expansion returns the input unchanged")
  void disabled() {
    RetrievalStrategy minimal = presets().get("minimal").retrieval();
    List<MergedCandidate> input = List.of(direct(5, 2.0));

    assertSame(input, expander.expand(input, minimal, driver));
  }
}
