package com.gentoro.graphrag.retrieval.search;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeywordMatchSearchTest {

  @Mock private GraphDriver driver;

  private final KeywordMatchSearch search = new KeywordMatchSearch();
  private final RetrievalStrategy strategy = presets().get("balanced").retrieval();

  private static ChunkRecord chunk(int index, String... keyTerms) {
    return new ChunkRecord(
        "doc_chunk_" + index,
        DOC_ID,
        index,
        "text",
        1,
        null,
        null,
        List.of(keyTerms),
        null,
        null,
        null);
  }

  @Test
  @DisplayName("Overlap is the share of keywords found among key terms")
  void overlap() {
    List<String> keywords = List.of("payment", "invoice", "penalty", "software");

    assertEquals(0.5, KeywordMatchSearch.overlap(keywords, List.of("payments", "invoice")));
    assertEquals(0.25, KeywordMatchSearch.overlap(keywords, List.of("Software License")));
    assertEquals(0.0, KeywordMatchSearch.overlap(keywords, List.of("", "delivery")));
    assertEquals(0.0, KeywordMatchSearch.overlap(List.of(), List.of("payment")));
  }

  @Test
  @DisplayName("Chunks below the match threshold are dropped")
  void threshold() {
    ChunkRecord strong = chunk(0, "payment", "invoice");
    ChunkRecord weak = chunk(1, "payment", "delivery");
    when(driver.chunksByKeyTerms(anyCollection(), isNull(), anyInt()))
        .thenReturn(List.of(strong, weak));
    QueryIntent intent = QueryIntent.builder().keywords("payment", "invoice", "penalty").build();

    List<ScoredCandidate> found = search.search(intent, strategy, driver);

    assertEquals(1, found.size());
    assertEquals("doc_chunk_0", found.get(0).id());
    assertEquals(2.0 / 3.0, found.get(0).rawScore(), 1e-9);
    assertEquals(Signal.KEYWORD_MATCHING, found.get(0).signal());
  }

  @Test
  @DisplayName("Only applicable with keywords")
  void applicability() {
    assertFalse(search.isApplicable(QueryIntent.builder().searchText("x").build(), strategy));
    assertTrue(search.isApplicable(QueryIntent.builder().keywords("x").build(), strategy));
    verifyNoInteractions(driver);
  }

  @Test
  @DisplayName("All matching chunks are requested and the best scores are kept")
  void bestScoresSurviveCandidateCap() {
    List<ChunkRecord> chunks = new ArrayList<>();
    for (int i = 0; i < 120; i++) {
      chunks.add(chunk(i, "payment"));
    }
    chunks.add(chunk(120, "payment", "invoice"));
    when(driver.chunksByKeyTerms(anyCollection(), isNull(), eq(GraphDriver.UNLIMITED)))
        .thenReturn(chunks);
    QueryIntent intent = QueryIntent.builder().keywords("payment", "invoice").build();

    List<ScoredCandidate> found = search.search(intent, strategy, driver);

    assertEquals(SignalSearcher.CANDIDATE_LIMIT, found.size());
    assertEquals("doc_chunk_120", found.get(0).id());
    assertEquals(1.0, found.get(0).rawScore());
    assertEquals("doc_chunk_0", found.get(1).id());
  }
}
