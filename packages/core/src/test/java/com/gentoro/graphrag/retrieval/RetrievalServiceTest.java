package com.gentoro.graphrag.retrieval;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.exception.NotFoundException;
import com.gentoro.graphrag.exception.RetrievalCancelledException;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.retrieval.intent.HeuristicIntentAnalyzer;
import com.gentoro.graphrag.retrieval.search.ChunkTextSearch;
import com.gentoro.graphrag.retrieval.search.GraphTraversalSearch;
import com.gentoro.graphrag.retrieval.search.ScoredCandidate;
import com.gentoro.graphrag.retrieval.search.Signal;
import com.gentoro.graphrag.retrieval.search.SignalSearcher;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetrievalServiceTest {

  private static final QueryIntent ACME_INTENT =
      QueryIntent.builder().entityTypes("Party").searchText("Acme").build();

  private InMemoryGraphDriver driver;
  private StrategyStore store;
  private ExecutorService searchPool;
  private ExecutorService requestPool;
  private final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void setUp() {
    store = strategies("balanced");
    driver = ingested(store, acmeOnly());
    searchPool = Executors.newFixedThreadPool(4);
    requestPool = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    searchPool.shutdownNow();
    requestPool.shutdownNow();
  }

  private RetrievalService service(List<SignalSearcher> searchers, BaseConfiguration config) {
    return new RetrievalService(
        driver,
        store,
        new HeuristicIntentAnalyzer(schema()),
        searchers,
        searchPool,
        requestPool,
        config);
  }

  private RetrievalService service() {
    return service(RetrievalService.defaultSearchers(), new BaseConfiguration());
  }

  /** A searcher that always applies and delegates to {@code body}. */
  private static SignalSearcher stub(Signal signal, Supplier<List<ScoredCandidate>> body) {
    return new SignalSearcher() {
      @Override
      public Signal signal() {
        return signal;
      }

      @Override
      public boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy) {
        return true;
      }

      @Override
      public List<ScoredCandidate> search(
          QueryIntent intent, RetrievalStrategy strategy, GraphDriver graph) {
        return body.get();
      }
    };
  }

  /** Blocks until released or interrupted, counting down {@code interrupted} on interrupt. */
  private SignalSearcher blocking(CountDownLatch started, CountDownLatch interrupted) {
    return stub(
        Signal.TEMPORAL_FILTERING,
        () -> {
          started.countDown();
          try {
            release.await(30, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            interrupted.countDown();
            Thread.currentThread().interrupt();
          }
          return List.of();
        });
  }

  @Test
  @DisplayName("Acme question: graph and text signals rank the Acme chunk first")
  void acmeScenario() {
    RetrievalResult result = service().retrieve(ACME_INTENT);

    assertEquals(List.of("doc_chunk_1", "doc_chunk_0", "doc_chunk_2"), result.chunkIds());
    assertEquals(2.5, result.chunks().get(0).score(), 1e-9);
    assertEquals(2.45, result.chunks().get(1).score(), 1e-9);
    assertFalse(result.chunks().get(1).direct());
    assertEquals(1, result.entities().size());
    assertEquals(ACME, result.entityRecords().get(0).key());
    assertEquals(1.5, result.entities().get(0).score(), 1e-9);
    assertEquals(List.of("graph_traversal", "chunk_text_search"), result.searchMethodsUsed());
    assertFalse(result.isDegraded());
    assertEquals("balanced", result.strategyName());
    assertTrue(result.context().contains("Acme Corporation agrees to deliver"));
    assertTrue(result.context().contains("**Acme Corporation**"));
  }

  @Test
  @DisplayName("A failing signal is reported and the others still answer")
  void failingSignal() {
    SignalSearcher broken =
        stub(
            Signal.KEYWORD_MATCHING,
            () -> {
              throw new IllegalStateException("key term index offline");
            });
    RetrievalService service =
        service(
            List.of(new GraphTraversalSearch(), new ChunkTextSearch(), broken),
            new BaseConfiguration());

    RetrievalResult result = service.retrieve(ACME_INTENT);

    assertTrue(result.isDegraded());
    assertEquals("keyword_matching", result.failures().get(0).signal());
    assertTrue(result.failures().get(0).message().contains("key term index offline"));
    assertEquals(List.of("graph_traversal", "chunk_text_search"), result.searchMethodsUsed());
    assertEquals("doc_chunk_1", result.chunkIds().get(0));
  }

  @Test
  @DisplayName("A signal exceeding its timeout counts as failed")
  void timeout() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("retrieval.searchers.temporal_filtering.timeoutMs", 100);
    CountDownLatch interrupted = new CountDownLatch(1);
    RetrievalService service =
        service(
            List.of(new ChunkTextSearch(), blocking(new CountDownLatch(1), interrupted)), config);

    RetrievalResult result = service.retrieve(ACME_INTENT);

    assertEquals(List.of("chunk_text_search"), result.searchMethodsUsed());
    assertEquals(1, result.failures().size());
    assertEquals("temporal_filtering", result.failures().get(0).signal());
    assertTrue(result.failures().get(0).message().contains("Timed out"));
  }

  @Test
  @DisplayName("Interrupting the caller cancels the retrieval")
  void interrupted() {
    RetrievalService service =
        service(
            List.of(blocking(new CountDownLatch(1), new CountDownLatch(1))),
            new BaseConfiguration());

    Thread.currentThread().interrupt();
    try {
      assertThrows(RetrievalCancelledException.class, () -> service.retrieve(ACME_INTENT));
    } finally {
      assertTrue(Thread.interrupted());
    }
  }

  @Test
  @DisplayName("Cancelling an asynchronous retrieval interrupts its searches")
  void asyncCancel() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    RetrievalService service =
        service(List.of(blocking(started, interrupted)), new BaseConfiguration());

    Future<RetrievalResult> future = service.retrieveAsync("When is payment due?", DOC_ID);
    assertTrue(started.await(5, TimeUnit.SECONDS));
    future.cancel(true);

    assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    assertTrue(future.isCancelled());
  }

  @Test
  @DisplayName("A question is analyzed and restricted to the requested document")
  void questionWithDocument() {
    String question = "What does \"Acme Corporation\" deliver?";

    RetrievalResult inDocument = service().retrieve(question, DOC_ID);

    assertEquals("Acme Corporation", inDocument.intent().searchText());
    assertEquals(DOC_ID, inDocument.intent().documentId());
    assertEquals("doc_chunk_1", inDocument.chunkIds().get(0));

    RetrievalResult elsewhere = service().retrieve(question, "other");
    assertTrue(elsewhere.chunks().isEmpty());
  }

  @Test
  @DisplayName("Entity context holds the entity and its source chunks")
  void contextForEntity() {
    RetrievalResult result = service().contextForEntity(ACME);

    assertEquals(List.of(ACME), result.entityRecords().stream().map(EntityRecord::key).toList());
    assertEquals(List.of("doc_chunk_1"), result.chunkIds());
    assertEquals("entity_details", result.intent().intent());
    assertTrue(result.context().startsWith("# Context for Query: Details about Acme Corporation"));
    assertTrue(result.searchMethodsUsed().isEmpty());
  }

  @Test
  @DisplayName("Entity context for an unknown entity is not found")
  void contextForUnknownEntity() {
    assertThrows(
        NotFoundException.class,
        () -> service().contextForEntity(EntityKey.of("Party", "nobody")));
  }
}
