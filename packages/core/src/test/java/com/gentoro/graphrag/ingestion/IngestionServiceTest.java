package com.gentoro.graphrag.ingestion;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.graphrag.exception.StateException;
import com.gentoro.graphrag.graph.DeleteSummary;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.strategy.StrategyKind;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

  @Mock private GraphDriver blockingDriver;

  @Test
  @DisplayName("ingest writes chunks, entities and the document record")
  void ingest() {
    InMemoryGraphDriver driver = driver();
    IngestionService service =
        new IngestionService(driver, strategies("balanced"), validator(), CLOCK);

    IngestionSummary summary = service.ingest(document(), chunks(), acmeAndContract());

    assertEquals(DOC_ID, summary.documentId());
    assertEquals(3, summary.chunkCount());
    assertEquals(2, summary.entityCount());
    assertEquals(1, summary.relationshipCount());
    assertEquals(CLOCK.instant(), driver.getDocument(DOC_ID).orElseThrow().ingestedAt());
  }

  @Test
  @DisplayName("a null extraction result ingests chunks only")
  void nullExtraction() {
    InMemoryGraphDriver driver = driver();
    IngestionService service =
        new IngestionService(driver, strategies("balanced"), validator(), CLOCK);
    IngestionSummary summary = service.ingest(document(), chunks(), null);
    assertEquals(0, summary.entityCount());
    assertEquals(3, driver.chunksForDocument(DOC_ID).size());
  }

  @Test
  @DisplayName("the extraction strategy active at call time is used")
  void usesCurrentStrategy() {
    InMemoryGraphDriver driver = driver();
    StrategyStore store = strategies("balanced");
    IngestionService service = new IngestionService(driver, store, validator(), CLOCK);

    store.update(StrategyKind.EXTRACTION, Map.of("chunks", Map.of("enabled", false)));
    service.ingest(document(), chunks(), acmeOnly());

    assertTrue(driver.chunksForDocument(DOC_ID).isEmpty());
    assertTrue(driver.getEntity(ACME).isPresent());
  }

  @Test
  @DisplayName("a second ingestion of a document in flight is rejected")
  void concurrentSameDocument() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    lenient().when(blockingDriver.getEntity(any())).thenReturn(Optional.empty());
    doAnswer(
            inv -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return null;
            })
        .when(blockingDriver)
        .applyBatch(any());

    IngestionService service =
        new IngestionService(blockingDriver, strategies("balanced"), validator(), CLOCK);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<IngestionSummary> first =
          pool.submit(() -> service.ingest(document(), chunks(), acmeOnly()));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      StateException ex =
          assertThrows(
              StateException.class, () -> service.ingest(document(), chunks(), acmeOnly()));
      assertEquals(DOC_ID, ex.getContext().get("document_id"));
      assertThrows(StateException.class, service::clearAll);
      assertThrows(StateException.class, () -> service.deleteDocument(DOC_ID));

      release.countDown();
      assertEquals(DOC_ID, first.get(5, TimeUnit.SECONDS).documentId());
    } finally {
      release.countDown();
      pool.shutdownNow();
    }

    // the guard is released once the first ingestion finishes
    assertDoesNotThrow(() -> service.ingest(document(), chunks(), acmeOnly()));
  }

  @Test
  @DisplayName("deleting a document removes its chunks and its exclusive entities")
  void deleteDocument() {
    InMemoryGraphDriver driver = driver();
    IngestionService service =
        new IngestionService(driver, strategies("balanced"), validator(), CLOCK);
    service.ingest(document(), chunks(), acmeAndContract());

    DeleteSummary summary = service.deleteDocument(DOC_ID);

    assertTrue(summary.found());
    assertEquals(3, summary.chunksDeleted());
    assertEquals(2, summary.entitiesDeleted());
    assertEquals(1, summary.relationshipsDeleted());
    assertEquals(0, driver.stats().entityCount());
    assertFalse(service.deleteDocument(DOC_ID).found());
  }

  @Test
  @DisplayName("clearAll empties the graph when nothing is in flight")
  void clearAll() {
    InMemoryGraphDriver driver = driver();
    IngestionService service =
        new IngestionService(driver, strategies("balanced"), validator(), CLOCK);
    service.ingest(document(), chunks(), acmeOnly());
    service.clearAll();
    assertEquals(0, driver.stats().documents());
  }
}
