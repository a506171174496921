package com.gentoro.graphrag.ingestion;

import com.gentoro.graphrag.exception.StateException;
import com.gentoro.graphrag.graph.DeleteSummary;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.schema.SchemaValidator;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Write-side entry point. Reads the extraction strategy once per document and rejects a second
 * ingestion (or deletion) of a document that is still being written. Different documents are
 * ingested in parallel without coordination.
 */
public class IngestionService {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(IngestionService.class);

  private final GraphDriver driver;
  private final StrategyStore strategies;
  private final ChunkGraphBuilder builder;
  private final Clock clock;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public IngestionService(
      GraphDriver driver, StrategyStore strategies, SchemaValidator validator, Clock clock) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.strategies = Objects.requireNonNull(strategies, "strategies");
    this.builder = new ChunkGraphBuilder(driver, validator);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public IngestionSummary ingest(
      DocumentInput document, List<ChunkInput> chunks, ExtractionResult extraction) {
    ExtractionStrategy strategy = strategies.get().extraction();
    return guarded(
        document.id(),
        () -> {
          log.debug(
              "Ingesting document '{}' with extraction strategy '{}' ({} mode)",
              document.id(),
              strategy.name(),
              strategy.validation().mode());
          return builder.write(
              document,
              chunks,
              extraction == null ? ExtractionResult.empty() : extraction,
              strategy,
              clock.instant());
        });
  }

  /** Removes a document, its chunks and the entities only it contributed. */
  public DeleteSummary deleteDocument(String documentId) {
    return guarded(documentId, () -> driver.deleteDocument(documentId));
  }

  public void clearAll() {
    if (!inFlight.isEmpty()) {
      throw new StateException(
          "Cannot clear the graph while documents are being ingested",
          Map.of("in_flight", List.copyOf(inFlight)));
    }
    driver.clearAll();
  }

  private <T> T guarded(String documentId, Supplier<T> work) {
    if (!inFlight.add(documentId)) {
      throw new StateException(
          "Document '%s' is already being ingested".formatted(documentId),
          Map.of("document_id", documentId));
    }
    try {
      return work.get();
    } finally {
      inFlight.remove(documentId);
    }
  }
}
