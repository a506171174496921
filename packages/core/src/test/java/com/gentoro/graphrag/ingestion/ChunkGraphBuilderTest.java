package com.gentoro.graphrag.ingestion;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.graphrag.exception.GraphRagErrorCode;
import com.gentoro.graphrag.exception.GraphStorageException;
import com.gentoro.graphrag.exception.PartialChainException;
import com.gentoro.graphrag.exception.SchemaValidationException;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.graph.EdgeTypes;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.GraphEdge;
import com.gentoro.graphrag.graph.GraphStats;
import com.gentoro.graphrag.graph.GraphWriteBatch;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import com.gentoro.graphrag.strategy.StrategyKind;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChunkGraphBuilderTest {

  private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

  @Mock private GraphDriver mockDriver;

  private InMemoryGraphDriver driver;
  private ChunkGraphBuilder builder;

  @BeforeEach
  void setUp() {
    driver = driver();
    builder = new ChunkGraphBuilder(driver, validator());
  }

  private static ExtractionStrategy extraction(String preset) {
    return presets().get(preset).extraction();
  }

  private static ExtractionStrategy withMode(String mode) {
    StrategyStore store = strategies("balanced");
    return store.update(StrategyKind.EXTRACTION, Map.of("validation", Map.of("mode", mode)))
        .extraction();
  }

  @Test
  @DisplayName("N chunks produce N-1 NEXT and N-1 PREV edges and one FROM_DOCUMENT per chunk")
  void chainEdges() {
    ChunkGraphBuilder.Plan plan =
        builder.plan(document(), chunks(), acmeOnly(), extraction("balanced"), NOW);
    List<GraphEdge> edges = plan.batch().chunkEdges();

    assertEquals(2, edges.stream().filter(e -> e.type().equals(EdgeTypes.NEXT_CHUNK)).count());
    assertEquals(2, edges.stream().filter(e -> e.type().equals(EdgeTypes.PREV_CHUNK)).count());
    assertEquals(3, edges.stream().filter(e -> e.type().equals(EdgeTypes.FROM_DOCUMENT)).count());
    assertTrue(edges.contains(GraphEdge.next("doc_chunk_0", "doc_chunk_1")));
    assertTrue(edges.contains(GraphEdge.prev("doc_chunk_1", "doc_chunk_0")));
  }

  @Test
  @DisplayName("chunk order follows chunk_index, not input order")
  void chunksAreSorted() {
    List<ChunkInput> shuffled = List.of(chunks().get(2), chunks().get(0), chunks().get(1));
    GraphWriteBatch batch =
        builder.plan(document(), shuffled, acmeOnly(), extraction("balanced"), NOW).batch();
    assertEquals(
        List.of("doc_chunk_0", "doc_chunk_1", "doc_chunk_2"),
        batch.chunks().stream().map(c -> c.id()).toList());
  }

  @Test
  @DisplayName("chunk indexes with gaps or duplicates are rejected")
  void badIndexes() {
    List<ChunkInput> gap = List.of(ChunkInput.of(0, "a"), ChunkInput.of(2, "b"));
    assertThrows(
        ValidationException.class,
        () -> builder.write(document(), gap, acmeOnly(), extraction("balanced"), NOW));
    List<ChunkInput> dup = List.of(ChunkInput.of(0, "a"), ChunkInput.of(0, "b"));
    assertThrows(
        ValidationException.class,
        () -> builder.write(document(), dup, acmeOnly(), extraction("balanced"), NOW));
  }

  @Test
  @DisplayName("minimal preset stores entities without chunks, chain or provenance")
  void minimalPreset() {
    GraphWriteBatch batch =
        builder.plan(document(), chunks(), acmeOnly(), extraction("minimal"), NOW).batch();
    assertTrue(batch.chunks().isEmpty());
    assertTrue(batch.chunkEdges().isEmpty());
    assertTrue(batch.provenance().isEmpty());
    assertEquals(1, batch.entities().size());
  }

  @Test
  @DisplayName("re-ingesting the same entities does not duplicate them")
  void idempotentEntities() {
    builder.write(document(), chunks(), acmeAndContract(), extraction("balanced"), NOW);
    builder.write(document(), chunks(), acmeAndContract(), extraction("balanced"), NOW);

    GraphStats stats = driver.stats();
    assertEquals(Map.of("Contract", 1L, "Party", 1L), stats.entitiesByType());
    assertEquals(Map.of("PARTY_TO", 1L), stats.relationshipsByType());
    assertEquals(3, stats.chunks());
    assertEquals(2, stats.edgeCount(EdgeTypes.NEXT_CHUNK));
    assertEquals(2, stats.edgeCount(EdgeTypes.EXTRACTED_FROM));
  }

  @Test
  @DisplayName("strict mode rejects the whole batch when any entity is invalid")
  void strictWritesNothing() {
    ExtractionResult bad =
        new ExtractionResult(
            List.of(
                ExtractedEntity.of("Party", "acme", Map.of("name", "Acme"), 1),
                ExtractedEntity.of("Invoice", "inv-1", Map.of(), 2)),
            List.of());

    SchemaValidationException ex =
        assertThrows(
            SchemaValidationException.class,
            () -> builder.write(document(), chunks(), bad, withMode("strict"), NOW));
    assertEquals(1, ex.getIssues().size());
    assertEquals(0, driver.stats().documents());
    assertEquals(Optional.empty(), driver.getEntity(ACME));
  }

  @Test
  @DisplayName("store_valid skips invalid entities and their relationships")
  void storeValidSkips() {
    ExtractionResult mixed =
        new ExtractionResult(
            List.of(
                ExtractedEntity.of("Party", "acme", Map.of("name", "Acme"), 1),
                ExtractedEntity.of("Contract", "msa", Map.of(), 0)),
            List.of(ExtractedRelationship.of("PARTY_TO", ACME, CONTRACT)));
    ExtractionStrategy strategy =
        strategies("balanced")
            .update(
                StrategyKind.EXTRACTION,
                Map.of(
                    "validation",
                    Map.of("mode", "store_valid", "fail_on_missing_required", true)))
            .extraction();

    IngestionSummary summary = builder.write(document(), chunks(), mixed, strategy, NOW);

    assertEquals(1, summary.entityCount());
    assertEquals(1, summary.skippedEntities());
    assertEquals(1, summary.skippedRelationships());
    assertTrue(driver.getEntity(ACME).isPresent());
    assertTrue(driver.getEntity(CONTRACT).isEmpty());
  }

  @Test
  @DisplayName("warn mode stores everything valid and reports the issues")
  void warnModeReports() {
    ExtractionResult missingName =
        new ExtractionResult(
            List.of(ExtractedEntity.of("Party", "acme", Map.of("role", "buyer"), 1)), List.of());
    IngestionSummary summary =
        builder.write(document(), chunks(), missingName, extraction("balanced"), NOW);
    assertEquals(1, summary.entityCount());
    assertEquals(1, summary.issues().size());
    assertFalse(summary.issues().get(0).isError());
  }

  @Test
  @DisplayName("relationships to unknown entities are dropped")
  void danglingRelationshipDropped() {
    ExtractionResult dangling =
        new ExtractionResult(
            acmeOnly().entities(),
            List.of(ExtractedRelationship.of("PARTY_TO", ACME, EntityKey.of("Contract", "gone"))));
    IngestionSummary summary =
        builder.write(document(), chunks(), dangling, extraction("balanced"), NOW);
    assertEquals(0, summary.relationshipCount());
    assertEquals(1, summary.skippedRelationships());
  }

  @Test
  @DisplayName("entities accumulate source documents across ingestions")
  void sourceDocumentsAccumulate() {
    builder.write(document(), chunks(), acmeOnly(), extraction("balanced"), NOW);
    builder.write(
        new DocumentInput("other", "other.pdf", 1),
        List.of(ChunkInput.of(0, "Acme again")),
        new ExtractionResult(
            List.of(ExtractedEntity.of("Party", "acme", Map.of("name", "Acme Corp"), 0)),
            List.of()),
        extraction("balanced"),
        NOW);

    EntityRecord acme = driver.getEntity(ACME).orElseThrow();
    assertEquals("Acme Corp", acme.properties().get("name"));
    assertEquals("supplier", acme.properties().get("role"));
    assertEquals(List.of("doc", "other"), List.copyOf(acme.sourceDocuments()));
  }

  @Test
  @DisplayName("a storage failure while the chain is written surfaces as a partial chain error")
  void chainFailureIsAborted() {
    lenient().when(mockDriver.getEntity(any())).thenReturn(Optional.empty());
    doThrow(new GraphStorageException("boom", null)).when(mockDriver).applyBatch(any());

    ChunkGraphBuilder failing = new ChunkGraphBuilder(mockDriver, validator());
    PartialChainException ex =
        assertThrows(
            PartialChainException.class,
            () -> failing.write(document(), chunks(), acmeOnly(), extraction("balanced"), NOW));
    assertEquals(GraphRagErrorCode.ABORTED, ex.getCode());
    assertEquals("doc", ex.getContext().get("document_id"));
  }

  @Test
  @DisplayName("a storage failure without chain edges keeps its own error")
  void storageFailureWithoutChain() {
    lenient().when(mockDriver.getEntity(any())).thenReturn(Optional.empty());
    doThrow(new GraphStorageException("boom", null)).when(mockDriver).applyBatch(any());

    ChunkGraphBuilder failing = new ChunkGraphBuilder(mockDriver, validator());
    assertThrows(
        GraphStorageException.class,
        () -> failing.write(document(), chunks(), acmeOnly(), extraction("minimal"), NOW));
  }
}
