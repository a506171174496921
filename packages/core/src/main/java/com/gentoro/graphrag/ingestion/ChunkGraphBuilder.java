package com.gentoro.graphrag.ingestion;

import com.gentoro.graphrag.exception.ExceptionUtil;
import com.gentoro.graphrag.exception.GraphStorageException;
import com.gentoro.graphrag.exception.PartialChainException;
import com.gentoro.graphrag.exception.SchemaValidationException;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.DocumentRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.GraphEdge;
import com.gentoro.graphrag.graph.GraphWriteBatch;
import com.gentoro.graphrag.graph.ProvenanceLink;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.ingestion.metadata.ChunkEnricher;
import com.gentoro.graphrag.logging.LoggingService;
import com.gentoro.graphrag.schema.SchemaValidator;
import com.gentoro.graphrag.schema.ValidationIssue;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import com.gentoro.graphrag.strategy.ValidationMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Stages the graph writes for one document and hands them to the driver as a single batch.
 *
 * <p>Order of construction: document node; chunk nodes with the metadata the strategy enables;
 * NEXT_CHUNK/PREV_CHUNK chain; FROM_DOCUMENT edges; entity upserts; relationships whose endpoints
 * exist; EXTRACTED_FROM provenance. The validation mode is taken from the strategy passed in and
 * applies to the whole batch.
 */
public class ChunkGraphBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(ChunkGraphBuilder.class);

  private final GraphDriver driver;
  private final SchemaValidator validator;

  public ChunkGraphBuilder(GraphDriver driver, SchemaValidator validator) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  /** Outcome of staging: the batch plus what was left out of it and why. */
  record Plan(
      GraphWriteBatch batch,
      int skippedEntities,
      int skippedRelationships,
      List<ValidationIssue> issues) {}

  public IngestionSummary write(
      DocumentInput document,
      List<ChunkInput> chunks,
      ExtractionResult extraction,
      ExtractionStrategy strategy,
      Instant ingestedAt) {
    Plan plan = plan(document, chunks, extraction, strategy, ingestedAt);
    GraphWriteBatch batch = plan.batch();
    try {
      driver.applyBatch(batch);
    } catch (RuntimeException e) {
      if (batch.containsChain()) {
        throw new PartialChainException(document.id(), e);
      }
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new GraphStorageException(
                  "Failed to write document", Map.of("document_id", document.id()), ex));
    }
    IngestionSummary summary =
        new IngestionSummary(
            document.id(),
            batch.entities().size(),
            batch.relationships().size(),
            batch.chunks().size(),
            plan.skippedEntities(),
            plan.skippedRelationships(),
            plan.issues());
    log.info(
        "Ingested document '{}': {} chunks, {} entities, {} relationships ({} issues)",
        summary.documentId(),
        summary.chunkCount(),
        summary.entityCount(),
        summary.relationshipCount(),
        summary.issues().size());
    return summary;
  }

  Plan plan(
      DocumentInput document,
      List<ChunkInput> chunks,
      ExtractionResult extraction,
      ExtractionStrategy strategy,
      Instant ingestedAt) {
    String docId = document.id();
    List<ChunkInput> ordered = orderedChunks(docId, chunks);
    ExtractionStrategy.Validation validation = strategy.validation();
    ValidationMode mode = validation.mode();
    List<ValidationIssue> issues = new ArrayList<>();

    DocumentRecord docRecord =
        new DocumentRecord(docId, document.filename(), document.pageCount(), ingestedAt);

    List<ChunkRecord> chunkRecords =
        strategy.chunks().enabled()
            ? new ChunkEnricher(strategy).enrich(docId, ordered)
            : List.of();

    List<GraphEdge> chunkEdges = new ArrayList<>();
    if (strategy.chunkLinking().sequential()) {
      for (int i = 0; i + 1 < chunkRecords.size(); i++) {
        String a = chunkRecords.get(i).id();
        String b = chunkRecords.get(i + 1).id();
        chunkEdges.add(GraphEdge.next(a, b));
        chunkEdges.add(GraphEdge.prev(b, a));
      }
    }
    if (strategy.chunkLinking().toDocument()) {
      for (ChunkRecord c : chunkRecords) {
        chunkEdges.add(GraphEdge.fromDocument(c.id(), docId));
      }
    }

    // Entities, merged within the batch by (type, id)
    Map<EntityKey, EntityRecord> staged = new LinkedHashMap<>();
    Map<EntityKey, Integer> sourceChunk = new LinkedHashMap<>();
    for (ExtractedEntity e : extraction.entities()) {
      EntityRecord record = toRecord(e, docId, strategy.entityLinking());
      staged.merge(record.key(), record, EntityRecord::mergedWith);
      if (e.chunkIndex() != null) sourceChunk.putIfAbsent(record.key(), e.chunkIndex());
    }
    int skippedEntities = 0;
    Map<EntityKey, EntityRecord> accepted = new LinkedHashMap<>();
    for (EntityRecord record : staged.values()) {
      List<ValidationIssue> found =
          mode == ValidationMode.IGNORE ? List.of() : validator.checkEntity(record, validation);
      issues.addAll(found);
      if (mode == ValidationMode.STORE_VALID && found.stream().anyMatch(ValidationIssue::isError)) {
        skippedEntities++;
        continue;
      }
      accepted.put(record.key(), record);
    }

    Predicate<EntityKey> exists =
        k -> accepted.containsKey(k) || driver.getEntity(k).isPresent();
    Map<String, RelationshipRecord> relationships = new LinkedHashMap<>();
    int skippedRelationships = 0;
    for (ExtractedRelationship r : extraction.relationships()) {
      RelationshipRecord record =
          new RelationshipRecord(r.type(), r.source(), r.target(), r.confidence(), r.properties());
      boolean sourceExists = exists.test(record.source());
      boolean targetExists = exists.test(record.target());
      boolean dangling = !sourceExists || !targetExists;
      List<ValidationIssue> found =
          mode == ValidationMode.IGNORE
              ? List.of()
              : validator.checkRelationship(
                  record,
                  k -> k.equals(record.source()) ? sourceExists : targetExists,
                  validation);
      issues.addAll(found);
      boolean invalid = found.stream().anyMatch(ValidationIssue::isError);
      if (dangling || (mode == ValidationMode.STORE_VALID && invalid)) {
        skippedRelationships++;
        continue;
      }
      relationships.merge(record.identity(), record, (a, b) -> b);
    }

    if (mode == ValidationMode.STRICT && issues.stream().anyMatch(ValidationIssue::isError)) {
      issues.forEach(i -> LoggingService.logAt(log, validation.logLevel(), "{}", i));
      throw new SchemaValidationException(docId, issues);
    }
    if (mode != ValidationMode.IGNORE) {
      issues.forEach(i -> LoggingService.logAt(log, validation.logLevel(), "{}", i));
    }

    List<ProvenanceLink> provenance = new ArrayList<>();
    if (strategy.entityLinking().enabled() && !chunkRecords.isEmpty()) {
      for (Map.Entry<EntityKey, Integer> en : sourceChunk.entrySet()) {
        if (!accepted.containsKey(en.getKey())) continue;
        int idx = en.getValue();
        if (idx < 0 || idx >= chunkRecords.size()) {
          log.warn(
              "Entity {} refers to chunk index {} outside document '{}'", en.getKey(), idx, docId);
          continue;
        }
        provenance.add(new ProvenanceLink(en.getKey(), chunkRecords.get(idx).id()));
      }
    }

    GraphWriteBatch batch =
        new GraphWriteBatch(
            docRecord,
            chunkRecords,
            chunkEdges,
            new ArrayList<>(accepted.values()),
            new ArrayList<>(relationships.values()),
            provenance);
    return new Plan(batch, skippedEntities, skippedRelationships, issues);
  }

  /** Sorts by chunk_index and requires the indexes to be exactly 0..N-1. */
  static List<ChunkInput> orderedChunks(String documentId, List<ChunkInput> chunks) {
    List<ChunkInput> ordered = new ArrayList<>(chunks == null ? List.of() : chunks);
    ordered.sort(Comparator.comparingInt(ChunkInput::chunkIndex));
    for (int i = 0; i < ordered.size(); i++) {
      if (ordered.get(i).chunkIndex() != i) {
        throw new ValidationException(
            "Chunk indexes must be exactly 0..N-1",
            Map.of(
                "document_id",
                documentId,
                "expected_index",
                i,
                "found_index",
                ordered.get(i).chunkIndex()));
      }
    }
    return ordered;
  }

  private static EntityRecord toRecord(
      ExtractedEntity e, String documentId, ExtractionStrategy.EntityLinking linking) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(EntityRecord.SOURCE_DOCUMENTS, List.of(documentId));
    if (linking.storeChunkIndex() && e.chunkIndex() != null) {
      metadata.put(EntityRecord.CHUNK_INDEX, e.chunkIndex());
    }
    if (linking.storeSourceText() && e.sourceText() != null) {
      metadata.put(EntityRecord.SOURCE_TEXT, e.sourceText());
    }
    return new EntityRecord(e.key(), e.properties(), e.confidence(), metadata);
  }
}
