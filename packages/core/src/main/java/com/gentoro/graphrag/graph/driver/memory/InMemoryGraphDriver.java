package com.gentoro.graphrag.graph.driver.memory;

import com.gentoro.graphrag.exception.GraphStorageException;
import com.gentoro.graphrag.exception.StateException;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.DeleteSummary;
import com.gentoro.graphrag.graph.DocumentRecord;
import com.gentoro.graphrag.graph.EdgeTypes;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.GraphEdge;
import com.gentoro.graphrag.graph.GraphStats;
import com.gentoro.graphrag.graph.GraphWriteBatch;
import com.gentoro.graphrag.graph.NeighborWindow;
import com.gentoro.graphrag.graph.ProvenanceLink;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.graph.TraversalHit;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.strategy.TextSearchMethod;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Process-local graph store. Chunks of each document are kept in an index-addressed array so
 * neighbor lookup is index arithmetic; the NEXT/PREV edges are recorded per document as a flag
 * plus the array itself.
 *
 * <p>A single {@link ReentrantReadWriteLock} guards all structures. {@link #applyBatch} validates
 * the complete batch before it touches any structure, so a rejected batch leaves no trace.
 */
public class InMemoryGraphDriver implements GraphDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(InMemoryGraphDriver.class);
  public static final String NAME = "in-memory";

  private static final Comparator<ChunkRecord> READING_ORDER =
      Comparator.comparing(ChunkRecord::documentId).thenComparingInt(ChunkRecord::chunkIndex);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private final Map<String, DocumentRecord> documents = new LinkedHashMap<>();
  private final Map<String, ChunkRecord> chunks = new HashMap<>();
  private final Map<String, List<String>> chunkArrays = new HashMap<>();
  private final Set<String> chainedDocuments = new HashSet<>();
  private final Set<String> documentLinkedChunks = new HashSet<>();
  private final Map<EntityKey, EntityRecord> entities = new TreeMap<>();
  private final Map<String, RelationshipRecord> relationships = new TreeMap<>();
  private final Map<EntityKey, Set<String>> adjacency = new HashMap<>();
  private final Map<EntityKey, Set<String>> entityToChunks = new HashMap<>();
  private final Map<String, Set<EntityKey>> chunkToEntities = new HashMap<>();

  private volatile boolean initialized;

  @Override
  public void initialize() {
    initialized = true;
    log.debug("In-memory graph driver initialized");
  }

  @Override
  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public String getDriverName() {
    return NAME;
  }

  @Override
  public void shutdown() {
    initialized = false;
  }

  private void ensureInitialized() {
    if (!initialized) {
      throw new StateException("In-memory graph driver is not initialized");
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Writes
  // ---------------------------------------------------------------------------------------------

  @Override
  public void applyBatch(GraphWriteBatch batch) {
    ensureInitialized();
    lock.writeLock().lock();
    try {
      String docId = batch.document().id();
      verify(batch);

      removeChunksOf(docId);
      documents.put(docId, batch.document());

      List<String> array = new ArrayList<>(batch.chunks().size());
      for (ChunkRecord c : batch.chunks()) {
        chunks.put(c.id(), c);
        array.add(c.id());
      }
      chunkArrays.put(docId, array);
      for (GraphEdge e : batch.chunkEdges()) {
        if (EdgeTypes.FROM_DOCUMENT.equals(e.type())) documentLinkedChunks.add(e.fromId());
      }
      if (batch.containsChain()) chainedDocuments.add(docId);

      for (EntityRecord incoming : batch.entities()) {
        entities.merge(incoming.key(), incoming, EntityRecord::mergedWith);
      }
      for (RelationshipRecord r : batch.relationships()) {
        relationships.merge(r.identity(), r, InMemoryGraphDriver::mergeRelationship);
        adjacency.computeIfAbsent(r.source(), k -> new LinkedHashSet<>()).add(r.identity());
        adjacency.computeIfAbsent(r.target(), k -> new LinkedHashSet<>()).add(r.identity());
      }
      for (ProvenanceLink p : batch.provenance()) {
        entityToChunks.computeIfAbsent(p.entity(), k -> new LinkedHashSet<>()).add(p.chunkId());
        chunkToEntities.computeIfAbsent(p.chunkId(), k -> new LinkedHashSet<>()).add(p.entity());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Rejects a batch that would leave dangling edges; nothing has been mutated at this point. */
  private void verify(GraphWriteBatch batch) {
    Set<String> batchChunkIds = new HashSet<>();
    batch.chunks().forEach(c -> batchChunkIds.add(c.id()));
    for (ChunkRecord c : batch.chunks()) {
      if (!c.documentId().equals(batch.document().id())) {
        throw new GraphStorageException(
            "Chunk belongs to another document",
            Map.of("chunk_id", c.id(), "document_id", c.documentId()),
            null);
      }
    }
    for (GraphEdge e : batch.chunkEdges()) {
      boolean targetOk =
          EdgeTypes.FROM_DOCUMENT.equals(e.type())
              ? e.toId().equals(batch.document().id())
              : batchChunkIds.contains(e.toId());
      if (!batchChunkIds.contains(e.fromId()) || !targetOk) {
        throw new GraphStorageException(
            "Edge references a node outside the batch",
            Map.of("edge_type", e.type(), "from", e.fromId(), "to", e.toId()),
            null);
      }
    }
    Set<EntityKey> batchEntities = new HashSet<>();
    batch.entities().forEach(e -> batchEntities.add(e.key()));
    Predicate<EntityKey> exists = k -> batchEntities.contains(k) || entities.containsKey(k);
    for (RelationshipRecord r : batch.relationships()) {
      if (!exists.test(r.source()) || !exists.test(r.target())) {
        throw new GraphStorageException(
            "Relationship endpoint does not exist", Map.of("relationship", r.identity()), null);
      }
    }
    for (ProvenanceLink p : batch.provenance()) {
      if (!batchChunkIds.contains(p.chunkId()) || !exists.test(p.entity())) {
        throw new GraphStorageException(
            "Provenance link references a missing node",
            Map.of("entity", p.entity().toString(), "chunk_id", p.chunkId()),
            null);
      }
    }
  }

  private static RelationshipRecord mergeRelationship(
      RelationshipRecord existing, RelationshipRecord incoming) {
    Map<String, Object> props = new LinkedHashMap<>(existing.properties());
    props.putAll(incoming.properties());
    return new RelationshipRecord(
        existing.type(),
        existing.source(),
        existing.target(),
        Math.max(existing.confidence(), incoming.confidence()),
        props);
  }

  /** Drops a document's chunks together with their chain, ownership and provenance edges. */
  private int removeChunksOf(String documentId) {
    List<String> ids = chunkArrays.remove(documentId);
    chainedDocuments.remove(documentId);
    if (ids == null) return 0;
    for (String id : ids) {
      chunks.remove(id);
      documentLinkedChunks.remove(id);
      Set<EntityKey> linked = chunkToEntities.remove(id);
      if (linked != null) {
        for (EntityKey k : linked) {
          Set<String> back = entityToChunks.get(k);
          if (back != null) {
            back.remove(id);
            if (back.isEmpty()) entityToChunks.remove(k);
          }
        }
      }
    }
    return ids.size();
  }

  @Override
  public DeleteSummary deleteDocument(String documentId) {
    ensureInitialized();
    lock.writeLock().lock();
    try {
      if (documents.remove(documentId) == null) {
        return DeleteSummary.notFound(documentId);
      }
      int chunkCount = removeChunksOf(documentId);
      int entityCount = 0;
      int relCount = 0;
      for (EntityRecord e : new ArrayList<>(entities.values())) {
        Set<String> sources = e.sourceDocuments();
        if (!sources.contains(documentId)) continue;
        if (sources.size() == 1) {
          entities.remove(e.key());
          entityToChunks.remove(e.key());
          relCount += removeRelationshipsOf(e.key());
          entityCount++;
        } else {
          entities.put(e.key(), e.withoutSourceDocument(documentId));
        }
      }
      log.info(
          "Deleted document '{}': {} chunks, {} entities, {} relationships",
          documentId,
          chunkCount,
          entityCount,
          relCount);
      return new DeleteSummary(documentId, true, chunkCount, entityCount, relCount);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private int removeRelationshipsOf(EntityKey key) {
    Set<String> ids = adjacency.remove(key);
    if (ids == null) return 0;
    int removed = 0;
    for (String id : ids) {
      RelationshipRecord r = relationships.remove(id);
      if (r == null) continue;
      removed++;
      EntityKey other = r.source().equals(key) ? r.target() : r.source();
      Set<String> otherIds = adjacency.get(other);
      if (otherIds != null) otherIds.remove(id);
    }
    return removed;
  }

  @Override
  public void clearAll() {
    ensureInitialized();
    lock.writeLock().lock();
    try {
      documents.clear();
      chunks.clear();
      chunkArrays.clear();
      chainedDocuments.clear();
      documentLinkedChunks.clear();
      entities.clear();
      relationships.clear();
      adjacency.clear();
      entityToChunks.clear();
      chunkToEntities.clear();
      log.info("Cleared in-memory graph");
    } finally {
      lock.writeLock().unlock();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Documents and chunks
  // ---------------------------------------------------------------------------------------------

  @Override
  public Optional<DocumentRecord> getDocument(String documentId) {
    return read(() -> Optional.ofNullable(documents.get(documentId)));
  }

  @Override
  public Optional<ChunkRecord> getChunk(String chunkId) {
    return read(() -> Optional.ofNullable(chunks.get(chunkId)));
  }

  @Override
  public List<ChunkRecord> chunksForDocument(String documentId) {
    return read(
        () -> {
          List<String> ids = chunkArrays.getOrDefault(documentId, List.of());
          return ids.stream().map(chunks::get).toList();
        });
  }

  @Override
  public Optional<ChunkRecord> nextChunk(String chunkId) {
    return read(() -> atOffset(chunkId, 1));
  }

  @Override
  public Optional<ChunkRecord> previousChunk(String chunkId) {
    return read(() -> atOffset(chunkId, -1));
  }

  private Optional<ChunkRecord> atOffset(String chunkId, int offset) {
    ChunkRecord c = chunks.get(chunkId);
    if (c == null || !chainedDocuments.contains(c.documentId())) return Optional.empty();
    List<String> array = chunkArrays.get(c.documentId());
    int target = c.chunkIndex() + offset;
    if (target < 0 || target >= array.size()) return Optional.empty();
    return Optional.of(chunks.get(array.get(target)));
  }

  @Override
  public NeighborWindow neighbors(String chunkId, int before, int after) {
    return read(
        () -> {
          ChunkRecord c = chunks.get(chunkId);
          if (c == null) return NeighborWindow.empty();
          if (!chainedDocuments.contains(c.documentId())) {
            return new NeighborWindow(List.of(), c, List.of());
          }
          List<String> array = chunkArrays.get(c.documentId());
          int i = c.chunkIndex();
          int from = Math.max(0, i - Math.max(0, before));
          int to = Math.min(array.size() - 1, i + Math.max(0, after));
          List<ChunkRecord> b = new ArrayList<>();
          for (int j = from; j < i; j++) b.add(chunks.get(array.get(j)));
          List<ChunkRecord> a = new ArrayList<>();
          for (int j = i + 1; j <= to; j++) a.add(chunks.get(array.get(j)));
          return new NeighborWindow(b, c, a);
        });
  }

  @Override
  public List<ChunkRecord> searchChunks(
      TextSearchMethod method, String query, String documentId, int limit) {
    if (query == null || query.isBlank()) return List.of();
    Predicate<String> matcher =
        switch (method) {
          case CONTAINS -> text -> StringUtility.containsIgnoreCase(text, query);
          case FULLTEXT -> {
            Set<String> terms = StringUtility.significantTerms(query);
            Set<String> required =
                terms.isEmpty() ? Set.copyOf(StringUtility.words(query)) : terms;
            yield text -> {
              Set<String> words = new HashSet<>(StringUtility.words(text));
              return required.stream().anyMatch(words::contains);
            };
          }
          case REGEX -> {
            Pattern p;
            try {
              p = Pattern.compile(query, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
              throw new ValidationException(
                  "Invalid regular expression", Map.of("pattern", query, "reason", e.getMessage()));
            }
            yield text -> p.matcher(text).find();
          }
        };
    return filterChunks(c -> c.text() != null && matcher.test(c.text()), documentId, limit);
  }

  @Override
  public List<ChunkRecord> chunksByKeyTerms(
      Collection<String> terms, String documentId, int limit) {
    List<String> wanted =
        terms.stream()
            .map(t -> t.toLowerCase(Locale.ROOT).trim())
            .filter(t -> !t.isEmpty())
            .toList();
    if (wanted.isEmpty()) return List.of();
    return filterChunks(
        c ->
            c.keyTermsOrEmpty().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .anyMatch(t -> wanted.stream().anyMatch(w -> t.contains(w) || w.contains(t))),
        documentId,
        limit);
  }

  @Override
  public List<ChunkRecord> chunksWithTemporalRefs(String documentId, int limit) {
    return filterChunks(c -> !c.temporalRefsOrEmpty().isEmpty(), documentId, limit);
  }

  private List<ChunkRecord> filterChunks(
      Predicate<ChunkRecord> predicate, String documentId, int limit) {
    return read(
        () ->
            chunks.values().stream()
                .filter(c -> documentId == null || documentId.equals(c.documentId()))
                .filter(predicate)
                .sorted(READING_ORDER)
                .limit(limit > UNLIMITED ? limit : Long.MAX_VALUE)
                .toList());
  }

  // ---------------------------------------------------------------------------------------------
  // Entities and relationships
  // ---------------------------------------------------------------------------------------------

  @Override
  public Optional<EntityRecord> getEntity(EntityKey key) {
    return read(() -> Optional.ofNullable(entities.get(key)));
  }

  @Override
  public List<EntityRecord> findEntities(
      Collection<String> types, Map<String, String> filters, int limit) {
    Set<String> typeSet = types == null ? Set.of() : Set.copyOf(types);
    Map<String, String> f = filters == null ? Map.of() : filters;
    return read(
        () ->
            entities.values().stream()
                .filter(e -> typeSet.isEmpty() || typeSet.contains(e.type()))
                .filter(e -> matchesFilters(e, f))
                .limit(limit > UNLIMITED ? limit : Long.MAX_VALUE)
                .toList());
  }

  static boolean matchesFilters(EntityRecord e, Map<String, String> filters) {
    for (Map.Entry<String, String> f : filters.entrySet()) {
      Object value = e.properties().get(f.getKey());
      if (value == null || !StringUtility.containsIgnoreCase(String.valueOf(value), f.getValue())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public List<TraversalHit> traverse(
      Collection<EntityKey> seeds, int maxDepth, Collection<String> relationshipTypes) {
    Set<String> allowed = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);
    return read(
        () -> {
          Map<EntityKey, Integer> depth = new LinkedHashMap<>();
          Deque<EntityKey> queue = new ArrayDeque<>();
          for (EntityKey s : seeds) {
            if (entities.containsKey(s) && depth.putIfAbsent(s, 0) == null) queue.add(s);
          }
          while (!queue.isEmpty()) {
            EntityKey current = queue.poll();
            int d = depth.get(current);
            if (d >= maxDepth) continue;
            for (String relId : adjacency.getOrDefault(current, Set.of())) {
              RelationshipRecord r = relationships.get(relId);
              if (r == null || (!allowed.isEmpty() && !allowed.contains(r.type()))) continue;
              EntityKey other = r.source().equals(current) ? r.target() : r.source();
              if (entities.containsKey(other) && depth.putIfAbsent(other, d + 1) == null) {
                queue.add(other);
              }
            }
          }
          return depth.entrySet().stream()
              .map(en -> new TraversalHit(entities.get(en.getKey()), en.getValue()))
              .sorted(
                  Comparator.comparingInt(TraversalHit::depth)
                      .thenComparing(h -> h.entity().key()))
              .toList();
        });
  }

  @Override
  public List<RelationshipRecord> relationshipsAmong(Collection<EntityKey> keys) {
    Set<EntityKey> set = Set.copyOf(keys);
    return read(
        () ->
            relationships.values().stream()
                .filter(r -> set.contains(r.source()) && set.contains(r.target()))
                .toList());
  }

  @Override
  public List<ChunkRecord> sourceChunks(EntityKey key) {
    return read(
        () ->
            entityToChunks.getOrDefault(key, Set.of()).stream()
                .map(chunks::get)
                .filter(Objects::nonNull)
                .sorted(READING_ORDER)
                .toList());
  }

  @Override
  public List<EntityRecord> entitiesFromChunk(String chunkId) {
    return read(
        () ->
            chunkToEntities.getOrDefault(chunkId, Set.of()).stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(EntityRecord::key))
                .toList());
  }

  @Override
  public GraphStats stats() {
    return read(
        () -> {
          Map<String, Long> byType = new TreeMap<>();
          entities.values().forEach(e -> byType.merge(e.type(), 1L, Long::sum));
          Map<String, Long> relByType = new TreeMap<>();
          relationships.values().forEach(r -> relByType.merge(r.type(), 1L, Long::sum));
          long chainEdges = 0;
          for (String doc : chainedDocuments) {
            chainEdges += Math.max(0, chunkArrays.getOrDefault(doc, List.of()).size() - 1);
          }
          long provenance = entityToChunks.values().stream().mapToLong(Set::size).sum();
          Map<String, Long> infra = new TreeMap<>();
          infra.put(EdgeTypes.NEXT_CHUNK, chainEdges);
          infra.put(EdgeTypes.PREV_CHUNK, chainEdges);
          infra.put(EdgeTypes.FROM_DOCUMENT, (long) documentLinkedChunks.size());
          infra.put(EdgeTypes.EXTRACTED_FROM, provenance);
          return new GraphStats(documents.size(), chunks.size(), byType, relByType, infra);
        });
  }

  private <T> T read(Supplier<T> op) {
    ensureInitialized();
    lock.readLock().lock();
    try {
      return op.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
