package com.gentoro.graphrag.graph.driver.arangodb;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.entity.StreamTransactionEntity;
import com.arangodb.model.AqlQueryOptions;
import com.arangodb.model.CollectionCreateOptions;
import com.arangodb.model.StreamTransactionOptions;
import com.gentoro.graphrag.exception.ExceptionUtil;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.configuration2.Configuration;

/**
 * ArangoDB implementation of {@link GraphDriver}.
 *
 * <p>Documents, chunks and entities live in document collections; chunk chain and ownership edges
 * in {@code chunk_links}, entity relationships in {@code relationships} and provenance in {@code
 * extracted_from}. Every batch is written inside one stream transaction.
 */
public class ArangoGraphDriver implements GraphDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(ArangoGraphDriver.class);
  public static final String NAME = "arangodb";

  static final String COLLECTION_DOCUMENTS = "documents";
  static final String COLLECTION_CHUNKS = "chunks";
  static final String COLLECTION_ENTITIES = "entities";
  static final String COLLECTION_CHUNK_LINKS = "chunk_links";
  static final String COLLECTION_RELATIONSHIPS = "relationships";
  static final String COLLECTION_EXTRACTED_FROM = "extracted_from";

  private static final String[] WRITE_COLLECTIONS = {
    COLLECTION_DOCUMENTS,
    COLLECTION_CHUNKS,
    COLLECTION_ENTITIES,
    COLLECTION_CHUNK_LINKS,
    COLLECTION_RELATIONSHIPS,
    COLLECTION_EXTRACTED_FROM
  };

  private final Configuration configuration;
  private final String databaseName;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  private ArangoDB arango;
  private ArangoDatabase db;

  public ArangoGraphDriver(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.databaseName = configuration.getString("graph.arangodb.database", "graphrag");
  }

  /** Uses an already connected client; {@link #initialize()} then only prepares collections. */
  ArangoGraphDriver(Configuration configuration, ArangoDB arango) {
    this(configuration);
    this.arango = arango;
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    try {
      if (arango == null) {
        String host = configuration.getString("graph.arangodb.host", "localhost");
        int port = configuration.getInt("graph.arangodb.port", 8529);
        String user = configuration.getString("graph.arangodb.user", "root");
        String password = configuration.getString("graph.arangodb.password", "");
        arango = new ArangoDB.Builder().host(host, port).user(user).password(password).build();
      }
      if (!arango.getDatabases().contains(databaseName)) {
        arango.createDatabase(databaseName);
      }
      db = arango.db(databaseName);
      createCollectionIfNeeded(COLLECTION_DOCUMENTS, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_CHUNKS, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_ENTITIES, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_CHUNK_LINKS, CollectionType.EDGES);
      createCollectionIfNeeded(COLLECTION_RELATIONSHIPS, CollectionType.EDGES);
      createCollectionIfNeeded(COLLECTION_EXTRACTED_FROM, CollectionType.EDGES);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new GraphStorageException(
                  "Failed to initialize ArangoDB database '%s'".formatted(databaseName), ex));
    }
    initialized.set(true);
    log.info("ArangoGraphDriver initialized database '{}'", databaseName);
  }

  private void createCollectionIfNeeded(String name, CollectionType type) {
    if (!db.collection(name).exists()) {
      db.createCollection(name, new CollectionCreateOptions().type(type));
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public String getDriverName() {
    return NAME;
  }

  @Override
  public void shutdown() {
    if (!initialized.getAndSet(false)) return;
    if (arango != null) {
      arango.shutdown();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Writes
  // ---------------------------------------------------------------------------------------------

  @Override
  public void applyBatch(GraphWriteBatch batch) {
    String docId = batch.document().id();
    inTransaction(
        "apply batch for document '%s'".formatted(docId),
        tx -> {
          removeChunks(docId, tx);
          query(
              "UPSERT { _key: @doc._key } INSERT @doc REPLACE @doc IN " + COLLECTION_DOCUMENTS,
              Map.of("doc", withKey(batch.document().toMap(), key(docId))),
              tx);
          if (!batch.chunks().isEmpty()) {
            List<Map<String, Object>> chunkDocs = new ArrayList<>();
            for (ChunkRecord c : batch.chunks()) {
              chunkDocs.add(withKey(c.toMap(), key(c.id())));
            }
            query(
                "FOR c IN @chunks INSERT c IN " + COLLECTION_CHUNKS,
                Map.of("chunks", chunkDocs),
                tx);
          }
          if (!batch.chunkEdges().isEmpty()) {
            List<Map<String, Object>> edges = new ArrayList<>();
            for (GraphEdge e : batch.chunkEdges()) {
              Map<String, Object> edge = new LinkedHashMap<>(e.toMap());
              edge.put("_from", COLLECTION_CHUNKS + "/" + key(e.fromId()));
              String target =
                  EdgeTypes.FROM_DOCUMENT.equals(e.type())
                      ? COLLECTION_DOCUMENTS + "/" + key(e.toId())
                      : COLLECTION_CHUNKS + "/" + key(e.toId());
              edge.put("_to", target);
              edge.put("document_id", docId);
              edges.add(edge);
            }
            query(
                "FOR e IN @edges INSERT e IN " + COLLECTION_CHUNK_LINKS,
                Map.of("edges", edges),
                tx);
          }
          upsertEntities(batch.entities(), tx);
          upsertRelationships(batch.relationships(), tx);
          insertProvenance(docId, batch.provenance(), tx);
          return null;
        });
  }

  private void upsertEntities(List<EntityRecord> entities, String tx) {
    if (entities.isEmpty()) return;
    List<Map<String, Object>> docs = new ArrayList<>();
    for (EntityRecord e : entities) {
      docs.add(withKey(e.toMap(), entityKey(e.key())));
    }
    query(
        "FOR d IN @docs UPSERT { _key: d._key } INSERT d UPDATE {"
            + " properties: MERGE(OLD.properties, d.properties),"
            + " confidence: MAX([OLD.confidence, d.confidence]),"
            + " metadata: MERGE(OLD.metadata, d.metadata, { source_documents:"
            + " UNION_DISTINCT(OLD.metadata.source_documents || [],"
            + " d.metadata.source_documents || []) }) } IN "
            + COLLECTION_ENTITIES,
        Map.of("docs", docs),
        tx);
  }

  private void upsertRelationships(List<RelationshipRecord> relationships, String tx) {
    if (relationships.isEmpty()) return;
    List<Map<String, Object>> edges = new ArrayList<>();
    List<String> endpoints = new ArrayList<>();
    for (RelationshipRecord r : relationships) {
      Map<String, Object> edge = withKey(r.toMap(), key(r.identity()));
      edge.put("_from", entityId(r.source()));
      edge.put("_to", entityId(r.target()));
      edges.add(edge);
      endpoints.add(entityId(r.source()));
      endpoints.add(entityId(r.target()));
    }
    List<Map<String, Object>> missing =
        query(
            "FOR id IN UNIQUE(@ids) FILTER DOCUMENT(id) == null RETURN { id: id }",
            Map.of("ids", endpoints),
            tx);
    if (!missing.isEmpty()) {
      throw new GraphStorageException(
          "Relationship endpoint does not exist", Map.of("missing", missing.toString()), null);
    }
    query(
        "FOR r IN @edges UPSERT { _key: r._key } INSERT r UPDATE {"
            + " properties: MERGE(OLD.properties, r.properties),"
            + " confidence: MAX([OLD.confidence, r.confidence]) } IN "
            + COLLECTION_RELATIONSHIPS,
        Map.of("edges", edges),
        tx);
  }

  private void insertProvenance(String docId, List<ProvenanceLink> links, String tx) {
    if (links.isEmpty()) return;
    List<Map<String, Object>> edges = new ArrayList<>();
    for (ProvenanceLink p : links) {
      Map<String, Object> edge = new LinkedHashMap<>();
      edge.put("_from", entityId(p.entity()));
      edge.put("_to", COLLECTION_CHUNKS + "/" + key(p.chunkId()));
      edge.put("document_id", docId);
      edges.add(edge);
    }
    query("FOR e IN @edges INSERT e IN " + COLLECTION_EXTRACTED_FROM, Map.of("edges", edges), tx);
  }

  private int removeChunks(String docId, String tx) {
    Map<String, Object> bind = Map.of("doc", docId);
    query(
        "FOR e IN " + COLLECTION_CHUNK_LINKS + " FILTER e.document_id == @doc REMOVE e IN "
            + COLLECTION_CHUNK_LINKS,
        bind,
        tx);
    query(
        "FOR e IN " + COLLECTION_EXTRACTED_FROM + " FILTER e.document_id == @doc REMOVE e IN "
            + COLLECTION_EXTRACTED_FROM,
        bind,
        tx);
    return query(
            "FOR c IN " + COLLECTION_CHUNKS + " FILTER c.document_id == @doc REMOVE c IN "
                + COLLECTION_CHUNKS + " RETURN 1",
            bind,
            tx)
        .size();
  }

  @Override
  public DeleteSummary deleteDocument(String documentId) {
    if (getDocument(documentId).isEmpty()) {
      return DeleteSummary.notFound(documentId);
    }
    DeleteSummary summary =
        inTransaction(
            "delete document '%s'".formatted(documentId),
            tx -> {
              int chunkCount = removeChunks(documentId, tx);
              query(
                  "REMOVE @key IN " + COLLECTION_DOCUMENTS,
                  Map.of("key", key(documentId)),
                  tx);
              List<Map<String, Object>> sourced =
                  query(
                      "FOR e IN " + COLLECTION_ENTITIES
                          + " FILTER @doc IN (e.metadata.source_documents || []) RETURN e",
                      Map.of("doc", documentId),
                      tx);
              List<String> orphanIds = new ArrayList<>();
              List<String> sharedKeys = new ArrayList<>();
              for (Map<String, Object> raw : sourced) {
                EntityRecord e = EntityRecord.fromMap(raw);
                if (e.sourceDocuments().size() == 1) {
                  orphanIds.add(entityId(e.key()));
                } else {
                  sharedKeys.add(entityKey(e.key()));
                }
              }
              int relCount =
                  query(
                          "FOR r IN " + COLLECTION_RELATIONSHIPS
                              + " FILTER r._from IN @ids OR r._to IN @ids REMOVE r IN "
                              + COLLECTION_RELATIONSHIPS + " RETURN 1",
                          Map.of("ids", orphanIds),
                          tx)
                      .size();
              query(
                  "FOR e IN " + COLLECTION_EXTRACTED_FROM
                      + " FILTER e._from IN @ids REMOVE e IN " + COLLECTION_EXTRACTED_FROM,
                  Map.of("ids", orphanIds),
                  tx);
              query(
                  "FOR id IN @ids REMOVE PARSE_IDENTIFIER(id).key IN " + COLLECTION_ENTITIES,
                  Map.of("ids", orphanIds),
                  tx);
              query(
                  "FOR k IN @keys LET e = DOCUMENT(CONCAT('" + COLLECTION_ENTITIES + "/', k))"
                      + " UPDATE e WITH { metadata: { source_documents:"
                      + " REMOVE_VALUE(e.metadata.source_documents, @doc) } } IN "
                      + COLLECTION_ENTITIES,
                  Map.of("keys", sharedKeys, "doc", documentId),
                  tx);
              return new DeleteSummary(documentId, true, chunkCount, orphanIds.size(), relCount);
            });
    log.info(
        "Deleted document '{}': {} chunks, {} entities, {} relationships",
        documentId,
        summary.chunksDeleted(),
        summary.entitiesDeleted(),
        summary.relationshipsDeleted());
    return summary;
  }

  @Override
  public void clearAll() {
    ensureInitialized();
    for (String name : WRITE_COLLECTIONS) {
      db.collection(name).truncate();
    }
    log.info("Cleared ArangoDB database '{}'", databaseName);
  }

  // ---------------------------------------------------------------------------------------------
  // Documents and chunks
  // ---------------------------------------------------------------------------------------------

  @Override
  public Optional<DocumentRecord> getDocument(String documentId) {
    return first(
            "RETURN DOCUMENT(CONCAT('" + COLLECTION_DOCUMENTS + "/', @key))",
            Map.of("key", key(documentId)))
        .map(DocumentRecord::fromMap);
  }

  @Override
  public Optional<ChunkRecord> getChunk(String chunkId) {
    return first(
            "RETURN DOCUMENT(CONCAT('" + COLLECTION_CHUNKS + "/', @key))",
            Map.of("key", key(chunkId)))
        .map(ChunkRecord::fromMap);
  }

  @Override
  public List<ChunkRecord> chunksForDocument(String documentId) {
    return chunks(
        "FOR c IN " + COLLECTION_CHUNKS
            + " FILTER c.document_id == @doc SORT c.chunk_index RETURN c",
        Map.of("doc", documentId));
  }

  @Override
  public Optional<ChunkRecord> nextChunk(String chunkId) {
    return walk(chunkId, EdgeTypes.NEXT_CHUNK, 1).stream().findFirst();
  }

  @Override
  public Optional<ChunkRecord> previousChunk(String chunkId) {
    return walk(chunkId, EdgeTypes.PREV_CHUNK, 1).stream().findFirst();
  }

  /** Follows one chain direction for up to {@code hops} edges, nearest first. */
  private List<ChunkRecord> walk(String chunkId, String edgeType, int hops) {
    if (hops <= 0) return List.of();
    return chunks(
        "FOR v, e, p IN 1..@hops OUTBOUND CONCAT('" + COLLECTION_CHUNKS + "/', @key) "
            + COLLECTION_CHUNK_LINKS
            + " PRUNE e != null AND e.edge_type != @type"
            + " FILTER p.edges[*].edge_type ALL == @type"
            + " SORT LENGTH(p.edges) RETURN v",
        Map.of("hops", hops, "key", key(chunkId), "type", edgeType));
  }

  @Override
  public NeighborWindow neighbors(String chunkId, int before, int after) {
    Optional<ChunkRecord> center = getChunk(chunkId);
    if (center.isEmpty()) return NeighborWindow.empty();
    List<ChunkRecord> prev = new ArrayList<>(walk(chunkId, EdgeTypes.PREV_CHUNK, before));
    prev.sort(Comparator.comparingInt(ChunkRecord::chunkIndex));
    List<ChunkRecord> next = walk(chunkId, EdgeTypes.NEXT_CHUNK, after);
    return new NeighborWindow(prev, center.get(), next);
  }

  @Override
  public List<ChunkRecord> searchChunks(
      TextSearchMethod method, String query, String documentId, int limit) {
    if (query == null || query.isBlank()) return List.of();
    Map<String, Object> bind = new HashMap<>();
    bind.put("doc", documentId);
    String predicate;
    switch (method) {
      case CONTAINS -> {
        predicate = "CONTAINS(LOWER(c.text), LOWER(@q))";
        bind.put("q", query);
      }
      case FULLTEXT -> {
        Set<String> terms = StringUtility.significantTerms(query);
        List<String> required =
            terms.isEmpty() ? StringUtility.words(query) : new ArrayList<>(terms);
        predicate =
            "LENGTH(FOR t IN @terms FILTER REGEX_TEST(c.text, CONCAT('\\\\b', t, '\\\\b'), true)"
                + " LIMIT 1 RETURN 1) > 0";
        bind.put("terms", required);
      }
      case REGEX -> {
        try {
          Pattern.compile(query);
        } catch (PatternSyntaxException e) {
          throw new ValidationException(
              "Invalid regular expression", Map.of("pattern", query, "reason", e.getMessage()));
        }
        predicate = "REGEX_TEST(c.text, @q, true)";
        bind.put("q", query);
      }
      default -> throw new IllegalStateException("Unsupported search method: " + method);
    }
    return chunks(
        "FOR c IN " + COLLECTION_CHUNKS
            + " FILTER c.text != null AND (@doc == null OR c.document_id == @doc) AND "
            + predicate
            + " SORT c.document_id, c.chunk_index"
            + limitClause(bind, limit)
            + " RETURN c",
        bind);
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
    Map<String, Object> bind = new HashMap<>();
    bind.put("doc", documentId);
    bind.put("terms", wanted);
    return chunks(
        "FOR c IN " + COLLECTION_CHUNKS
            + " FILTER @doc == null OR c.document_id == @doc"
            + " FILTER LENGTH(FOR kt IN (c.key_terms || []) FOR w IN @terms"
            + " FILTER CONTAINS(LOWER(kt), w) OR CONTAINS(w, LOWER(kt)) LIMIT 1 RETURN 1) > 0"
            + " SORT c.document_id, c.chunk_index"
            + limitClause(bind, limit)
            + " RETURN c",
        bind);
  }

  @Override
  public List<ChunkRecord> chunksWithTemporalRefs(String documentId, int limit) {
    Map<String, Object> bind = new HashMap<>();
    bind.put("doc", documentId);
    return chunks(
        "FOR c IN " + COLLECTION_CHUNKS
            + " FILTER (@doc == null OR c.document_id == @doc)"
            + " AND LENGTH(c.temporal_refs || []) > 0"
            + " SORT c.document_id, c.chunk_index"
            + limitClause(bind, limit)
            + " RETURN c",
        bind);
  }

  // ---------------------------------------------------------------------------------------------
  // Entities and relationships
  // ---------------------------------------------------------------------------------------------

  @Override
  public Optional<EntityRecord> getEntity(EntityKey key) {
    return first("RETURN DOCUMENT(@id)", Map.of("id", entityId(key))).map(EntityRecord::fromMap);
  }

  @Override
  public List<EntityRecord> findEntities(
      Collection<String> types, Map<String, String> filters, int limit) {
    List<Map<String, String>> filterList = new ArrayList<>();
    if (filters != null) {
      filters.forEach((k, v) -> filterList.add(Map.of("key", k, "value", v)));
    }
    Map<String, Object> bind = new HashMap<>();
    bind.put("types", types == null ? List.of() : List.copyOf(types));
    bind.put("filters", filterList);
    return query(
            "FOR e IN " + COLLECTION_ENTITIES
                + " FILTER LENGTH(@types) == 0 OR e.type IN @types"
                + " FILTER LENGTH(FOR f IN @filters FILTER e.properties[f.key] == null"
                + " OR !CONTAINS(LOWER(TO_STRING(e.properties[f.key])), LOWER(f.value))"
                + " RETURN 1) == 0"
                + " SORT e.type, e.id"
                + limitClause(bind, limit)
                + " RETURN e",
            bind,
            null)
        .stream()
        .map(EntityRecord::fromMap)
        .toList();
  }

  /** Breadth-first, one AQL round trip per level so the depth of each entity is exact. */
  @Override
  public List<TraversalHit> traverse(
      Collection<EntityKey> seeds, int maxDepth, Collection<String> relationshipTypes) {
    List<String> types = relationshipTypes == null ? List.of() : List.copyOf(relationshipTypes);
    Map<EntityKey, TraversalHit> hits = new LinkedHashMap<>();
    List<String> frontier = new ArrayList<>();
    for (EntityKey seed : seeds) {
      if (hits.containsKey(seed)) continue;
      Optional<EntityRecord> e = getEntity(seed);
      if (e.isPresent()) {
        hits.put(seed, new TraversalHit(e.get(), 0));
        frontier.add(entityId(seed));
      }
    }
    for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
      List<Map<String, Object>> reached =
          query(
              "FOR id IN @frontier FOR v, e IN 1..1 ANY id " + COLLECTION_RELATIONSHIPS
                  + " FILTER LENGTH(@types) == 0 OR e.type IN @types RETURN DISTINCT v",
              Map.of("frontier", frontier, "types", types),
              null);
      List<String> next = new ArrayList<>();
      for (Map<String, Object> raw : reached) {
        EntityRecord e = EntityRecord.fromMap(raw);
        if (hits.putIfAbsent(e.key(), new TraversalHit(e, depth)) == null) {
          next.add(entityId(e.key()));
        }
      }
      frontier = next;
    }
    return hits.values().stream()
        .sorted(Comparator.comparingInt(TraversalHit::depth).thenComparing(h -> h.entity().key()))
        .toList();
  }

  @Override
  public List<RelationshipRecord> relationshipsAmong(Collection<EntityKey> keys) {
    List<String> ids = keys.stream().map(ArangoGraphDriver::entityId).toList();
    return query(
            "FOR r IN " + COLLECTION_RELATIONSHIPS
                + " FILTER r._from IN @ids AND r._to IN @ids SORT r.type, r._key RETURN r",
            Map.of("ids", ids),
            null)
        .stream()
        .map(RelationshipRecord::fromMap)
        .toList();
  }

  @Override
  public List<ChunkRecord> sourceChunks(EntityKey key) {
    return chunks(
        "FOR v IN 1..1 OUTBOUND @id " + COLLECTION_EXTRACTED_FROM
            + " SORT v.document_id, v.chunk_index RETURN DISTINCT v",
        Map.of("id", entityId(key)));
  }

  @Override
  public List<EntityRecord> entitiesFromChunk(String chunkId) {
    return query(
            "FOR v IN 1..1 INBOUND CONCAT('" + COLLECTION_CHUNKS + "/', @key) "
                + COLLECTION_EXTRACTED_FROM
                + " SORT v.type, v.id RETURN DISTINCT v",
            Map.of("key", key(chunkId)),
            null)
        .stream()
        .map(EntityRecord::fromMap)
        .toList();
  }

  @Override
  public GraphStats stats() {
    Map<String, Long> byType = countBy(COLLECTION_ENTITIES, "type");
    Map<String, Long> relByType = countBy(COLLECTION_RELATIONSHIPS, "type");
    Map<String, Long> infra = new TreeMap<>(countBy(COLLECTION_CHUNK_LINKS, "edge_type"));
    for (String t : List.of(EdgeTypes.NEXT_CHUNK, EdgeTypes.PREV_CHUNK, EdgeTypes.FROM_DOCUMENT)) {
      infra.putIfAbsent(t, 0L);
    }
    infra.put(EdgeTypes.EXTRACTED_FROM, count(COLLECTION_EXTRACTED_FROM));
    return new GraphStats(
        count(COLLECTION_DOCUMENTS), count(COLLECTION_CHUNKS), byType, relByType, infra);
  }

  private long count(String collection) {
    return first("RETURN { n: LENGTH(" + collection + ") }", Map.of())
        .map(m -> ((Number) m.get("n")).longValue())
        .orElse(0L);
  }

  private Map<String, Long> countBy(String collection, String attribute) {
    Map<String, Long> out = new TreeMap<>();
    for (Map<String, Object> row :
        query(
            "FOR x IN " + collection + " COLLECT k = x." + attribute
                + " WITH COUNT INTO n RETURN { k: k, n: n }",
            Map.of(),
            null)) {
      out.put(String.valueOf(row.get("k")), ((Number) row.get("n")).longValue());
    }
    return out;
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  @FunctionalInterface
  private interface TransactionWork<T> {
    T run(String transactionId);
  }

  private <T> T inTransaction(String description, TransactionWork<T> work) {
    ensureInitialized();
    StreamTransactionEntity tx =
        db.beginStreamTransaction(
            new StreamTransactionOptions().writeCollections(WRITE_COLLECTIONS));
    try {
      T result = work.run(tx.getId());
      db.commitStreamTransaction(tx.getId());
      return result;
    } catch (Exception e) {
      try {
        db.abortStreamTransaction(tx.getId());
      } catch (Exception abortFailure) {
        e.addSuppressed(abortFailure);
      }
      log.error("Failed to {}; transaction {} aborted", description, tx.getId());
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new GraphStorageException("Failed to " + description, ex));
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<Map<String, Object>> query(String aql, Map<String, ?> bind, String transactionId) {
    ensureInitialized();
    AqlQueryOptions options = new AqlQueryOptions();
    if (transactionId != null) {
      options.streamTransactionId(transactionId);
    }
    try (ArangoCursor<Map> cursor = db.query(aql, Map.class, (Map<String, Object>) bind, options)) {
      List<Map<String, Object>> out = new ArrayList<>();
      for (Map row : cursor.asListRemaining()) {
        if (row != null) out.add((Map<String, Object>) row);
      }
      return out;
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new GraphStorageException("AQL query failed", Map.of("aql", aql), ex));
    }
  }

  private Optional<Map<String, Object>> first(String aql, Map<String, ?> bind) {
    return query(aql, bind, null).stream().findFirst();
  }

  private static String limitClause(Map<String, Object> bind, int limit) {
    if (limit <= UNLIMITED) return "";
    bind.put("limit", limit);
    return " LIMIT @limit";
  }

  private List<ChunkRecord> chunks(String aql, Map<String, ?> bind) {
    return query(aql, bind, null).stream().map(ChunkRecord::fromMap).toList();
  }

  private void ensureInitialized() {
    if (!initialized.get()) {
      throw new StateException("ArangoDB graph driver is not initialized");
    }
  }

  private static Map<String, Object> withKey(Map<String, Object> doc, String key) {
    Map<String, Object> out = new LinkedHashMap<>(doc);
    out.put("_key", key);
    return out;
  }

  static String entityKey(EntityKey key) {
    return key(key.type() + "|" + key.id());
  }

  static String entityId(EntityKey key) {
    return COLLECTION_ENTITIES + "/" + entityKey(key);
  }

  /**
   * Maps an identifier onto a valid ArangoDB {@code _key}: letters, digits, dashes and
   * underscores, not starting with a digit or underscore, at most 254 characters. Identifiers that
   * had to be rewritten get a hash suffix so distinct ids never collide.
   */
  static String key(String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new IllegalArgumentException("Document key cannot be null or empty");
    }
    String sanitized = raw.replaceAll("[^a-zA-Z0-9_\\-]", "_");
    if (sanitized.matches("^[0-9].*")) {
      sanitized = "k_" + sanitized;
    }
    if (sanitized.startsWith("_")) {
      sanitized = "k" + sanitized;
    }
    if (sanitized.equals(raw) && sanitized.length() <= 254) {
      return sanitized;
    }
    if (sanitized.length() > 240) {
      sanitized = sanitized.substring(0, 240);
    }
    return sanitized + "-" + Integer.toHexString(raw.hashCode());
  }
}
