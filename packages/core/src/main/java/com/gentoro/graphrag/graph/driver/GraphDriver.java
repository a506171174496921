package com.gentoro.graphrag.graph.driver;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.DeleteSummary;
import com.gentoro.graphrag.graph.DocumentRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.GraphStats;
import com.gentoro.graphrag.graph.GraphWriteBatch;
import com.gentoro.graphrag.graph.NeighborWindow;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.graph.TraversalHit;
import com.gentoro.graphrag.strategy.TextSearchMethod;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query and write contracts against the property graph.
 *
 * <p>Implementations hide the storage engine and its query language so ingestion and retrieval stay
 * database-agnostic and the driver can be switched through configuration ({@code graph.driver}).
 * Read operations are safe to call concurrently. {@link #applyBatch(GraphWriteBatch)} is atomic.
 *
 * <p>The chunk searches return matches in reading order. For them and for {@link
 * #findEntities(Collection, Map, int)}, a {@code limit} of {@link #UNLIMITED} or less returns every
 * match, so callers that rank by their own measure can cut after scoring.
 */
public interface GraphDriver extends AutoCloseable {

  int UNLIMITED = 0;

  /** Initialize the driver and underlying connections/resources. */
  void initialize();

  /**
   * @return true when the driver is ready to accept operations.
   */
  boolean isInitialized();

  /**
   * @return logical driver identifier (e.g. {@code in-memory}, {@code arangodb}).
   */
  String getDriverName();

  // ---------------------------------------------------------------------------------------------
  // Writes
  // ---------------------------------------------------------------------------------------------

  /**
   * Apply all writes of one document ingestion atomically. Re-applying a document id replaces that
   * document's chunks and chunk edges; entities and relationships are upserted.
   *
   * @throws com.gentoro.graphrag.exception.GraphStorageException when the batch cannot be applied;
   *     nothing of the batch is visible afterwards
   */
  void applyBatch(GraphWriteBatch batch);

  /** Remove a document, its chunks and chunk edges, and entities sourced only from it. */
  DeleteSummary deleteDocument(String documentId);

  /** Remove everything. */
  void clearAll();

  // ---------------------------------------------------------------------------------------------
  // Documents and chunks
  // ---------------------------------------------------------------------------------------------

  Optional<DocumentRecord> getDocument(String documentId);

  Optional<ChunkRecord> getChunk(String chunkId);

  /** All chunks of a document ordered by chunk_index. */
  List<ChunkRecord> chunksForDocument(String documentId);

  /** Follow the NEXT_CHUNK edge. */
  Optional<ChunkRecord> nextChunk(String chunkId);

  /** Follow the PREV_CHUNK edge. */
  Optional<ChunkRecord> previousChunk(String chunkId);

  /** Up to {@code before} preceding and {@code after} following chunks of the same document. */
  NeighborWindow neighbors(String chunkId, int before, int after);

  /**
   * Chunks whose text matches {@code query}. For {@code contains} the query is a case-insensitive
   * substring, for {@code fulltext} a set of terms of which at least one must appear, for {@code
   * regex} a Java regular expression.
   *
   * @param documentId optional scope; {@code null} searches all documents
   */
  List<ChunkRecord> searchChunks(
      TextSearchMethod method, String query, String documentId, int limit);

  /** Chunks whose key terms overlap {@code terms}, compared case-insensitively by containment. */
  List<ChunkRecord> chunksByKeyTerms(Collection<String> terms, String documentId, int limit);

  /** Chunks carrying at least one temporal reference. */
  List<ChunkRecord> chunksWithTemporalRefs(String documentId, int limit);

  // ---------------------------------------------------------------------------------------------
  // Entities and relationships
  // ---------------------------------------------------------------------------------------------

  Optional<EntityRecord> getEntity(EntityKey key);

  /**
   * Entities of the given types (all types when empty) whose properties match every filter: the
   * property value must contain the filter value, ignoring case.
   */
  List<EntityRecord> findEntities(Collection<String> types, Map<String, String> filters, int limit);

  /**
   * Breadth-first traversal over relationships in both directions, starting at {@code seeds}
   * (depth 0) and stopping after {@code maxDepth} hops.
   *
   * @param relationshipTypes types to follow; all when empty
   */
  List<TraversalHit> traverse(
      Collection<EntityKey> seeds, int maxDepth, Collection<String> relationshipTypes);

  /** Relationships whose source and target are both in {@code keys}. */
  List<RelationshipRecord> relationshipsAmong(Collection<EntityKey> keys);

  /** Chunks an entity was extracted from (EXTRACTED_FROM). */
  List<ChunkRecord> sourceChunks(EntityKey key);

  /** Entities extracted from a chunk. */
  List<EntityRecord> entitiesFromChunk(String chunkId);

  GraphStats stats();

  /** Shut down the driver and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
