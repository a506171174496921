package com.gentoro.graphrag.retrieval;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.utility.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the strategy limits in order: {@code max_entities}, {@code max_chunks}, then {@code
 * max_context_tokens} measured on the formatted context. Under the token budget the lowest-ranked
 * chunk goes first; entities are dropped only once no chunk is left. Never fails: an oversized
 * result is cut and reported.
 */
public class LimitEnforcer {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(LimitEnforcer.class);

  private final ContextFormatter formatter;

  public LimitEnforcer(ContextFormatter formatter) {
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  /** The bounded selection plus its rendered context. */
  public record Bounded(
      List<MergedCandidate> entities,
      List<MergedCandidate> chunks,
      List<RelationshipRecord> relationships,
      String context,
      TruncationReport report) {}

  /**
   * @param entities entity candidates in rank order
   * @param chunks chunk candidates in rank order
   * @param relationships relationships among the entity candidates
   */
  public Bounded enforce(
      String query,
      List<MergedCandidate> entities,
      List<MergedCandidate> chunks,
      List<RelationshipRecord> relationships,
      RetrievalStrategy strategy) {
    RetrievalStrategy.Limits limits = strategy.limits();
    List<MergedCandidate> keptEntities =
        new ArrayList<>(entities.subList(0, Math.min(entities.size(), limits.maxEntities())));
    List<MergedCandidate> keptChunks =
        new ArrayList<>(chunks.subList(0, Math.min(chunks.size(), limits.maxChunks())));
    int entitiesByCap = entities.size() - keptEntities.size();
    int chunksByCap = chunks.size() - keptChunks.size();

    int chunksByTokens = 0;
    int entitiesByTokens = 0;
    List<RelationshipRecord> keptRelationships = among(keptEntities, relationships);
    String context = render(query, keptEntities, keptChunks, keptRelationships, strategy);
    int tokens = TokenEstimator.estimateTokens(context);
    while (tokens > limits.maxContextTokens()
        && (!keptChunks.isEmpty() || !keptEntities.isEmpty())) {
      if (!keptChunks.isEmpty()) {
        keptChunks.remove(keptChunks.size() - 1);
        chunksByTokens++;
      } else {
        keptEntities.remove(keptEntities.size() - 1);
        entitiesByTokens++;
        keptRelationships = among(keptEntities, relationships);
      }
      context = render(query, keptEntities, keptChunks, keptRelationships, strategy);
      tokens = TokenEstimator.estimateTokens(context);
    }

    TruncationReport report =
        new TruncationReport(entitiesByCap, chunksByCap, entitiesByTokens, chunksByTokens, tokens);
    if (report.truncated()) {
      log.debug(
          "Context limited: {} entities and {} chunks dropped by caps, {} entities and {} chunks"
              + " dropped for the {} token budget",
          entitiesByCap,
          chunksByCap,
          entitiesByTokens,
          chunksByTokens,
          limits.maxContextTokens());
    }
    return new Bounded(
        List.copyOf(keptEntities), List.copyOf(keptChunks), keptRelationships, context, report);
  }

  private String render(
      String query,
      List<MergedCandidate> entities,
      List<MergedCandidate> chunks,
      List<RelationshipRecord> relationships,
      RetrievalStrategy strategy) {
    List<EntityRecord> e = entities.stream().map(MergedCandidate::entity).toList();
    List<ChunkRecord> c = chunks.stream().map(MergedCandidate::chunk).toList();
    return formatter.format(query, e, c, relationships, strategy.context().includeMetadata());
  }

  static List<RelationshipRecord> among(
      List<MergedCandidate> entities, List<RelationshipRecord> relationships) {
    Set<EntityKey> keys =
        entities.stream().map(c -> c.entity().key()).collect(Collectors.toSet());
    return relationships.stream()
        .filter(r -> keys.contains(r.source()) && keys.contains(r.target()))
        .toList();
  }
}
