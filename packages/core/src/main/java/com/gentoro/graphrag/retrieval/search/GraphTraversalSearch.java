package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.TraversalHit;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds on entities of the requested types that satisfy the intent filters, then walks
 * relationships in both directions. A seed that also mentions the search text or a keyword in one
 * of its properties starts at 1.0, any other seed at {@value #TYPE_ONLY_SEED_SCORE}; every hop
 * halves the score. Source chunks of each reached entity inherit its score.
 */
public class GraphTraversalSearch implements SignalSearcher {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(GraphTraversalSearch.class);

  public static final double TYPE_ONLY_SEED_SCORE = 0.75;
  public static final double HOP_DECAY = 0.5;
  static final int SEED_LIMIT = 50;

  @Override
  public Signal signal() {
    return Signal.GRAPH_TRAVERSAL;
  }

  @Override
  public boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy) {
    return !intent.entityTypes().isEmpty() || !intent.filters().isEmpty();
  }

  @Override
  public List<ScoredCandidate> search(
      QueryIntent intent, RetrievalStrategy strategy, GraphDriver driver) {
    List<EntityRecord> seeds =
        driver.findEntities(intent.entityTypes(), intent.filters(), GraphDriver.UNLIMITED);
    if (seeds.isEmpty()) {
      log.debug(
          "No seed entities for types {} and filters {}", intent.entityTypes(), intent.filters());
      return List.of();
    }

    // Seeds that mention the query take the seed slots first.
    List<EntityKey> strong = new ArrayList<>();
    List<EntityKey> weak = new ArrayList<>();
    for (EntityRecord seed : seeds) {
      (mentionsQuery(seed, intent) ? strong : weak).add(seed.key());
    }
    if (strong.size() > SEED_LIMIT) {
      strong = new ArrayList<>(strong.subList(0, SEED_LIMIT));
    }
    if (weak.size() > SEED_LIMIT - strong.size()) {
      weak = new ArrayList<>(weak.subList(0, SEED_LIMIT - strong.size()));
    }

    int maxDepth = strategy.search().graphTraversal().maxDepth();
    Map<EntityKey, EntityRecord> reached = new LinkedHashMap<>();
    Map<EntityKey, Double> scores = new LinkedHashMap<>();
    walk(driver, strong, 1.0, maxDepth, intent.relationshipTypes(), reached, scores);
    SignalSearcher.checkInterrupted(signal());
    walk(driver, weak, TYPE_ONLY_SEED_SCORE, maxDepth, intent.relationshipTypes(), reached, scores);

    List<ScoredCandidate> out = new ArrayList<>();
    Map<String, ScoredCandidate> chunks = new LinkedHashMap<>();
    for (Map.Entry<EntityKey, EntityRecord> e : reached.entrySet()) {
      SignalSearcher.checkInterrupted(signal());
      double score = scores.get(e.getKey());
      out.add(ScoredCandidate.entity(signal(), e.getValue(), score));
      for (ChunkRecord chunk : driver.sourceChunks(e.getKey())) {
        if (intent.documentId() != null && !intent.documentId().equals(chunk.documentId())) {
          continue;
        }
        chunks.merge(
            chunk.id(),
            ScoredCandidate.chunk(signal(), chunk, score),
            (a, b) -> a.rawScore() >= b.rawScore() ? a : b);
      }
    }
    out.addAll(chunks.values());
    log.debug(
        "Graph traversal from {} seeds reached {} entities and {} chunks",
        seeds.size(),
        reached.size(),
        chunks.size());
    return out;
  }

  private void walk(
      GraphDriver driver,
      List<EntityKey> seeds,
      double seedScore,
      int maxDepth,
      List<String> relationshipTypes,
      Map<EntityKey, EntityRecord> reached,
      Map<EntityKey, Double> scores) {
    if (seeds.isEmpty()) return;
    for (TraversalHit hit : driver.traverse(seeds, maxDepth, relationshipTypes)) {
      EntityKey key = hit.entity().key();
      double score = seedScore * Math.pow(HOP_DECAY, hit.depth());
      if (score > scores.getOrDefault(key, -1.0)) {
        scores.put(key, score);
        reached.put(key, hit.entity());
      }
    }
  }

  static boolean mentionsQuery(EntityRecord entity, QueryIntent intent) {
    List<String> needles = new ArrayList<>(intent.keywords());
    if (intent.hasSearchText()) needles.add(intent.searchText());
    for (Object value : entity.properties().values()) {
      if (value == null) continue;
      String text = String.valueOf(value);
      for (String needle : needles) {
        if (StringUtility.containsIgnoreCase(text, needle)) return true;
      }
    }
    return false;
  }
}
