package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.exception.RetrievalCancelledException;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One independent retrieval signal. Implementations are stateless and may run concurrently with
 * each other; they should stop early when the running thread is interrupted.
 */
public interface SignalSearcher {

  /** Most candidates one signal contributes. Applied after scoring. */
  int CANDIDATE_LIMIT = 100;

  Signal signal();

  default boolean isEnabled(RetrievalStrategy strategy) {
    return signal().isEnabled(strategy);
  }

  /** Whether the intent carries what this signal needs. Inapplicable searchers are not run. */
  boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy);

  List<ScoredCandidate> search(QueryIntent intent, RetrievalStrategy strategy, GraphDriver driver);

  /** The {@code limit} highest-scoring candidates. Equal scores keep their input order. */
  static List<ScoredCandidate> best(List<ScoredCandidate> candidates, int limit) {
    List<ScoredCandidate> sorted = new ArrayList<>(candidates);
    sorted.sort(Comparator.comparingDouble(ScoredCandidate::rawScore).reversed());
    return sorted.size() > limit ? List.copyOf(sorted.subList(0, limit)) : sorted;
  }

  /**
   * @throws RetrievalCancelledException when interrupted
   */
  static void checkInterrupted(Signal signal) {
    if (Thread.currentThread().isInterrupted()) {
      throw new RetrievalCancelledException("Search '" + signal.id() + "' was cancelled", null);
    }
  }
}
