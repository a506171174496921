package com.gentoro.graphrag.retrieval;

import com.gentoro.graphrag.exception.ExceptionUtil;
import com.gentoro.graphrag.exception.GraphRagErrorCode;
import com.gentoro.graphrag.exception.NotFoundException;
import com.gentoro.graphrag.exception.RetrievalCancelledException;
import com.gentoro.graphrag.exception.SignalSearchException;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.intent.IntentAnalyzer;
import com.gentoro.graphrag.retrieval.search.CandidateKind;
import com.gentoro.graphrag.retrieval.search.ChunkTextSearch;
import com.gentoro.graphrag.retrieval.search.GraphTraversalSearch;
import com.gentoro.graphrag.retrieval.search.KeywordMatchSearch;
import com.gentoro.graphrag.retrieval.search.ScoredCandidate;
import com.gentoro.graphrag.retrieval.search.Signal;
import com.gentoro.graphrag.retrieval.search.SignalSearcher;
import com.gentoro.graphrag.retrieval.search.TemporalFilterSearch;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.configuration2.Configuration;

/**
 * Read-side entry point: question, intent, concurrent signal searches, merge, neighbor expansion,
 * limits and formatting.
 *
 * <p>The retrieval strategy is read once per request. Each enabled and applicable searcher runs
 * as its own task on the search executor and is awaited up to its own timeout ({@code
 * retrieval.searchers.<signal>.timeoutMs}, else {@code retrieval.searchers.timeoutMs}). A
 * searcher that fails or times out is cancelled, reported in {@link RetrievalResult#failures()}
 * and left out of the merge. Interrupting the calling thread cancels every running searcher and
 * raises {@link RetrievalCancelledException}.
 */
public class RetrievalService {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(RetrievalService.class);

  public static final long DEFAULT_TIMEOUT_MS = 5000;

  private final GraphDriver driver;
  private final StrategyStore strategies;
  private final IntentAnalyzer analyzer;
  private final List<SignalSearcher> searchers;
  private final ExecutorService searchExecutor;
  private final ExecutorService requestExecutor;
  private final Map<Signal, Long> timeouts = new EnumMap<>(Signal.class);
  private final ResultMerger merger = new ResultMerger();
  private final ContextExpander expander = new ContextExpander();
  private final ContextFormatter formatter = new ContextFormatter();
  private final LimitEnforcer enforcer = new LimitEnforcer(formatter);

  /**
   * @param searchExecutor runs individual signal searches
   * @param requestExecutor runs whole retrievals for {@link #retrieveAsync}; must not be the
   *     search executor when that one is bounded
   */
  public RetrievalService(
      GraphDriver driver,
      StrategyStore strategies,
      IntentAnalyzer analyzer,
      List<SignalSearcher> searchers,
      ExecutorService searchExecutor,
      ExecutorService requestExecutor,
      Configuration config) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.strategies = Objects.requireNonNull(strategies, "strategies");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.searchers =
        Objects.requireNonNull(searchers, "searchers").stream()
            .sorted(Comparator.comparingInt(s -> s.signal().priority()))
            .toList();
    this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    long fallback = config.getLong("retrieval.searchers.timeoutMs", DEFAULT_TIMEOUT_MS);
    for (Signal signal : Signal.values()) {
      timeouts.put(
          signal, config.getLong("retrieval.searchers." + signal.id() + ".timeoutMs", fallback));
    }
  }

  /** The four built-in signals in priority order. */
  public static List<SignalSearcher> defaultSearchers() {
    return List.of(
        new GraphTraversalSearch(),
        new ChunkTextSearch(),
        new KeywordMatchSearch(),
        new TemporalFilterSearch());
  }

  public RetrievalResult retrieve(String question) {
    return retrieve(question, null);
  }

  /**
   * @param documentId restricts chunk matches to one document; {@code null} searches all
   */
  public RetrievalResult retrieve(String question, String documentId) {
    QueryIntent intent = analyzer.analyze(question);
    if (documentId != null) {
      intent = intent.withDocumentId(documentId);
    }
    return retrieve(intent);
  }

  /** Runs the retrieval on the request executor; cancelling the future cancels its searches. */
  public Future<RetrievalResult> retrieveAsync(String question, String documentId) {
    return requestExecutor.submit(() -> retrieve(question, documentId));
  }

  public RetrievalResult retrieve(QueryIntent intent) {
    RetrievalStrategy strategy = strategies.get().retrieval();
    long started = System.nanoTime();

    List<ScoredCandidate> candidates = new ArrayList<>();
    List<Signal> used = new ArrayList<>();
    List<SignalFailure> failures = new ArrayList<>();
    runSearches(intent, strategy, candidates, used, failures);

    List<MergedCandidate> merged = merger.merge(candidates, strategy);
    List<MergedCandidate> entities = new ArrayList<>();
    List<MergedCandidate> chunks = new ArrayList<>();
    for (MergedCandidate c : merged) {
      (c.kind() == CandidateKind.ENTITY ? entities : chunks).add(c);
    }
    chunks = expander.expand(chunks, strategy, driver);
    List<RelationshipRecord> relationships =
        entities.isEmpty()
            ? List.of()
            : driver.relationshipsAmong(entities.stream().map(c -> c.entity().key()).toList());

    LimitEnforcer.Bounded bounded =
        enforcer.enforce(queryText(intent), entities, chunks, relationships, strategy);
    List<String> methods = used.stream().map(Signal::id).toList();
    log.info(
        "Retrieved {} entities and {} chunks using {} in {} ms{}",
        bounded.entities().size(),
        bounded.chunks().size(),
        methods,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
        failures.isEmpty() ? "" : " (degraded: " + failures.size() + " signal(s) failed)");
    return new RetrievalResult(
        bounded.entities(),
        bounded.chunks(),
        bounded.relationships(),
        methods,
        bounded.context(),
        intent,
        failures,
        bounded.report(),
        strategy.name());
  }

  /** Context for one entity and the chunks it was extracted from. */
  public RetrievalResult contextForEntity(EntityKey key) {
    EntityRecord entity =
        driver
            .getEntity(key)
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Entity not found: " + key,
                        Map.of("type", key.type(), "id", key.id())));
    RetrievalStrategy strategy = strategies.get().retrieval();
    String query = "Details about " + entity.displayName();
    Map<Signal, Double> direct = Map.of(Signal.GRAPH_TRAVERSAL, 1.0);
    List<MergedCandidate> entities =
        List.of(
            new MergedCandidate(
                CandidateKind.ENTITY, key.toString(), 1.0, direct, true, entity));
    List<MergedCandidate> chunks = new ArrayList<>();
    for (ChunkRecord chunk : driver.sourceChunks(key)) {
      chunks.add(new MergedCandidate(CandidateKind.CHUNK, chunk.id(), 1.0, direct, true, chunk));
    }
    chunks.sort(ResultMerger.RANKING);
    List<RelationshipRecord> relationships = driver.relationshipsAmong(List.of(key));
    LimitEnforcer.Bounded bounded =
        enforcer.enforce(query, entities, chunks, relationships, strategy);
    QueryIntent intent =
        QueryIntent.builder()
            .intent("entity_details")
            .entityTypes(key.type())
            .searchText(entity.displayName())
            .question(query)
            .build();
    return new RetrievalResult(
        bounded.entities(),
        bounded.chunks(),
        bounded.relationships(),
        List.of(),
        bounded.context(),
        intent,
        List.of(),
        bounded.report(),
        strategy.name());
  }

  private void runSearches(
      QueryIntent intent,
      RetrievalStrategy strategy,
      List<ScoredCandidate> candidates,
      List<Signal> used,
      List<SignalFailure> failures) {
    Map<SignalSearcher, Future<List<ScoredCandidate>>> running = new LinkedHashMap<>();
    for (SignalSearcher searcher : searchers) {
      if (!searcher.isEnabled(strategy)) continue;
      if (!searcher.isApplicable(intent, strategy)) {
        log.debug("Signal {} not applicable to intent", searcher.signal());
        continue;
      }
      running.put(searcher, searchExecutor.submit(() -> timed(searcher, intent, strategy)));
    }

    long submitted = System.nanoTime();
    for (Map.Entry<SignalSearcher, Future<List<ScoredCandidate>>> e : running.entrySet()) {
      Signal signal = e.getKey().signal();
      Future<List<ScoredCandidate>> future = e.getValue();
      long timeout = timeouts.get(signal);
      long remaining = timeout - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submitted);
      try {
        candidates.addAll(future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS));
        used.add(signal);
      } catch (InterruptedException ie) {
        running.values().forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new RetrievalCancelledException("Retrieval was cancelled", ie);
      } catch (TimeoutException te) {
        future.cancel(true);
        fail(
            failures,
            new SignalSearchException(
                signal.id(),
                GraphRagErrorCode.DEADLINE_EXCEEDED,
                "Timed out after " + timeout + " ms"));
      } catch (ExecutionException ee) {
        Throwable cause = ExceptionUtil.unwrap(ee);
        fail(
            failures,
            cause instanceof SignalSearchException sse
                ? sse
                : new SignalSearchException(signal.id(), describe(cause), cause));
      } catch (CancellationException ce) {
        fail(failures, new SignalSearchException(signal.id(), "Search was cancelled", ce));
      }
    }
  }

  private List<ScoredCandidate> timed(
      SignalSearcher searcher, QueryIntent intent, RetrievalStrategy strategy) {
    long t0 = System.nanoTime();
    List<ScoredCandidate> found = searcher.search(intent, strategy, driver);
    log.debug(
        "Signal {} produced {} candidates in {} ms",
        searcher.signal(),
        found.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
    return found;
  }

  private static void fail(List<SignalFailure> failures, SignalSearchException e) {
    log.warn("Signal {} failed: {}", e.getSignal(), e.getMessage());
    failures.add(SignalFailure.of(e));
  }

  private static String describe(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }

  private static String queryText(QueryIntent intent) {
    if (intent.question() != null) return intent.question();
    if (intent.searchText() != null) return intent.searchText();
    return intent.intent();
  }
}
