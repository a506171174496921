package com.gentoro.graphrag;

import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.exception.StateException;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.GraphDriverFactory;
import com.gentoro.graphrag.ingestion.IngestionService;
import com.gentoro.graphrag.llm.LlmClient;
import com.gentoro.graphrag.logging.LoggingService;
import com.gentoro.graphrag.prompt.impl.ClasspathPromptRepository;
import com.gentoro.graphrag.retrieval.RetrievalService;
import com.gentoro.graphrag.retrieval.intent.HeuristicIntentAnalyzer;
import com.gentoro.graphrag.retrieval.intent.IntentAnalyzer;
import com.gentoro.graphrag.retrieval.intent.LlmIntentAnalyzer;
import com.gentoro.graphrag.schema.SchemaDescriptor;
import com.gentoro.graphrag.schema.SchemaLoader;
import com.gentoro.graphrag.schema.SchemaValidator;
import com.gentoro.graphrag.strategy.PresetRegistry;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, wires the graph driver, strategy store, schema and
 * the ingestion and retrieval services, and releases them on {@link #shutdown()}.
 *
 * <pre>
 * try (GraphRag rag = new GraphRag("classpath:application.yaml")) {
 *   rag.initialize();
 *   rag.ingestion().ingest(document, chunks, extraction);
 *   RetrievalResult result = rag.retrieval().retrieve("What are the payment terms?");
 * }
 * </pre>
 */
public class GraphRag implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GraphRag.class);

  public static final int DEFAULT_SEARCH_THREADS = 8;

  private final Configuration configuration;
  private LlmClient llmClient;
  private SchemaDescriptor schema;
  private StrategyStore strategies;
  private GraphDriver driver;
  private ExecutorService searchExecutor;
  private ExecutorService requestExecutor;
  private IngestionService ingestion;
  private RetrievalService retrieval;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  /**
   * @param configLocation {@code classpath:}, {@code file:} or plain path of a YAML file; blank
   *     means {@code classpath:application.yaml}
   */
  public GraphRag(String configLocation) {
    this(new ConfigurationProvider(configLocation).config());
  }

  public GraphRag(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Model used when {@code intent.analyzer} is {@code llm}. Must be set before initializing. */
  public GraphRag withLlmClient(LlmClient client) {
    if (initialized.get()) {
      throw new StateException("LLM client must be set before initialize()");
    }
    this.llmClient = client;
    return this;
  }

  /**
   * Wires every component. Components become visible only once all of them are built; a failure
   * releases whatever was created and leaves the context uninitialized, so it may be retried.
   */
  public GraphRag initialize() {
    if (!initialized.compareAndSet(false, true)) {
      return this;
    }
    LoggingService.applyConfiguration(configuration);

    GraphDriver newDriver = null;
    ExecutorService newSearchExecutor = null;
    ExecutorService newRequestExecutor = null;
    try {
      int threads = configuration.getInt("retrieval.executor.threads", DEFAULT_SEARCH_THREADS);
      if (threads < 1) {
        throw new ConfigException("retrieval.executor.threads must be >= 1, got " + threads);
      }
      PresetRegistry presets =
          PresetRegistry.fromClasspath(
              configuration.getString("strategy.presets", PresetRegistry.DEFAULT_RESOURCE));
      StrategyStore newStrategies =
          new StrategyStore(
              presets, configuration.getString("strategy.defaultPreset", "balanced"));
      SchemaDescriptor newSchema =
          SchemaLoader.load(configuration.getString("schema.location", null));
      IntentAnalyzer analyzer = intentAnalyzer(newSchema);

      newDriver = GraphDriverFactory.create(configuration);
      newSearchExecutor = Executors.newFixedThreadPool(threads, named("graphrag-search"));
      newRequestExecutor = Executors.newCachedThreadPool(named("graphrag-retrieval"));
      IngestionService newIngestion =
          new IngestionService(
              newDriver, newStrategies, new SchemaValidator(newSchema), Clock.systemUTC());
      RetrievalService newRetrieval =
          new RetrievalService(
              newDriver,
              newStrategies,
              analyzer,
              RetrievalService.defaultSearchers(),
              newSearchExecutor,
              newRequestExecutor,
              configuration);

      this.schema = newSchema;
      this.strategies = newStrategies;
      this.driver = newDriver;
      this.searchExecutor = newSearchExecutor;
      this.requestExecutor = newRequestExecutor;
      this.ingestion = newIngestion;
      this.retrieval = newRetrieval;
      log.info(
          "GraphRAG ready: driver '{}', schema '{}', preset '{}', {} search threads",
          newDriver.getDriverName(),
          newSchema.name(),
          newStrategies.get().activePreset(),
          threads);
      return this;
    } catch (RuntimeException e) {
      log.error("GraphRAG initialization failed: {}", e.getMessage());
      stop(newRequestExecutor);
      stop(newSearchExecutor);
      shutdownQuietly(newDriver);
      initialized.set(false);
      throw e;
    }
  }

  private IntentAnalyzer intentAnalyzer(SchemaDescriptor descriptor) {
    IntentAnalyzer heuristic = new HeuristicIntentAnalyzer(descriptor);
    String kind = configuration.getString("intent.analyzer", "heuristic").trim();
    return switch (kind.toLowerCase(Locale.ROOT)) {
      case "heuristic" -> heuristic;
      case "llm" -> {
        if (llmClient == null) {
          throw new ConfigException("intent.analyzer is 'llm' but no LLM client was supplied");
        }
        ClasspathPromptRepository prompts =
            new ClasspathPromptRepository(
                configuration.getString(
                    "intent.prompts", ClasspathPromptRepository.DEFAULT_BASE_PATH));
        yield new LlmIntentAnalyzer(
            llmClient, prompts.get(LlmIntentAnalyzer.PROMPT_ID), descriptor, heuristic);
      }
      default -> throw new ConfigException("Unknown intent.analyzer '" + kind + "'");
    };
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    stop(requestExecutor);
    stop(searchExecutor);
    shutdownQuietly(driver);
    log.info("GraphRAG shut down");
  }

  private static void shutdownQuietly(GraphDriver driver) {
    if (driver == null) return;
    try {
      driver.shutdown();
    } catch (RuntimeException e) {
      log.warn("Graph driver did not shut down cleanly: {}", e.getMessage());
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private static void stop(ExecutorService executor) {
    if (executor == null) return;
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  public Configuration configuration() {
    return configuration;
  }

  public SchemaDescriptor schema() {
    return requireInitialized(schema);
  }

  public StrategyStore strategies() {
    return requireInitialized(strategies);
  }

  public GraphDriver driver() {
    return requireInitialized(driver);
  }

  public IngestionService ingestion() {
    return requireInitialized(ingestion);
  }

  public RetrievalService retrieval() {
    return requireInitialized(retrieval);
  }

  private static <T> T requireInitialized(T component) {
    if (component == null) {
      throw new StateException("GraphRag not initialized. Call initialize() first.");
    }
    return component;
  }
}
