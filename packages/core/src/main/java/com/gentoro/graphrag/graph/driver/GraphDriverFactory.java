package com.gentoro.graphrag.graph.driver;

import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.graph.driver.spi.GraphDriverProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the configured {@link GraphDriver} through the {@link GraphDriverProvider} SPI. */
public final class GraphDriverFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(GraphDriverFactory.class);

  private GraphDriverFactory() {}

  /**
   * Create and initialize the driver named by {@code graph.driver} (default {@code in-memory}).
   *
   * @throws ConfigException when no registered provider matches or the match is unavailable
   */
  public static GraphDriver create(Configuration configuration) {
    String desired = configuration.getString("graph.driver", "in-memory").trim();
    List<String> known = new ArrayList<>();
    for (GraphDriverProvider p : ServiceLoader.load(GraphDriverProvider.class)) {
      known.add(p.id());
      if (p.id().equalsIgnoreCase(desired)) {
        if (!p.isAvailable(configuration)) {
          throw new ConfigException("Graph driver '%s' is not available".formatted(desired));
        }
        GraphDriver driver = p.create(configuration);
        driver.initialize();
        log.info("Using graph driver '{}'", driver.getDriverName());
        return driver;
      }
    }
    throw new ConfigException(
        "Unknown graph.driver '%s'; registered drivers: %s".formatted(desired, known));
  }
}
