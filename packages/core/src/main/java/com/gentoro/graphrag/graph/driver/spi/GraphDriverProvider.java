package com.gentoro.graphrag.graph.driver.spi;

import com.gentoro.graphrag.graph.driver.GraphDriver;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for graph storage drivers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in {@code
 * META-INF/services/com.gentoro.graphrag.graph.driver.spi.GraphDriverProvider}. The factory picks
 * the provider whose {@link #id()} equals {@code graph.driver}.
 */
public interface GraphDriverProvider {
  /** A stable, lowercase identifier (e.g. "in-memory", "arangodb"). */
  String id();

  /** Whether the provider can be used with the given configuration. */
  boolean isAvailable(Configuration configuration);

  /** Create an uninitialized driver. */
  GraphDriver create(Configuration configuration);
}
