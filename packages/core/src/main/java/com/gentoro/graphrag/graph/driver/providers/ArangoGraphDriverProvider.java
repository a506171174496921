package com.gentoro.graphrag.graph.driver.providers;

import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.arangodb.ArangoGraphDriver;
import com.gentoro.graphrag.graph.driver.spi.GraphDriverProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the ArangoDB-backed driver. */
public class ArangoGraphDriverProvider implements GraphDriverProvider {
  @Override
  public String id() {
    return ArangoGraphDriver.NAME;
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    // Available if explicitly selected or an Arango host is configured
    String desired = configuration.getString("graph.driver", "in-memory");
    if (ArangoGraphDriver.NAME.equalsIgnoreCase(desired)) return true;
    return configuration.getString("graph.arangodb.host", null) != null;
  }

  @Override
  public GraphDriver create(Configuration configuration) {
    return new ArangoGraphDriver(configuration);
  }
}
