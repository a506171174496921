package com.gentoro.graphrag.graph.driver.providers;

import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.graph.driver.spi.GraphDriverProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-memory driver; always available. */
public class InMemoryGraphDriverProvider implements GraphDriverProvider {
  @Override
  public String id() {
    return InMemoryGraphDriver.NAME;
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    return true;
  }

  @Override
  public GraphDriver create(Configuration configuration) {
    return new InMemoryGraphDriver();
  }
}
