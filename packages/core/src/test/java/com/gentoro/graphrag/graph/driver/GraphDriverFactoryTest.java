package com.gentoro.graphrag.graph.driver;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.graph.driver.providers.ArangoGraphDriverProvider;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GraphDriverFactory")
class GraphDriverFactoryTest {

  @Test
  @DisplayName("defaults to an initialized in-memory driver")
  void defaultsToInMemory() {
    GraphDriver driver = GraphDriverFactory.create(new BaseConfiguration());
    assertInstanceOf(InMemoryGraphDriver.class, driver);
    assertTrue(driver.isInitialized());
    driver.close();
    assertFalse(driver.isInitialized());
  }

  @Test
  @DisplayName("driver names are matched ignoring case")
  void caseInsensitive() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("graph.driver", " In-Memory ");
    assertEquals("in-memory", GraphDriverFactory.create(config).getDriverName());
  }

  @Test
  @DisplayName("an unknown driver lists the registered ones")
  void unknownDriver() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("graph.driver", "neo4j");
    ConfigException ex =
        assertThrows(ConfigException.class, () -> GraphDriverFactory.create(config));
    assertTrue(ex.getMessage().contains("in-memory"));
    assertTrue(ex.getMessage().contains("arangodb"));
  }

  @Test
  @DisplayName("the arangodb provider is available when selected or when a host is set")
  void arangoAvailability() {
    ArangoGraphDriverProvider provider = new ArangoGraphDriverProvider();
    BaseConfiguration config = new BaseConfiguration();
    assertFalse(provider.isAvailable(config));
    config.setProperty("graph.arangodb.host", "db.internal");
    assertTrue(provider.isAvailable(config));

    BaseConfiguration selected = new BaseConfiguration();
    selected.setProperty("graph.driver", "arangodb");
    assertTrue(provider.isAvailable(selected));
    assertFalse(provider.create(selected).isInitialized());
  }
}
