package com.gentoro.graphrag.schema;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.exception.SerializationException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaLoader")
class SchemaLoaderTest {

  @Test
  @DisplayName("loads entity types, required properties and endpoints from the classpath")
  void loadsFromClasspath() {
    SchemaDescriptor schema = SchemaLoader.load("classpath:schemas/contracts.yaml");

    assertEquals("Contracts", schema.name());
    assertFalse(schema.open());
    assertEquals(Set.of("Contract", "Party", "Obligation"), schema.entityTypes());
    assertEquals(Set.of("PARTY_TO", "HAS_OBLIGATION"), schema.relationshipTypes());
    assertEquals(List.of("name"), schema.requiredFor("Party"));
    assertEquals(List.of(), schema.requiredFor("Unknown"));
    assertEquals("Party", schema.relationshipEndpoints().get("PARTY_TO").source());
    assertEquals("Contract", schema.relationshipEndpoints().get("PARTY_TO").target());
  }

  @Test
  @DisplayName("a blank location yields the open schema")
  void blankIsOpen() {
    SchemaDescriptor schema = SchemaLoader.load("  ");
    assertTrue(schema.open());
    assertTrue(schema.hasEntityType("Anything"));
    assertTrue(schema.hasRelationshipType("ANY"));
  }

  @Test
  @DisplayName("loads a schema file from disk")
  void loadsFromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("schema.yaml");
    Files.writeString(
        file,
        "schema: Tiny\nentities:\n  - name: Widget\nrelationships: []\n",
        StandardCharsets.UTF_8);

    SchemaDescriptor schema = SchemaLoader.load(file.toString());
    assertEquals("Tiny", schema.name());
    assertTrue(schema.hasEntityType("Widget"));
    assertFalse(schema.hasEntityType("Gadget"));
  }

  @Test
  @DisplayName("missing resources and files are configuration errors")
  void missingLocation(@TempDir Path dir) {
    assertThrows(ConfigException.class, () -> SchemaLoader.load("classpath:schemas/none.yaml"));
    assertThrows(
        ConfigException.class, () -> SchemaLoader.load(dir.resolve("absent.yaml").toString()));
  }

  @Test
  @DisplayName("malformed YAML and nameless entities are rejected")
  void malformed() {
    assertThrows(
        SerializationException.class,
        () -> SchemaLoader.parse("entities: [".getBytes(StandardCharsets.UTF_8), "inline"));
    assertThrows(
        ConfigException.class,
        () ->
            SchemaLoader.parse(
                "entities:\n  - properties: []\n".getBytes(StandardCharsets.UTF_8), "inline"));
  }
}
