package com.gentoro.graphrag.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.exception.IoException;
import com.gentoro.graphrag.exception.SerializationException;
import com.gentoro.graphrag.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link SchemaDescriptor} from a YAML schema file.
 *
 * <pre>
 * schema:
 *   name: Contracts
 * entities:
 *   - name: Party
 *     properties:
 *       - name: name
 *         type: string
 *         required: true
 * relationships:
 *   - name: PARTY_TO
 *     source: Party
 *     target: Contract
 * </pre>
 *
 * Locations use the same {@code classpath:} / path convention as the application configuration.
 * A blank location yields {@link SchemaDescriptor#permissive()}.
 */
public final class SchemaLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(SchemaLoader.class);

  private SchemaLoader() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SchemaFile(
      @JsonProperty("schema") JsonNode schema,
      @JsonProperty("entities") List<EntityDef> entities,
      @JsonProperty("relationships") List<RelationshipDef> relationships) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record EntityDef(
      @JsonProperty("name") String name,
      @JsonProperty("properties") List<PropertyDef> properties) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record PropertyDef(
      @JsonProperty("name") String name,
      @JsonProperty("type") String type,
      @JsonProperty("required") boolean required) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RelationshipDef(
      @JsonProperty("name") String name,
      @JsonProperty("source") String source,
      @JsonProperty("target") String target) {}

  public static SchemaDescriptor load(String location) {
    if (location == null || location.isBlank()) {
      log.info("No schema configured; accepting every entity and relationship type");
      return SchemaDescriptor.permissive();
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      String resource = loc.substring("classpath:".length());
      ClassLoader cl = Thread.currentThread().getContextClassLoader();
      try (InputStream in = cl.getResourceAsStream(resource)) {
        if (in == null) {
          throw new ConfigException("Schema resource not found: %s".formatted(resource));
        }
        return parse(in.readAllBytes(), loc);
      } catch (IOException e) {
        throw new IoException("Failed to read schema resource: " + resource, e);
      }
    }
    Path path = Path.of(loc);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Schema file does not exist: " + path.toAbsolutePath());
    }
    try {
      return parse(Files.readAllBytes(path), loc);
    } catch (IOException e) {
      throw new IoException("Failed to read schema file: " + path, e);
    }
  }

  static SchemaDescriptor parse(byte[] yaml, String origin) {
    SchemaFile file;
    try {
      file = JacksonUtility.getYamlMapper().readValue(yaml, SchemaFile.class);
    } catch (IOException e) {
      throw new SerializationException("Invalid schema YAML in " + origin, e);
    }
    if (file == null) {
      throw new ConfigException("Schema file is empty: " + origin);
    }
    Set<String> entityTypes = new LinkedHashSet<>();
    Map<String, List<String>> required = new LinkedHashMap<>();
    for (EntityDef e : nullSafe(file.entities())) {
      if (e.name() == null || e.name().isBlank()) {
        throw new ConfigException("Schema entity without a name in " + origin);
      }
      entityTypes.add(e.name());
      List<String> req = new ArrayList<>();
      for (PropertyDef p : nullSafe(e.properties())) {
        if (p.required() && p.name() != null) req.add(p.name());
      }
      required.put(e.name(), req);
    }
    Set<String> relTypes = new LinkedHashSet<>();
    Map<String, SchemaDescriptor.Endpoints> endpoints = new LinkedHashMap<>();
    for (RelationshipDef r : nullSafe(file.relationships())) {
      if (r.name() == null || r.name().isBlank()) {
        throw new ConfigException("Schema relationship without a name in " + origin);
      }
      relTypes.add(r.name());
      if (r.source() != null && r.target() != null) {
        endpoints.put(r.name(), new SchemaDescriptor.Endpoints(r.source(), r.target()));
      }
    }
    String name = schemaName(file.schema());
    log.info(
        "Loaded schema '{}' with {} entity types and {} relationship types",
        name,
        entityTypes.size(),
        relTypes.size());
    return new SchemaDescriptor(name, entityTypes, relTypes, required, endpoints, false);
  }

  private static String schemaName(JsonNode node) {
    if (node == null || node.isNull()) return "unnamed";
    if (node.isTextual()) return node.asText();
    JsonNode name = node.get("name");
    return name == null ? "unnamed" : name.asText();
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
