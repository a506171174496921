package com.gentoro.graphrag.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only description of the active entity schema: which entity and relationship types exist,
 * which properties each entity type requires, and which endpoint types a relationship connects.
 *
 * <p>An {@link #permissive()} descriptor accepts every type and requires nothing.
 */
public record SchemaDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("entity_types") Set<String> entityTypes,
    @JsonProperty("relationship_types") Set<String> relationshipTypes,
    @JsonProperty("required_properties") Map<String, List<String>> requiredProperties,
    @JsonProperty("relationship_endpoints") Map<String, Endpoints> relationshipEndpoints,
    @JsonProperty("open") boolean open) {

  /** Declared source and target entity types of a relationship type. */
  public record Endpoints(
      @JsonProperty("source") String source, @JsonProperty("target") String target) {}

  public SchemaDescriptor {
    entityTypes = Collections.unmodifiableSet(new LinkedHashSet<>(orEmpty(entityTypes)));
    relationshipTypes =
        Collections.unmodifiableSet(new LinkedHashSet<>(orEmpty(relationshipTypes)));
    Map<String, List<String>> req = new LinkedHashMap<>();
    if (requiredProperties != null) {
      requiredProperties.forEach((k, v) -> req.put(k, v == null ? List.of() : List.copyOf(v)));
    }
    requiredProperties = Collections.unmodifiableMap(req);
    relationshipEndpoints =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(relationshipEndpoints == null ? Map.of() : relationshipEndpoints));
  }

  /** Permissive descriptor used when no schema is configured. */
  public static SchemaDescriptor permissive() {
    return new SchemaDescriptor("open", Set.of(), Set.of(), Map.of(), Map.of(), true);
  }

  public boolean hasEntityType(String type) {
    return open || entityTypes.contains(type);
  }

  public boolean hasRelationshipType(String type) {
    return open || relationshipTypes.contains(type);
  }

  public List<String> requiredFor(String entityType) {
    return requiredProperties.getOrDefault(entityType, List.of());
  }

  private static <T> Set<T> orEmpty(Set<T> s) {
    return s == null ? Set.of() : s;
  }
}
