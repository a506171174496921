package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Schema-typed entity: a type tag plus a property bag whose keys are defined by the active schema.
 * {@code metadata} holds provenance such as {@code source_documents}, {@code chunk_index} and
 * {@code source_text}.
 */
public record EntityRecord(
    @JsonProperty("key") EntityKey key,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("metadata") Map<String, Object> metadata) {

  public static final String SOURCE_DOCUMENTS = "source_documents";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String SOURCE_TEXT = "source_text";

  public EntityRecord {
    Objects.requireNonNull(key, "key");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(nonNull(properties)));
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(nonNull(metadata)));
  }

  @JsonIgnore
  public String type() {
    return key.type();
  }

  @JsonIgnore
  public String id() {
    return key.id();
  }

  /** Human-facing label: {@code name}, then {@code title}, then the id. */
  @JsonIgnore
  public String displayName() {
    Object name = properties.get("name");
    if (name == null) name = properties.get("title");
    return name == null ? key.id() : String.valueOf(name);
  }

  @JsonIgnore
  public Set<String> sourceDocuments() {
    Object docs = metadata.get(SOURCE_DOCUMENTS);
    Set<String> out = new LinkedHashSet<>();
    if (docs instanceof Collection<?> c) {
      c.forEach(d -> out.add(String.valueOf(d)));
    }
    return out;
  }

  /**
   * Merge semantics used by upsert: incoming properties overwrite existing keys, other keys are
   * kept, confidence keeps the maximum and source documents accumulate.
   */
  public EntityRecord mergedWith(EntityRecord incoming) {
    if (!key.equals(incoming.key)) {
      throw new IllegalArgumentException("Cannot merge " + key + " with " + incoming.key);
    }
    Map<String, Object> props = new LinkedHashMap<>(properties);
    props.putAll(incoming.properties);
    Map<String, Object> meta = new LinkedHashMap<>(metadata);
    meta.putAll(incoming.metadata);
    Set<String> docs = sourceDocuments();
    docs.addAll(incoming.sourceDocuments());
    meta.put(SOURCE_DOCUMENTS, new ArrayList<>(docs));
    return new EntityRecord(key, props, Math.max(confidence, incoming.confidence), meta);
  }

  /** Copy of this entity with {@code documentId} removed from its source documents. */
  public EntityRecord withoutSourceDocument(String documentId) {
    Set<String> docs = sourceDocuments();
    docs.remove(documentId);
    Map<String, Object> meta = new LinkedHashMap<>(metadata);
    meta.put(SOURCE_DOCUMENTS, new ArrayList<>(docs));
    return new EntityRecord(key, properties, confidence, meta);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", key.type());
    map.put("id", key.id());
    map.put("properties", properties);
    map.put("confidence", confidence);
    map.put("metadata", metadata);
    return map;
  }

  @SuppressWarnings("unchecked")
  public static EntityRecord fromMap(Map<String, ?> map) {
    Object conf = map.get("confidence");
    return new EntityRecord(
        EntityKey.of(String.valueOf(map.get("type")), String.valueOf(map.get("id"))),
        (Map<String, Object>) map.get("properties"),
        conf instanceof Number n ? n.doubleValue() : 1.0,
        (Map<String, Object>) map.get("metadata"));
  }

  public static List<String> sortedIds(Collection<EntityRecord> entities) {
    return entities.stream().map(e -> e.key().toString()).sorted().toList();
  }

  private static Map<String, Object> nonNull(Map<String, Object> m) {
    if (m == null) return Map.of();
    Map<String, Object> copy = new LinkedHashMap<>();
    m.forEach(
        (k, v) -> {
          if (k != null && v != null) copy.put(k, v);
        });
    return copy;
  }
}
