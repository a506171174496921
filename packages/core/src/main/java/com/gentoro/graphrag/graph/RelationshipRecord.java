package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Typed, directed edge between two existing entities. */
public record RelationshipRecord(
    @JsonProperty("type") String type,
    @JsonProperty("source") EntityKey source,
    @JsonProperty("target") EntityKey target,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("properties") Map<String, Object> properties) {

  public RelationshipRecord {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  /** Unique per (type, source, target); re-ingestion merges into the same edge. */
  public String identity() {
    return type + "|" + source + "|" + target;
  }

  public boolean touches(EntityKey key) {
    return source.equals(key) || target.equals(key);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", type);
    map.put("source_type", source.type());
    map.put("source_id", source.id());
    map.put("target_type", target.type());
    map.put("target_id", target.id());
    map.put("confidence", confidence);
    map.put("properties", properties);
    return map;
  }

  @SuppressWarnings("unchecked")
  public static RelationshipRecord fromMap(Map<String, ?> map) {
    Object conf = map.get("confidence");
    return new RelationshipRecord(
        String.valueOf(map.get("type")),
        EntityKey.of(String.valueOf(map.get("source_type")), String.valueOf(map.get("source_id"))),
        EntityKey.of(String.valueOf(map.get("target_type")), String.valueOf(map.get("target_id"))),
        conf instanceof Number n ? n.doubleValue() : 1.0,
        (Map<String, Object>) map.get("properties"));
  }
}
