package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DocumentRecord(
    @JsonProperty("id") String id,
    @JsonProperty("filename") String filename,
    @JsonProperty("page_count") int pageCount,
    @JsonProperty("ingested_at") Instant ingestedAt) {
  public DocumentRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ingestedAt, "ingestedAt");
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", id);
    if (filename != null) map.put("filename", filename);
    map.put("page_count", pageCount);
    map.put("ingested_at", ingestedAt.toString());
    return map;
  }

  public static DocumentRecord fromMap(Map<String, ?> map) {
    Object pages = map.get("page_count");
    return new DocumentRecord(
        String.valueOf(map.get("id")),
        map.get("filename") == null ? null : String.valueOf(map.get("filename")),
        pages instanceof Number n ? n.intValue() : 0,
        Instant.parse(String.valueOf(map.get("ingested_at"))));
  }
}
