package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A stored chunk. Metadata fields that the extraction strategy disabled are {@code null} and are
 * omitted from the storage representation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkRecord(
    @JsonProperty("id") String id,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("text") String text,
    @JsonProperty("page_number") Integer pageNumber,
    @JsonProperty("section_heading") String sectionHeading,
    @JsonProperty("temporal_refs") List<String> temporalRefs,
    @JsonProperty("key_terms") List<String> keyTerms,
    @JsonProperty("word_count") Integer wordCount,
    @JsonProperty("char_count") Integer charCount,
    @JsonProperty("sentence_count") Integer sentenceCount) {

  public ChunkRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(documentId, "documentId");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunk_index must be >= 0");
    }
    temporalRefs = temporalRefs == null ? null : List.copyOf(temporalRefs);
    keyTerms = keyTerms == null ? null : List.copyOf(keyTerms);
  }

  public String textOrEmpty() {
    return text == null ? "" : text;
  }

  public List<String> temporalRefsOrEmpty() {
    return temporalRefs == null ? List.of() : temporalRefs;
  }

  public List<String> keyTermsOrEmpty() {
    return keyTerms == null ? List.of() : keyTerms;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", id);
    map.put("document_id", documentId);
    map.put("chunk_index", chunkIndex);
    putIfPresent(map, "text", text);
    putIfPresent(map, "page_number", pageNumber);
    putIfPresent(map, "section_heading", sectionHeading);
    putIfPresent(map, "temporal_refs", temporalRefs);
    putIfPresent(map, "key_terms", keyTerms);
    putIfPresent(map, "word_count", wordCount);
    putIfPresent(map, "char_count", charCount);
    putIfPresent(map, "sentence_count", sentenceCount);
    return map;
  }

  public static ChunkRecord fromMap(Map<String, ?> map) {
    return new ChunkRecord(
        String.valueOf(map.get("id")),
        String.valueOf(map.get("document_id")),
        intOrNull(map.get("chunk_index")),
        map.get("text") == null ? null : String.valueOf(map.get("text")),
        intOrNull(map.get("page_number")),
        map.get("section_heading") == null ? null : String.valueOf(map.get("section_heading")),
        stringsOrNull(map.get("temporal_refs")),
        stringsOrNull(map.get("key_terms")),
        intOrNull(map.get("word_count")),
        intOrNull(map.get("char_count")),
        intOrNull(map.get("sentence_count")));
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) map.put(key, value);
  }

  private static Integer intOrNull(Object o) {
    return o instanceof Number n ? n.intValue() : null;
  }

  private static List<String> stringsOrNull(Object o) {
    if (!(o instanceof Collection<?> c)) return null;
    List<String> out = new ArrayList<>(c.size());
    c.forEach(v -> out.add(String.valueOf(v)));
    return out;
  }
}
