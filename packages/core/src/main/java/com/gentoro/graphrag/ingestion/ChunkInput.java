package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A chunk as produced by the upstream chunker. Metadata may be pre-filled; whatever is missing is
 * computed by {@link com.gentoro.graphrag.ingestion.metadata.ChunkEnricher} when the extraction
 * strategy enables it.
 */
public record ChunkInput(
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("text") String text,
    @JsonProperty("page_number") Integer pageNumber,
    @JsonProperty("section_heading") String sectionHeading,
    @JsonProperty("temporal_refs") List<String> temporalRefs,
    @JsonProperty("key_terms") List<String> keyTerms) {

  public ChunkInput {
    text = text == null ? "" : text;
    temporalRefs = temporalRefs == null ? null : List.copyOf(temporalRefs);
    keyTerms = keyTerms == null ? null : List.copyOf(keyTerms);
  }

  public static ChunkInput of(int chunkIndex, String text) {
    return new ChunkInput(chunkIndex, text, null, null, null, null);
  }

  public static ChunkInput of(int chunkIndex, String text, int pageNumber) {
    return new ChunkInput(chunkIndex, text, pageNumber, null, null, null);
  }
}
