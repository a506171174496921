package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Recorded for the upstream chunker; this library consumes already-chunked text. */
public enum ChunkingMethod {
  @JsonProperty("fixed")
  FIXED,
  @JsonProperty("semantic")
  SEMANTIC,
  @JsonProperty("sentence")
  SENTENCE
}
