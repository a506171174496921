package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Key term extraction method. Only {@code simple} and {@code regex} are computed locally; {@code
 * llm} and {@code tfidf} expect key terms to be supplied by the upstream extractor and fall back to
 * {@code simple} when a chunk arrives without them.
 */
public enum KeyTermMethod {
  @JsonProperty("llm")
  LLM,
  @JsonProperty("tfidf")
  TFIDF,
  @JsonProperty("regex")
  REGEX,
  @JsonProperty("simple")
  SIMPLE
}
