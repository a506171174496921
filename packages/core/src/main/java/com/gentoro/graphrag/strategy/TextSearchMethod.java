package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TextSearchMethod {
  @JsonProperty("contains")
  CONTAINS,
  @JsonProperty("fulltext")
  FULLTEXT,
  @JsonProperty("regex")
  REGEX
}
