package com.gentoro.graphrag.retrieval.search;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CandidateKind {
  @JsonProperty("entity")
  ENTITY,
  @JsonProperty("chunk")
  CHUNK
}
