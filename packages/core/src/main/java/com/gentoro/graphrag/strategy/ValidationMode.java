package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How schema violations found during ingestion are handled. */
public enum ValidationMode {
  /** Abort the whole batch when any item fails. */
  @JsonProperty("strict")
  STRICT,
  /** Log issues, store everything that can be stored. */
  @JsonProperty("warn")
  WARN,
  /** Skip invalid items, store the rest. */
  @JsonProperty("store_valid")
  STORE_VALID,
  /** Skip checks entirely. */
  @JsonProperty("ignore")
  IGNORE
}
