package com.gentoro.graphrag.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphrag.exception.ValidationException;

/** Document metadata handed over by the upstream parser. */
public record DocumentInput(
    @JsonProperty("id") String id,
    @JsonProperty("filename") String filename,
    @JsonProperty("page_count") int pageCount) {
  public DocumentInput {
    if (id == null || id.isBlank()) {
      throw new ValidationException("Document id cannot be null or empty");
    }
    if (pageCount < 0) {
      throw new ValidationException("page_count must be >= 0");
    }
  }
}
