package com.gentoro.graphrag.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A single schema finding about one entity or relationship of an ingestion batch. */
public record ValidationIssue(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("kind") Kind kind,
    @JsonProperty("subject") String subject,
    @JsonProperty("message") String message) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Kind {
    UNKNOWN_ENTITY_TYPE,
    MISSING_REQUIRED_PROPERTY,
    UNKNOWN_RELATIONSHIP_TYPE,
    ENDPOINT_TYPE_MISMATCH,
    MISSING_ENDPOINT
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + kind + " [" + subject + "]: " + message;
  }
}
