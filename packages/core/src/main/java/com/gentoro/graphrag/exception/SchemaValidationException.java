package com.gentoro.graphrag.exception;

import com.gentoro.graphrag.schema.ValidationIssue;
import java.util.List;
import java.util.Map;

/**
 * Entities or relationships of an ingestion batch violate the schema descriptor. Only thrown when
 * the extraction strategy runs in {@code strict} validation mode; the batch is not written.
 */
public class SchemaValidationException extends ValidationException {
  private final List<ValidationIssue> issues;

  public SchemaValidationException(String documentId, List<ValidationIssue> issues) {
    super(
        "Schema validation failed for document '%s' with %d issue(s)"
            .formatted(documentId, issues.size()),
        Map.of("document_id", documentId, "issue_count", issues.size()));
    this.issues = List.copyOf(issues);
  }

  public List<ValidationIssue> getIssues() {
    return issues;
  }
}
