package com.gentoro.graphrag.exception;

import java.util.Map;

/** Chunk chain creation failed for a document; the whole ingestion batch was rolled back. */
public class PartialChainException extends GraphRagException {
  public PartialChainException(String documentId, Throwable cause) {
    super(
        GraphRagErrorCode.ABORTED,
        "Chunk chain creation failed for document '%s'; ingestion rolled back"
            .formatted(documentId),
        Map.of("document_id", documentId),
        cause);
  }
}
