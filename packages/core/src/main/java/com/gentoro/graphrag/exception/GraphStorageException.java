package com.gentoro.graphrag.exception;

import java.util.Map;

/** Failure reported by the underlying graph storage engine. */
public class GraphStorageException extends GraphRagException {
  public GraphStorageException(String message, Throwable cause) {
    super(GraphRagErrorCode.GRAPH_STORAGE_ERROR, message, cause);
  }

  public GraphStorageException(String message, Map<String, ?> context, Throwable cause) {
    super(GraphRagErrorCode.GRAPH_STORAGE_ERROR, message, context, cause);
  }
}
