package com.gentoro.graphrag.exception;

public class RetrievalCancelledException extends GraphRagException {
  public RetrievalCancelledException(String message, Throwable cause) {
    super(GraphRagErrorCode.CANCELLED, message, cause);
  }
}
