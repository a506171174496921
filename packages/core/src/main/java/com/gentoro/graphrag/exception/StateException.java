package com.gentoro.graphrag.exception;

import java.util.Map;

/** The operation is not allowed in the current state of the system. */
public class StateException extends GraphRagException {
  public StateException(String message) {
    super(GraphRagErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Map<String, ?> context) {
    super(GraphRagErrorCode.FAILED_PRECONDITION, message, context);
  }
}
