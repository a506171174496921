package com.gentoro.graphrag.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends GraphRagException {
  public ValidationException(String message) {
    super(GraphRagErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GraphRagErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(GraphRagErrorCode.INVALID_ARGUMENT, message, context);
  }
}
