package com.gentoro.graphrag.exception;

import java.util.Map;

/** A named resource (preset, schema, document) does not exist. */
public class NotFoundException extends GraphRagException {
  public NotFoundException(String message) {
    super(GraphRagErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(GraphRagErrorCode.NOT_FOUND, message, context);
  }
}
