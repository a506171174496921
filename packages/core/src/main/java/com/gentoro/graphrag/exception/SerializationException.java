package com.gentoro.graphrag.exception;

public class SerializationException extends GraphRagException {
  public SerializationException(String message, Throwable cause) {
    super(GraphRagErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
