package com.gentoro.graphrag.exception;

public class IoException extends GraphRagException {
  public IoException(String message) {
    super(GraphRagErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GraphRagErrorCode.IO_ERROR, message, cause);
  }
}
