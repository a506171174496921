package com.gentoro.graphrag.exception;

public class LlmException extends GraphRagException {
  public LlmException(String message) {
    super(GraphRagErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(GraphRagErrorCode.LLM_ERROR, message, cause);
  }
}
