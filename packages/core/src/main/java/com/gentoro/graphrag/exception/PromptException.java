package com.gentoro.graphrag.exception;

/** Prompt lookup, parsing or rendering error. */
public class PromptException extends GraphRagException {
  public PromptException(String message) {
    super(GraphRagErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(GraphRagErrorCode.PROMPT_ERROR, message, cause);
  }
}
