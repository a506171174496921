package com.gentoro.graphrag.exception;

import java.util.Map;

/**
 * One retrieval signal failed or timed out. Recorded in the retrieval diagnostics and never
 * propagated to the caller of a retrieval.
 */
public class SignalSearchException extends GraphRagException {
  private final String signal;

  public SignalSearchException(String signal, String message, Throwable cause) {
    super(GraphRagErrorCode.EXECUTION_ERROR, message, Map.of("signal", signal), cause);
    this.signal = signal;
  }

  public SignalSearchException(String signal, GraphRagErrorCode code, String message) {
    super(code, message, Map.of("signal", signal));
    this.signal = signal;
  }

  public String getSignal() {
    return signal;
  }
}
