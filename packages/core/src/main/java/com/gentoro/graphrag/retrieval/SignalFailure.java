package com.gentoro.graphrag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphrag.exception.SignalSearchException;

/** A signal that failed or timed out during one retrieval. */
public record SignalFailure(
    @JsonProperty("signal") String signal, @JsonProperty("message") String message) {

  static SignalFailure of(SignalSearchException e) {
    return new SignalFailure(e.getSignal(), e.getMessage());
  }
}
