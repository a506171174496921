package com.gentoro.graphrag.exception;

import java.util.List;
import java.util.Map;

/** A strategy tree contains unknown keys or values outside their allowed range. */
public class StrategyValidationException extends ValidationException {
  private final List<String> violations;

  public StrategyValidationException(String message, List<String> violations) {
    super(message, Map.of("violations", List.copyOf(violations)));
    this.violations = List.copyOf(violations);
  }

  public StrategyValidationException(String message, Throwable cause) {
    super(message, cause);
    this.violations = List.of(message);
  }

  public List<String> getViolations() {
    return violations;
  }
}
