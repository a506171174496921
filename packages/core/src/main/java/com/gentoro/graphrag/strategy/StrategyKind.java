package com.gentoro.graphrag.strategy;

import com.gentoro.graphrag.exception.ValidationException;
import java.util.Locale;

public enum StrategyKind {
  EXTRACTION,
  RETRIEVAL;

  public static StrategyKind parse(String value) {
    if (value == null) {
      throw new ValidationException("Strategy kind is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Unknown strategy kind '%s'; expected extraction or retrieval".formatted(value), e);
    }
  }
}
