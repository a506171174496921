package com.gentoro.graphrag.exception;

import java.util.List;
import java.util.Map;

/** Raised when a strategy preset name is not registered. */
public class UnknownPresetException extends NotFoundException {
  private final String presetName;

  public UnknownPresetException(String presetName, List<String> available) {
    super(
        "Unknown preset '%s'. Available: %s".formatted(presetName, String.join(", ", available)),
        Map.of("preset", String.valueOf(presetName), "available", List.copyOf(available)));
    this.presetName = presetName;
  }

  public String getPresetName() {
    return presetName;
  }
}
