package com.gentoro.graphrag.exception;

/** Misconfiguration detected while loading or applying application settings. */
public class ConfigException extends GraphRagException {
  public ConfigException(String message) {
    super(GraphRagErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GraphRagErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
