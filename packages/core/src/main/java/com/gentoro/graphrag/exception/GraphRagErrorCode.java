package com.gentoro.graphrag.exception;

/**
 * Stable error codes shared by all GraphRAG failures. Modeled on Google/RPC status codes so they
 * can be mapped onto transport-level statuses by whatever surface embeds this library.
 */
public enum GraphRagErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  CANCELLED,
  ABORTED,
  DEADLINE_EXCEEDED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  GRAPH_STORAGE_ERROR,
  LLM_ERROR,
  PROMPT_ERROR,
}
