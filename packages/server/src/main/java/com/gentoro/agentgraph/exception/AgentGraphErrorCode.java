package com.gentoro.agentgraph.exception;

/**
 * Canonical error codes for agentgraph. Codes are stable and suitable for downstream services and
 * logs. Prefer choosing the most specific code that reflects the failure origin and actionability.
 */
public enum AgentGraphErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  UNAUTHENTICATED,
  RESOURCE_EXHAUSTED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  CATALOG_ERROR,
  GRAPH_VALIDATION_ERROR,
  NODE_EXECUTION_ERROR,
  PROMPT_ERROR,
}
