package com.gentoro.knowledge.exception;

/**
 * Canonical error codes for the knowledge core. Codes are stable and suitable for downstream
 * services and logs. Prefer the most specific code that reflects the failure origin.
 */
public enum KnowledgeErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  COLLABORATOR_ERROR,
  INDEX_NOT_READY,
}
