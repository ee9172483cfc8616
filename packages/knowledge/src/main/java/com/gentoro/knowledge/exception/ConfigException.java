package com.gentoro.knowledge.exception;

/** Configuration is missing or invalid. */
public class ConfigException extends KnowledgeException {
  public ConfigException(String message) {
    super(KnowledgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KnowledgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
