package com.gentoro.knowledge.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends KnowledgeException {
  public ValidationException(String message) {
    super(KnowledgeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(KnowledgeErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
