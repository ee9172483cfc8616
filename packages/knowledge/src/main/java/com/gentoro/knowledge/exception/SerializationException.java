package com.gentoro.knowledge.exception;

/** Failed to serialize or deserialize data (JSON/YAML). */
public class SerializationException extends KnowledgeException {
  public SerializationException(String message) {
    super(KnowledgeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KnowledgeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
