package com.gentoro.knowledge.exception;

/** Reading a document or configuration resource failed. */
public class IoException extends KnowledgeException {
  public IoException(String message) {
    super(KnowledgeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(KnowledgeErrorCode.IO_ERROR, message, cause);
  }
}
