package com.gentoro.knowledge.exception;

/** A lexical search was issued before any index was built. */
public class IndexNotReadyException extends KnowledgeException {
  public IndexNotReadyException(String message) {
    super(KnowledgeErrorCode.INDEX_NOT_READY, message);
  }
}
