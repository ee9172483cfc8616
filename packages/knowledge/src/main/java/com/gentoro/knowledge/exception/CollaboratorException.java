package com.gentoro.knowledge.exception;

import java.util.Map;

/**
 * An external collaborator (semantic search, embedding, vector store) failed. The original failure
 * is kept as the cause; {@code collaborator} in the context names which one.
 */
public class CollaboratorException extends KnowledgeException {
  public CollaboratorException(String collaborator, String message) {
    super(KnowledgeErrorCode.COLLABORATOR_ERROR, message, Map.of("collaborator", collaborator));
  }

  public CollaboratorException(String collaborator, String message, Throwable cause) {
    super(
        KnowledgeErrorCode.COLLABORATOR_ERROR,
        message,
        Map.of("collaborator", collaborator),
        cause);
  }
}
