package com.gentoro.knowledge.chunk;

/** Identity of the document a set of elements was parsed from. */
public record DocumentMetadata(String documentId, String documentTitle, String documentType) {
  public DocumentMetadata {
    documentId = documentId == null ? "" : documentId;
    documentTitle = documentTitle == null ? "" : documentTitle;
    documentType = documentType == null ? "" : documentType;
  }
}
