package com.gentoro.knowledge.ingest;

import com.gentoro.knowledge.exception.KnowledgeErrorCode;
import com.gentoro.knowledge.exception.KnowledgeException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 fingerprint of chunk text, insensitive to surrounding whitespace and CRLF endings. */
public final class ContentHasher {
  private ContentHasher() {}

  public static String sha256(String content) {
    String normalized = content == null ? "" : content.trim().replace("\r\n", "\n");
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new KnowledgeException(KnowledgeErrorCode.UNKNOWN, "SHA-256 is not available", e);
    }
  }
}
