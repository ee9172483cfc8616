package com.gentoro.knowledge.ingest;

/**
 * What a document id reveals about the standard it holds. Every field is null when unknown.
 *
 * @param standard display name such as {@code AIAG-VDA FMEA 2019}
 * @param domain one of {@code fmea}, {@code safety}, {@code quality}, {@code reliability}
 * @param version publication year or revision letter
 */
public record StandardMetadata(
    String standard, String domain, String version, String standardFamily) {
  public static final StandardMetadata NONE = new StandardMetadata(null, null, null, null);
}
