package com.gentoro.knowledge.classify;

import java.util.regex.Pattern;

/**
 * Classifies standards text using RFC 2119 / ISO drafting conventions.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>an explicit {@code (normative)} or {@code (informative)} marker in the section path or the
 *       text, as used for annex titles;
 *   <li>a requirement keyword: SHALL, MUST, REQUIRED, SHOULD, RECOMMENDED;
 *   <li>a guidance keyword: MAY, OPTIONAL, CAN, NOTE, EXAMPLE;
 *   <li>otherwise {@link NormativeIndicator#UNKNOWN}.
 * </ol>
 *
 * Keywords match whole words, case-insensitively. Requirement keywords are checked before guidance
 * keywords, so "The system SHALL ... NOTE ..." is normative.
 */
public final class NormativeClassifier {
  private static final Pattern NORMATIVE_MARKER =
      Pattern.compile("\\(normative\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern INFORMATIVE_MARKER =
      Pattern.compile("\\(informative\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern NORMATIVE_KEYWORDS =
      Pattern.compile("\\b(SHALL|MUST|REQUIRED|SHOULD|RECOMMENDED)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern INFORMATIVE_KEYWORDS =
      Pattern.compile("\\b(MAY|OPTIONAL|CAN|NOTE|EXAMPLE)\\b", Pattern.CASE_INSENSITIVE);

  public NormativeIndicator classify(String text) {
    return classify(text, "");
  }

  public NormativeIndicator classify(String text, String sectionPath) {
    String body = text == null ? "" : text;
    String path = sectionPath == null ? "" : sectionPath;

    if (NORMATIVE_MARKER.matcher(path).find() || NORMATIVE_MARKER.matcher(body).find()) {
      return NormativeIndicator.NORMATIVE;
    }
    if (INFORMATIVE_MARKER.matcher(path).find() || INFORMATIVE_MARKER.matcher(body).find()) {
      return NormativeIndicator.INFORMATIVE;
    }
    if (body.isBlank()) {
      return NormativeIndicator.UNKNOWN;
    }
    if (NORMATIVE_KEYWORDS.matcher(body).find()) {
      return NormativeIndicator.NORMATIVE;
    }
    if (INFORMATIVE_KEYWORDS.matcher(body).find()) {
      return NormativeIndicator.INFORMATIVE;
    }
    return NormativeIndicator.UNKNOWN;
  }
}
