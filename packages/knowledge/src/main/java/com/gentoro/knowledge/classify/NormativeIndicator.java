package com.gentoro.knowledge.classify;

/** Whether a passage states requirements (normative) or guidance (informative). */
public enum NormativeIndicator {
  NORMATIVE,
  INFORMATIVE,
  UNKNOWN;

  /** {@code true}, {@code false}, or {@code null} when unknown. */
  public Boolean toNormativeFlag() {
    return switch (this) {
      case NORMATIVE -> Boolean.TRUE;
      case INFORMATIVE -> Boolean.FALSE;
      case UNKNOWN -> null;
    };
  }
}
