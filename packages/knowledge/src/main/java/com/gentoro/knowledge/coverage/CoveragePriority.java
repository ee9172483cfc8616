package com.gentoro.knowledge.coverage;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How urgently a knowledge area needs more content. */
public enum CoveragePriority {
  HIGH,
  MEDIUM,
  LOW,
  SUFFICIENT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
