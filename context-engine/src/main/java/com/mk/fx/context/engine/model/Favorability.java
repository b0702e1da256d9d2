package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Favorability {
  SUPPORTING,
  OPPOSING,
  NEUTRAL;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Unknown or missing categories are neutral. */
  @JsonCreator
  public static Favorability fromValue(String value) {
    if (value != null) {
      for (Favorability favorability : values()) {
        if (favorability.name().equalsIgnoreCase(value.trim())) {
          return favorability;
        }
      }
    }
    return NEUTRAL;
  }
}
