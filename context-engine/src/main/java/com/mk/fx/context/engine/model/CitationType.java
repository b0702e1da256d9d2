package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CitationType {
  STATUTE,
  CASE_LAW,
  REGULATION;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CitationType fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
