package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a case as far as cache expiry is concerned. */
public enum CaseStatus {
  ACTIVE,
  CLOSED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** {@code closed} (any case) maps to CLOSED, everything else including null to ACTIVE. */
  public static CaseStatus fromValue(String value) {
    return value != null && "closed".equalsIgnoreCase(value.trim()) ? CLOSED : ACTIVE;
  }
}
