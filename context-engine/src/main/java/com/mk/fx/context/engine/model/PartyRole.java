package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum PartyRole {
  PLAINTIFF,
  DEFENDANT,
  THIRD_PARTY,
  INTERVENOR,
  PETITIONER,
  RESPONDENT,
  APPELLANT,
  APPELLEE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @throws IllegalArgumentException for anything outside the known roles
   */
  @JsonCreator
  public static PartyRole fromValue(String value) {
    if (value != null) {
      var normalized = value.trim().toUpperCase(Locale.ROOT);
      for (PartyRole role : values()) {
        if (role.name().equals(normalized)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException("Invalid party role: " + value);
  }
}
