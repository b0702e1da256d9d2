package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Named dimension sets a caller can request instead of listing dimensions. */
public enum Scope {
  MINIMAL(List.of(Dimension.WHO, Dimension.WHERE)),
  STANDARD(List.of(Dimension.WHO, Dimension.WHAT, Dimension.WHERE, Dimension.WHEN)),
  COMPREHENSIVE(List.of(Dimension.values()));

  private final List<Dimension> dimensions;

  Scope(List<Dimension> dimensions) {
    this.dimensions = dimensions;
  }

  public List<Dimension> dimensions() {
    return dimensions;
  }

  /** Lower-case wire name, also used in cache keys. */
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Scope fromValue(String value) {
    if (value != null) {
      var normalized = value.trim().toUpperCase(Locale.ROOT);
      for (Scope scope : values()) {
        if (scope.name().equals(normalized)) {
          return scope;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid scope: "
            + value
            + ". Valid scopes: "
            + Arrays.stream(values()).map(Scope::value).collect(Collectors.joining(", ", "[", "]")));
  }
}
