package com.mk.fx.context.engine.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** The five context dimensions, in build and reporting order. */
public enum Dimension {
  WHO,
  WHAT,
  WHERE,
  WHEN,
  WHY;

  /**
   * Case-insensitive lookup.
   *
   * @throws IllegalArgumentException for an unknown or blank name
   */
  public static Dimension fromValue(String value) {
    if (value != null) {
      var normalized = value.trim().toUpperCase(Locale.ROOT);
      for (Dimension dimension : values()) {
        if (dimension.name().equals(normalized)) {
          return dimension;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid dimension: " + value + ". Valid dimensions: " + names());
  }

  public static String names() {
    return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ", "[", "]"));
  }
}
