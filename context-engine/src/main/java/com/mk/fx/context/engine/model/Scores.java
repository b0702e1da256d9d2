package com.mk.fx.context.engine.model;

public final class Scores {

  private Scores() {}

  public static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  /** {@code min(1, count / 10)}: ten or more items count as complete. */
  public static double byCount(int count) {
    return Math.min(1.0, count / 10.0);
  }
}
