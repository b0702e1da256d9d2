package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Quality of one built dimension.
 *
 * @param dimensionName WHO, WHAT, WHERE, WHEN or WHY
 * @param completenessScore completeness in [0, 1]
 * @param dataPoints number of extracted items
 * @param confidenceAvg mean extraction confidence in [0, 1]
 * @param sufficient always {@code completenessScore >= 0.85}
 */
public record DimensionQualityMetrics(
    String dimensionName,
    double completenessScore,
    int dataPoints,
    double confidenceAvg,
    @JsonProperty("is_sufficient") boolean sufficient) {

  public static final double SUFFICIENCY_THRESHOLD = 0.85;

  public DimensionQualityMetrics {
    completenessScore = Scores.clamp(completenessScore);
    confidenceAvg = Scores.clamp(confidenceAvg);
    sufficient = completenessScore >= SUFFICIENCY_THRESHOLD;
  }

  public static DimensionQualityMetrics of(
      Dimension dimension, double completenessScore, int dataPoints, double confidenceAvg) {
    return new DimensionQualityMetrics(
        dimension.name(), completenessScore, dataPoints, confidenceAvg, false);
  }
}
