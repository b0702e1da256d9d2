package com.mk.fx.context.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Legal theories and the precedents for and against them. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhyContext implements DimensionContext {
  private String caseId;
  private String caseName;
  @Builder.Default private List<LegalTheory> legalTheories = new ArrayList<>();
  @Builder.Default private List<Map<String, Object>> argumentOutline = new ArrayList<>();
  @Builder.Default private List<PrecedentAnalysis> supportingPrecedents = new ArrayList<>();
  @Builder.Default private List<PrecedentAnalysis> opposingPrecedents = new ArrayList<>();
  @Builder.Default private List<String> distinguishingFactors = new ArrayList<>();
  @Builder.Default private double argumentStrength = 0.5;
  @Builder.Default private List<String> riskFactors = new ArrayList<>();
  @Builder.Default private List<String> mitigationStrategies = new ArrayList<>();
  @Builder.Default private Map<String, Double> similarCaseOutcomes = new LinkedHashMap<>();
  @Builder.Default private Map<String, Double> judgeRulingPatterns = new LinkedHashMap<>();

  public static WhyContext empty(String caseId) {
    return WhyContext.builder()
        .caseId(caseId)
        .caseName(DimensionContext.defaultCaseName(caseId))
        .build();
  }

  public int supportingCount() {
    return supportingPrecedents.size();
  }

  /** Mean relevance over supporting and opposing precedents, 0.0 when there are none. */
  public double averageRelevance() {
    return Stream.concat(supportingPrecedents.stream(), opposingPrecedents.stream())
        .mapToDouble(PrecedentAnalysis::getRelevanceScore)
        .average()
        .orElse(0.0);
  }

  public int dataPoints() {
    return legalTheories.size() + supportingPrecedents.size() + opposingPrecedents.size();
  }
}
