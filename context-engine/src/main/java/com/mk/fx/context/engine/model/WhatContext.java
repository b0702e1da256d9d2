package com.mk.fx.context.engine.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Claims, issues and authorities of a case. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhatContext implements DimensionContext {
  private String caseId;
  private String caseName;
  @Builder.Default private List<CauseOfAction> causesOfAction = new ArrayList<>();
  @Builder.Default private List<String> legalIssues = new ArrayList<>();
  @Builder.Default private List<String> doctrines = new ArrayList<>();
  @Builder.Default private List<Citation> statutes = new ArrayList<>();
  @Builder.Default private List<Citation> caseCitations = new ArrayList<>();
  private String primaryLegalTheory;
  @Builder.Default private double issueComplexity = 0.5;
  @Builder.Default private String jurisdictionType = "federal";

  public static WhatContext empty(String caseId) {
    return WhatContext.builder()
        .caseId(caseId)
        .caseName(DimensionContext.defaultCaseName(caseId))
        .build();
  }

  public int dataPoints() {
    return causesOfAction.size() + legalIssues.size() + statutes.size() + caseCitations.size();
  }
}
