package com.mk.fx.context.engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Jurisdiction, court and venue of a case. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhereContext implements DimensionContext {

  public static final String UNKNOWN_JURISDICTION = "Unknown";
  public static final String UNKNOWN_COURT = "Unknown Court";
  public static final String UNKNOWN_VENUE = "Unknown Venue";

  private String caseId;
  private String caseName;
  private String primaryJurisdiction;
  private String court;
  private String venue;
  private String judgeChambers;
  @Builder.Default private List<LocalRule> localRules = new ArrayList<>();
  @Builder.Default private List<String> filingRequirements = new ArrayList<>();
  @Builder.Default private List<Map<String, Object>> relatedProceedings = new ArrayList<>();

  public static WhereContext empty(String caseId) {
    return WhereContext.builder()
        .caseId(caseId)
        .caseName(DimensionContext.defaultCaseName(caseId))
        .primaryJurisdiction(UNKNOWN_JURISDICTION)
        .court(UNKNOWN_COURT)
        .venue(UNKNOWN_VENUE)
        .build();
  }

  public String fullCourtName() {
    return court + ", " + primaryJurisdiction;
  }
}
