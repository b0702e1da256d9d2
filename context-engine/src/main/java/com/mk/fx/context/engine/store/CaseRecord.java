package com.mk.fx.context.engine.store;

import com.mk.fx.context.engine.model.CaseStatus;
import java.util.Map;
import lombok.Builder;

/** Row of {@code client.client_cases}. Date columns are kept as the stored ISO strings. */
@Builder
public record CaseRecord(
    String id,
    String caseName,
    String status,
    String jurisdiction,
    String court,
    String venue,
    String judgeChambers,
    String filingDate,
    String incidentDate,
    String discoveryCutoff,
    String motionDeadline,
    String trialDate,
    String statuteOfLimitations) {

  public static CaseRecord fromRow(Map<String, Object> row) {
    return CaseRecord.builder()
        .id(text(row, "id"))
        .caseName(text(row, "case_name"))
        .status(text(row, "status"))
        .jurisdiction(text(row, "jurisdiction"))
        .court(text(row, "court"))
        .venue(text(row, "venue"))
        .judgeChambers(text(row, "judge_chambers"))
        .filingDate(text(row, "filing_date"))
        .incidentDate(text(row, "incident_date"))
        .discoveryCutoff(text(row, "discovery_cutoff"))
        .motionDeadline(text(row, "motion_deadline"))
        .trialDate(text(row, "trial_date"))
        .statuteOfLimitations(text(row, "statute_of_limitations"))
        .build();
  }

  public CaseStatus caseStatus() {
    return CaseStatus.fromValue(status);
  }

  private static String text(Map<String, Object> row, String key) {
    Object value = row.get(key);
    if (value == null) {
      return null;
    }
    var text = String.valueOf(value);
    return text.isBlank() ? null : text;
  }
}
