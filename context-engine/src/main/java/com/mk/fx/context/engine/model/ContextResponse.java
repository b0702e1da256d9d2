package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Multi-dimensional context of one case. Dimensions that were not requested or failed are null. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  @Builder.Default private String queryId = UUID.randomUUID().toString();
  private String caseId;
  private String caseName;
  private WhoContext who;
  private WhatContext what;
  private WhereContext where;
  private WhenContext when;
  private WhyContext why;

  /** Overall quality in [0, 1]. */
  private double contextScore;

  @JsonProperty("is_complete")
  private boolean complete;

  private boolean cached;
  private long executionTimeMs;
  @Builder.Default private Instant timestamp = Instant.now();

  public DimensionContext dimension(Dimension dimension) {
    return switch (dimension) {
      case WHO -> who;
      case WHAT -> what;
      case WHERE -> where;
      case WHEN -> when;
      case WHY -> why;
    };
  }

  public boolean hasDimension(Dimension dimension) {
    return dimension(dimension) != null;
  }

  public int dimensionCount() {
    int count = 0;
    for (Dimension dimension : Dimension.values()) {
      if (hasDimension(dimension)) {
        count++;
      }
    }
    return count;
  }

  /** Counts per populated dimension, for logs and dashboards. Absent dimensions map to null. */
  public Map<String, Object> summary() {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("query_id", queryId);
    summary.put("case_id", caseId);
    summary.put("case_name", caseName);
    summary.put("dimensions_populated", dimensionCount());
    summary.put("context_score", contextScore);
    summary.put("is_complete", complete);
    summary.put("execution_time_ms", executionTimeMs);
    summary.put("cached", cached);
    summary.put(
        "who_summary",
        who == null
            ? null
            : Map.of(
                "parties", who.partyCount(),
                "plaintiffs", who.partiesByRole("plaintiff").size(),
                "defendants", who.partiesByRole("defendant").size(),
                "judges", who.getJudges().size(),
                "attorneys", who.getAttorneys().size()));
    summary.put(
        "what_summary",
        what == null
            ? null
            : Map.of(
                "causes_of_action", what.getCausesOfAction().size(),
                "statutes", what.getStatutes().size(),
                "case_citations", what.getCaseCitations().size()));
    summary.put(
        "where_summary",
        where == null
            ? null
            : Map.of(
                "full_court_name", where.fullCourtName(),
                "local_rules", where.getLocalRules().size()));
    summary.put(
        "when_summary",
        when == null
            ? null
            : Map.of(
                "timeline_events", when.getTimeline().size(),
                "upcoming_deadlines", when.getUpcomingDeadlines().size(),
                "case_age_days", when.getCaseAgeDays()));
    summary.put(
        "why_summary",
        why == null
            ? null
            : Map.of(
                "legal_theories", why.getLegalTheories().size(),
                "supporting_precedents", why.supportingCount(),
                "average_relevance", why.averageRelevance(),
                "argument_strength", why.getArgumentStrength()));
    return summary;
  }
}
