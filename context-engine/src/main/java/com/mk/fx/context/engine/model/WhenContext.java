package com.mk.fx.context.engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Dates, timeline and deadlines of a case. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhenContext implements DimensionContext {
  private String caseId;
  private String caseName;
  private Instant filingDate;
  private Instant incidentDate;
  @Builder.Default private List<TimelineEvent> timeline = new ArrayList<>();
  @Builder.Default private List<Deadline> upcomingDeadlines = new ArrayList<>();
  @Builder.Default private List<Deadline> pastDeadlines = new ArrayList<>();
  private Instant discoveryCutoff;
  private Instant motionDeadline;
  private Instant trialDate;
  private Instant statuteOfLimitations;
  private Long daysUntilNextDeadline;
  @Builder.Default private double urgencyScore = 0.5;
  private long caseAgeDays;

  public static WhenContext empty(String caseId, Instant now) {
    return WhenContext.builder()
        .caseId(caseId)
        .caseName(DimensionContext.defaultCaseName(caseId))
        .filingDate(now)
        .caseAgeDays(0)
        .build();
  }

  /** Earliest upcoming deadline. */
  public Optional<Deadline> nextDeadline() {
    return upcomingDeadlines.stream().min(Comparator.comparing(Deadline::getDeadlineDate));
  }

  public int dataPoints() {
    return timeline.size() + upcomingDeadlines.size() + pastDeadlines.size();
  }
}
