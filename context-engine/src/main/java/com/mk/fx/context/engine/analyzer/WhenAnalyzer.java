package com.mk.fx.context.engine.analyzer;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.model.Deadline;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.TimelineEvent;
import com.mk.fx.context.engine.model.WhenContext;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.CaseRecord;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Key dates, timeline and deadlines of a case, relative to the current time. */
@Slf4j
@Component
public class WhenAnalyzer extends DimensionAnalyzer<WhenContext> {

  static final double FILING_DATE_BOOST = 0.3;

  public WhenAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    super(graphRag, store, clock);
  }

  @Override
  public Dimension dimension() {
    return Dimension.WHEN;
  }

  @Override
  protected WhenContext doAnalyze(String clientId, String caseId) {
    var now = clock.instant();
    var caseRecord = findCase(clientId, caseId);
    var row = caseRecord.orElseGet(() -> CaseRecord.builder().id(caseId).build());

    var timeline = new ArrayList<TimelineEvent>();
    var upcoming = new ArrayList<Deadline>();
    var past = new ArrayList<Deadline>();
    for (GraphNode node : findNodes(clientId, caseId, "EVENT", "DEADLINE")) {
      if (node.isType("EVENT")) {
        toEvent(node, caseId).ifPresent(timeline::add);
      } else {
        toDeadline(node, caseId)
            .ifPresent(d -> (d.getDeadlineDate().isAfter(now) ? upcoming : past).add(d));
      }
    }
    timeline.sort(Comparator.comparing(TimelineEvent::getDate));
    upcoming.sort(Comparator.comparing(Deadline::getDeadlineDate));
    past.sort(Comparator.comparing(Deadline::getDeadlineDate));

    var filingDate = Objects.requireNonNullElse(CaseDates.parse(row.filingDate()), now);
    var context =
        WhenContext.builder()
            .caseId(caseId)
            .caseName(caseName(caseRecord, caseId))
            .filingDate(filingDate)
            .incidentDate(CaseDates.parse(row.incidentDate()))
            .timeline(timeline)
            .upcomingDeadlines(upcoming)
            .pastDeadlines(past)
            .discoveryCutoff(CaseDates.parse(row.discoveryCutoff()))
            .motionDeadline(CaseDates.parse(row.motionDeadline()))
            .trialDate(CaseDates.parse(row.trialDate()))
            .statuteOfLimitations(CaseDates.parse(row.statuteOfLimitations()))
            .caseAgeDays(Math.max(0, Duration.between(filingDate, now).toDays()))
            .urgencyScore(urgency(upcoming, now))
            .build();
    context
        .nextDeadline()
        .ifPresent(
            next ->
                context.setDaysUntilNextDeadline(
                    Duration.between(now, next.getDeadlineDate()).toDays()));
    return context;
  }

  @Override
  protected WhenContext emptyContext(String caseId) {
    return WhenContext.empty(caseId, clock.instant());
  }

  @Override
  public int dataPoints(WhenContext context) {
    return context.dataPoints();
  }

  /** Timeline score plus a fixed boost when the filing date is known, capped at 1. */
  @Override
  public double score(WhenContext context) {
    double timeScore = Math.min(1.0, dataPoints(context) / 10.0);
    double boost = context.getFilingDate() != null ? FILING_DATE_BOOST : 0.0;
    return Math.min(1.0, timeScore + boost);
  }

  static double urgency(List<Deadline> upcoming, Instant now) {
    if (upcoming.isEmpty()) {
      return 0.3;
    }
    long soonest =
        upcoming.stream()
            .mapToLong(d -> Duration.between(now, d.getDeadlineDate()).toDays())
            .min()
            .getAsLong();
    if (soonest <= 7) {
      return 1.0;
    }
    return soonest <= 30 ? 0.7 : 0.5;
  }

  private static Optional<TimelineEvent> toEvent(GraphNode node, String caseId) {
    var date = CaseDates.parse(node.text("date", node.text("event_date")));
    if (date == null) {
      log.debug("Skipping undated event {} of case {}", node.nodeId(), caseId);
      return Optional.empty();
    }
    return Optional.of(
        TimelineEvent.builder()
            .date(date)
            .eventType(node.text("event_type", "event"))
            .description(node.text("description", node.text("name", "")))
            .caseId(caseId)
            .build());
  }

  private static Optional<Deadline> toDeadline(GraphNode node, String caseId) {
    var date = CaseDates.parse(node.text("deadline_date", node.text("date")));
    if (date == null) {
      log.debug("Skipping undated deadline {} of case {}", node.nodeId(), caseId);
      return Optional.empty();
    }
    return Optional.of(
        Deadline.builder()
            .deadlineDate(date)
            .deadlineType(node.text("deadline_type", "deadline"))
            .description(node.text("description", node.text("name", "")))
            .met(Boolean.parseBoolean(node.text("is_met", "false")))
            .priority(node.text("priority", "medium"))
            .caseId(caseId)
            .build());
  }
}
