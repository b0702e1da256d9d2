package com.mk.fx.context.engine.analyzer;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.LocalRule;
import com.mk.fx.context.engine.model.WhereContext;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.CaseRecord;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/** Jurisdiction, court and venue of a case, read from its {@code client_cases} row. */
@Component
public class WhereAnalyzer extends DimensionAnalyzer<WhereContext> {

  public WhereAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    super(graphRag, store, clock);
  }

  @Override
  public Dimension dimension() {
    return Dimension.WHERE;
  }

  @Override
  protected WhereContext doAnalyze(String clientId, String caseId) {
    var caseRecord = findCase(clientId, caseId);
    var row = caseRecord.orElseGet(() -> CaseRecord.builder().id(caseId).build());
    var jurisdiction =
        Objects.requireNonNullElse(row.jurisdiction(), WhereContext.UNKNOWN_JURISDICTION);

    return WhereContext.builder()
        .caseId(caseId)
        .caseName(caseName(caseRecord, caseId))
        .primaryJurisdiction(jurisdiction)
        .court(Objects.requireNonNullElse(row.court(), WhereContext.UNKNOWN_COURT))
        .venue(Objects.requireNonNullElse(row.venue(), WhereContext.UNKNOWN_VENUE))
        .judgeChambers(row.judgeChambers())
        .localRules(localRules(clientId, caseId, jurisdiction))
        .build();
  }

  @Override
  protected WhereContext emptyContext(String caseId) {
    return WhereContext.empty(caseId);
  }

  /** Three when jurisdiction, court and venue are all known, otherwise none. */
  @Override
  public int dataPoints(WhereContext context) {
    return presentFields(context) == 3 ? 3 : 0;
  }

  /** Fraction of jurisdiction, court and venue that are filled in. */
  @Override
  public double score(WhereContext context) {
    return presentFields(context) / 3.0;
  }

  private static long presentFields(WhereContext context) {
    return Stream.of(context.getPrimaryJurisdiction(), context.getCourt(), context.getVenue())
        .filter(value -> value != null && !value.isBlank())
        .count();
  }

  private List<LocalRule> localRules(String clientId, String caseId, String jurisdiction) {
    return findNodes(clientId, caseId, "LOCAL_RULE").stream()
        .map(node -> toRule(node, jurisdiction))
        .collect(Collectors.toList());
  }

  private static LocalRule toRule(GraphNode node, String jurisdiction) {
    return new LocalRule(
        node.text("rule_number", node.nodeId()),
        node.text("description", ""),
        node.text("jurisdiction", jurisdiction));
  }
}
