package com.mk.fx.context.engine.analyzer;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.client.graphrag.model.SearchType;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Favorability;
import com.mk.fx.context.engine.model.LegalTheory;
import com.mk.fx.context.engine.model.PrecedentAnalysis;
import com.mk.fx.context.engine.model.Scores;
import com.mk.fx.context.engine.model.WhyContext;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Legal theories and the precedents for and against them. */
@Component
public class WhyAnalyzer extends DimensionAnalyzer<WhyContext> {

  static final String[] PRECEDENT_TYPES = {"CASE_CITATION", "CASE_LAW", "HOLDING", "PRECEDENT"};

  public WhyAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    super(graphRag, store, clock);
  }

  @Override
  public Dimension dimension() {
    return Dimension.WHY;
  }

  @Override
  protected WhyContext doAnalyze(String clientId, String caseId) {
    var query = "Find relevant precedent cases for case " + caseId;
    var precedents =
        queryGraph(clientId, caseId, query, SearchType.GLOBAL, PRECEDENT_TYPES).stream()
            .map(WhyAnalyzer::toPrecedent)
            .collect(Collectors.toList());

    var supporting = byFavorability(precedents, Favorability.SUPPORTING);
    var opposing = byFavorability(precedents, Favorability.OPPOSING);

    Set<String> distinguishing = new LinkedHashSet<>();
    supporting.forEach(p -> distinguishing.addAll(p.getDistinguishingFactors()));
    opposing.forEach(p -> distinguishing.addAll(p.getDistinguishingFactors()));

    return WhyContext.builder()
        .caseId(caseId)
        .caseName(resolveCaseName(clientId, caseId))
        .legalTheories(theories(clientId, caseId))
        .supportingPrecedents(supporting)
        .opposingPrecedents(opposing)
        .distinguishingFactors(new ArrayList<>(distinguishing))
        .argumentStrength(argumentStrength(supporting, opposing))
        .build();
  }

  @Override
  protected WhyContext emptyContext(String caseId) {
    return WhyContext.empty(caseId);
  }

  @Override
  public int dataPoints(WhyContext context) {
    return context.dataPoints();
  }

  /** Share of precedent relevance that supports the case; 0.5 when there is nothing to weigh. */
  static double argumentStrength(
      List<PrecedentAnalysis> supporting, List<PrecedentAnalysis> opposing) {
    double support = supporting.stream().mapToDouble(PrecedentAnalysis::getRelevanceScore).sum();
    double oppose = opposing.stream().mapToDouble(PrecedentAnalysis::getRelevanceScore).sum();
    double total = support + oppose;
    return total == 0 ? 0.5 : Scores.clamp(support / total);
  }

  private List<LegalTheory> theories(String clientId, String caseId) {
    return findNodes(clientId, caseId, "LEGAL_THEORY").stream()
        .map(
            node ->
                LegalTheory.builder()
                    .id(node.nodeId())
                    .name(node.text("name", "Unknown Theory"))
                    .description(node.text("description", ""))
                    .strength(Scores.clamp(node.number("strength", 0.5)))
                    .supportingPrecedents(new ArrayList<>(node.strings("supporting_precedents")))
                    .caseId(caseId)
                    .build())
        .collect(Collectors.toList());
  }

  private static PrecedentAnalysis toPrecedent(GraphNode node) {
    double confidence = node.number("confidence", 0.5);
    return PrecedentAnalysis.builder()
        .caseName(node.text("name", "Unknown Case"))
        .citation(node.text("citation", ""))
        .relevanceScore(Scores.clamp(node.number("relevance", confidence)))
        .holding(node.text("holding", ""))
        .distinguishingFactors(new ArrayList<>(node.strings("distinguishing_factors")))
        .favorability(Favorability.fromValue(node.text("category")))
        .build();
  }

  private static List<PrecedentAnalysis> byFavorability(
      List<PrecedentAnalysis> precedents, Favorability favorability) {
    return precedents.stream()
        .filter(p -> p.getFavorability() == favorability)
        .collect(Collectors.toList());
  }
}
