package com.mk.fx.context.engine.analyzer;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.model.CauseOfAction;
import com.mk.fx.context.engine.model.Citation;
import com.mk.fx.context.engine.model.CitationType;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Scores;
import com.mk.fx.context.engine.model.WhatContext;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Causes of action, legal issues, doctrines and citations of a case. */
@Slf4j
@Component
public class WhatAnalyzer extends DimensionAnalyzer<WhatContext> {

  static final String[] ENTITY_TYPES = {
    "STATUTE_CITATION", "CASE_CITATION", "LEGAL_PRINCIPLE", "CAUSE_OF_ACTION", "DOCTRINE"
  };

  public WhatAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    super(graphRag, store, clock);
  }

  @Override
  public Dimension dimension() {
    return Dimension.WHAT;
  }

  @Override
  protected WhatContext doAnalyze(String clientId, String caseId) {
    var nodes = findNodes(clientId, caseId, ENTITY_TYPES);

    var causes = new ArrayList<CauseOfAction>();
    Set<String> issues = new LinkedHashSet<>();
    Set<String> doctrines = new LinkedHashSet<>();
    var statutes = new ArrayList<Citation>();
    var caseCitations = new ArrayList<Citation>();
    for (GraphNode node : nodes) {
      switch (node.entityType()) {
        case "CAUSE_OF_ACTION" -> causes.add(toCause(node, caseId));
        case "LEGAL_PRINCIPLE" -> addLabel(issues, node);
        case "DOCTRINE" -> addLabel(doctrines, node);
        case "STATUTE_CITATION" -> statutes.add(toCitation(node, CitationType.STATUTE, caseId));
        case "CASE_CITATION" -> caseCitations.add(toCitation(node, CitationType.CASE_LAW, caseId));
        default -> log.debug("Skipping {} node {}", node.entityType(), node.nodeId());
      }
    }

    var issueList = new ArrayList<>(issues);
    return WhatContext.builder()
        .caseId(caseId)
        .caseName(resolveCaseName(clientId, caseId))
        .causesOfAction(causes)
        .legalIssues(issueList)
        .doctrines(new ArrayList<>(doctrines))
        .statutes(statutes)
        .caseCitations(caseCitations)
        .primaryLegalTheory(primaryTheory(causes, issueList))
        .issueComplexity(complexity(causes.size(), issueList.size(), statutes.size()))
        .build();
  }

  @Override
  protected WhatContext emptyContext(String caseId) {
    return WhatContext.empty(caseId);
  }

  @Override
  public int dataPoints(WhatContext context) {
    return context.dataPoints();
  }

  private static CauseOfAction toCause(GraphNode node, String caseId) {
    return CauseOfAction.builder()
        .id(node.nodeId())
        .name(node.text("name", "Unknown Cause"))
        .description(node.text("description", ""))
        .elements(new ArrayList<>(node.strings("elements")))
        .caseId(caseId)
        .build();
  }

  private static Citation toCitation(GraphNode node, CitationType type, String caseId) {
    return Citation.builder()
        .text(node.text("text", ""))
        .type(type)
        .jurisdiction(node.text("jurisdiction", "federal"))
        .confidence(Scores.clamp(node.number("confidence", 0.9)))
        .caseId(caseId)
        .build();
  }

  private static void addLabel(Set<String> labels, GraphNode node) {
    var label = node.text("name", node.text("text"));
    if (label != null) {
      labels.add(label);
    }
  }

  static String primaryTheory(List<CauseOfAction> causes, List<String> issues) {
    if (!causes.isEmpty()) {
      return causes.get(0).getName();
    }
    return issues.isEmpty() ? null : issues.get(0);
  }

  static double complexity(int causes, int issues, int statutes) {
    return Math.min(1.0, (causes + issues + statutes) / 20.0);
  }
}
