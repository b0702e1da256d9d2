package com.mk.fx.context.engine.analyzer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.model.CauseOfAction;
import com.mk.fx.context.engine.model.CitationType;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WhatAnalyzerTest {

  private CaseDataStore store;
  private WhatAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    store = mock(CaseDataStore.class);
    analyzer = new WhatAnalyzer(mock(GraphRagClient.class), store, Clock.systemUTC());
    when(store.findCase("c1", "k1")).thenReturn(Optional.empty());
  }

  @Test
  void analyze_groupsLegalEntities() {
    when(store.findNodes(eq("c1"), eq("k1"), anyCollection()))
        .thenReturn(
            List.of(
                new GraphNode(
                    "x1",
                    "CAUSE_OF_ACTION",
                    Map.of("name", "Breach of Contract", "elements", List.of("offer", "breach"))),
                new GraphNode("x2", "LEGAL_PRINCIPLE", Map.of("name", "Consideration")),
                new GraphNode("x3", "LEGAL_PRINCIPLE", Map.of("name", "Consideration")),
                new GraphNode("x4", "LEGAL_PRINCIPLE", Map.of("text", "Mitigation")),
                new GraphNode("x5", "DOCTRINE", Map.of("name", "Estoppel")),
                new GraphNode(
                    "x6", "STATUTE_CITATION", Map.of("text", "UCC 2-207", "confidence", 1.7)),
                new GraphNode("x7", "CASE_CITATION", Map.of("text", "Hadley v. Baxendale"))));

    var ctx = analyzer.analyze("c1", "k1");

    assertEquals("Case k1", ctx.getCaseName());
    assertEquals(List.of("offer", "breach"), ctx.getCausesOfAction().get(0).getElements());
    assertEquals(List.of("Consideration", "Mitigation"), ctx.getLegalIssues());
    assertEquals(List.of("Estoppel"), ctx.getDoctrines());
    assertEquals(CitationType.STATUTE, ctx.getStatutes().get(0).getType());
    assertEquals(1.0, ctx.getStatutes().get(0).getConfidence());
    assertEquals(0.9, ctx.getCaseCitations().get(0).getConfidence());
    assertEquals("Breach of Contract", ctx.getPrimaryLegalTheory());
    assertEquals(0.2, ctx.getIssueComplexity(), 1e-9);
    assertEquals(5, analyzer.dataPoints(ctx));
  }

  @Test
  void primaryTheory_fallsBackToFirstIssue() {
    assertEquals("Negligence", WhatAnalyzer.primaryTheory(List.of(), List.of("Negligence")));
    assertNull(WhatAnalyzer.primaryTheory(List.of(), List.of()));
    assertEquals(
        "Fraud",
        WhatAnalyzer.primaryTheory(
            List.of(CauseOfAction.builder().name("Fraud").build()), List.of("Negligence")));
  }

  @Test
  void complexity_isCappedAtOne() {
    assertEquals(0.0, WhatAnalyzer.complexity(0, 0, 0));
    assertEquals(0.5, WhatAnalyzer.complexity(4, 3, 3), 1e-9);
    assertEquals(1.0, WhatAnalyzer.complexity(10, 10, 10));
  }
}
