package com.mk.fx.context.engine.analyzer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.client.graphrag.model.GraphEntity;
import com.mk.fx.context.client.graphrag.model.GraphQueryResponse;
import com.mk.fx.context.client.graphrag.model.SearchType;
import com.mk.fx.context.client.http.ServiceTimeoutException;
import com.mk.fx.context.engine.model.Attorney;
import com.mk.fx.context.engine.model.PartyRole;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.CaseRecord;
import com.mk.fx.context.engine.store.GraphEdge;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WhoAnalyzerTest {

  private CaseDataStore store;
  private GraphRagClient graphRag;
  private WhoAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    store = mock(CaseDataStore.class);
    graphRag = mock(GraphRagClient.class);
    analyzer =
        new WhoAnalyzer(
            graphRag, store, Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC));
    when(store.findCase("c1", "k1"))
        .thenReturn(Optional.of(CaseRecord.builder().id("k1").caseName("Smith v. Jones").build()));
    when(graphRag.queryCaseGraph(anyString(), anyString(), anyString(), any(SearchType.class)))
        .thenReturn(new GraphQueryResponse());
  }

  @Test
  void analyze_buildsPeopleFromStoreNodes() {
    when(store.findNodes(eq("c1"), eq("k1"), anyCollection()))
        .thenReturn(
            List.of(
                new GraphNode("p1", "party", Map.of("name", "Smith", "role", "plaintiff")),
                new GraphNode("p2", "PARTY", Map.of("name", "Jones", "role", "Defendant")),
                new GraphNode("j1", "JUDGE", Map.of("name", "Judge Judy")),
                new GraphNode(
                    "a1", "ATTORNEY", Map.of("name", "Saul", "representing", List.of("p1"))),
                new GraphNode("w1", "WITNESS", Map.of())));
    when(store.findEdges("c1", "k1"))
        .thenReturn(
            List.of(new GraphEdge("a1", "p1", "REPRESENTS"), new GraphEdge("p1", "p2", "SUES")));

    var ctx = analyzer.analyze("c1", "k1");

    assertEquals("Smith v. Jones", ctx.getCaseName());
    assertEquals(2, ctx.getParties().size());
    assertEquals(PartyRole.DEFENDANT, ctx.getParties().get(1).getRole());
    assertEquals("Unknown Court", ctx.getJudges().get(0).getCourt());
    assertEquals("Unknown Witness", ctx.getWitnesses().get(0).getName());
    assertEquals("fact", ctx.getWitnesses().get(0).getWitnessType());
    assertEquals(Map.of("p1", "a1"), ctx.getRepresentationMap());
    assertEquals(List.of("p1"), ctx.getPartyRelationships().get("a1"));
    assertEquals(5, analyzer.dataPoints(ctx));
    assertEquals(0.5, analyzer.score(ctx), 1e-9);
  }

  @Test
  void analyze_skipsPartyWithUnknownRole() {
    when(store.findNodes(eq("c1"), eq("k1"), anyCollection()))
        .thenReturn(
            List.of(
                new GraphNode("p1", "PARTY", Map.of("name", "Smith", "role", "plaintiff")),
                new GraphNode("p2", "PARTY", Map.of("name", "Ghost", "role", "bystander"))));

    var ctx = analyzer.analyze("c1", "k1");

    assertEquals(1, ctx.getParties().size());
    assertEquals("Smith", ctx.getParties().get(0).getName());
  }

  @Test
  void analyze_addsGraphEntitiesNotKnownToStore() {
    when(store.findNodes(eq("c1"), eq("k1"), anyCollection()))
        .thenReturn(List.of(new GraphNode("j1", "JUDGE", Map.of("name", "Judge Judy"))));
    var response = new GraphQueryResponse();
    response.setEntities(
        List.of(
            new GraphEntity("j1", "Duplicate Judge", "judge", 0.8),
            new GraphEntity("w9", "Dr. Expert", "witness", 0.7),
            new GraphEntity("s1", "42 U.S.C. 1983", "statute_citation", 0.9)));
    when(graphRag.queryCaseGraph(eq("c1"), eq("k1"), anyString(), eq(SearchType.LOCAL)))
        .thenReturn(response);

    var ctx = analyzer.analyze("c1", "k1");

    assertEquals(1, ctx.getJudges().size());
    assertEquals("Judge Judy", ctx.getJudges().get(0).getName());
    assertEquals(1, ctx.getWitnesses().size());
    assertEquals("Dr. Expert", ctx.getWitnesses().get(0).getName());
  }

  @Test
  void analyze_sourceFailuresYieldEmptyContext() {
    when(store.findNodes(anyString(), anyString(), anyCollection()))
        .thenThrow(new IllegalStateException("db down"));
    when(store.findEdges(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));
    when(graphRag.queryCaseGraph(anyString(), anyString(), anyString(), any(SearchType.class)))
        .thenThrow(new ServiceTimeoutException("slow", null));

    var ctx = analyzer.analyze("c1", "k1");

    assertEquals("k1", ctx.getCaseId());
    assertEquals(0, analyzer.dataPoints(ctx));
    assertEquals(0.0, analyzer.score(ctx));
  }

  @Test
  void representationMap_lastAttorneyWins() {
    var first = Attorney.builder().id("a1").representing(List.of("p1", "p2")).build();
    var second = Attorney.builder().id("a2").representing(List.of("p2")).build();

    assertEquals(
        Map.of("p1", "a1", "p2", "a2"), WhoAnalyzer.representationMap(List.of(first, second)));
  }
}
