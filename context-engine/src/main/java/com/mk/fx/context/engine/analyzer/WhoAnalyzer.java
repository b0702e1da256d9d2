package com.mk.fx.context.engine.analyzer;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.client.graphrag.model.SearchType;
import com.mk.fx.context.engine.model.Attorney;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Judge;
import com.mk.fx.context.engine.model.Party;
import com.mk.fx.context.engine.model.PartyRole;
import com.mk.fx.context.engine.model.WhoContext;
import com.mk.fx.context.engine.model.Witness;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.GraphEdge;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Parties, judges, attorneys and witnesses of a case. */
@Slf4j
@Component
public class WhoAnalyzer extends DimensionAnalyzer<WhoContext> {

  static final String[] ENTITY_TYPES = {"PARTY", "JUDGE", "ATTORNEY", "WITNESS"};

  public WhoAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    super(graphRag, store, clock);
  }

  @Override
  public Dimension dimension() {
    return Dimension.WHO;
  }

  @Override
  protected WhoContext doAnalyze(String clientId, String caseId) {
    var nodes = collectNodes(clientId, caseId);

    var parties = new ArrayList<Party>();
    var judges = new ArrayList<Judge>();
    var attorneys = new ArrayList<Attorney>();
    var witnesses = new ArrayList<Witness>();
    for (GraphNode node : nodes) {
      switch (node.entityType()) {
        case "PARTY" -> toParty(node, caseId).ifPresent(parties::add);
        case "JUDGE" -> judges.add(toJudge(node, caseId));
        case "ATTORNEY" -> attorneys.add(toAttorney(node, caseId));
        case "WITNESS" -> witnesses.add(toWitness(node, caseId));
        default -> log.debug("Skipping {} node {}", node.entityType(), node.nodeId());
      }
    }

    return WhoContext.builder()
        .caseId(caseId)
        .caseName(resolveCaseName(clientId, caseId))
        .parties(parties)
        .judges(judges)
        .attorneys(attorneys)
        .witnesses(witnesses)
        .partyRelationships(relationships(clientId, caseId))
        .representationMap(representationMap(attorneys))
        .build();
  }

  @Override
  protected WhoContext emptyContext(String caseId) {
    return WhoContext.empty(caseId);
  }

  @Override
  public int dataPoints(WhoContext context) {
    return context.dataPoints();
  }

  /** Store nodes first; graph entities only fill in ids the store does not know. */
  private List<GraphNode> collectNodes(String clientId, String caseId) {
    var nodes = new ArrayList<GraphNode>(findNodes(clientId, caseId, ENTITY_TYPES));
    Set<String> known = new LinkedHashSet<>();
    nodes.forEach(node -> known.add(node.nodeId()));

    var query =
        "Find all parties, judges, attorneys, and witnesses in case "
            + caseId
            + ". Include their roles, relationships, and metadata.";
    for (GraphNode node : queryGraph(clientId, caseId, query, SearchType.LOCAL, ENTITY_TYPES)) {
      if (node.nodeId().isEmpty() || known.add(node.nodeId())) {
        nodes.add(node);
      }
    }
    return nodes;
  }

  private Optional<Party> toParty(GraphNode node, String caseId) {
    PartyRole role;
    try {
      role = PartyRole.fromValue(node.text("role"));
    } catch (IllegalArgumentException e) {
      log.warn("Skipping party {} of case {}: {}", node.nodeId(), caseId, e.getMessage());
      return Optional.empty();
    }
    return Optional.of(
        Party.builder()
            .id(node.nodeId())
            .name(node.text("name", "Unknown Party"))
            .role(role)
            .entityType(node.text("entity_type", "person"))
            .caseId(caseId)
            .metadata(new LinkedHashMap<>(node.properties()))
            .build());
  }

  private static Judge toJudge(GraphNode node, String caseId) {
    return Judge.builder()
        .id(node.nodeId())
        .name(node.text("name", "Unknown Judge"))
        .court(node.text("court", "Unknown Court"))
        .assignmentDate(node.text("assignment_date"))
        .caseId(caseId)
        .build();
  }

  private static Attorney toAttorney(GraphNode node, String caseId) {
    return Attorney.builder()
        .id(node.nodeId())
        .name(node.text("name", "Unknown Attorney"))
        .firm(node.text("firm"))
        .barNumber(node.text("bar_number"))
        .representing(new ArrayList<>(node.strings("representing")))
        .caseId(caseId)
        .build();
  }

  private static Witness toWitness(GraphNode node, String caseId) {
    return Witness.builder()
        .id(node.nodeId())
        .name(node.text("name", "Unknown Witness"))
        .witnessType(node.text("witness_type", "fact"))
        .representingParty(node.text("representing_party"))
        .expertise(node.text("expertise"))
        .caseId(caseId)
        .build();
  }

  private Map<String, List<String>> relationships(String clientId, String caseId) {
    Map<String, List<String>> relationships = new LinkedHashMap<>();
    try {
      for (GraphEdge edge : store.findEdges(clientId, caseId)) {
        if (edge.source() != null && edge.target() != null) {
          relationships.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }
      }
    } catch (RuntimeException e) {
      log.warn("Failed to build party relationships for case {}: {}", caseId, e.getMessage());
    }
    return relationships;
  }

  static Map<String, String> representationMap(List<Attorney> attorneys) {
    Map<String, String> representation = new LinkedHashMap<>();
    for (Attorney attorney : attorneys) {
      attorney.getRepresenting().stream()
          .filter(Objects::nonNull)
          .forEach(partyId -> representation.put(partyId, attorney.getId()));
    }
    return representation;
  }
}
