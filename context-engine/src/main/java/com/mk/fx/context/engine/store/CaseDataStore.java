package com.mk.fx.context.engine.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Structured case data used by the dimension analyzers. Every lookup is scoped to one client and
 * one case. Implementations propagate failures; callers decide how to degrade.
 */
public interface CaseDataStore {

  List<GraphNode> findNodes(String clientId, String caseId, Collection<String> entityTypes);

  List<GraphEdge> findEdges(String clientId, String caseId);

  Optional<CaseRecord> findCase(String clientId, String caseId);

  /** Cheap round trip proving the store is reachable; throws when it is not. */
  void ping();
}
