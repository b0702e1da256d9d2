package com.mk.fx.context.engine.store;

import com.mk.fx.context.client.supabase.PostgrestQuery;
import com.mk.fx.context.client.supabase.SupabaseRestClient;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
@RequiredArgsConstructor
public class SupabaseCaseDataStore implements CaseDataStore {

  static final String GRAPH_SCHEMA = "graph";
  static final String CLIENT_SCHEMA = "client";

  private final SupabaseRestClient supabase;

  @Override
  public List<GraphNode> findNodes(String clientId, String caseId, Collection<String> entityTypes) {
    var rows =
        supabase.select(
            PostgrestQuery.from(GRAPH_SCHEMA, "nodes")
                .eq("client_id", clientId)
                .eq("case_id", caseId)
                .in("entity_type", entityTypes));
    log.debug("Found {} nodes of {} for case {}", rows.size(), entityTypes, caseId);
    return rows.stream().map(SupabaseCaseDataStore::toNode).collect(Collectors.toList());
  }

  @Override
  public List<GraphEdge> findEdges(String clientId, String caseId) {
    var rows =
        supabase.select(
            PostgrestQuery.from(GRAPH_SCHEMA, "edges").eq("client_id", clientId).eq("case_id", caseId));
    return rows.stream()
        .map(
            row ->
                new GraphEdge(
                    stringOrNull(row.get("source_node_id")),
                    stringOrNull(row.get("target_node_id")),
                    stringOrNull(row.get("relationship_type"))))
        .collect(Collectors.toList());
  }

  @Override
  public Optional<CaseRecord> findCase(String clientId, String caseId) {
    return supabase
        .selectOne(
            PostgrestQuery.from(CLIENT_SCHEMA, "client_cases").eq("client_id", clientId).eq("id", caseId))
        .map(CaseRecord::fromRow);
  }

  @Override
  public void ping() {
    supabase.select(PostgrestQuery.from(CLIENT_SCHEMA, "client_cases").select("id").limit(1));
  }

  @SuppressWarnings("unchecked")
  private static GraphNode toNode(Map<String, Object> row) {
    Object properties = row.get("properties");
    return new GraphNode(
        stringOrNull(row.get("node_id")),
        stringOrNull(row.get("entity_type")),
        properties instanceof Map ? (Map<String, Object>) properties : Map.of());
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
