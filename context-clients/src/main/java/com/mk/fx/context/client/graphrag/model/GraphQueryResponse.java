package com.mk.fx.context.client.graphrag.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Result of a GraphRAG query, case scoped or cross-case. */
@Data
public class GraphQueryResponse {
  private String query;
  private String searchType;
  private String mode;

  /** AI-generated answer text. */
  private String response;

  private List<GraphEntity> entities = new ArrayList<>();
  private List<GraphRelationship> relationships = new ArrayList<>();
  private List<GraphCommunity> communities;
  private Map<String, Object> metadata = new LinkedHashMap<>();

  /** Client-measured round trip, overwritten after every call. */
  private long executionTimeMs;
}
