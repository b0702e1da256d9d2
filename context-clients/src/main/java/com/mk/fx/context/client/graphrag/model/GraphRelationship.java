package com.mk.fx.context.client.graphrag.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/** Relationship edge in the knowledge graph. */
@Data
public class GraphRelationship {
  private String relationshipId;
  private String sourceEntityId;
  private String targetEntityId;
  private String relationshipType;
  private double confidence;
  private String caseId;
  private String context;
  private Map<String, Object> metadata = new LinkedHashMap<>();
}
