package com.mk.fx.context.client.graphrag.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class GraphStats {
  private long totalEntities;
  private long totalRelationships;
  private long totalCommunities;
  private long totalDocuments;
  private Map<String, Long> entityBreakdown = new LinkedHashMap<>();
  private Map<String, Long> relationshipBreakdown = new LinkedHashMap<>();
  private Map<String, Double> graphMetrics = new LinkedHashMap<>();
  private Map<String, Double> qualityMetrics = new LinkedHashMap<>();
}
