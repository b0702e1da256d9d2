package com.mk.fx.context.client.graphrag.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Outcome of building a case graph from extracted document entities. */
@Data
public class GraphBuildResponse {
  private boolean success;
  private String graphId;
  private String caseId;
  private String clientId;
  private Map<String, Long> processingResults = new LinkedHashMap<>();
  private Map<String, Double> graphMetrics = new LinkedHashMap<>();
  private Map<String, Double> qualityMetrics = new LinkedHashMap<>();
  private List<GraphCommunity> communities = new ArrayList<>();
  private double processingTimeSeconds;
  private String timestamp;
}
