package com.mk.fx.context.client.graphrag.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** Community cluster detected in the knowledge graph. */
@Data
public class GraphCommunity {
  private String communityId;
  private String title;
  private String summary;
  private int size;
  private int level;
  private List<String> entities = new ArrayList<>();
  private double coherenceScore;
  private List<String> keyRelationships = new ArrayList<>();
  private String clientId;
}
