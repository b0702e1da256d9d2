package com.mk.fx.context.client.graphrag.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Entity node in the knowledge graph. */
@Data
@NoArgsConstructor
public class GraphEntity {

  private String entityId;
  private String entityText;

  /** Entity type such as CASE_CITATION or COURT, always upper case. */
  private String entityType;

  private double confidenceScore;
  private List<String> documentIds = new ArrayList<>();

  /** Case the entity belongs to; missing values indicate a case isolation problem upstream. */
  private String caseId;

  private Map<String, Object> properties = new LinkedHashMap<>();
  private Map<String, Object> metadata = new LinkedHashMap<>();

  public GraphEntity(String entityId, String entityText, String entityType, double confidence) {
    this.entityId = entityId;
    this.entityText = entityText;
    setEntityType(entityType);
    this.confidenceScore = confidence;
  }

  public void setEntityType(String entityType) {
    this.entityType = entityType == null ? null : entityType.toUpperCase(Locale.ROOT);
  }

  public boolean hasType(String... types) {
    for (String type : types) {
      if (type.equals(entityType)) {
        return true;
      }
    }
    return false;
  }

  /** String property lookup, null when absent. */
  public String property(String name) {
    Object value = properties == null ? null : properties.get(name);
    return value == null ? null : String.valueOf(value);
  }
}
