package com.mk.fx.context.engine.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Judge {
  private String id;
  private String name;
  private String court;
  private String caseId;
  private String assignmentDate;

  /** Prior rulings count keyed by party id. */
  @Builder.Default private Map<String, Integer> historyWithParties = new LinkedHashMap<>();
}
