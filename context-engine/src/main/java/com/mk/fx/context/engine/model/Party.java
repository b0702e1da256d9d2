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
public class Party {
  private String id;
  private String name;
  private PartyRole role;

  /** person, organization, government... */
  @Builder.Default private String entityType = "person";

  private String caseId;
  @Builder.Default private Map<String, Object> metadata = new LinkedHashMap<>();
}
