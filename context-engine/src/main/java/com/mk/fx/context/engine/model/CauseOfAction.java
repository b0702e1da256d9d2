package com.mk.fx.context.engine.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CauseOfAction {
  private String id;
  private String name;
  @Builder.Default private String description = "";
  @Builder.Default private List<String> elements = new ArrayList<>();
  private String caseId;
}
