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
public class LegalTheory {
  private String id;
  private String name;
  @Builder.Default private String description = "";
  private double strength;
  @Builder.Default private List<String> supportingPrecedents = new ArrayList<>();
  private String caseId;
}
