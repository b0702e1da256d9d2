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
public class Attorney {
  private String id;
  private String name;
  private String firm;
  private String barNumber;

  /** Ids of the parties this attorney represents. */
  @Builder.Default private List<String> representing = new ArrayList<>();

  private String caseId;
}
