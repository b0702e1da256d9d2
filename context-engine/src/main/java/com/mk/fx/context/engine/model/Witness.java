package com.mk.fx.context.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Witness {
  private String id;
  private String name;

  /** fact, expert or character. */
  @Builder.Default private String witnessType = "fact";

  private String representingParty;
  private String caseId;
  private String expertise;
}
