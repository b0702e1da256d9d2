package com.mk.fx.context.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocalRule {
  private String ruleNumber;
  private String description;
  private String jurisdiction;
}
