package com.mk.fx.context.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {
  private String text;
  private CitationType type;
  @Builder.Default private String jurisdiction = "federal";

  /** Extraction confidence in [0, 1]. */
  @Builder.Default private double confidence = 0.9;

  private String caseId;
}
