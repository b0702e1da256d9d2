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
public class PrecedentAnalysis {
  private String caseName;
  @Builder.Default private String citation = "";

  /** Relevance to the case in [0, 1]. */
  private double relevanceScore;

  @Builder.Default private String holding = "";
  @Builder.Default private List<String> distinguishingFactors = new ArrayList<>();
  private Favorability favorability;
}
