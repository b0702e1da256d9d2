package com.mk.fx.context.client.graphrag.model;

import lombok.Builder;
import lombok.Value;

/** Tuning knobs shared by case and research queries. */
@Value
@Builder(toBuilder = true)
public class GraphQueryOptions {

  @Builder.Default SearchType searchType = SearchType.LOCAL;
  @Builder.Default GraphRagMode mode = GraphRagMode.LAZY_GRAPHRAG;
  @Builder.Default int maxResults = 100;

  /** Relevance score budget for lazy mode, omitted from the payload when null. */
  Integer relevanceBudget;

  @Builder.Default int communityLevel = 2;
  @Builder.Default double vectorWeight = 0.7;

  public static GraphQueryOptions caseDefaults() {
    return builder().build();
  }

  public static GraphQueryOptions researchDefaults() {
    return builder().searchType(SearchType.GLOBAL).maxResults(50).build();
  }

  public static GraphQueryOptions of(SearchType searchType) {
    return builder().searchType(searchType).build();
  }
}
