package com.mk.fx.context.client.graphrag.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Input for building a case knowledge graph from one processed document. */
@Value
@Builder
public class CaseGraphBuildRequest {
  String documentId;
  String caseId;
  String clientId;
  String markdownContent;
  @Singular List<Map<String, Object>> entities;
  @Singular List<Map<String, Object>> citations;
  @Singular List<Map<String, Object>> relationships;
  @Singular List<Map<String, Object>> enhancedChunks;

  @Builder.Default boolean enableDeduplication = true;
  @Builder.Default boolean enableCommunityDetection = true;
  @Builder.Default boolean enableCrossDocumentLinking = true;
  @Builder.Default boolean enableAnalytics = true;

  /** AI summaries switch the build to full mode; lazy mode is the default. */
  @Builder.Default boolean useAiSummaries = false;

  @Builder.Default double leidenResolution = 1.0;
  @Builder.Default int minCommunitySize = 3;
  @Builder.Default double similarityThreshold = 0.85;
}
