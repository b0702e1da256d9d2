package com.mk.fx.context.client.graphrag.model;

public enum GraphRagMode {
  FULL_GRAPHRAG,
  LAZY_GRAPHRAG,
  HYBRID_MODE
}
