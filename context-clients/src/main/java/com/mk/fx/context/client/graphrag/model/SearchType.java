package com.mk.fx.context.client.graphrag.model;

/** GraphRAG search strategy. LOCAL stays inside one case graph, GLOBAL spans cases. */
public enum SearchType {
  LOCAL,
  GLOBAL,
  HYBRID
}
