package com.mk.fx.context.engine.model;

/** How a context build interacts with the context cache. */
public enum CachePolicy {
  /** Serve from cache when possible, store complete results. */
  USE(true, true),
  /** Always rebuild, then store complete results. */
  REFRESH(false, true),
  /** Neither read nor write the cache. */
  BYPASS(false, false);

  private final boolean reads;
  private final boolean writes;

  CachePolicy(boolean reads, boolean writes) {
    this.reads = reads;
    this.writes = writes;
  }

  public boolean readsCache() {
    return reads;
  }

  public boolean writesCache() {
    return writes;
  }

  public static CachePolicy fromUseCache(boolean useCache) {
    return useCache ? USE : BYPASS;
  }
}
