package com.mk.fx.context.engine.cache;

import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** In-process LRU tier; the same short TTL applies to active and closed cases. */
@Order(1)
@Component
public class MemoryCacheTier implements CacheTier {

  public static final String NAME = "memory";

  private final LruCache<ContextResponse> cache;

  @Autowired
  public MemoryCacheTier(ContextEngineProperties properties, Clock clock) {
    this(
        new LruCache<>(
            properties.getCache().getMemoryMaxSize(),
            Duration.ofSeconds(properties.getCache().getMemoryTtlSeconds()),
            clock));
  }

  MemoryCacheTier(LruCache<ContextResponse> cache) {
    this.cache = cache;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<ContextResponse> get(String key) {
    return cache.get(key);
  }

  @Override
  public void put(String key, ContextResponse context, CaseStatus caseStatus) {
    cache.put(key, context);
  }

  @Override
  public int deleteByPrefix(String prefix) {
    return cache.deleteByPrefix(prefix);
  }

  public Map<String, Object> stats() {
    return cache.stats();
  }

  public double utilization() {
    return (double) cache.size() / cache.getMaxSize();
  }

  public int maxSize() {
    return cache.getMaxSize();
  }

  public long ttlSeconds() {
    return cache.getDefaultTtl().toSeconds();
  }
}
