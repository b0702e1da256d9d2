package com.mk.fx.context.engine.cache;

import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.ContextResponse;
import com.mk.fx.context.engine.model.Scope;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Multi-tier cache of complete contexts.
 *
 * <p>Reads walk the tiers fastest first and copy a hit from a slower tier into every faster one.
 * Writes go to all enabled tiers. Hit and miss counters are kept per tier for the memory and
 * {@code db} tiers whether or not the latter is enabled, so the statistics shape is stable.
 */
@Slf4j
@Service
public class ContextCacheManager {

  private static final List<String> TIER_NAMES =
      List.of(MemoryCacheTier.NAME, SupabaseCacheTier.NAME);

  private final List<CacheTier> tiers;
  private final MemoryCacheTier memoryTier;
  private final ContextEngineProperties.Cache settings;
  private final ContextEngineMetrics metrics;

  private final Map<String, AtomicLong> hits = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> misses = new ConcurrentHashMap<>();
  private final AtomicLong totalSets = new AtomicLong();
  private final AtomicLong totalDeletes = new AtomicLong();

  public ContextCacheManager(
      List<CacheTier> tiers,
      MemoryCacheTier memoryTier,
      ContextEngineProperties properties,
      ContextEngineMetrics metrics) {
    this.tiers = List.copyOf(tiers);
    this.memoryTier = memoryTier;
    this.settings = properties.getCache();
    this.metrics = metrics;
    TIER_NAMES.forEach(
        name -> {
          hits.put(name, new AtomicLong());
          misses.put(name, new AtomicLong());
        });
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ContextCacheManager initialised: tiers={}, memoryMaxSize={}, memoryTtl={}s",
        tiers.stream().map(CacheTier::name).toList(),
        settings.getMemoryMaxSize(),
        settings.getMemoryTtlSeconds());
  }

  public Optional<ContextResponse> get(ContextQuery query) {
    var key = CacheKeys.forQuery(query);
    for (int i = 0; i < tiers.size(); i++) {
      var tier = tiers.get(i);
      var found = tier.get(key);
      if (found.isPresent()) {
        count(hits, tier.name());
        metrics.cacheHit(tier.name());
        log.debug("Cache hit in {} tier for {}", tier.name(), key);
        promote(key, found.get(), i);
        return found;
      }
      count(misses, tier.name());
      metrics.cacheMiss(tier.name());
    }
    return Optional.empty();
  }

  public void put(ContextQuery query, ContextResponse context, CaseStatus caseStatus) {
    var key = CacheKeys.forQuery(query);
    tiers.forEach(tier -> tier.put(key, context, caseStatus));
    totalSets.incrementAndGet();
    log.debug("Cache SET: {} (status: {})", key, caseStatus.value());
  }

  /**
   * Deletes the cached contexts of one scope of a case, or of every scope when the scope is null.
   *
   * @return number of entries removed across all tiers
   */
  public int delete(String clientId, String caseId, Scope scope) {
    var prefix =
        scope == null
            ? CacheKeys.casePrefix(clientId, caseId)
            : CacheKeys.scopePrefix(clientId, caseId, scope);
    int deleted = tiers.stream().mapToInt(tier -> tier.deleteByPrefix(prefix)).sum();
    totalDeletes.addAndGet(deleted);
    log.info(
        "Cache DELETE: case={}, scope={}, deleted={} entries",
        caseId,
        scope == null ? "all" : scope.value(),
        deleted);
    return deleted;
  }

  public int invalidateCase(String clientId, String caseId) {
    log.info("Invalidating all cache for case: {}", caseId);
    return delete(clientId, caseId, null);
  }

  public Map<String, Object> getStats() {
    Map<String, Object> stats = new LinkedHashMap<>();
    for (String tier : TIER_NAMES) {
      stats.put(tier + "_hits", hits.get(tier).get());
      stats.put(tier + "_misses", misses.get(tier).get());
    }
    stats.put("total_sets", totalSets.get());
    stats.put("total_deletes", totalDeletes.get());
    stats.put("memory_cache", memoryTier.stats());
    for (String tier : TIER_NAMES) {
      stats.put(tier + "_hit_rate", hitRate(tier));
    }
    stats.put("overall_hit_rate", overallHitRate());
    return stats;
  }

  /** Hits over lookups, summed across all tiers. */
  public double overallHitRate() {
    long allHits = 0;
    long allOps = 0;
    for (String tier : TIER_NAMES) {
      long tierHits = hits.get(tier).get();
      allHits += tierHits;
      allOps += tierHits + misses.get(tier).get();
    }
    return ratio(allHits, allOps);
  }

  public void resetStats() {
    hits.values().forEach(counter -> counter.set(0));
    misses.values().forEach(counter -> counter.set(0));
    totalSets.set(0);
    totalDeletes.set(0);
    log.info("Cache statistics reset");
  }

  public double hitRate(String tier) {
    long tierHits = hits.getOrDefault(tier, new AtomicLong()).get();
    return ratio(tierHits, tierHits + misses.getOrDefault(tier, new AtomicLong()).get());
  }

  public boolean isPersistentEnabled() {
    return tiers.stream().anyMatch(tier -> SupabaseCacheTier.NAME.equals(tier.name()));
  }

  public Map<String, Object> getConfig() {
    Map<String, Object> memory = new LinkedHashMap<>();
    memory.put("enabled", true);
    memory.put("ttl_seconds", memoryTier.ttlSeconds());
    memory.put("max_size", memoryTier.maxSize());

    Map<String, Object> database = new LinkedHashMap<>();
    database.put("enabled", isPersistentEnabled());
    database.put("active_case_ttl_seconds", settings.getActiveCaseTtlSeconds());
    database.put("closed_case_ttl_seconds", settings.getClosedCaseTtlSeconds());

    Map<String, Object> tierConfig = new LinkedHashMap<>();
    tierConfig.put("memory", memory);
    tierConfig.put("database", database);

    Map<String, Object> ttlStrategy = new LinkedHashMap<>();
    ttlStrategy.put("memory", describe(memoryTier.ttlSeconds()));
    ttlStrategy.put("active_cases", describe(settings.getActiveCaseTtlSeconds()));
    ttlStrategy.put("closed_cases", describe(settings.getClosedCaseTtlSeconds()));

    Map<String, Object> config = new LinkedHashMap<>();
    config.put("tiers", tierConfig);
    config.put("ttl_strategy", ttlStrategy);
    return config;
  }

  public double memoryUtilization() {
    return memoryTier.utilization();
  }

  private void promote(String key, ContextResponse context, int foundAt) {
    for (int i = 0; i < foundAt; i++) {
      tiers.get(i).put(key, context, CaseStatus.ACTIVE);
    }
  }

  private static double ratio(long part, long total) {
    return total == 0 ? 0.0 : (double) part / total;
  }

  private static void count(Map<String, AtomicLong> counters, String tier) {
    counters.computeIfAbsent(tier, name -> new AtomicLong()).incrementAndGet();
  }

  /** 600 becomes "10 minutes", 3600 "1 hour", 86400 "24 hours". */
  static String describe(long seconds) {
    if (seconds % 3600 == 0) {
      long hoursCount = seconds / 3600;
      return hoursCount + (hoursCount == 1 ? " hour" : " hours");
    }
    if (seconds % 60 == 0) {
      long minutes = seconds / 60;
      return minutes + (minutes == 1 ? " minute" : " minutes");
    }
    return seconds + " seconds";
  }
}
