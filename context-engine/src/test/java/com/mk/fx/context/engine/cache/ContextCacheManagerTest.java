package com.mk.fx.context.engine.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.model.CachePolicy;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.ContextResponse;
import com.mk.fx.context.engine.model.Scope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextCacheManagerTest {

  private SimpleMeterRegistry registry;
  private ContextEngineProperties properties;
  private MemoryCacheTier memory;

  /** Map-backed stand-in for the persistent tier. */
  private static final class MapTier implements CacheTier {
    private final Map<String, ContextResponse> entries = new HashMap<>();
    private final Map<String, CaseStatus> statuses = new HashMap<>();

    @Override
    public String name() {
      return SupabaseCacheTier.NAME;
    }

    @Override
    public Optional<ContextResponse> get(String key) {
      return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, ContextResponse context, CaseStatus caseStatus) {
      entries.put(key, context);
      statuses.put(key, caseStatus);
    }

    @Override
    public int deleteByPrefix(String prefix) {
      int before = entries.size();
      entries.keySet().removeIf(key -> key.startsWith(prefix));
      return before - entries.size();
    }
  }

  private static ContextQuery query(String caseId, Scope scope) {
    return ContextQuery.of("client-1", caseId, scope, CachePolicy.USE);
  }

  private static ContextResponse context(String caseId) {
    return ContextResponse.builder().caseId(caseId).contextScore(0.9).complete(true).build();
  }

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    properties = new ContextEngineProperties();
    memory =
        new MemoryCacheTier(
            new LruCache<>(
                10,
                Duration.ofSeconds(600),
                new MutableClock(Instant.parse("2024-03-01T10:00:00Z"))));
  }

  private ContextCacheManager manager(CacheTier... tiers) {
    return new ContextCacheManager(
        List.of(tiers), memory, properties, new ContextEngineMetrics(registry));
  }

  @Test
  void get_missThenHitAfterPut() {
    var manager = manager(memory);
    var query = query("case-1", Scope.STANDARD);

    assertTrue(manager.get(query).isEmpty());
    manager.put(query, context("case-1"), CaseStatus.ACTIVE);
    assertEquals("case-1", manager.get(query).orElseThrow().getCaseId());

    var stats = manager.getStats();
    assertEquals(1L, stats.get("memory_hits"));
    assertEquals(1L, stats.get("memory_misses"));
    assertEquals(0L, stats.get("db_hits"));
    assertEquals(1L, stats.get("total_sets"));
    assertEquals(0.5, manager.hitRate("memory"), 1e-9);
    assertEquals(
        1.0, registry.get("context.engine.cache.hits").tag("tier", "memory").counter().count());
  }

  @Test
  void get_persistentHitIsPromotedToMemory() {
    var db = new MapTier();
    var manager = manager(memory, db);
    var query = query("case-2", Scope.MINIMAL);
    db.put(CacheKeys.forQuery(query), context("case-2"), CaseStatus.CLOSED);

    assertTrue(manager.get(query).isPresent());
    assertTrue(memory.get(CacheKeys.forQuery(query)).isPresent());

    manager.get(query);
    var stats = manager.getStats();
    assertEquals(1L, stats.get("db_hits"));
    assertEquals(1L, stats.get("memory_hits"));
    assertEquals(1L, stats.get("memory_misses"));
  }

  @Test
  void put_writesAllTiersWithCaseStatus() {
    var db = new MapTier();
    var manager = manager(memory, db);
    var query = query("case-3", Scope.COMPREHENSIVE);

    manager.put(query, context("case-3"), CaseStatus.CLOSED);

    var key = CacheKeys.forQuery(query);
    assertTrue(memory.get(key).isPresent());
    assertEquals(CaseStatus.CLOSED, db.statuses.get(key));
  }

  @Test
  void delete_scopeOnlyRemovesThatScope() {
    var manager = manager(memory);
    manager.put(query("case-4", Scope.MINIMAL), context("case-4"), CaseStatus.ACTIVE);
    manager.put(query("case-4", Scope.STANDARD), context("case-4"), CaseStatus.ACTIVE);

    assertEquals(1, manager.delete("client-1", "case-4", Scope.MINIMAL));
    assertTrue(manager.get(query("case-4", Scope.MINIMAL)).isEmpty());
    assertTrue(manager.get(query("case-4", Scope.STANDARD)).isPresent());
  }

  @Test
  void invalidateCase_removesEveryScopeAcrossTiers() {
    var db = new MapTier();
    var manager = manager(memory, db);
    manager.put(query("case-5", Scope.MINIMAL), context("case-5"), CaseStatus.ACTIVE);
    manager.put(query("case-5", Scope.STANDARD), context("case-5"), CaseStatus.ACTIVE);
    manager.put(query("case-50", Scope.MINIMAL), context("case-50"), CaseStatus.ACTIVE);

    assertEquals(4, manager.invalidateCase("client-1", "case-5"));
    assertEquals(4L, manager.getStats().get("total_deletes"));
    assertTrue(manager.get(query("case-50", Scope.MINIMAL)).isPresent());
  }

  @Test
  void resetStats_zeroesCounters() {
    var manager = manager(memory);
    manager.get(query("case-6", Scope.MINIMAL));
    manager.resetStats();

    var stats = manager.getStats();
    assertEquals(0L, stats.get("memory_misses"));
    assertEquals(0.0, manager.overallHitRate());
  }

  @Test
  void getConfig_reportsTiersAndTtlStrategy() {
    var manager = manager(memory);
    var config = manager.getConfig();

    @SuppressWarnings("unchecked")
    var tiers = (Map<String, Map<String, Object>>) config.get("tiers");
    assertEquals(true, tiers.get("memory").get("enabled"));
    assertEquals(10, tiers.get("memory").get("max_size"));
    assertEquals(false, tiers.get("database").get("enabled"));
    assertFalse(manager.isPersistentEnabled());

    @SuppressWarnings("unchecked")
    var ttl = (Map<String, Object>) config.get("ttl_strategy");
    assertEquals("10 minutes", ttl.get("memory"));
    assertEquals("1 hour", ttl.get("active_cases"));
    assertEquals("24 hours", ttl.get("closed_cases"));
  }

  @Test
  void describe_formatsSeconds() {
    assertEquals("1 minute", ContextCacheManager.describe(60));
    assertEquals("2 hours", ContextCacheManager.describe(7200));
    assertEquals("45 seconds", ContextCacheManager.describe(45));
  }
}
