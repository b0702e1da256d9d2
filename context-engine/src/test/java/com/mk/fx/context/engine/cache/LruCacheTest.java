package com.mk.fx.context.engine.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LruCacheTest {

  private MutableClock clock;
  private LruCache<String> cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    cache = new LruCache<>(3, Duration.ofSeconds(600), clock);
  }

  @Test
  void constructor_rejectsNonPositiveSize() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LruCache<String>(0, Duration.ofSeconds(1), clock));
  }

  @Test
  void get_returnsStoredValueUntilTtlElapses() {
    cache.put("a", "one");
    clock.advance(Duration.ofSeconds(599));
    assertEquals("one", cache.get("a").orElseThrow());

    clock.advance(Duration.ofSeconds(1));
    assertTrue(cache.get("a").isEmpty());
    assertEquals(0, cache.size(), "expired entry is dropped on read");
  }

  @Test
  void put_nonPositiveTtlFallsBackToDefault() {
    cache.put("a", "one", Duration.ZERO);
    cache.put("b", "two", Duration.ofSeconds(-5));
    cache.put("c", "three", Duration.ofSeconds(10));

    clock.advance(Duration.ofSeconds(11));
    assertTrue(cache.get("a").isPresent());
    assertTrue(cache.get("b").isPresent());
    assertTrue(cache.get("c").isEmpty());
  }

  @Test
  void put_evictsLeastRecentlyUsedBeyondCapacity() {
    cache.put("a", "1");
    cache.put("b", "2");
    cache.put("c", "3");
    cache.get("a");

    cache.put("d", "4");

    assertEquals(3, cache.size());
    assertTrue(cache.get("b").isEmpty(), "b was least recently used");
    assertTrue(cache.get("a").isPresent());
    assertTrue(cache.get("c").isPresent());
    assertTrue(cache.get("d").isPresent());
  }

  @Test
  void put_overwriteDoesNotGrowCache() {
    cache.put("a", "1");
    cache.put("a", "2");
    assertEquals(1, cache.size());
    assertEquals("2", cache.get("a").orElseThrow());
  }

  @Test
  void deleteByPrefix_removesOnlyMatchingKeys() {
    cache.put("context:c1:case1:minimal:aaaa", "x");
    cache.put("context:c1:case1:standard:bbbb", "y");
    cache.put("context:c1:case10:minimal:cccc", "z");

    assertEquals(2, cache.deleteByPrefix("context:c1:case1:"));
    assertEquals(1, cache.size());
    assertTrue(cache.get("context:c1:case10:minimal:cccc").isPresent());
  }

  @Test
  void delete_and_clear() {
    cache.put("a", "1");
    cache.put("b", "2");
    assertTrue(cache.delete("a"));
    assertFalse(cache.delete("a"));
    assertEquals(1, cache.clear());
    assertEquals(0, cache.size());
  }

  @Test
  void stats_reportHitsUtilizationAndExpiredEntries() {
    cache.put("a", "1");
    cache.put("b", "2", Duration.ofSeconds(5));
    cache.get("a");
    cache.get("a");
    clock.advance(Duration.ofSeconds(6));

    var stats = cache.stats();

    assertEquals(2, stats.get("size"));
    assertEquals(3, stats.get("max_size"));
    assertEquals(2.0 / 3, (double) stats.get("utilization"), 1e-9);
    assertEquals(2L, stats.get("total_hits"));
    assertEquals(1L, stats.get("expired_entries"));
    assertEquals(600L, stats.get("default_ttl_seconds"));
  }
}
