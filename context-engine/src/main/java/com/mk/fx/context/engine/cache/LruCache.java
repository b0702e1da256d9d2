package com.mk.fx.context.engine.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Size-bounded, least-recently-used cache with per-entry expiry. All operations synchronize on the
 * cache instance.
 *
 * @param <V> cached value type
 */
@Slf4j
public class LruCache<V> {

  public static final int DEFAULT_MAX_SIZE = 1000;
  public static final Duration DEFAULT_TTL = Duration.ofSeconds(600);

  private final int maxSize;
  private final Duration defaultTtl;
  private final Clock clock;

  /** Access-ordered: iteration starts at the least recently used entry. */
  private final LinkedHashMap<String, Entry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);

  public LruCache() {
    this(DEFAULT_MAX_SIZE, DEFAULT_TTL, Clock.systemUTC());
  }

  public LruCache(int maxSize, Duration defaultTtl, Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    this.maxSize = maxSize;
    this.defaultTtl = defaultTtl;
    this.clock = clock;
  }

  /** The live value for the key; an expired entry is dropped and reported as absent. */
  public synchronized Optional<V> get(String key) {
    var entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      log.debug("Cache entry expired: {}", key);
      entries.remove(key);
      return Optional.empty();
    }
    entry.hitCount++;
    log.debug("Cache HIT: {} (hits: {})", key, entry.hitCount);
    return Optional.of(entry.value);
  }

  public synchronized void put(String key, V value) {
    put(key, value, null);
  }

  /**
   * Stores the value, evicting least recently used entries beyond capacity.
   *
   * @param ttl time to live; null, zero or negative means the default TTL
   */
  public synchronized void put(String key, V value, Duration ttl) {
    var effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
    entries.put(key, new Entry<>(value, clock.instant().plus(effectiveTtl)));

    Iterator<String> eldest = entries.keySet().iterator();
    while (entries.size() > maxSize && eldest.hasNext()) {
      var evicted = eldest.next();
      eldest.remove();
      log.debug("Evicting least recently used entry: {}", evicted);
    }
    log.debug("Cache SET: {} (ttl: {}s, size: {}/{})", key, effectiveTtl.toSeconds(),
        entries.size(), maxSize);
  }

  public synchronized boolean delete(String key) {
    return entries.remove(key) != null;
  }

  /** Removes every entry whose key starts with the prefix; returns how many were removed. */
  public synchronized int deleteByPrefix(String prefix) {
    int removed = 0;
    Iterator<String> keys = entries.keySet().iterator();
    while (keys.hasNext()) {
      if (keys.next().startsWith(prefix)) {
        keys.remove();
        removed++;
      }
    }
    return removed;
  }

  public synchronized int clear() {
    int count = entries.size();
    entries.clear();
    log.info("Cache CLEARED: {} entries removed", count);
    return count;
  }

  public synchronized int size() {
    return entries.size();
  }

  public int getMaxSize() {
    return maxSize;
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public synchronized Map<String, Object> stats() {
    var now = clock.instant();
    long totalHits = 0;
    long expired = 0;
    for (Entry<V> entry : entries.values()) {
      totalHits += entry.hitCount;
      if (entry.isExpired(now)) {
        expired++;
      }
    }
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("size", entries.size());
    stats.put("max_size", maxSize);
    stats.put("utilization", (double) entries.size() / maxSize);
    stats.put("total_hits", totalHits);
    stats.put("expired_entries", expired);
    stats.put("default_ttl_seconds", defaultTtl.toSeconds());
    return stats;
  }

  private static final class Entry<V> {
    private final V value;
    private final Instant expiresAt;
    private long hitCount;

    private Entry(V value, Instant expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }

    private boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
