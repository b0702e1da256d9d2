package com.mk.fx.context.engine.cache;

import com.mk.fx.context.client.http.JsonUtil;
import com.mk.fx.context.client.supabase.PostgrestQuery;
import com.mk.fx.context.client.supabase.SupabaseRestClient;
import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Persistent tier in {@code context.cached_contexts}. Active cases live for an hour, closed cases
 * for a day. Failures are logged and behave as misses.
 */
@Slf4j
@Order(2)
@Component
@ConditionalOnProperty(prefix = "context-engine.cache", name = "persistent-enabled", havingValue = "true")
public class SupabaseCacheTier implements CacheTier {

  public static final String NAME = "db";
  static final String SCHEMA = "context";
  static final String TABLE = "cached_contexts";

  private final SupabaseRestClient supabase;
  private final ContextEngineProperties.Cache settings;
  private final Clock clock;

  public SupabaseCacheTier(
      SupabaseRestClient supabase, ContextEngineProperties properties, Clock clock) {
    this.supabase = supabase;
    this.settings = properties.getCache();
    this.clock = clock;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<ContextResponse> get(String key) {
    try {
      return supabase
          .selectOne(
              PostgrestQuery.from(SCHEMA, TABLE)
                  .select("context_data")
                  .eq("cache_key", key)
                  .gt("expires_at", clock.instant().toString()))
          .map(row -> row.get("context_data"))
          .map(data -> JsonUtil.convert(data, ContextResponse.class));
    } catch (RuntimeException e) {
      log.warn("Persistent cache read failed for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, ContextResponse context, CaseStatus caseStatus) {
    var now = clock.instant();
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("cache_key", key);
    row.put("case_id", context.getCaseId());
    row.put("case_status", caseStatus.value());
    row.put("context_data", context);
    row.put("created_at", now.toString());
    row.put("expires_at", now.plus(ttl(caseStatus)).toString());
    try {
      supabase.upsert(SCHEMA, TABLE, row);
    } catch (RuntimeException e) {
      log.warn("Persistent cache write failed for {}: {}", key, e.getMessage());
    }
  }

  /**
   * Deletes the rows whose key starts with {@code prefix}. Candidate keys are read first and
   * checked here, so ids containing LIKE wildcards never reach rows of another case.
   */
  @Override
  public int deleteByPrefix(String prefix) {
    try {
      List<String> keys =
          supabase
              .select(
                  PostgrestQuery.from(SCHEMA, TABLE)
                      .select("cache_key")
                      .likePrefix("cache_key", prefix))
              .stream()
              .map(row -> row.get("cache_key"))
              .filter(Objects::nonNull)
              .map(Object::toString)
              .filter(key -> key.startsWith(prefix))
              .distinct()
              .collect(Collectors.toList());
      if (keys.isEmpty()) {
        return 0;
      }
      return supabase.delete(PostgrestQuery.from(SCHEMA, TABLE).in("cache_key", keys)).size();
    } catch (RuntimeException e) {
      log.warn("Persistent cache delete failed for {}: {}", prefix, e.getMessage());
      return 0;
    }
  }

  Duration ttl(CaseStatus caseStatus) {
    return Duration.ofSeconds(
        caseStatus == CaseStatus.CLOSED
            ? settings.getClosedCaseTtlSeconds()
            : settings.getActiveCaseTtlSeconds());
  }
}
