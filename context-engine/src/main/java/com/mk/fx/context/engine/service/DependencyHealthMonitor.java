package com.mk.fx.context.engine.service;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.store.CaseDataStore;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically probes GraphRAG and Supabase and publishes the result as a health gauge. */
@Slf4j
@Component
@RequiredArgsConstructor
public class DependencyHealthMonitor {

  public static final String GRAPHRAG = "graphrag";
  public static final String SUPABASE = "supabase";

  private final GraphRagClient graphRag;
  private final CaseDataStore store;
  private final ContextEngineMetrics metrics;
  private final Clock clock;

  private final Map<String, Map<String, Object>> lastResults = new ConcurrentHashMap<>();

  @Scheduled(fixedDelayString = "${context-engine.health.probe-interval-ms:30000}")
  public void probe() {
    probeGraphRag();
    probeSupabase();
  }

  /** Last probe result per dependency, in probe order. */
  public Map<String, Map<String, Object>> lastResults() {
    Map<String, Map<String, Object>> results = new LinkedHashMap<>();
    for (String dependency : new String[] {GRAPHRAG, SUPABASE}) {
      results.put(
          dependency, lastResults.getOrDefault(dependency, Map.of("status", "unknown")));
    }
    return results;
  }

  void probeGraphRag() {
    try {
      var health = graphRag.healthCheck();
      boolean healthy =
          !"unhealthy".equals(health.get("status")) && !Boolean.FALSE.equals(health.get("ready"));
      record(GRAPHRAG, healthy, healthy ? null : String.valueOf(health.get("error")));
    } catch (RuntimeException e) {
      log.warn("GraphRAG health probe failed: {}", e.getMessage());
      record(GRAPHRAG, false, String.valueOf(e.getMessage()));
    }
  }

  void probeSupabase() {
    try {
      store.ping();
      record(SUPABASE, true, null);
    } catch (RuntimeException e) {
      log.warn("Supabase health probe failed: {}", e.getMessage());
      record(SUPABASE, false, e.getMessage());
    }
  }

  private void record(String dependency, boolean healthy, String error) {
    metrics.dependencyHealth(dependency, healthy);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("status", healthy ? "healthy" : "unhealthy");
    result.put("checked_at", clock.instant().toString());
    if (error != null) {
      result.put("error", error);
    }
    var previous = lastResults.put(dependency, result);
    if (previous == null || !previous.get("status").equals(result.get("status"))) {
      log.info("Dependency {} is {}", dependency, result.get("status"));
    }
  }
}
