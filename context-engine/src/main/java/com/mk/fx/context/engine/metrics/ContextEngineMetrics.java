package com.mk.fx.context.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Service meters, exported through the Prometheus registry as {@code context_engine_*}.
 *
 * <p>Tagged meters are looked up on every call; Micrometer caches them by name and tags.
 */
@Component
public class ContextEngineMetrics {

  static final String REQUESTS = "context.engine.requests";
  static final String REQUEST_LATENCY = "context.engine.request.latency";
  static final String CACHE_HITS = "context.engine.cache.hits";
  static final String CACHE_MISSES = "context.engine.cache.misses";
  static final String DEPENDENCY_HEALTH = "context.engine.dependency.health";
  static final String CONTEXT_BUILDS = "context.engine.context.builds";

  private final MeterRegistry meterRegistry;
  private final Map<String, AtomicInteger> dependencyStates = new ConcurrentHashMap<>();

  public ContextEngineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRequest(String endpoint, String method, Duration elapsed) {
    Counter.builder(REQUESTS)
        .description("Total HTTP requests")
        .tag("endpoint", endpoint)
        .tag("method", method)
        .register(meterRegistry)
        .increment();
    Timer.builder(REQUEST_LATENCY)
        .description("HTTP request latency")
        .tag("endpoint", endpoint)
        .publishPercentileHistogram()
        .register(meterRegistry)
        .record(elapsed);
  }

  public void cacheHit(String tier) {
    Counter.builder(CACHE_HITS)
        .description("Cache hits by tier")
        .tag("tier", tier)
        .register(meterRegistry)
        .increment();
  }

  public void cacheMiss(String tier) {
    Counter.builder(CACHE_MISSES)
        .description("Cache misses by tier")
        .tag("tier", tier)
        .register(meterRegistry)
        .increment();
  }

  public void contextBuilt(String scope, boolean complete) {
    Counter.builder(CONTEXT_BUILDS)
        .description("Contexts built by scope and completeness")
        .tag("scope", scope)
        .tag("complete", String.valueOf(complete))
        .register(meterRegistry)
        .increment();
  }

  /** Sets the 1/0 health gauge of a dependency, registering it on first use. */
  public void dependencyHealth(String dependency, boolean healthy) {
    dependencyStates
        .computeIfAbsent(
            dependency,
            name -> {
              var state = new AtomicInteger();
              Gauge.builder(DEPENDENCY_HEALTH, state, AtomicInteger::get)
                  .description("Dependency health (1=healthy, 0=unhealthy)")
                  .tag("dependency", name)
                  .register(meterRegistry);
              return state;
            })
        .set(healthy ? 1 : 0);
  }
}
