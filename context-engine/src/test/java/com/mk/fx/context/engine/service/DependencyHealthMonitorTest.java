package com.mk.fx.context.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.store.CaseDataStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DependencyHealthMonitorTest {

  @Mock private GraphRagClient graphRag;

  @Mock private CaseDataStore store;

  private SimpleMeterRegistry registry;
  private DependencyHealthMonitor monitor;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    monitor =
        new DependencyHealthMonitor(
            graphRag,
            store,
            new ContextEngineMetrics(registry),
            Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
  }

  private double gauge(String dependency) {
    return registry
        .get("context.engine.dependency.health")
        .tag("dependency", dependency)
        .gauge()
        .value();
  }

  // ========== lastResults() ==========

  @Test
  void lastResults_BeforeFirstProbe_ShouldReportUnknown() {
    var results = monitor.lastResults();

    assertThat(results).containsOnlyKeys("graphrag", "supabase");
    assertThat(results.get("graphrag")).containsEntry("status", "unknown");
    assertThat(results.get("supabase")).containsEntry("status", "unknown");
  }

  // ========== probe() ==========

  @Test
  void probe_WhenDependenciesUp_ShouldRecordHealthy() {
    when(graphRag.healthCheck()).thenReturn(Map.of("status", "healthy", "ready", true));

    monitor.probe();

    var results = monitor.lastResults();
    assertThat(results.get("graphrag"))
        .containsEntry("status", "healthy")
        .doesNotContainKey("error");
    assertThat(results.get("supabase"))
        .containsEntry("status", "healthy")
        .containsEntry("checked_at", "2024-03-01T12:00:00Z");
    assertThat(gauge("graphrag")).isEqualTo(1.0);
    assertThat(gauge("supabase")).isEqualTo(1.0);
  }

  @Test
  void probe_WhenDependenciesDown_ShouldRecordErrors() {
    when(graphRag.healthCheck())
        .thenReturn(Map.of("status", "unhealthy", "error", "connection refused", "ready", false));
    doThrow(new IllegalStateException("timeout")).when(store).ping();

    monitor.probe();

    var results = monitor.lastResults();
    assertThat(results.get("graphrag"))
        .containsEntry("status", "unhealthy")
        .containsEntry("error", "connection refused");
    assertThat(results.get("supabase")).containsEntry("error", "timeout");
    assertThat(gauge("graphrag")).isZero();
    assertThat(gauge("supabase")).isZero();
  }

  @Test
  void probeGraphRag_WhenNotReady_ShouldBeUnhealthy() {
    when(graphRag.healthCheck()).thenReturn(Map.of("status", "degraded", "ready", false));

    monitor.probeGraphRag();

    assertThat(monitor.lastResults().get("graphrag")).containsEntry("status", "unhealthy");
  }

  @Test
  void probe_WhenGraphRagProbeThrows_ShouldStillProbeSupabase() {
    when(graphRag.healthCheck()).thenThrow(new IllegalStateException("bad reply"));

    monitor.probe();

    var results = monitor.lastResults();
    assertThat(results.get("graphrag"))
        .containsEntry("status", "unhealthy")
        .containsEntry("error", "bad reply");
    assertThat(results.get("supabase")).containsEntry("status", "healthy");
    assertThat(gauge("graphrag")).isZero();
  }
}
