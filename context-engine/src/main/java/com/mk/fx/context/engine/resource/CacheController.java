package com.mk.fx.context.engine.resource;

import com.mk.fx.context.engine.cache.ContextCacheManager;
import com.mk.fx.context.engine.cache.MemoryCacheTier;
import com.mk.fx.context.engine.dto.request.CacheWarmupRequest;
import com.mk.fx.context.engine.dto.response.InvalidationResponse;
import com.mk.fx.context.engine.dto.response.StatsResetResponse;
import com.mk.fx.context.engine.dto.response.WarmupResponse;
import com.mk.fx.context.engine.model.Scope;
import com.mk.fx.context.engine.service.ContextBuilderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Cache", description = "Context cache statistics, invalidation and warmup")
@RestController
@RequestMapping("/api/v1/cache")
@Validated
@RequiredArgsConstructor
public class CacheController {

  static final double HEALTHY_HIT_RATE = 0.5;

  private final ContextCacheManager cacheManager;
  private final ContextBuilderService contextBuilder;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Statistics
  // -----------------------------------------------------
  @Operation(summary = "Cache statistics", description = "Hit, miss and size figures per tier.")
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    return responseFactory.ok(cacheManager.getStats());
  }

  @Operation(summary = "Reset cache statistics", description = "Zeroes all cache counters.")
  @PostMapping("/stats/reset")
  public ResponseEntity<StatsResetResponse> resetStats() {
    var previous = cacheManager.getStats();
    cacheManager.resetStats();
    return responseFactory.ok(
        new StatsResetResponse(
            "Cache statistics reset successfully", previous, cacheManager.getStats()));
  }

  // -----------------------------------------------------
  // Invalidation
  // -----------------------------------------------------
  @Operation(
      summary = "Invalidate cached context",
      description = "Deletes one scope of a case, or all scopes when none is given.")
  @DeleteMapping("/invalidate")
  public ResponseEntity<InvalidationResponse> invalidate(
      @RequestParam("client_id") @NotBlank String clientId,
      @RequestParam("case_id") @NotBlank String caseId,
      @RequestParam(name = "scope", required = false) String scope) {
    var parsedScope = scope == null || scope.isBlank() ? null : Scope.fromValue(scope);
    int deleted = cacheManager.delete(clientId, caseId, parsedScope);
    return responseFactory.ok(
        new InvalidationResponse(
            "Cache invalidated successfully",
            clientId,
            caseId,
            parsedScope == null ? "all" : parsedScope.value(),
            deleted));
  }

  @Operation(
      summary = "Invalidate all cache of a case",
      description = "Deletes every cached scope and dimension set of a case.")
  @PostMapping("/invalidate/case")
  public ResponseEntity<InvalidationResponse> invalidateCase(
      @RequestParam("client_id") @NotBlank String clientId,
      @RequestParam("case_id") @NotBlank String caseId) {
    int deleted = cacheManager.invalidateCase(clientId, caseId);
    return responseFactory.ok(
        new InvalidationResponse(
            "All cache for case invalidated successfully", null, caseId, null, deleted));
  }

  // -----------------------------------------------------
  // Warmup
  // -----------------------------------------------------
  @Operation(
      summary = "Warm up cache",
      description = "Builds and caches the contexts of the given cases ahead of use.")
  @PostMapping("/warmup")
  public ResponseEntity<WarmupResponse> warmup(@Valid @RequestBody CacheWarmupRequest request) {
    var scope = Scope.fromValue(request.getScope() == null ? "standard" : request.getScope());
    var outcome =
        contextBuilder.warmup(request.getClientId(), List.copyOf(request.getCaseIds()), scope);
    log.info(
        "Cache warmup complete: {} of {} cases", outcome.successful(), outcome.totalCases());
    return responseFactory.ok(
        new WarmupResponse(
            "Cache warmup completed",
            outcome.totalCases(),
            outcome.successful(),
            outcome.failed(),
            outcome.errors()));
  }

  // -----------------------------------------------------
  // Configuration and health
  // -----------------------------------------------------
  @Operation(summary = "Cache configuration", description = "Enabled tiers and TTL strategy.")
  @GetMapping("/config")
  public ResponseEntity<Map<String, Object>> config() {
    return responseFactory.ok(cacheManager.getConfig());
  }

  @Operation(
      summary = "Cache health",
      description = "Healthy when the memory or overall hit rate is above one half.")
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    try {
      double memoryHitRate = cacheManager.hitRate(MemoryCacheTier.NAME);
      double overallHitRate = cacheManager.overallHitRate();
      boolean memoryHealthy = memoryHitRate > HEALTHY_HIT_RATE;
      boolean healthy = memoryHealthy || overallHitRate > HEALTHY_HIT_RATE;

      Map<String, Object> memory = new LinkedHashMap<>();
      memory.put("status", memoryHealthy ? "healthy" : "degraded");
      memory.put("utilization", cacheManager.memoryUtilization());
      memory.put("hit_rate", memoryHitRate);

      Map<String, Object> tiers = new LinkedHashMap<>();
      tiers.put("memory", memory);
      tiers.put(
          "database", Map.of("status", cacheManager.isPersistentEnabled() ? "enabled" : "disabled"));

      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", healthy ? "healthy" : "degraded");
      body.put("tiers", tiers);
      body.put("overall_hit_rate", overallHitRate);
      return responseFactory.ok(body);
    } catch (RuntimeException e) {
      log.error("Cache health check failed", e);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "unhealthy");
      body.put("error", e.getMessage());
      return responseFactory.unavailable(body);
    }
  }
}
