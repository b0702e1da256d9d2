package com.mk.fx.context.engine.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.base.Stopwatch;
import com.mk.fx.context.engine.analyzer.DimensionAnalyzer;
import com.mk.fx.context.engine.cache.ContextCacheManager;
import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.model.CachePolicy;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.ContextResponse;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.DimensionContext;
import com.mk.fx.context.engine.model.DimensionQualityMetrics;
import com.mk.fx.context.engine.model.Scope;
import com.mk.fx.context.engine.model.Scores;
import com.mk.fx.context.engine.model.WhatContext;
import com.mk.fx.context.engine.model.WhenContext;
import com.mk.fx.context.engine.model.WhereContext;
import com.mk.fx.context.engine.model.WhoContext;
import com.mk.fx.context.engine.model.WhyContext;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.CaseRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the dimension analyzers into one scored {@link ContextResponse} per case.
 *
 * <p>Requested dimensions run in parallel on a fixed pool of daemon workers, each bounded by the
 * configured per-dimension timeout. A dimension that fails or times out is left out of the
 * response and pulls the context score down rather than failing the request. Only complete
 * contexts are cached, and only when the query's {@link CachePolicy} allows writing.
 */
@Slf4j
@Service
public class ContextBuilderService {

  static final double COMPLETENESS_THRESHOLD = 0.85;
  static final double DEFAULT_CONFIDENCE = 0.9;

  private final Map<Dimension, DimensionAnalyzer<?>> analyzers;
  private final ContextCacheManager cacheManager;
  private final CaseDataStore store;
  private final ContextEngineMetrics metrics;
  private final ContextEngineProperties.Analysis settings;
  private final Clock clock;
  private final ExecutorService executor;

  public ContextBuilderService(
      List<DimensionAnalyzer<?>> analyzers,
      ContextCacheManager cacheManager,
      CaseDataStore store,
      ContextEngineMetrics metrics,
      ContextEngineProperties properties,
      Clock clock) {
    this.analyzers = initialiseAnalyzers(analyzers);
    this.cacheManager = cacheManager;
    this.store = store;
    this.metrics = metrics;
    this.settings = properties.getAnalysis();
    this.clock = clock;
    this.executor = createExecutor(settings.getWorkerThreads());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ContextBuilderService initialised with dimensions={} workers={} dimensionTimeout={}",
        analyzers.keySet(),
        settings.getWorkerThreads(),
        settings.getDimensionTimeout());
  }

  private ExecutorService createExecutor(int workers) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("context-dimension-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    return newFixedThreadPool(workers, threadFactory);
  }

  /** One analyzer per dimension, all five present. */
  private Map<Dimension, DimensionAnalyzer<?>> initialiseAnalyzers(
      List<DimensionAnalyzer<?>> available) {
    Map<Dimension, DimensionAnalyzer<?>> map = new EnumMap<>(Dimension.class);
    for (DimensionAnalyzer<?> analyzer : available) {
      Objects.requireNonNull(analyzer, "Analyzer entry cannot be null");
      var existing = map.putIfAbsent(analyzer.dimension(), analyzer);
      if (existing != null) {
        throw new IllegalStateException(
            "Multiple analyzers registered for dimension " + analyzer.dimension());
      }
    }
    for (Dimension dimension : Dimension.values()) {
      if (!map.containsKey(dimension)) {
        throw new IllegalStateException("No analyzer registered for dimension " + dimension);
      }
    }
    return map;
  }

  // ---------------------------------------------------------------------------
  // Context building
  // ---------------------------------------------------------------------------

  public ContextResponse buildContext(ContextQuery query) {
    var stopwatch = Stopwatch.createStarted();
    var dimensions = query.effectiveDimensions();
    log.info(
        "Building {} context for case {} (client {}), dimensions={}, cache={}",
        query.scope().value(),
        query.caseId(),
        query.clientId(),
        dimensions,
        query.cachePolicy());

    if (query.cachePolicy().readsCache()) {
      var cached = cacheManager.get(query);
      if (cached.isPresent()) {
        log.info("Returning cached context for case {}", query.caseId());
        return cached.get().toBuilder().cached(true).build();
      }
    }

    var outcomes = analyzeAll(query.clientId(), query.caseId(), dimensions);
    double score = contextScore(dimensions, outcomes);
    boolean complete = score >= COMPLETENESS_THRESHOLD;

    var response =
        ContextResponse.builder()
            .caseId(query.caseId())
            .caseName(caseName(query.caseId(), outcomes))
            .who((WhoContext) contextOf(outcomes, Dimension.WHO))
            .what((WhatContext) contextOf(outcomes, Dimension.WHAT))
            .where((WhereContext) contextOf(outcomes, Dimension.WHERE))
            .when((WhenContext) contextOf(outcomes, Dimension.WHEN))
            .why((WhyContext) contextOf(outcomes, Dimension.WHY))
            .contextScore(score)
            .complete(complete)
            .cached(false)
            .executionTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
            .timestamp(clock.instant())
            .build();

    metrics.contextBuilt(query.scope().value(), complete);
    if (complete && query.cachePolicy().writesCache()) {
      cacheManager.put(query, response, caseStatus(query.clientId(), query.caseId()));
    } else if (!complete) {
      log.info("Context for case {} incomplete (score {}), not cached", query.caseId(), score);
    }

    log.info(
        "Context built for case {}: score={}, complete={}, {} of {} dimensions in {} ms",
        query.caseId(),
        String.format("%.2f", score),
        complete,
        outcomes.size(),
        dimensions.size(),
        response.getExecutionTimeMs());
    if (log.isDebugEnabled()) {
      log.debug("Context summary for case {}: {}", query.caseId(), response.summary());
    }
    return response;
  }

  /**
   * Builds each distinct case in turn; a failing case is reported in the errors map. Repeated
   * case ids are built once and counted once.
   */
  public BatchOutcome buildBatch(
      String clientId, List<String> caseIds, Scope scope, CachePolicy cachePolicy) {
    var distinctIds = new LinkedHashSet<>(caseIds);
    Map<String, ContextResponse> contexts = new LinkedHashMap<>();
    Map<String, String> errors = new LinkedHashMap<>();
    for (String caseId : distinctIds) {
      try {
        contexts.put(
            caseId, buildContext(ContextQuery.of(clientId, caseId, scope, cachePolicy)));
      } catch (RuntimeException e) {
        log.error("Failed to build context for case {}", caseId, e);
        errors.put(caseId, e.getMessage());
      }
    }
    return new BatchOutcome(distinctIds.size(), contexts, errors);
  }

  /** Rebuilds and caches the contexts of the given cases, skipping any cached copy. */
  public BatchOutcome warmup(String clientId, List<String> caseIds, Scope scope) {
    log.info("Warming cache for {} cases of client {} at scope {}", caseIds.size(), clientId,
        scope.value());
    return buildBatch(clientId, caseIds, scope, CachePolicy.REFRESH);
  }

  // ---------------------------------------------------------------------------
  // Single dimensions
  // ---------------------------------------------------------------------------

  /** Runs one analyzer directly, without consulting or filling the cache. */
  public DimensionContext refreshDimension(String clientId, String caseId, Dimension dimension) {
    log.info("Refreshing {} dimension for case {}", dimension, caseId);
    return analyzers.get(dimension).analyze(clientId, caseId);
  }

  public DimensionQualityMetrics getDimensionQuality(
      String clientId, String caseId, Dimension dimension) {
    return quality(analyzers.get(dimension), clientId, caseId);
  }

  private static <T extends DimensionContext> DimensionQualityMetrics quality(
      DimensionAnalyzer<T> analyzer, String clientId, String caseId) {
    T context = analyzer.analyze(clientId, caseId);
    return analyzer.qualityMetrics(context, DEFAULT_CONFIDENCE);
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  /**
   * Runs the analyzers of the requested dimensions with one shared deadline. Analyses still
   * running at the deadline are cancelled and their workers interrupted, so a slow dependency
   * never holds a pool thread beyond the timeout.
   */
  private Map<Dimension, DimensionOutcome> analyzeAll(
      String clientId, String caseId, List<Dimension> dimensions) {
    var timeout = settings.getDimensionTimeout();
    List<Callable<DimensionOutcome>> tasks = new ArrayList<>(dimensions.size());
    for (Dimension dimension : dimensions) {
      var analyzer = analyzers.get(dimension);
      tasks.add(() -> analyze(analyzer, clientId, caseId));
    }

    List<Future<DimensionOutcome>> futures;
    try {
      futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while analysing case {}", caseId);
      return new EnumMap<>(Dimension.class);
    }

    Map<Dimension, DimensionOutcome> outcomes = new EnumMap<>(Dimension.class);
    for (int i = 0; i < dimensions.size(); i++) {
      var dimension = dimensions.get(i);
      var future = futures.get(i);
      if (future.isCancelled()) {
        log.warn("{} analysis for case {} timed out after {}", dimension, caseId, timeout);
        continue;
      }
      try {
        var outcome = future.get();
        if (outcome != null && outcome.context() != null) {
          outcomes.put(dimension, outcome);
        }
      } catch (ExecutionException e) {
        log.error("{} analysis for case {} failed", dimension, caseId, e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    return outcomes;
  }

  private static <T extends DimensionContext> DimensionOutcome analyze(
      DimensionAnalyzer<T> analyzer, String clientId, String caseId) {
    T context = analyzer.analyze(clientId, caseId);
    return new DimensionOutcome(context, Scores.clamp(analyzer.score(context)));
  }

  /** Average dimension score scaled by the share of requested dimensions actually built. */
  static double contextScore(List<Dimension> requested, Map<Dimension, DimensionOutcome> built) {
    if (requested.isEmpty()) {
      return 0.0;
    }
    double sum = built.values().stream().mapToDouble(DimensionOutcome::score).sum();
    double average = sum / requested.size();
    double completeness = (double) built.size() / requested.size();
    return Scores.clamp(average * completeness);
  }

  static String caseName(String caseId, Map<Dimension, DimensionOutcome> outcomes) {
    var fallback = DimensionContext.defaultCaseName(caseId);
    for (Dimension dimension : Dimension.values()) {
      var outcome = outcomes.get(dimension);
      if (outcome != null) {
        var name = outcome.context().getCaseName();
        if (name != null && !name.isBlank() && !name.equals(fallback)) {
          return name;
        }
      }
    }
    return fallback;
  }

  private static DimensionContext contextOf(
      Map<Dimension, DimensionOutcome> outcomes, Dimension dimension) {
    var outcome = outcomes.get(dimension);
    return outcome == null ? null : outcome.context();
  }

  private CaseStatus caseStatus(String clientId, String caseId) {
    try {
      return store.findCase(clientId, caseId).map(CaseRecord::caseStatus).orElse(CaseStatus.ACTIVE);
    } catch (RuntimeException e) {
      log.warn("Could not read status of case {}, assuming active: {}", caseId, e.getMessage());
      return CaseStatus.ACTIVE;
    }
  }

  /** Stops accepting work; running analyses are abandoned with the daemon workers. */
  public void shutdown() {
    executor.shutdownNow();
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  record DimensionOutcome(DimensionContext context, double score) {}

  /**
   * Result of building several cases.
   *
   * @param totalCases number of distinct cases requested
   * @param contexts built contexts by case id
   * @param errors failure messages by case id
   */
  public record BatchOutcome(
      int totalCases, Map<String, ContextResponse> contexts, Map<String, String> errors) {

    public int successful() {
      return contexts.size();
    }

    public int failed() {
      return errors.size();
    }
  }
}
