package com.mk.fx.context.engine.analyzer;

import com.google.common.base.Stopwatch;
import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.client.graphrag.model.GraphEntity;
import com.mk.fx.context.client.graphrag.model.SearchType;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.DimensionContext;
import com.mk.fx.context.engine.model.DimensionQualityMetrics;
import com.mk.fx.context.engine.model.Scores;
import com.mk.fx.context.engine.store.CaseDataStore;
import com.mk.fx.context.engine.store.CaseRecord;
import com.mk.fx.context.engine.store.GraphNode;
import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for the per-dimension analyzers.
 *
 * <p>{@link #analyze(String, String)} never throws: a failure inside an analyzer produces the
 * dimension's empty context, and a failure of a single source (GraphRAG or the case store) is
 * logged and treated as an empty result from that source.
 *
 * @param <T> the context type produced for the dimension
 */
@Slf4j
public abstract class DimensionAnalyzer<T extends DimensionContext> {

  protected final GraphRagClient graphRag;
  protected final CaseDataStore store;
  protected final Clock clock;

  protected DimensionAnalyzer(GraphRagClient graphRag, CaseDataStore store, Clock clock) {
    this.graphRag = graphRag;
    this.store = store;
    this.clock = clock;
  }

  /** The dimension this analyzer builds. */
  public abstract Dimension dimension();

  /**
   * Builds the dimension context for one case.
   *
   * @param clientId owning client
   * @param caseId case to analyze
   * @return the populated context, or the empty context when analysis failed
   */
  public T analyze(String clientId, String caseId) {
    log.info("Analyzing {} dimension for case {}", dimension(), caseId);
    var stopwatch = Stopwatch.createStarted();
    try {
      T context = doAnalyze(clientId, caseId);
      log.info(
          "{} analysis for case {} complete: {} data points in {} ms",
          dimension(),
          caseId,
          dataPoints(context),
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
      return context;
    } catch (RuntimeException e) {
      log.error("Error analyzing {} dimension for case {}", dimension(), caseId, e);
      return emptyContext(caseId);
    }
  }

  protected abstract T doAnalyze(String clientId, String caseId);

  protected abstract T emptyContext(String caseId);

  /** Number of facts the context carries, used for completeness. */
  public abstract int dataPoints(T context);

  /** Dimension score in [0, 1]. */
  public double score(T context) {
    return Scores.byCount(dataPoints(context));
  }

  public DimensionQualityMetrics qualityMetrics(T context, double confidenceAvg) {
    int points = dataPoints(context);
    return DimensionQualityMetrics.of(dimension(), Scores.byCount(points), points, confidenceAvg);
  }

  // ---------------------------------------------------------------------------
  // Sources
  // ---------------------------------------------------------------------------

  protected List<GraphNode> findNodes(String clientId, String caseId, String... entityTypes) {
    try {
      return store.findNodes(clientId, caseId, Arrays.asList(entityTypes));
    } catch (RuntimeException e) {
      log.warn("Case store node query failed for case {}: {}", caseId, e.getMessage());
      return List.of();
    }
  }

  protected Optional<CaseRecord> findCase(String clientId, String caseId) {
    try {
      return store.findCase(clientId, caseId);
    } catch (RuntimeException e) {
      log.warn("Failed to query case metadata for case {}: {}", caseId, e.getMessage());
      return Optional.empty();
    }
  }

  /** Case-scoped GraphRAG query, returning entities of the wanted types as nodes. */
  protected List<GraphNode> queryGraph(
      String clientId, String caseId, String query, SearchType searchType, String... types) {
    try {
      var response = graphRag.queryCaseGraph(clientId, caseId, query, searchType);
      return response.getEntities().stream()
          .filter(entity -> entity.hasType(types))
          .map(DimensionAnalyzer::toNode)
          .collect(Collectors.toList());
    } catch (RuntimeException e) {
      log.warn("GraphRAG query failed for case {}: {}", caseId, e.getMessage());
      return List.of();
    }
  }

  protected String resolveCaseName(String clientId, String caseId) {
    return caseName(findCase(clientId, caseId), caseId);
  }

  protected static String caseName(Optional<CaseRecord> caseRecord, String caseId) {
    return caseRecord
        .map(CaseRecord::caseName)
        .orElseGet(() -> DimensionContext.defaultCaseName(caseId));
  }

  /** Graph entity as a node; the entity text stands in for a missing {@code name} property. */
  static GraphNode toNode(GraphEntity entity) {
    var properties = new LinkedHashMap<String, Object>();
    if (entity.getProperties() != null) {
      properties.putAll(entity.getProperties());
    }
    if (entity.getEntityText() != null) {
      properties.putIfAbsent("name", entity.getEntityText());
    }
    properties.putIfAbsent("confidence", entity.getConfidenceScore());
    return new GraphNode(entity.getEntityId(), entity.getEntityType(), properties);
  }
}
