package com.mk.fx.context.client.graphrag;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.mk.fx.context.client.graphrag.model.CaseGraphBuildRequest;
import com.mk.fx.context.client.graphrag.model.GraphBuildResponse;
import com.mk.fx.context.client.graphrag.model.GraphCommunity;
import com.mk.fx.context.client.graphrag.model.GraphEntity;
import com.mk.fx.context.client.graphrag.model.GraphQueryOptions;
import com.mk.fx.context.client.graphrag.model.GraphQueryResponse;
import com.mk.fx.context.client.graphrag.model.GraphRelationship;
import com.mk.fx.context.client.graphrag.model.GraphStats;
import com.mk.fx.context.client.graphrag.model.SearchType;
import com.mk.fx.context.client.http.JsonUtil;
import com.mk.fx.context.client.http.Request;
import com.mk.fx.context.client.http.RestResponseData;
import com.mk.fx.context.client.http.ServiceClientException;
import com.mk.fx.context.client.http.ServiceHttpClient;
import com.mk.fx.context.client.http.ServiceStatusException;
import com.mk.fx.context.client.http.ServiceTransportException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Case-aware client for the GraphRAG service.
 *
 * <p>Two query modes are offered. Case context queries are scoped to one {@code case_id} and
 * default to LOCAL search; legal research queries carry no case id and search across cases.
 * Every case-scoped operation refuses to run without a case id.
 *
 * <p>Timeouts and connection failures are retried with exponential backoff ({@code retryDelay *
 * 2^attempt}). HTTP error statuses are logged and propagated without retrying.
 */
@Slf4j
public class GraphRagClient implements AutoCloseable {

  public static final String DEFAULT_BASE_URL = "http://10.10.0.87:8010";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

  private static final String QUERY_PATH = "/api/v1/graphrag/query";
  private static final String GRAPH_QUERY_PATH = "/api/v1/graph/query";

  private static final Escaper PATH_SEGMENT = UrlEscapers.urlPathSegmentEscaper();

  private static final Set<String> SIMILAR_CASE_TYPES = Set.of("CASE_CITATION", "CASE_LAW");
  private static final Set<String> PRECEDENT_TYPES =
      Set.of("CASE_CITATION", "CASE_LAW", "LEGAL_DOCTRINE", "HOLDING");

  private final ServiceHttpClient http;
  @Getter private final int maxRetries;
  @Getter private final Duration retryDelay;
  private final Clock clock;

  public GraphRagClient() {
    this(DEFAULT_BASE_URL, DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
  }

  public GraphRagClient(String baseUrl, Duration timeout, int maxRetries, Duration retryDelay) {
    this(new ServiceHttpClient(baseUrl, timeout, timeout, Map.of()), maxRetries, retryDelay,
        Clock.systemUTC());
  }

  @VisibleForTesting
  GraphRagClient(ServiceHttpClient http, int maxRetries, Duration retryDelay, Clock clock) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.http = http;
    this.maxRetries = maxRetries;
    this.retryDelay = retryDelay;
    this.clock = clock;
    log.info(
        "GraphRagClient initialised: baseUrl={}, timeout={}ms, maxRetries={}",
        http.getBaseUrl(),
        http.getRequestTimeout().toMillis(),
        maxRetries);
  }

  public String getBaseUrl() {
    return http.getBaseUrl();
  }

  // ---------------------------------------------------------------------------
  // Case context mode
  // ---------------------------------------------------------------------------

  public GraphQueryResponse queryCaseGraph(String clientId, String caseId, String query) {
    return queryCaseGraph(clientId, caseId, query, GraphQueryOptions.caseDefaults());
  }

  public GraphQueryResponse queryCaseGraph(
      String clientId, String caseId, String query, SearchType searchType) {
    return queryCaseGraph(clientId, caseId, query, GraphQueryOptions.of(searchType));
  }

  /**
   * Queries the knowledge graph of one case.
   *
   * @throws IllegalArgumentException if {@code caseId} is missing
   */
  public GraphQueryResponse queryCaseGraph(
      String clientId, String caseId, String query, GraphQueryOptions options) {
    requireCaseId(caseId, "queryCaseGraph");
    var stopwatch = Stopwatch.createStarted();

    Map<String, Object> payload = basePayload(clientId, query, options);
    payload.put("case_id", caseId);

    log.info(
        "Querying case graph: caseId={}, query='{}', searchType={}, mode={}",
        caseId,
        query,
        options.getSearchType(),
        options.getMode());

    var result = readQueryResponse(send(Request.post(QUERY_PATH, payload)).getBody());
    result.setExecutionTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS));

    long missingCaseId =
        result.getEntities().stream().filter(e -> isBlank(e.getCaseId())).count();
    if (missingCaseId > 0) {
      log.warn(
          "Found {} entities without case_id for case {} - potential case isolation violation",
          missingCaseId,
          caseId);
    }
    return result;
  }

  public List<GraphEntity> getCaseEntities(String clientId, String caseId, String entityType) {
    return getCaseEntities(clientId, caseId, entityType, 0.7, 100);
  }

  public List<GraphEntity> getCaseEntities(
      String clientId, String caseId, String entityType, double minConfidence, int limit) {
    requireCaseId(caseId, "getCaseEntities");
    var request =
        Request.get("/api/v1/graphrag/entities/" + pathSegment(clientId, "clientId"))
            .withQuery("case_id", caseId)
            .withQuery("min_confidence", minConfidence)
            .withQuery("limit", limit)
            .withQuery("entity_type", isBlank(entityType) ? null : entityType);

    log.info("Getting entities for case: caseId={}, entityType={}", caseId, entityType);
    var entities = JsonUtil.listField(send(request).getBody(), "entities", GraphEntity.class);
    log.info("Retrieved {} entities for case {}", entities.size(), caseId);
    return entities;
  }

  public List<GraphRelationship> getCaseRelationships(String caseId, String relationshipType) {
    return getCaseRelationships(caseId, relationshipType, 0.7, 100);
  }

  public List<GraphRelationship> getCaseRelationships(
      String caseId, String relationshipType, double minConfidence, int limit) {
    requireCaseId(caseId, "getCaseRelationships");
    Map<String, Object> filters = new LinkedHashMap<>();
    filters.put("case_id", caseId);
    filters.put("confidence_threshold", minConfidence);
    if (!isBlank(relationshipType)) {
      filters.put("relationship_type", relationshipType);
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("query_type", "relationships");
    payload.put("filters", filters);
    payload.put("max_results", limit);

    log.info("Getting relationships for case: caseId={}, type={}", caseId, relationshipType);
    var relationships =
        JsonUtil.listField(
            send(Request.post(GRAPH_QUERY_PATH, payload)).getBody(),
            "relationships",
            GraphRelationship.class);
    log.info("Retrieved {} relationships for case {}", relationships.size(), caseId);
    return relationships;
  }

  public List<GraphCommunity> getCaseCommunities(String clientId, String caseId, int minSize) {
    requireCaseId(caseId, "getCaseCommunities");
    Map<String, Object> filters = new LinkedHashMap<>();
    filters.put("case_id", caseId);
    filters.put("client_id", clientId);
    filters.put("min_size", minSize);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("query_type", "communities");
    payload.put("filters", filters);
    payload.put("include_communities", true);

    log.info("Getting communities for case: caseId={}, minSize={}", caseId, minSize);
    var communities =
        JsonUtil.listField(
            send(Request.post(GRAPH_QUERY_PATH, payload)).getBody(),
            "communities",
            GraphCommunity.class);
    log.info("Retrieved {} communities for case {}", communities.size(), caseId);
    return communities;
  }

  /** Builds the knowledge graph of a case from one document's extracted entities. */
  public GraphBuildResponse createCaseGraph(CaseGraphBuildRequest request) {
    requireCaseId(request.getCaseId(), "createCaseGraph");

    Map<String, Object> graphOptions = new LinkedHashMap<>();
    graphOptions.put("enable_deduplication", request.isEnableDeduplication());
    graphOptions.put("enable_community_detection", request.isEnableCommunityDetection());
    graphOptions.put("enable_cross_document_linking", request.isEnableCrossDocumentLinking());
    graphOptions.put("enable_analytics", request.isEnableAnalytics());
    graphOptions.put("use_ai_summaries", request.isUseAiSummaries());
    graphOptions.put("leiden_resolution", request.getLeidenResolution());
    graphOptions.put("min_community_size", request.getMinCommunitySize());
    graphOptions.put("similarity_threshold", request.getSimilarityThreshold());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("document_id", request.getDocumentId());
    payload.put("case_id", request.getCaseId());
    payload.put("client_id", request.getClientId());
    payload.put("markdown_content", request.getMarkdownContent());
    payload.put("entities", request.getEntities());
    payload.put("citations", request.getCitations());
    payload.put("relationships", request.getRelationships());
    payload.put("enhanced_chunks", request.getEnhancedChunks());
    payload.put("graph_options", graphOptions);
    payload.put("metadata", Map.of("processing_timestamp", Instant.now(clock).toString()));

    log.info(
        "Creating graph for case: documentId={}, caseId={}, entities={}",
        request.getDocumentId(),
        request.getCaseId(),
        request.getEntities().size());

    var body = send(Request.post("/api/v1/graph/create", payload)).getBody();
    var result = isBlank(body) ? null : JsonUtil.fromJson(body, GraphBuildResponse.class);
    if (result == null) {
      throw new ServiceClientException(
          "Empty graph build response for case " + request.getCaseId());
    }
    Map<String, Long> processed =
        result.getProcessingResults() == null ? Map.of() : result.getProcessingResults();
    log.info(
        "Graph created: graphId={}, entities={}, communities={}",
        result.getGraphId(),
        processed.get("entities_processed"),
        processed.get("communities_detected"));
    return result;
  }

  // ---------------------------------------------------------------------------
  // Legal research mode
  // ---------------------------------------------------------------------------

  public GraphQueryResponse queryLegalResearch(String clientId, String query, String jurisdiction) {
    return queryLegalResearch(clientId, query, jurisdiction, GraphQueryOptions.researchDefaults());
  }

  /** Cross-case query. Carries no case id. */
  public GraphQueryResponse queryLegalResearch(
      String clientId, String query, String jurisdiction, GraphQueryOptions options) {
    var stopwatch = Stopwatch.createStarted();
    Map<String, Object> payload = basePayload(clientId, query, options);
    if (!isBlank(jurisdiction)) {
      payload.put("filters", Map.of("jurisdiction", jurisdiction));
    }

    log.info(
        "Legal research query: query='{}', jurisdiction={}, searchType={}",
        query,
        jurisdiction,
        options.getSearchType());

    var result = readQueryResponse(send(Request.post(QUERY_PATH, payload)).getBody());
    result.setExecutionTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS));
    log.info(
        "Legal research completed: found {} entities in {}ms",
        result.getEntities().size(),
        result.getExecutionTimeMs());
    return result;
  }

  public List<GraphEntity> findSimilarCases(
      String clientId, String referenceCaseId, double similarityThreshold, int maxResults) {
    requireCaseId(referenceCaseId, "findSimilarCases");
    var query =
        "Find cases similar to case " + referenceCaseId + " based on legal issues and entities";
    var options =
        GraphQueryOptions.researchDefaults().toBuilder().maxResults(maxResults).build();
    var response = queryLegalResearch(clientId, query, null, options);

    // the threshold is advisory; the service applies its own similarity cut-off
    log.debug("Similarity threshold {} for reference case {}", similarityThreshold, referenceCaseId);
    var similar =
        response.getEntities().stream()
            .filter(e -> SIMILAR_CASE_TYPES.contains(e.getEntityType()))
            .filter(e -> !referenceCaseId.equals(e.getCaseId()))
            .limit(maxResults)
            .collect(Collectors.toList());
    log.info("Found {} similar cases to {}", similar.size(), referenceCaseId);
    return similar;
  }

  public List<GraphEntity> searchPrecedents(
      String clientId, String legalIssue, String jurisdiction, String courtLevel, int maxResults) {
    var query = new StringBuilder("Find legal precedents related to: ").append(legalIssue);
    if (!isBlank(jurisdiction)) {
      query.append(" in ").append(jurisdiction).append(" jurisdiction");
    }
    if (!isBlank(courtLevel)) {
      query.append(" from ").append(courtLevel).append(" court");
    }
    var options =
        GraphQueryOptions.researchDefaults().toBuilder().maxResults(maxResults).build();
    var response = queryLegalResearch(clientId, query.toString(), jurisdiction, options);

    var precedents =
        response.getEntities().stream()
            .filter(e -> PRECEDENT_TYPES.contains(e.getEntityType()))
            .collect(Collectors.toList());
    log.info("Found {} precedents for: {}", precedents.size(), legalIssue);
    return precedents;
  }

  // ---------------------------------------------------------------------------
  // Statistics, health and visualization
  // ---------------------------------------------------------------------------

  public GraphStats getGraphStats(String caseId, String clientId, boolean includeDetails) {
    var request =
        Request.get("/api/v1/graph/stats")
            .withQuery("include_details", includeDetails ? "true" : null)
            .withQuery("case_id", isBlank(caseId) ? null : caseId)
            .withQuery("client_id", isBlank(clientId) ? null : clientId);

    log.info("Getting graph stats: caseId={}, clientId={}", caseId, clientId);
    Map<String, Object> result = JsonUtil.toMap(send(request).getBody());

    Map<String, Object> flattened = new LinkedHashMap<>();
    Object statistics = result.get("statistics");
    Map<?, ?> totals = statistics instanceof Map ? (Map<?, ?>) statistics : Map.of();
    for (String key :
        List.of("total_entities", "total_relationships", "total_communities", "total_documents")) {
      flattened.put(key, totals.get(key) != null ? totals.get(key) : 0);
    }
    for (String key :
        List.of("entity_breakdown", "relationship_breakdown", "graph_metrics", "quality_metrics")) {
      flattened.put(key, result.get(key) != null ? result.get(key) : Map.of());
    }
    return JsonUtil.convert(flattened, GraphStats.class);
  }

  /**
   * Never throws; an unreachable or failing service, or an empty or unreadable reply, yields
   * {@code status=unhealthy}.
   */
  public Map<String, Object> healthCheck() {
    try {
      Map<String, Object> health = JsonUtil.toMap(send(Request.get("/api/v1/health/ready")).getBody());
      if (health.isEmpty()) {
        return unhealthy("Empty health response");
      }
      log.info("GraphRAG service health: {}", health.get("status"));
      return health;
    } catch (RuntimeException e) {
      log.error("GraphRAG service health check failed: {}", e.getMessage());
      return unhealthy(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
  }

  private static Map<String, Object> unhealthy(String error) {
    Map<String, Object> unhealthy = new LinkedHashMap<>();
    unhealthy.put("status", "unhealthy");
    unhealthy.put("error", error);
    unhealthy.put("ready", false);
    return unhealthy;
  }

  public Map<String, Object> getVisualizationData(
      String clientId, String caseId, int maxNodes, List<String> nodeTypes) {
    var request =
        Request.get("/api/v1/graphrag/graph/visualization/" + pathSegment(clientId, "clientId"))
            .withQuery("max_nodes", maxNodes)
            .withQuery("case_id", isBlank(caseId) ? null : caseId)
            .withQuery(
                "node_types",
                nodeTypes == null || nodeTypes.isEmpty() ? null : String.join(",", nodeTypes));

    log.info(
        "Getting visualization data: clientId={}, caseId={}, maxNodes={}",
        clientId,
        caseId,
        maxNodes);
    return JsonUtil.toMap(send(request).getBody());
  }

  // ---------------------------------------------------------------------------
  // Plumbing
  // ---------------------------------------------------------------------------

  private Map<String, Object> basePayload(String clientId, String query, GraphQueryOptions options) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("query", query);
    payload.put("client_id", clientId);
    payload.put("search_type", options.getSearchType().name());
    payload.put("mode", options.getMode().name());
    payload.put("max_results", options.getMaxResults());
    payload.put("community_level", options.getCommunityLevel());
    payload.put("vector_weight", options.getVectorWeight());
    if (options.getRelevanceBudget() != null) {
      payload.put("relevance_budget", options.getRelevanceBudget());
    }
    return payload;
  }

  /** Parses a query reply; a null body, entity list or relationship list reads as empty. */
  private static GraphQueryResponse readQueryResponse(String body) {
    var result = isBlank(body) ? null : JsonUtil.fromJson(body, GraphQueryResponse.class);
    if (result == null) {
      result = new GraphQueryResponse();
    }
    if (result.getEntities() == null) {
      result.setEntities(new ArrayList<>());
    }
    result.getEntities().removeIf(Objects::isNull);
    if (result.getRelationships() == null) {
      result.setRelationships(new ArrayList<>());
    }
    return result;
  }

  private static String pathSegment(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
    return PATH_SEGMENT.escape(value);
  }

  /**
   * Sends the request, retrying timeouts and connection failures. Error statuses are not
   * retried.
   */
  @VisibleForTesting
  RestResponseData send(Request request) {
    int attempt = 0;
    while (true) {
      try {
        return http.executeChecked(request);
      } catch (ServiceTransportException e) {
        if (!e.isRetryable() || attempt >= maxRetries) {
          if (e.isRetryable()) {
            log.error("Request failed after {} retries: {}", maxRetries, e.getMessage());
          }
          throw e;
        }
        long delayMs = retryDelay.toMillis() * (1L << attempt);
        log.warn(
            "Request failed (attempt {}/{}): {}. Retrying in {}ms...",
            attempt + 1,
            maxRetries,
            e.getMessage(),
            delayMs);
        sleep(delayMs);
        attempt++;
      } catch (ServiceStatusException e) {
        log.error(
            "GraphRAG HTTP error {} for {} {}: {}",
            e.getStatusCode(),
            request.getMethod(),
            request.getPath(),
            e.getResponseBody());
        throw e;
      }
    }
  }

  private static void sleep(long delayMs) {
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ServiceClientException("Interrupted while waiting to retry", ie);
    }
  }

  private static void requireCaseId(String caseId, String operation) {
    if (isBlank(caseId)) {
      var message =
          "case_id is required for case-specific operation: "
              + operation
              + ". Case isolation prevents cross-tenant data leaks.";
      log.error(message);
      throw new IllegalArgumentException(message);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @Override
  public void close() {
    http.close();
    log.info("GraphRagClient closed");
  }
}
