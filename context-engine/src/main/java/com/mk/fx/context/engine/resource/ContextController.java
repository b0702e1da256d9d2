package com.mk.fx.context.engine.resource;

import com.mk.fx.context.engine.dto.request.BatchContextRequest;
import com.mk.fx.context.engine.dto.request.ContextRetrievalRequest;
import com.mk.fx.context.engine.dto.request.DimensionRequest;
import com.mk.fx.context.engine.dto.response.BatchContextResponse;
import com.mk.fx.context.engine.dto.response.DimensionResponse;
import com.mk.fx.context.engine.dto.response.RefreshResponse;
import com.mk.fx.context.engine.model.CachePolicy;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.ContextResponse;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.DimensionQualityMetrics;
import com.mk.fx.context.engine.model.Scope;
import com.mk.fx.context.engine.service.ContextBuilderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Context", description = "Case-scoped WHO/WHAT/WHERE/WHEN/WHY context retrieval")
@RestController
@RequestMapping("/api/v1/context")
@Validated
@RequiredArgsConstructor
public class ContextController {

  private final ContextBuilderService contextBuilder;
  private final ContextQueryMapper queryMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Full context
  // -----------------------------------------------------
  @Operation(
      summary = "Retrieve case context",
      description = "Builds or returns the cached multi-dimensional context of a case.")
  @PostMapping("/retrieve")
  public ResponseEntity<ContextResponse> retrieveContext(
      @Valid @RequestBody ContextRetrievalRequest request) {
    log.info(
        "Context retrieval: client={}, case={}, scope={}",
        request.getClientId(),
        request.getCaseId(),
        request.getScope());
    return responseFactory.ok(contextBuilder.buildContext(queryMapper.toQuery(request)));
  }

  @Operation(
      summary = "Retrieve case context (query parameters)",
      description = "Same as the POST form, for simple integrations.")
  @GetMapping("/retrieve")
  public ResponseEntity<ContextResponse> retrieveContextByParams(
      @RequestParam("client_id") @NotBlank String clientId,
      @RequestParam("case_id") @NotBlank String caseId,
      @RequestParam(name = "scope", defaultValue = "comprehensive") String scope,
      @RequestParam(name = "use_cache", defaultValue = "true") boolean useCache) {
    var request =
        ContextRetrievalRequest.builder()
            .clientId(clientId)
            .caseId(caseId)
            .scope(scope)
            .useCache(useCache)
            .build();
    return retrieveContext(request);
  }

  @Operation(
      summary = "Refresh case context",
      description = "Rebuilds the context without reading the cache and caches the result.")
  @PostMapping("/refresh")
  public ResponseEntity<RefreshResponse> refreshContext(
      @RequestParam("client_id") @NotBlank String clientId,
      @RequestParam("case_id") @NotBlank String caseId,
      @RequestParam(name = "scope", defaultValue = "comprehensive") String scope) {
    log.info("Context refresh: case={}, scope={}", caseId, scope);
    var parsedScope = Scope.fromValue(scope);
    var context =
        contextBuilder.buildContext(
            ContextQuery.of(clientId, caseId, parsedScope, CachePolicy.REFRESH));
    return responseFactory.ok(
        new RefreshResponse(
            "Context refreshed successfully",
            caseId,
            parsedScope.value(),
            context.getContextScore(),
            context.getExecutionTimeMs()));
  }

  @Operation(
      summary = "Batch retrieve contexts",
      description = "Builds the contexts of several cases of one client; failures are per case.")
  @PostMapping("/batch/retrieve")
  public ResponseEntity<BatchContextResponse> batchRetrieve(
      @Valid @RequestBody BatchContextRequest request) {
    log.info(
        "Batch retrieval: client={}, cases={}", request.getClientId(), request.getCaseIds().size());
    var scope = Scope.fromValue(request.getScope() == null ? "standard" : request.getScope());
    var policy = CachePolicy.fromUseCache(request.getUseCache() == null || request.getUseCache());
    var outcome =
        contextBuilder.buildBatch(request.getClientId(), List.copyOf(request.getCaseIds()), scope,
            policy);
    return responseFactory.ok(
        new BatchContextResponse(
            outcome.totalCases(),
            outcome.successful(),
            outcome.failed(),
            outcome.contexts(),
            outcome.errors()));
  }

  // -----------------------------------------------------
  // Single dimension
  // -----------------------------------------------------
  @Operation(
      summary = "Retrieve one dimension",
      description = "Runs a single dimension analyzer for a case, bypassing the cache.")
  @PostMapping("/dimension/retrieve")
  public ResponseEntity<DimensionResponse> retrieveDimension(
      @Valid @RequestBody DimensionRequest request) {
    var dimension = Dimension.fromValue(request.getDimension());
    log.info("Dimension retrieval: case={}, dimension={}", request.getCaseId(), dimension);
    var data =
        contextBuilder.refreshDimension(request.getClientId(), request.getCaseId(), dimension);
    return responseFactory.ok(new DimensionResponse(request.getCaseId(), dimension.name(), data));
  }

  @Operation(
      summary = "Dimension quality",
      description = "Completeness, data points and sufficiency of one dimension of a case.")
  @GetMapping("/dimension/quality")
  public ResponseEntity<DimensionQualityMetrics> dimensionQuality(
      @RequestParam("client_id") @NotBlank String clientId,
      @RequestParam("case_id") @NotBlank String caseId,
      @RequestParam(name = "dimension") @NotBlank String dimension) {
    return responseFactory.ok(
        contextBuilder.getDimensionQuality(clientId, caseId, Dimension.fromValue(dimension)));
  }
}
