package com.mk.fx.context.engine.resource;

import com.mk.fx.context.engine.cfg.ServiceInfo;
import com.mk.fx.context.engine.dto.response.HealthResponse;
import com.mk.fx.context.engine.dto.response.ServiceInfoResponse;
import com.mk.fx.context.engine.service.DependencyHealthMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Service", description = "Service information and health")
@RestController
public class ServiceInfoController {

  private final DependencyHealthMonitor healthMonitor;
  private final ApiResponseFactory responseFactory;
  private final int port;

  public ServiceInfoController(
      DependencyHealthMonitor healthMonitor,
      ApiResponseFactory responseFactory,
      @Value("${server.port:" + ServiceInfo.DEFAULT_PORT + "}") int port) {
    this.healthMonitor = healthMonitor;
    this.responseFactory = responseFactory;
    this.port = port;
  }

  @Operation(summary = "Service information", description = "Name, version and endpoints.")
  @GetMapping("/")
  public ResponseEntity<ServiceInfoResponse> root() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("docs", "/docs");
    endpoints.put("redoc", "/v3/api-docs");
    endpoints.put("health", "/api/v1/health");
    endpoints.put("metrics", "/metrics");
    return responseFactory.ok(
        new ServiceInfoResponse(
            ServiceInfo.NAME,
            ServiceInfo.VERSION,
            port,
            "running",
            ServiceInfo.DESCRIPTION,
            endpoints));
  }

  @Operation(summary = "Health check", description = "Liveness of the service itself.")
  @GetMapping("/api/v1/health")
  public ResponseEntity<HealthResponse> health() {
    log.debug("Health check");
    return responseFactory.ok(
        new HealthResponse("healthy", ServiceInfo.SHORT_NAME, port, ServiceInfo.VERSION));
  }

  @Operation(
      summary = "Dependency health",
      description = "Last probe result for GraphRAG and Supabase.")
  @GetMapping("/api/v1/health/dependencies")
  public ResponseEntity<Map<String, Map<String, Object>>> dependencies() {
    return responseFactory.ok(healthMonitor.lastResults());
  }
}
