package com.mk.fx.context.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON-over-HTTP client for the downstream services of the context engine. Supports global
 * headers, query parameter encoding and per-request timeouts. Retries are left to callers.
 */
@Slf4j
public class ServiceHttpClient implements AutoCloseable {

  /** Default request timeout in seconds. */
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  private static final int MAX_LOGGED_BODY_CHARS = 500;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for all requests. */
  @Getter private final String baseUrl;

  /** Timeout duration for requests. */
  @Getter private final Duration requestTimeout;

  /**
   * Constructs a client with the default request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connTimeOutSeconds connection timeout in seconds
   * @param headers global headers to include in all requests
   */
  public ServiceHttpClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
    this(baseUrl, Duration.ofSeconds(connTimeOutSeconds),
        Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS), headers);
  }

  /**
   * Constructs a client with a specified request timeout.
   *
   * @param baseUrl the base URL for all requests
   * @param connectTimeout connection timeout
   * @param requestTimeout request timeout
   * @param headers global headers to include in all requests
   */
  public ServiceHttpClient(
      String baseUrl, Duration connectTimeout, Duration requestTimeout, Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "ServiceHttpClient initialised - Base URL: {}, Connection timeout: {}ms, Request timeout: {}ms",
        this.baseUrl,
        connectTimeout.toMillis(),
        requestTimeout.toMillis());
  }

  /**
   * Executes a synchronous request and returns the response whatever its status.
   *
   * @param request the request to execute
   * @return the response data
   * @throws ServiceTimeoutException if the request timed out
   * @throws ServiceConnectionException if the service could not be reached
   * @throws ServiceTransportException for any other I/O failure
   */
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");

    var httpRequest = buildHttpRequest(request);
    var startTime = System.nanoTime();
    log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);

    } catch (HttpTimeoutException e) {
      throw new ServiceTimeoutException(
          "Request to " + httpRequest.uri() + " timed out after " + requestTimeout.toMillis()
              + "ms: " + e.getMessage(),
          e);
    } catch (ConnectException e) {
      throw new ServiceConnectionException(
          "Could not connect to " + httpRequest.uri() + ": " + e.getMessage(), e);
    } catch (IOException e) {
      if (e.getCause() instanceof ConnectException) {
        throw new ServiceConnectionException(
            "Could not connect to " + httpRequest.uri() + ": " + e.getMessage(), e);
      }
      throw new ServiceTransportException(
          "Error executing request to " + httpRequest.uri() + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ServiceTransportException("Request to " + httpRequest.uri() + " interrupted", e);
    }
  }

  /**
   * Executes a request and fails on any non-2xx status.
   *
   * @throws ServiceStatusException if the service answered with an error status
   */
  public RestResponseData executeChecked(Request request) {
    var response = execute(request);
    if (!response.isSuccessful()) {
      log.error(
          "HTTP error {} for {} {}{}: {}",
          response.getStatusCode(),
          request.getMethod(),
          baseUrl,
          request.getPath(),
          abbreviate(response.getBody()));
      throw new ServiceStatusException(
          response.getStatusCode(),
          "HTTP " + response.getStatusCode() + " for " + request.getMethod() + " "
              + request.getPath(),
          response.getBody());
    }
    return response;
  }

  private HttpRequest buildHttpRequest(Request request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    var url = baseUrl + (request.getPath() != null ? request.getPath() : "");

    if (request.getQuery() != null && !request.getQuery().isEmpty()) {
      url += "?" + buildQueryString(request.getQuery());
    }

    var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);
    requestBuilder.header("Accept", "application/json");

    // global headers
    headers.forEach(requestBuilder::setHeader);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .setHeader("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new ServiceClientException(
            "Failed to serialize request body: " + e.getOriginalMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }

    return requestBuilder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String buildQueryString(Map<String, String> query) {
    return query.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String abbreviate(String body) {
    if (body == null || body.length() <= MAX_LOGGED_BODY_CHARS) {
      return body;
    }
    return body.substring(0, MAX_LOGGED_BODY_CHARS) + "...";
  }

  /**
   * Validates and normalizes the base URL.
   *
   * @throws IllegalArgumentException if the base URL is empty
   */
  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  @Override
  public void close() {
    log.debug("ServiceHttpClient for {} closed", baseUrl);
  }
}
