package com.mk.fx.context.engine.metrics;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Counts and times every HTTP request by route and method.
 *
 * <p>The endpoint tag is the matched route pattern, never the raw URI, so path variables and
 * unmatched paths cannot create new meters.
 */
@RequiredArgsConstructor
public class RequestMetricsFilter extends OncePerRequestFilter {

  static final String UNKNOWN_ENDPOINT = "UNKNOWN";

  private final ContextEngineMetrics metrics;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    long start = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } finally {
      metrics.recordRequest(
          endpoint(request), request.getMethod(), Duration.ofNanos(System.nanoTime() - start));
    }
  }

  static String endpoint(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    return pattern != null ? pattern.toString() : UNKNOWN_ENDPOINT;
  }
}
