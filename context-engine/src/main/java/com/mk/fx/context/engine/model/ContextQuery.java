package com.mk.fx.context.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * A request to build context for one case.
 *
 * @param clientId tenant of the case
 * @param caseId case to build context for
 * @param scope named dimension set, used when {@code dimensions} is empty
 * @param dimensions explicit dimensions overriding the scope, may be null
 * @param cachePolicy cache interaction
 */
public record ContextQuery(
    String clientId,
    String caseId,
    Scope scope,
    List<Dimension> dimensions,
    CachePolicy cachePolicy) {

  public ContextQuery {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("client_id is required");
    }
    if (caseId == null || caseId.isBlank()) {
      throw new IllegalArgumentException("case_id is required");
    }
    scope = Objects.requireNonNullElse(scope, Scope.COMPREHENSIVE);
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    cachePolicy = Objects.requireNonNullElse(cachePolicy, CachePolicy.USE);
  }

  public static ContextQuery of(String clientId, String caseId, Scope scope, CachePolicy policy) {
    return new ContextQuery(clientId, caseId, scope, null, policy);
  }

  /** Explicit dimensions when given, otherwise those of the scope; de-duplicated in order. */
  public List<Dimension> effectiveDimensions() {
    if (dimensions.isEmpty()) {
      return scope.dimensions();
    }
    return dimensions.stream().distinct().toList();
  }
}
