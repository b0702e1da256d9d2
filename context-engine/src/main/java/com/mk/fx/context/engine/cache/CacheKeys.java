package com.mk.fx.context.engine.cache;

import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Scope;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.util.DigestUtils;

/**
 * Cache key layout: {@code context:{client_id}:{case_id}:{scope}:{hash}}, where the hash is the
 * first eight hex digits of the MD5 of {@code client:case:scope}, extended with the explicit
 * dimension set when the query names one. The set is hashed in WHO..WHY order, so the order the
 * caller listed the dimensions in does not matter.
 */
public final class CacheKeys {

  private static final String NAMESPACE = "context";

  private CacheKeys() {}

  public static String forQuery(ContextQuery query) {
    return key(query.clientId(), query.caseId(), query.scope(), query.dimensions());
  }

  public static String key(
      String clientId, String caseId, Scope scope, List<Dimension> dimensions) {
    var material = clientId + ":" + caseId + ":" + scope.value();
    if (dimensions != null && !dimensions.isEmpty()) {
      material +=
          ":"
              + dimensions.stream()
                  .distinct()
                  .sorted()
                  .map(Dimension::name)
                  .collect(Collectors.joining(","));
    }
    var hash = DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    return scopePrefix(clientId, caseId, scope) + hash.substring(0, 8);
  }

  /** Prefix shared by every key of one scope of a case, whatever the dimension list. */
  public static String scopePrefix(String clientId, String caseId, Scope scope) {
    return casePrefix(clientId, caseId) + scope.value() + ":";
  }

  /** Prefix shared by every key of a case. */
  public static String casePrefix(String clientId, String caseId) {
    return NAMESPACE + ":" + clientId + ":" + caseId + ":";
  }
}
