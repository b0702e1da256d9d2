package com.mk.fx.context.engine.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.context.engine.model.CachePolicy;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Scope;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

class CacheKeysTest {

  @Test
  void key_usesNamespaceIdsScopeAndShortHash() {
    var expectedHash =
        DigestUtils.md5DigestAsHex("client-1:case-9:standard".getBytes(StandardCharsets.UTF_8))
            .substring(0, 8);

    var key = CacheKeys.key("client-1", "case-9", Scope.STANDARD, List.of());

    assertEquals("context:client-1:case-9:standard:" + expectedHash, key);
  }

  @Test
  void key_differsWhenExplicitDimensionsAreGiven() {
    var scopeOnly = CacheKeys.key("c", "k", Scope.COMPREHENSIVE, null);
    var withWho = CacheKeys.key("c", "k", Scope.COMPREHENSIVE, List.of(Dimension.WHO));
    var withWhen = CacheKeys.key("c", "k", Scope.COMPREHENSIVE, List.of(Dimension.WHEN));

    assertNotEquals(scopeOnly, withWho);
    assertNotEquals(withWho, withWhen);
    assertTrue(withWho.startsWith(CacheKeys.scopePrefix("c", "k", Scope.COMPREHENSIVE)));
  }

  @Test
  void key_ignoresRepeatedDimensions() {
    assertEquals(
        CacheKeys.key("c", "k", Scope.MINIMAL, List.of(Dimension.WHO, Dimension.WHAT)),
        CacheKeys.key(
            "c", "k", Scope.MINIMAL, List.of(Dimension.WHO, Dimension.WHO, Dimension.WHAT)));
  }

  @Test
  void key_ignoresDimensionOrder() {
    var whoWhen =
        new ContextQuery(
            "c", "k", Scope.STANDARD, List.of(Dimension.WHO, Dimension.WHEN), CachePolicy.USE);
    var whenWho =
        new ContextQuery(
            "c", "k", Scope.STANDARD, List.of(Dimension.WHEN, Dimension.WHO), CachePolicy.USE);

    assertEquals(CacheKeys.forQuery(whoWhen), CacheKeys.forQuery(whenWho));
  }

  @Test
  void forQuery_matchesKey() {
    var query = new ContextQuery("c", "k", Scope.MINIMAL, null, CachePolicy.USE);
    assertEquals(CacheKeys.key("c", "k", Scope.MINIMAL, List.of()), CacheKeys.forQuery(query));
  }

  @Test
  void casePrefix_coversEveryScope() {
    var prefix = CacheKeys.casePrefix("c", "k");
    for (Scope scope : Scope.values()) {
      assertTrue(CacheKeys.key("c", "k", scope, null).startsWith(prefix));
    }
    assertFalse(CacheKeys.key("c", "k2", Scope.MINIMAL, null).startsWith(prefix));
  }
}
