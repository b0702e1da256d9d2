package com.mk.fx.context.engine.cache;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.context.client.http.ServiceConnectionException;
import com.mk.fx.context.client.supabase.PostgrestQuery;
import com.mk.fx.context.client.supabase.SupabaseRestClient;
import com.mk.fx.context.engine.cfg.ContextEngineProperties;
import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SupabaseCacheTierTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private SupabaseRestClient supabase;
  private SupabaseCacheTier tier;

  @BeforeEach
  void setUp() {
    supabase = mock(SupabaseRestClient.class);
    tier =
        new SupabaseCacheTier(
            supabase, new ContextEngineProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void ttl_dependsOnCaseStatus() {
    assertEquals(Duration.ofHours(1), tier.ttl(CaseStatus.ACTIVE));
    assertEquals(Duration.ofHours(24), tier.ttl(CaseStatus.CLOSED));
  }

  @Test
  void put_upsertsRowWithExpiry() {
    var context = ContextResponse.builder().caseId("case-1").build();

    tier.put("context:c:case-1:minimal:abcd1234", context, CaseStatus.CLOSED);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> row = ArgumentCaptor.forClass(Map.class);
    verify(supabase).upsert(eq("context"), eq("cached_contexts"), row.capture());
    assertEquals("context:c:case-1:minimal:abcd1234", row.getValue().get("cache_key"));
    assertEquals("case-1", row.getValue().get("case_id"));
    assertEquals("closed", row.getValue().get("case_status"));
    assertEquals(NOW.plus(Duration.ofDays(1)).toString(), row.getValue().get("expires_at"));
  }

  @Test
  void get_readsUnexpiredContextData() {
    when(supabase.selectOne(any(PostgrestQuery.class)))
        .thenReturn(
            Optional.of(
                Map.of("context_data", Map.of("case_id", "case-1", "context_score", 0.9))));

    var found = tier.get("key");

    assertTrue(found.isPresent());
    assertEquals("case-1", found.get().getCaseId());
    assertEquals(0.9, found.get().getContextScore());

    ArgumentCaptor<PostgrestQuery> query = ArgumentCaptor.forClass(PostgrestQuery.class);
    verify(supabase).selectOne(query.capture());
    assertTrue(query.getValue().toString().contains("expires_at=gt." + NOW));
  }

  @Test
  void get_failureIsAMiss() {
    when(supabase.selectOne(any(PostgrestQuery.class)))
        .thenThrow(new ServiceConnectionException("down", null));

    assertTrue(tier.get("key").isEmpty());
  }

  @Test
  void deleteByPrefix_deletesMatchingKeysAndCountsRows() {
    when(supabase.select(any(PostgrestQuery.class)))
        .thenReturn(
            List.of(
                Map.of("cache_key", "context:c:case-1:minimal:aaaa1111"),
                Map.of("cache_key", "context:c:case-1:standard:bbbb2222")));
    when(supabase.delete(any(PostgrestQuery.class)))
        .thenReturn(List.of(Map.of("cache_key", "a"), Map.of("cache_key", "b")));

    assertEquals(2, tier.deleteByPrefix("context:c:case-1:"));

    ArgumentCaptor<PostgrestQuery> select = ArgumentCaptor.forClass(PostgrestQuery.class);
    verify(supabase).select(select.capture());
    assertTrue(select.getValue().toString().contains("cache_key=like.context:c:case-1:*"));
    ArgumentCaptor<PostgrestQuery> delete = ArgumentCaptor.forClass(PostgrestQuery.class);
    verify(supabase).delete(delete.capture());
    assertTrue(
        delete
            .getValue()
            .toString()
            .contains(
                "cache_key=in.(\"context:c:case-1:minimal:aaaa1111\","
                    + "\"context:c:case-1:standard:bbbb2222\")"));
  }

  @Test
  void deleteByPrefix_leavesOtherCasesAlone() {
    when(supabase.select(any(PostgrestQuery.class)))
        .thenReturn(
            List.of(
                Map.of("cache_key", "context:c:case_1:minimal:aaaa1111"),
                Map.of("cache_key", "context:c:caseX1:minimal:cccc3333")));
    when(supabase.delete(any(PostgrestQuery.class)))
        .thenReturn(List.of(Map.of("cache_key", "context:c:case_1:minimal:aaaa1111")));

    assertEquals(1, tier.deleteByPrefix("context:c:case_1:"));

    ArgumentCaptor<PostgrestQuery> select = ArgumentCaptor.forClass(PostgrestQuery.class);
    verify(supabase).select(select.capture());
    assertTrue(select.getValue().toString().contains("cache_key=like.context:c:case\\_1:*"));
    ArgumentCaptor<PostgrestQuery> delete = ArgumentCaptor.forClass(PostgrestQuery.class);
    verify(supabase).delete(delete.capture());
    var filter = delete.getValue().toString();
    assertTrue(filter.contains("case_1:minimal:aaaa1111"));
    assertFalse(filter.contains("caseX1"));
  }

  @Test
  void deleteByPrefix_noMatchesSkipsDelete() {
    when(supabase.select(any(PostgrestQuery.class))).thenReturn(List.of());

    assertEquals(0, tier.deleteByPrefix("context:c:case-9:"));

    verify(supabase, never()).delete(any(PostgrestQuery.class));
  }

  @Test
  void put_failureIsLoggedNotThrown() {
    when(supabase.upsert(anyString(), anyString(), any()))
        .thenThrow(new ServiceConnectionException("down", null));

    assertDoesNotThrow(
        () -> tier.put("key", ContextResponse.builder().caseId("x").build(), CaseStatus.ACTIVE));
  }
}
