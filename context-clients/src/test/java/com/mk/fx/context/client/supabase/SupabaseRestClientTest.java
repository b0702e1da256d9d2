package com.mk.fx.context.client.supabase;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.context.client.http.ServiceStatusException;
import com.mk.fx.context.client.http.StubHttpServer;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SupabaseRestClientTest {

  private StubHttpServer server;
  private SupabaseRestClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubHttpServer();
    client = new SupabaseRestClient(server.baseUrl(), "service-key", Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.close();
  }

  @Test
  void selectSendsFiltersProfileAndAuthHeaders() {
    server.reply(
        "/rest/v1/nodes",
        200,
        "[{\"node_id\":\"n1\",\"entity_type\":\"PARTY\",\"properties\":{\"name\":\"Smith\"}}]");

    var rows =
        client.select(
            PostgrestQuery.from("graph", "nodes")
                .eq("case_id", "case-1")
                .in("entity_type", List.of("PARTY", "JUDGE")));

    assertEquals(1, rows.size());
    assertEquals("n1", rows.get(0).get("node_id"));

    var recorded = server.lastRequest();
    var query = URLDecoder.decode(recorded.rawQuery(), StandardCharsets.UTF_8);
    assertTrue(query.contains("select=*"));
    assertTrue(query.contains("case_id=eq.case-1"));
    assertTrue(query.contains("entity_type=in.(\"PARTY\",\"JUDGE\")"));
    assertEquals("graph", recorded.header("Accept-Profile"));
    assertEquals("service-key", recorded.header("apikey"));
    assertEquals("Bearer service-key", recorded.header("Authorization"));
  }

  @Test
  void selectOneLimitsToSingleRow() {
    server.reply("/rest/v1/client_cases", 200, "[]");

    var row = client.selectOne(PostgrestQuery.from("client", "client_cases").eq("id", "case-1"));

    assertTrue(row.isEmpty());
    assertTrue(server.lastRequest().rawQuery().contains("limit=1"));
  }

  @Test
  void upsertMergesDuplicates() {
    server.reply("/rest/v1/cached_contexts", 201, "[{\"cache_key\":\"k\"}]");

    var rows = client.upsert("context", "cached_contexts", Map.of("cache_key", "k"));

    assertEquals(1, rows.size());
    var recorded = server.lastRequest();
    assertEquals("POST", recorded.method());
    assertEquals("context", recorded.header("Content-Profile"));
    assertTrue(recorded.header("Prefer").contains("resolution=merge-duplicates"));
    assertEquals("{\"cache_key\":\"k\"}", recorded.body());
  }

  @Test
  void deleteReturnsDeletedRows() {
    server.reply("/rest/v1/cached_contexts", 200, "[{\"cache_key\":\"a\"},{\"cache_key\":\"b\"}]");

    var deleted =
        client.delete(
            PostgrestQuery.from("context", "cached_contexts").like("cache_key", "context:c:k:*"));

    assertEquals(2, deleted.size());
    var recorded = server.lastRequest();
    assertEquals("DELETE", recorded.method());
    assertEquals("return=representation", recorded.header("Prefer"));
    assertTrue(
        URLDecoder.decode(recorded.rawQuery(), StandardCharsets.UTF_8)
            .contains("cache_key=like.context:c:k:*"));
  }

  @Test
  void unfilteredDeleteIsRefused() {
    assertThrows(
        IllegalArgumentException.class,
        () -> client.delete(PostgrestQuery.from("context", "cached_contexts")));
    assertTrue(server.requests().isEmpty());
  }

  @Test
  void errorStatusPropagates() {
    server.reply("/rest/v1/nodes", 401, "{\"message\":\"JWT expired\"}");

    var ex =
        assertThrows(
            ServiceStatusException.class,
            () -> client.select(PostgrestQuery.from("graph", "nodes").eq("case_id", "c")));
    assertEquals(401, ex.getStatusCode());
  }

  @Test
  void prefixMatchEscapesLikeMetacharacters() {
    server.reply("/rest/v1/cached_contexts", 200, "[]");

    client.select(
        PostgrestQuery.from("context", "cached_contexts")
            .select("cache_key")
            .likePrefix("cache_key", "context:c_1:50%:"));

    assertTrue(
        URLDecoder.decode(server.lastRequest().rawQuery(), StandardCharsets.UTF_8)
            .contains("cache_key=like.context:c\\_1:50\\%:*"));
  }

  @Test
  void inFilterQuotesEmbeddedQuotes() {
    var query = PostgrestQuery.from("graph", "nodes").in("node_id", List.of("a,b", "say \"hi\""));

    assertTrue(query.toString().contains("node_id=in.(\"a,b\",\"say \\\"hi\\\"\")"));
  }
}
