package com.mk.fx.context.client.supabase;

import com.mk.fx.context.client.http.JsonUtil;
import com.mk.fx.context.client.http.Request;
import com.mk.fx.context.client.http.ServiceHttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Table access to Supabase through its PostgREST endpoint ({@code /rest/v1/{table}}). The target
 * schema is selected per call with the {@code Accept-Profile} and {@code Content-Profile}
 * headers.
 */
@Slf4j
public class SupabaseRestClient implements AutoCloseable {

  private static final String REST_PREFIX = "/rest/v1/";

  private final ServiceHttpClient http;

  public SupabaseRestClient(String url, String apiKey, Duration timeout) {
    this(
        new ServiceHttpClient(
            url, timeout, timeout, Map.of("apikey", apiKey, "Authorization", "Bearer " + apiKey)));
  }

  SupabaseRestClient(ServiceHttpClient http) {
    this.http = http;
  }

  /** Rows matching the query, possibly none. */
  public List<Map<String, Object>> select(PostgrestQuery query) {
    var request = Request.get(REST_PREFIX + query.getTable());
    query.toReadParams().forEach(request::withQuery);
    request.withHeader("Accept-Profile", query.getSchema());

    log.debug("Supabase select {}", query);
    return JsonUtil.toRows(http.executeChecked(request).getBody());
  }

  public Optional<Map<String, Object>> selectOne(PostgrestQuery query) {
    return select(query.single()).stream().findFirst();
  }

  /** Inserts the row or merges it into the existing row with the same primary key. */
  public List<Map<String, Object>> upsert(String schema, String table, Object row) {
    var request =
        Request.post(REST_PREFIX + table, row)
            .withHeader("Content-Profile", schema)
            .withHeader("Prefer", "resolution=merge-duplicates,return=representation");

    log.debug("Supabase upsert into {}.{}", schema, table);
    return JsonUtil.toRows(http.executeChecked(request).getBody());
  }

  /**
   * Deletes the rows matching the query's filters.
   *
   * @return the deleted rows
   */
  public List<Map<String, Object>> delete(PostgrestQuery query) {
    if (query.getFilters().isEmpty()) {
      throw new IllegalArgumentException("Refusing unfiltered delete on " + query.getTable());
    }
    var request = Request.delete(REST_PREFIX + query.getTable());
    query.getFilters().forEach(request::withQuery);
    request
        .withHeader("Content-Profile", query.getSchema())
        .withHeader("Prefer", "return=representation");

    log.debug("Supabase delete {}", query);
    return JsonUtil.toRows(http.executeChecked(request).getBody());
  }

  public String getUrl() {
    return http.getBaseUrl();
  }

  @Override
  public void close() {
    http.close();
  }
}
