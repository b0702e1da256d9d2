package com.mk.fx.context.client.supabase;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Fluent builder for PostgREST row filters, e.g. {@code
 * PostgrestQuery.from("graph", "nodes").eq("case_id", id).in("entity_type", types)}.
 *
 * <p>One filter per column; a later filter on the same column replaces the earlier one.
 */
@Getter
public final class PostgrestQuery {

  private static final Pattern LIKE_SPECIALS = Pattern.compile("[\\\\%_]");
  private static final Pattern QUOTED_SPECIALS = Pattern.compile("[\\\\\"]");

  private final String schema;
  private final String table;
  private final Map<String, String> filters = new LinkedHashMap<>();
  private String columns = "*";
  private Integer limit;

  private PostgrestQuery(String schema, String table) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
  }

  public static PostgrestQuery from(String schema, String table) {
    return new PostgrestQuery(schema, table);
  }

  public PostgrestQuery select(String columns) {
    this.columns = columns;
    return this;
  }

  public PostgrestQuery eq(String column, Object value) {
    filters.put(column, "eq." + value);
    return this;
  }

  public PostgrestQuery in(String column, Collection<?> values) {
    filters.put(
        column,
        values.stream()
            .map(PostgrestQuery::quote)
            .collect(Collectors.joining(",", "in.(", ")")));
    return this;
  }

  private static String quote(Object value) {
    return "\"" + QUOTED_SPECIALS.matcher(String.valueOf(value)).replaceAll("\\\\$0") + "\"";
  }

  /** Pattern uses {@code *} as the wildcard. */
  public PostgrestQuery like(String column, String pattern) {
    filters.put(column, "like." + pattern);
    return this;
  }

  /**
   * Values starting with {@code prefix}. The LIKE metacharacters {@code %} and {@code _} in the
   * prefix match literally. PostgREST has no escape for {@code *}, so a prefix containing one
   * still matches a superset and callers must check the returned values.
   */
  public PostgrestQuery likePrefix(String column, String prefix) {
    return like(column, LIKE_SPECIALS.matcher(prefix).replaceAll("\\\\$0") + "*");
  }

  public PostgrestQuery gt(String column, Object value) {
    filters.put(column, "gt." + value);
    return this;
  }

  public PostgrestQuery limit(int limit) {
    this.limit = limit;
    return this;
  }

  /** At most one row. */
  public PostgrestQuery single() {
    return limit(1);
  }

  /** Query parameters for a read: column list, filters and limit. */
  Map<String, String> toReadParams() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("select", columns);
    params.putAll(filters);
    if (limit != null) {
      params.put("limit", String.valueOf(limit));
    }
    return params;
  }

  @Override
  public String toString() {
    return schema + "." + table + filters;
  }
}
