package com.mk.fx.context.client.http;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Map<String, String> query;
  private Object body;

  public static Request get(String path) {
    return of(HttpMethod.GET, path, null);
  }

  public static Request post(String path, Object body) {
    return of(HttpMethod.POST, path, body);
  }

  public static Request delete(String path) {
    return of(HttpMethod.DELETE, path, null);
  }

  private static Request of(HttpMethod method, String path, Object body) {
    var request = new Request();
    request.setMethod(method);
    request.setPath(path);
    request.setBody(body);
    return request;
  }

  /** Adds a query parameter, skipping null values. */
  public Request withQuery(String name, Object value) {
    if (value == null) {
      return this;
    }
    if (query == null) {
      query = new LinkedHashMap<>();
    }
    query.put(name, String.valueOf(value));
    return this;
  }

  public Request withHeader(String name, String value) {
    if (headers == null) {
      headers = new LinkedHashMap<>();
    }
    headers.put(name, value);
    return this;
  }
}
