package com.mk.fx.context.client.http;

import java.util.Map;
import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private long responseTimeMs;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
