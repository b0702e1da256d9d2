package com.mk.fx.context.client.http;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE
}
