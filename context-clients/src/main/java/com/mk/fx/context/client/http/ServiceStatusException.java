package com.mk.fx.context.client.http;

import lombok.Getter;

/** The service answered with a non-2xx status. */
@Getter
public class ServiceStatusException extends ServiceClientException {

  private final int statusCode;
  private final String responseBody;

  public ServiceStatusException(int statusCode, String message, String responseBody) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }
}
