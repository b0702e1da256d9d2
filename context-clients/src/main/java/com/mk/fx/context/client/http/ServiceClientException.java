package com.mk.fx.context.client.http;

/** Base class for failures raised while talking to a downstream service. */
public class ServiceClientException extends RuntimeException {

  public ServiceClientException(String message) {
    super(message);
  }

  public ServiceClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
