package com.mk.fx.context.client.http;

public class ServiceConnectionException extends ServiceTransportException {

  public ServiceConnectionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
