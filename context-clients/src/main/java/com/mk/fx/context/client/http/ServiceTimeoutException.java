package com.mk.fx.context.client.http;

public class ServiceTimeoutException extends ServiceTransportException {

  public ServiceTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
