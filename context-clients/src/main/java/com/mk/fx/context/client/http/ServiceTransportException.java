package com.mk.fx.context.client.http;

/** The request never produced an HTTP response. */
public class ServiceTransportException extends ServiceClientException {

  public ServiceTransportException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether repeating the same request may succeed. */
  public boolean isRetryable() {
    return false;
  }
}
