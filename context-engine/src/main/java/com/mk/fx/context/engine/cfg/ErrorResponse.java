package com.mk.fx.context.engine.cfg;

import java.time.Instant;

/**
 * Body of every 4xx/5xx answer of the API.
 *
 * @param error short error category, for example {@code Invalid Argument}
 * @param details what was wrong with the request or what failed
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String error, String details, Instant timestamp) {

  public ErrorResponse(String error, String details) {
    this(error, details, Instant.now());
  }
}
