package com.mk.fx.context.engine.resource;

import com.mk.fx.context.engine.cfg.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/** Builds the response entities of the controllers and the exception handler. */
@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String details) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, details));
  }

  public <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok(body);
  }

  /** 503, used by health endpoints that could not evaluate their dependency. */
  public <T> ResponseEntity<T> unavailable(T body) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
