package com.codeheadsystems.tollgate.springboot.controller;

import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the core's exception contract onto HTTP responses for the tollgate endpoints only.
 */
@RestControllerAdvice(assignableTypes = AuthController.class)
public class TollgateExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(TollgateExceptionHandler.class);

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<ApiError> handleSecurity(SecurityException e) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiError.unauthorized(e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ApiError("BAD_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException e) {
    log.warn("Session store unavailable: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiError("SERVICE_UNAVAILABLE", "Service unavailable"));
  }
}
