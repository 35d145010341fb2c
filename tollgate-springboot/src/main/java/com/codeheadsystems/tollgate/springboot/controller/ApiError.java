package com.codeheadsystems.tollgate.springboot.controller;

import com.codeheadsystems.tollgate.server.guard.AuthenticationResult;
import com.codeheadsystems.tollgate.server.guard.AuthorizationGuard;

/**
 * JSON error body: {@code {"error":"UNAUTHORIZED","message":"Unauthorized"}}.
 *
 * @param error   machine-readable error code
 * @param message human-readable message
 */
public record ApiError(String error, String message) {

  public static ApiError unauthorized() {
    return unauthorized(AuthenticationResult.CLIENT_MESSAGE);
  }

  public static ApiError unauthorized(String message) {
    return new ApiError("UNAUTHORIZED", message);
  }

  public static ApiError forbidden() {
    return new ApiError("FORBIDDEN", AuthorizationGuard.CLIENT_MESSAGE);
  }
}
