package com.codeheadsystems.tollgate.server.guard;

/**
 * Internal reason an authentication attempt was rejected. Logged, never shown to the client.
 */
public enum RejectionReason {
  MISSING_CREDENTIALS,
  INVALID_TOKEN,
  MISSING_TOKEN_ID,
  SESSION_NOT_FOUND,
  STORE_UNAVAILABLE
}
