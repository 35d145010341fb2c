package com.codeheadsystems.tollgate.server.auth;

import java.time.Instant;

/**
 * A freshly signed token together with the values callers need to create its session.
 *
 * @param token     compact signed JWT
 * @param tokenId   the {@code jti} claim
 * @param issuedAt  the {@code iat} claim
 * @param expiresAt the {@code exp} claim
 */
public record IssuedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[tokenId=" + tokenId + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
  }
}
