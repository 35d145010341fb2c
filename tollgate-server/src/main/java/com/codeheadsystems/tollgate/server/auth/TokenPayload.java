package com.codeheadsystems.tollgate.server.auth;

import com.codeheadsystems.tollgate.server.model.Role;
import java.time.Instant;

/**
 * Claims of a token whose signature, issuer and expiry have been verified.
 *
 * @param subject     the {@code sub} claim
 * @param email       the {@code email} claim, may be null
 * @param tokenId     the {@code jti} claim, null when the token carries none
 * @param role        the {@code role} claim, may be null
 * @param displayName the {@code name} claim, may be null
 * @param issuedAt    the {@code iat} claim, may be null
 * @param expiresAt   the {@code exp} claim
 */
public record TokenPayload(String subject, String email, String tokenId, Role role,
                           String displayName, Instant issuedAt, Instant expiresAt) {

  /**
   * Whether the payload carries a usable session correlation id.
   *
   * @return true if the token id is present and not blank
   */
  public boolean hasTokenId() {
    return tokenId != null && !tokenId.isBlank();
  }
}
