package com.codeheadsystems.tollgate.server.auth;

import java.util.Optional;

/**
 * Result of {@link TokenIssuer#verify(String)}: either a payload or a failure kind, never both.
 */
public final class TokenVerification {

  private final TokenPayload payload;
  private final VerificationFailure failure;

  private TokenVerification(TokenPayload payload, VerificationFailure failure) {
    this.payload = payload;
    this.failure = failure;
  }

  /**
   * Successful verification.
   *
   * @param payload the verified payload
   * @return the token verification
   */
  public static TokenVerification valid(TokenPayload payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload must not be null");
    }
    return new TokenVerification(payload, null);
  }

  /**
   * Failed verification.
   *
   * @param failure the failure kind
   * @return the token verification
   */
  public static TokenVerification invalid(VerificationFailure failure) {
    if (failure == null) {
      throw new IllegalArgumentException("failure must not be null");
    }
    return new TokenVerification(null, failure);
  }

  public boolean isValid() {
    return payload != null;
  }

  public Optional<TokenPayload> payload() {
    return Optional.ofNullable(payload);
  }

  public Optional<VerificationFailure> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return isValid() ? "TokenVerification[valid, jti=" + payload.tokenId() + "]"
        : "TokenVerification[" + failure + "]";
  }
}
