package com.codeheadsystems.tollgate.server.auth;

/**
 * Why a token failed verification. Used for logging only; callers outside the guards see a single
 * uniform rejection.
 */
public enum VerificationFailure {
  /** Not a decodable JWT, or missing required claims. */
  MALFORMED,
  /** Signature does not match, or the algorithm is not the one we sign with. */
  BAD_SIGNATURE,
  /** The {@code exp} claim is in the past. */
  EXPIRED,
  /** Well-signed, but a claim has an unacceptable value (issuer, role). */
  INVALID_CLAIM
}
