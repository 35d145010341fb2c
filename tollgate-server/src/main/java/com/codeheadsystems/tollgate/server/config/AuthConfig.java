package com.codeheadsystems.tollgate.server.config;

import java.time.Duration;

/**
 * Immutable process-wide configuration for token issuance and session management.
 * <p>
 * Built once at startup and passed to the components that need it. Values are validated by the
 * consuming components so that a missing signing secret surfaces as a
 * {@link ConfigurationException} from the {@code TokenIssuer} constructor.
 *
 * @param signingSecret     HMAC-SHA256 signing secret (UTF-8 bytes must be at least 32 long)
 * @param issuer            value of the {@code iss} claim
 * @param tokenTtl          token lifetime
 * @param sessionTtl        default session record TTL
 * @param sessionKeyPrefix  prefix for session keys in the session store
 * @param slidingExpiration whether each authenticated request extends the session TTL
 */
public record AuthConfig(
    String signingSecret,
    String issuer,
    Duration tokenTtl,
    Duration sessionTtl,
    String sessionKeyPrefix,
    boolean slidingExpiration) {

  public static final String DEFAULT_ISSUER = "tollgate";
  public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);
  public static final Duration DEFAULT_SESSION_TTL = Duration.ofSeconds(3600);
  public static final String DEFAULT_SESSION_KEY_PREFIX = "session:";

  /**
   * Config with the given secret and every other value defaulted.
   *
   * @param signingSecret the signing secret
   * @return the auth config
   */
  public static AuthConfig withDefaults(String signingSecret) {
    return new AuthConfig(signingSecret, DEFAULT_ISSUER, DEFAULT_TOKEN_TTL, DEFAULT_SESSION_TTL,
        DEFAULT_SESSION_KEY_PREFIX, false);
  }

  /**
   * Copy of this config with a different token lifetime.
   *
   * @param ttl the token ttl
   * @return the auth config
   */
  public AuthConfig withTokenTtl(Duration ttl) {
    return new AuthConfig(signingSecret, issuer, ttl, sessionTtl, sessionKeyPrefix, slidingExpiration);
  }

  /**
   * Copy of this config with sliding expiration switched on or off.
   *
   * @param enabled whether sliding expiration is enabled
   * @return the auth config
   */
  public AuthConfig withSlidingExpiration(boolean enabled) {
    return new AuthConfig(signingSecret, issuer, tokenTtl, sessionTtl, sessionKeyPrefix, enabled);
  }

  @Override
  public String toString() {
    // The secret never appears in logs.
    return "AuthConfig[issuer=" + issuer + ", tokenTtl=" + tokenTtl + ", sessionTtl=" + sessionTtl
        + ", sessionKeyPrefix=" + sessionKeyPrefix + ", slidingExpiration=" + slidingExpiration + "]";
  }
}
