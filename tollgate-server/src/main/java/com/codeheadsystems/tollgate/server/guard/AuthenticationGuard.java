package com.codeheadsystems.tollgate.server.guard;

import com.codeheadsystems.tollgate.server.auth.TokenIssuer;
import com.codeheadsystems.tollgate.server.auth.TokenPayload;
import com.codeheadsystems.tollgate.server.auth.TokenVerification;
import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import com.codeheadsystems.tollgate.server.session.SessionManager;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@code Authorization} header into a trusted {@link TollgatePrincipal} or a rejection.
 * <p>
 * Steps, stopping at the first failure:
 * <ol>
 *   <li>extract the bearer token</li>
 *   <li>verify signature, issuer and expiry with the {@link TokenIssuer}</li>
 *   <li>require a {@code jti}; a token that cannot be correlated with a session is never trusted</li>
 *   <li>require a live session for that {@code jti}</li>
 *   <li>build the principal from the verified claims</li>
 * </ol>
 * Expired or forged tokens never reach the session store. When the store cannot be reached the
 * request is rejected. Every request runs the full chain; nothing is cached between requests.
 */
public class AuthenticationGuard {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationGuard.class);

  static final String BEARER_SCHEME = "bearer";

  private final TokenIssuer tokenIssuer;
  private final SessionManager sessionManager;
  private final boolean slidingExpiration;
  private final Clock clock;

  /**
   * Instantiates a new Authentication guard.
   *
   * @param tokenIssuer    the token issuer
   * @param sessionManager the session manager
   * @param config         the auth config
   */
  public AuthenticationGuard(TokenIssuer tokenIssuer, SessionManager sessionManager, AuthConfig config) {
    this(tokenIssuer, sessionManager, config, Clock.systemUTC());
  }

  /**
   * Instantiates a new Authentication guard.
   *
   * @param tokenIssuer    the token issuer
   * @param sessionManager the session manager
   * @param config         the auth config
   * @param clock          clock used to cap sliding refreshes at token expiry
   */
  public AuthenticationGuard(TokenIssuer tokenIssuer, SessionManager sessionManager, AuthConfig config,
                             Clock clock) {
    this.tokenIssuer = tokenIssuer;
    this.sessionManager = sessionManager;
    this.slidingExpiration = config.slidingExpiration();
    this.clock = clock;
  }

  /**
   * Authenticates a request from its {@code Authorization} header value.
   *
   * @param authorizationHeader the raw header value, may be null
   * @return the authentication result
   */
  public AuthenticationResult authenticate(String authorizationHeader) {
    Optional<String> token = extractBearerToken(authorizationHeader);
    if (token.isEmpty()) {
      return reject(RejectionReason.MISSING_CREDENTIALS);
    }
    return authenticateToken(token.get());
  }

  private AuthenticationResult authenticateToken(String token) {
    TokenVerification verification = tokenIssuer.verify(token);
    if (!verification.isValid()) {
      log.debug("Token verification failed: {}", verification.failure().orElse(null));
      return reject(RejectionReason.INVALID_TOKEN);
    }
    TokenPayload payload = verification.payload().orElseThrow();
    if (!payload.hasTokenId()) {
      log.debug("Token for subject={} has no jti", payload.subject());
      return reject(RejectionReason.MISSING_TOKEN_ID);
    }

    String tokenId = payload.tokenId();
    boolean live;
    try {
      live = sessionManager.exists(tokenId);
    } catch (StoreUnavailableException e) {
      log.warn("Session store unavailable while checking jti={}: {}", tokenId, e.getMessage());
      return reject(RejectionReason.STORE_UNAVAILABLE);
    } catch (RuntimeException e) {
      log.warn("Session lookup failed for jti={}", tokenId, e);
      return reject(RejectionReason.STORE_UNAVAILABLE);
    }
    if (!live) {
      log.debug("Session jti={} expired or revoked", tokenId);
      return reject(RejectionReason.SESSION_NOT_FOUND);
    }
    if (slidingExpiration) {
      slide(payload);
    }

    return AuthenticationResult.authenticated(new TollgatePrincipal(
        payload.subject(),
        payload.email(),
        payload.displayName(),
        payload.role(),
        tokenId));
  }

  /**
   * Extracts the token from an {@code Authorization: Bearer <token>} header value. The scheme is
   * matched case-insensitively.
   *
   * @param authorizationHeader the header value, may be null
   * @return the token, or empty if the header is missing or not a bearer credential
   */
  public static Optional<String> extractBearerToken(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return Optional.empty();
    }
    String header = authorizationHeader.trim();
    int space = header.indexOf(' ');
    if (space <= 0) {
      return Optional.empty();
    }
    if (!header.substring(0, space).toLowerCase(Locale.ROOT).equals(BEARER_SCHEME)) {
      return Optional.empty();
    }
    String token = header.substring(space + 1).trim();
    if (token.isEmpty() || token.contains(" ")) {
      return Optional.empty();
    }
    return Optional.of(token);
  }

  private void slide(TokenPayload payload) {
    Duration ttl = sessionManager.defaultTtl();
    if (payload.expiresAt() != null) {
      Duration remaining = Duration.between(clock.instant(), payload.expiresAt());
      if (remaining.compareTo(ttl) < 0) {
        ttl = remaining;
      }
    }
    if (ttl.isZero() || ttl.isNegative()) {
      return;
    }
    try {
      sessionManager.refresh(payload.tokenId(), ttl);
    } catch (StoreUnavailableException e) {
      // The session was live a moment ago; the request proceeds and the next one retries.
      log.warn("Unable to refresh session jti={}: {}", payload.tokenId(), e.getMessage());
    }
  }

  private static AuthenticationResult reject(RejectionReason reason) {
    return AuthenticationResult.rejected(reason);
  }
}
