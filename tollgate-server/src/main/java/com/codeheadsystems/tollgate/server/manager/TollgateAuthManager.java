package com.codeheadsystems.tollgate.server.manager;

import com.codeheadsystems.tollgate.server.auth.IssuedToken;
import com.codeheadsystems.tollgate.server.auth.PasswordHasher;
import com.codeheadsystems.tollgate.server.auth.TokenIssuer;
import com.codeheadsystems.tollgate.server.model.LoginResult;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import com.codeheadsystems.tollgate.server.model.UserRecord;
import com.codeheadsystems.tollgate.server.session.SessionManager;
import com.codeheadsystems.tollgate.server.store.CredentialStore;
import com.codeheadsystems.tollgate.server.store.SessionData;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic login and logout.
 * <p>
 * Framework adapters stay thin wrappers that translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for missing email or password (HTTP 400)</li>
 *   <li>{@link SecurityException} for bad credentials or an inactive account (HTTP 401)</li>
 *   <li>{@link com.codeheadsystems.tollgate.server.store.StoreUnavailableException} when the
 *       session cannot be stored (HTTP 503)</li>
 * </ul>
 */
public class TollgateAuthManager {

  private static final Logger log = LoggerFactory.getLogger(TollgateAuthManager.class);

  public static final String INVALID_CREDENTIALS = "Invalid email or password";
  public static final String ACCOUNT_INACTIVE = "Account is inactive";

  private static final String DUMMY_PASSWORD = "tollgate-unknown-user";

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;
  private final TokenIssuer tokenIssuer;
  private final SessionManager sessionManager;
  private final Clock clock;
  private final String dummyDigest;

  /**
   * Instantiates a new Tollgate auth manager.
   *
   * @param credentialStore the credential store
   * @param passwordHasher  the password hasher
   * @param tokenIssuer     the token issuer
   * @param sessionManager  the session manager
   * @param clock           clock used for session timestamps and TTLs
   */
  public TollgateAuthManager(CredentialStore credentialStore, PasswordHasher passwordHasher,
                             TokenIssuer tokenIssuer, SessionManager sessionManager, Clock clock) {
    this.credentialStore = credentialStore;
    this.passwordHasher = passwordHasher;
    this.tokenIssuer = tokenIssuer;
    this.sessionManager = sessionManager;
    this.clock = clock;
    // Unknown emails still pay for one hash comparison so response time does not reveal them.
    this.dummyDigest = passwordHasher.hash(DUMMY_PASSWORD);
  }

  /**
   * Verifies credentials, issues a token and opens its session.
   *
   * @param email    the login email
   * @param password the plaintext password
   * @return the user view and the access token
   * @throws SecurityException if the credentials are wrong or the account is inactive
   */
  public LoginResult login(String email, String password) {
    if (email == null || email.isBlank() || password == null || password.isEmpty()) {
      throw new IllegalArgumentException("email and password are required");
    }
    Optional<UserRecord> found = credentialStore.findByEmail(email.trim());
    if (found.isEmpty()) {
      passwordHasher.verify(password, dummyDigest);
      log.debug("login rejected: unknown email");
      throw new SecurityException(INVALID_CREDENTIALS);
    }
    UserRecord user = found.get();
    if (!passwordHasher.verify(password, user.passwordDigest())) {
      log.debug("login rejected: bad password for user={}", user.id());
      throw new SecurityException(INVALID_CREDENTIALS);
    }
    if (!user.active()) {
      log.info("login rejected: inactive account user={}", user.id());
      throw new SecurityException(ACCOUNT_INACTIVE);
    }

    IssuedToken issued = tokenIssuer.issue(user.id(), user.email(), user.displayName(), user.role());
    Instant now = clock.instant();
    Duration sessionTtl = Duration.between(now, issued.expiresAt());
    sessionManager.create(issued.tokenId(),
        new SessionData(user.id(), user.email(), user.role(), now),
        sessionTtl);
    log.info("login user={} jti={}", user.id(), issued.tokenId());
    return new LoginResult(user.toView(), issued.token(), issued.tokenId());
  }

  /**
   * Revokes the session behind the principal's token. Calling it twice is harmless.
   *
   * @param principal the authenticated principal
   */
  public void logout(TollgatePrincipal principal) {
    if (principal == null || principal.tokenId() == null || principal.tokenId().isBlank()) {
      throw new IllegalArgumentException("An authenticated principal with a token id is required");
    }
    sessionManager.delete(principal.tokenId());
    log.info("logout user={} jti={}", principal.subjectId(), principal.tokenId());
  }
}
