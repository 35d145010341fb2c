package com.codeheadsystems.tollgate.server.guard;

import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import java.util.Optional;

/**
 * Outcome of {@link AuthenticationGuard#authenticate(String)}: a principal, or a rejection.
 */
public final class AuthenticationResult {

  /**
   * The only message clients ever see for a rejection, whatever the reason.
   */
  public static final String CLIENT_MESSAGE = "Unauthorized";

  private final TollgatePrincipal principal;
  private final RejectionReason reason;

  private AuthenticationResult(TollgatePrincipal principal, RejectionReason reason) {
    this.principal = principal;
    this.reason = reason;
  }

  static AuthenticationResult authenticated(TollgatePrincipal principal) {
    return new AuthenticationResult(principal, null);
  }

  static AuthenticationResult rejected(RejectionReason reason) {
    return new AuthenticationResult(null, reason);
  }

  public boolean isAuthenticated() {
    return principal != null;
  }

  public Optional<TollgatePrincipal> principal() {
    return Optional.ofNullable(principal);
  }

  public Optional<RejectionReason> rejectionReason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    return isAuthenticated()
        ? "AuthenticationResult[authenticated, subject=" + principal.subjectId() + "]"
        : "AuthenticationResult[rejected, " + reason + "]";
  }
}
