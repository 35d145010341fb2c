package com.codeheadsystems.tollgate.server.guard;

import com.codeheadsystems.tollgate.server.model.RoleRequirement;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Role check that runs after authentication. Constructed from an {@link AuthenticationGuard} so
 * that it cannot be wired in front of one.
 */
public class AuthorizationGuard {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationGuard.class);

  /**
   * The only message clients see when a role check fails.
   */
  public static final String CLIENT_MESSAGE = "Forbidden";

  private final AuthenticationGuard authenticationGuard;

  /**
   * Instantiates a new Authorization guard.
   *
   * @param authenticationGuard the authentication guard this guard runs behind
   */
  public AuthorizationGuard(AuthenticationGuard authenticationGuard) {
    this.authenticationGuard = Objects.requireNonNull(authenticationGuard, "authenticationGuard");
  }

  /**
   * Decides whether an authenticated principal satisfies a role requirement. An unrestricted
   * requirement allows anyone who got past authentication; otherwise a missing principal or a
   * principal without a role is denied.
   *
   * @param principal   the principal, may be null
   * @param requirement the requirement, null means unrestricted
   * @return true if allowed
   */
  public boolean isAuthorized(TollgatePrincipal principal, RoleRequirement requirement) {
    if (requirement == null || !requirement.isRestricted()) {
      return true;
    }
    if (principal == null) {
      return false;
    }
    boolean allowed = requirement.permits(principal.role());
    if (!allowed) {
      log.debug("Denied subject={} role={} requirement={}",
          principal.subjectId(), principal.role(), requirement);
    }
    return allowed;
  }

  /**
   * Runs authentication then authorization for one request.
   *
   * @param authorizationHeader the raw header value, may be null
   * @param requirement         the route's role requirement
   * @return the access decision
   */
  public AccessDecision check(String authorizationHeader, RoleRequirement requirement) {
    AuthenticationResult result = authenticationGuard.authenticate(authorizationHeader);
    if (!result.isAuthenticated()) {
      return AccessDecision.unauthenticated(result.rejectionReason().orElseThrow());
    }
    TollgatePrincipal principal = result.principal().orElseThrow();
    return isAuthorized(principal, requirement)
        ? AccessDecision.granted(principal)
        : AccessDecision.forbidden(principal);
  }
}
