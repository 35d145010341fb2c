package com.codeheadsystems.tollgate.server.model;

import java.security.Principal;
import java.util.Optional;

/**
 * The identity resolved for one authenticated request. Built from verified token claims; never
 * persisted.
 *
 * @param subjectId   user id from the {@code sub} claim
 * @param email       email from the {@code email} claim
 * @param displayName display name from the {@code name} claim, may be null
 * @param role        role from the {@code role} claim, may be null
 * @param tokenId     the {@code jti} of the token that produced this principal
 */
public record TollgatePrincipal(String subjectId, String email, String displayName, Role role,
                                String tokenId) implements Principal {

  @Override
  public String getName() {
    return subjectId;
  }

  /**
   * Role as an optional.
   *
   * @return the role
   */
  public Optional<Role> roleOptional() {
    return Optional.ofNullable(role);
  }
}
