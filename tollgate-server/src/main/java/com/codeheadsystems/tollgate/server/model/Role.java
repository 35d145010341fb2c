package com.codeheadsystems.tollgate.server.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of roles a user may hold. Carried in the {@code role} token claim and in session
 * records by {@link #name()}.
 */
public enum Role {
  USER,
  ADMIN,
  MODERATOR,
  MANAGER;

  /**
   * Parses a role claim value, ignoring case.
   *
   * @param value the claim value, may be null
   * @return the role, or empty if the value is null, blank or not a known role
   */
  public static Optional<Role> fromClaim(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Role.valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
