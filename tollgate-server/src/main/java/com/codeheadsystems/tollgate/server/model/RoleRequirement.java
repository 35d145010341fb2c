package com.codeheadsystems.tollgate.server.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Roles accepted by a protected operation.
 * <p>
 * A requirement is either {@link #unrestricted()} (nothing declared, any authenticated principal
 * passes) or a non-empty set of roles of which the principal needs any one.
 */
public final class RoleRequirement {

  private static final RoleRequirement UNRESTRICTED = new RoleRequirement(Set.of());

  private final Set<Role> roles;

  private RoleRequirement(Set<Role> roles) {
    this.roles = roles;
  }

  /**
   * The requirement used when an operation declares no roles.
   *
   * @return the role requirement
   */
  public static RoleRequirement unrestricted() {
    return UNRESTRICTED;
  }

  /**
   * Requirement satisfied by any of the given roles.
   *
   * @param roles at least one role
   * @return the role requirement
   * @throws IllegalArgumentException if no roles are given
   */
  public static RoleRequirement anyOf(Role... roles) {
    if (roles == null) {
      throw new IllegalArgumentException("A role requirement needs at least one role");
    }
    return anyOf(Arrays.asList(roles));
  }

  /**
   * Requirement satisfied by any of the given roles.
   *
   * @param roles at least one role
   * @return the role requirement
   * @throws IllegalArgumentException if the collection is empty or contains null
   */
  public static RoleRequirement anyOf(Collection<Role> roles) {
    if (roles == null || roles.isEmpty()) {
      throw new IllegalArgumentException("A role requirement needs at least one role");
    }
    if (roles.contains(null)) {
      throw new IllegalArgumentException("A role requirement cannot contain null");
    }
    return new RoleRequirement(Set.copyOf(EnumSet.copyOf(roles)));
  }

  /**
   * Whether roles were declared at all.
   *
   * @return true if at least one role is required
   */
  public boolean isRestricted() {
    return !roles.isEmpty();
  }

  /**
   * Declared roles; empty when unrestricted.
   *
   * @return the roles
   */
  public Set<Role> roles() {
    return roles;
  }

  /**
   * Whether a principal holding {@code role} satisfies this requirement. A null role never
   * satisfies a restricted requirement.
   *
   * @param role the principal's role, may be null
   * @return true if permitted
   */
  public boolean permits(Role role) {
    if (!isRestricted()) {
      return true;
    }
    return role != null && roles.contains(role);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RoleRequirement other && roles.equals(other.roles);
  }

  @Override
  public int hashCode() {
    return roles.hashCode();
  }

  @Override
  public String toString() {
    return isRestricted() ? "RoleRequirement" + roles : "RoleRequirement[unrestricted]";
  }
}
