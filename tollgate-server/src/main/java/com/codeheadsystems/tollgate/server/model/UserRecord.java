package com.codeheadsystems.tollgate.server.model;

/**
 * A user as held by the credential store.
 *
 * @param id             opaque user id, becomes the token subject
 * @param email          login email
 * @param passwordDigest digest produced by the configured password hasher
 * @param displayName    display name, may be null
 * @param role           role, may be null
 * @param active         inactive users cannot log in
 */
public record UserRecord(String id, String email, String passwordDigest, String displayName,
                         Role role, boolean active) {

  /**
   * The record without its password digest.
   *
   * @return the user view
   */
  public UserView toView() {
    return new UserView(id, email, displayName, role, active);
  }
}
