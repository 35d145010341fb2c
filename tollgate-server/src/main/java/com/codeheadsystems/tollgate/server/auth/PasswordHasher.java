package com.codeheadsystems.tollgate.server.auth;

/**
 * Password hashing collaborator used by the login flow.
 * <p>
 * Implementations must be thread-safe and must compare digests in constant time.
 */
public interface PasswordHasher {

  /**
   * Hashes a plaintext password.
   *
   * @param plaintext the password
   * @return the digest to persist
   */
  String hash(String plaintext);

  /**
   * Checks a plaintext password against a stored digest.
   *
   * @param plaintext the password
   * @param digest    the stored digest
   * @return true if the password matches
   */
  boolean verify(String plaintext, String digest);
}
