package com.codeheadsystems.tollgate.server.store;

import com.codeheadsystems.tollgate.server.model.UserRecord;
import java.util.Optional;

/**
 * Lookup of user records for login.
 * <p>
 * Implementations must be thread-safe. Typical production implementations back
 * this with a relational database.
 */
public interface CredentialStore {

  /**
   * Finds a user by login email, ignoring case.
   *
   * @param email the email
   * @return the user, or empty if no user has that email
   */
  Optional<UserRecord> findByEmail(String email);

  /**
   * Stores or replaces a user record, keyed by email.
   *
   * @param user the user
   */
  void save(UserRecord user);
}
