package com.codeheadsystems.tollgate.server.store;

import com.codeheadsystems.tollgate.server.model.UserRecord;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All users are lost on server restart. Suitable for development and
 * integration testing only; replace with a database-backed implementation for production.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, UserRecord> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore: users will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public Optional<UserRecord> findByEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(store.get(normalize(email)));
  }

  @Override
  public void save(UserRecord user) {
    if (user == null || user.email() == null) {
      throw new IllegalArgumentException("user and user email must not be null");
    }
    store.put(normalize(user.email()), user);
    log.debug("Stored user id={}", user.id());
  }

  private static String normalize(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
