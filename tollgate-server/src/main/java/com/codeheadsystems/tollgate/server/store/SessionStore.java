package com.codeheadsystems.tollgate.server.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value storage with per-key expiry, used as the source of truth for session liveness.
 * <p>
 * Implementations must be thread-safe and must rely on the store's own expiry mechanism rather
 * than background sweeps. Any failure to reach the store (connection refused, timeout) is
 * reported as a {@link StoreUnavailableException}; implementations never answer "absent" for a
 * key they could not look up.
 */
public interface SessionStore {

  /**
   * Stores a value, replacing any existing value and TTL.
   *
   * @param key   the key
   * @param value the value
   * @param ttl   time to live, must be positive
   * @throws StoreUnavailableException if the store cannot be reached
   */
  void put(String key, String value, Duration ttl);

  /**
   * Loads a value.
   *
   * @param key the key
   * @return the value, or empty if absent or expired
   * @throws StoreUnavailableException if the store cannot be reached
   */
  Optional<String> get(String key);

  /**
   * Tests key presence without reading the value.
   *
   * @param key the key
   * @return true if the key exists and has not expired
   * @throws StoreUnavailableException if the store cannot be reached
   */
  boolean exists(String key);

  /**
   * Deletes a key. Deleting a missing key is not an error.
   *
   * @param key the key
   * @throws StoreUnavailableException if the store cannot be reached
   */
  void delete(String key);

  /**
   * Resets the TTL of an existing key without changing its value.
   *
   * @param key the key
   * @param ttl new time to live, must be positive
   * @return true if the key existed
   * @throws StoreUnavailableException if the store cannot be reached
   */
  boolean expire(String key, Duration ttl);

  /**
   * Checks that the store is reachable.
   *
   * @throws StoreUnavailableException if the store cannot be reached
   */
  void ping();
}
