package com.codeheadsystems.tollgate.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired entries are lazily evicted when touched. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    requirePositive(ttl);
    store.put(key, new Entry(value, clock.instant().plus(ttl)));
    log.debug("Stored key={} ttl={}", key, ttl);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(live(key)).map(Entry::value);
  }

  @Override
  public boolean exists(String key) {
    return live(key) != null;
  }

  @Override
  public void delete(String key) {
    store.remove(key);
    log.debug("Deleted key={}", key);
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    requirePositive(ttl);
    Instant now = clock.instant();
    Entry updated = store.computeIfPresent(key, (k, entry) ->
        entry.isExpired(now) ? null : new Entry(entry.value(), now.plus(ttl)));
    return updated != null;
  }

  @Override
  public void ping() {
    // always reachable
  }

  /**
   * Number of entries currently held, including expired entries not yet evicted.
   *
   * @return the size
   */
  public int size() {
    return store.size();
  }

  private Entry live(String key) {
    Entry entry = store.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.isExpired(clock.instant())) {
      store.remove(key, entry);
      return null;
    }
    return entry;
  }

  private static void requirePositive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
  }

  private record Entry(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !expiresAt.isAfter(now);
    }
  }
}
