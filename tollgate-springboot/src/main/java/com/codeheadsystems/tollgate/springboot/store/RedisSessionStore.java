package com.codeheadsystems.tollgate.springboot.store;

import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link SessionStore} backed by Redis string keys with native TTLs.
 * <p>
 * Every Spring {@link DataAccessException} (connection refused, command timeout) is rethrown as
 * {@link StoreUnavailableException} so the guards can fail closed.
 */
public class RedisSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

  private final StringRedisTemplate redis;

  public RedisSessionStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    call("SET", () -> {
      redis.opsForValue().set(key, value, ttl);
      return null;
    });
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(call("GET", () -> redis.opsForValue().get(key)));
  }

  @Override
  public boolean exists(String key) {
    return Boolean.TRUE.equals(call("EXISTS", () -> redis.hasKey(key)));
  }

  @Override
  public void delete(String key) {
    call("DEL", () -> redis.delete(key));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(call("EXPIRE", () -> redis.expire(key, ttl)));
  }

  @Override
  public void ping() {
    String reply = call("PING", () -> redis.execute((RedisCallback<String>) connection -> connection.ping()));
    if (reply == null) {
      throw new StoreUnavailableException("Redis did not answer PING");
    }
  }

  private <T> T call(String command, Supplier<T> operation) {
    try {
      return operation.get();
    } catch (DataAccessException e) {
      log.debug("Redis {} failed: {}", command, e.getMessage());
      throw new StoreUnavailableException("Redis " + command + " failed", e);
    }
  }
}
