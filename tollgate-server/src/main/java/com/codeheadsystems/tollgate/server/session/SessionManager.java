package com.codeheadsystems.tollgate.server.session;

import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.store.SessionData;
import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, reads, refreshes and deletes session records keyed by token id.
 * <p>
 * Records live at {@code {prefix}{tokenId}} (default prefix {@code session:}) as JSON
 * {@code {userId, email, role?, createdAt}}. Every operation is one call to the
 * {@link SessionStore}; store failures propagate as {@link StoreUnavailableException}.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final SessionStore sessionStore;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final Duration defaultTtl;

  /**
   * Instantiates a new Session manager with its own JSON mapper.
   *
   * @param sessionStore the session store
   * @param config       the auth config
   */
  public SessionManager(SessionStore sessionStore, AuthConfig config) {
    this(sessionStore, config, defaultObjectMapper());
  }

  /**
   * Instantiates a new Session manager.
   *
   * @param sessionStore the session store
   * @param config       the auth config
   * @param objectMapper mapper used for session values; must handle {@code java.time} types
   */
  public SessionManager(SessionStore sessionStore, AuthConfig config, ObjectMapper objectMapper) {
    this.sessionStore = sessionStore;
    this.objectMapper = objectMapper;
    this.keyPrefix = config.sessionKeyPrefix() == null
        ? AuthConfig.DEFAULT_SESSION_KEY_PREFIX : config.sessionKeyPrefix();
    this.defaultTtl = isPositive(config.sessionTtl())
        ? config.sessionTtl() : AuthConfig.DEFAULT_SESSION_TTL;
  }

  /**
   * Mapper writing ISO-8601 timestamps and tolerating unknown fields.
   *
   * @return the object mapper
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Creates (or overwrites) the session for a token with the default TTL.
   *
   * @param tokenId     the token id
   * @param sessionData the session data
   */
  public void create(String tokenId, SessionData sessionData) {
    create(tokenId, sessionData, defaultTtl);
  }

  /**
   * Creates (or overwrites) the session for a token.
   *
   * @param tokenId     the token id
   * @param sessionData the session data
   * @param ttl         time to live; null or non-positive means the default TTL
   */
  public void create(String tokenId, SessionData sessionData, Duration ttl) {
    requireTokenId(tokenId);
    if (sessionData == null) {
      throw new IllegalArgumentException("sessionData must not be null");
    }
    String value;
    try {
      value = objectMapper.writeValueAsString(sessionData);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize session data", e);
    }
    Duration effectiveTtl = isPositive(ttl) ? ttl : defaultTtl;
    sessionStore.put(key(tokenId), value, effectiveTtl);
    log.debug("Created session jti={} ttl={}", tokenId, effectiveTtl);
  }

  /**
   * Key-presence check used on every authenticated request. Does not read the value.
   *
   * @param tokenId the token id
   * @return true if the session exists
   */
  public boolean exists(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      return false;
    }
    return sessionStore.exists(key(tokenId));
  }

  /**
   * Loads session data. A value that cannot be parsed is treated as absent.
   *
   * @param tokenId the token id
   * @return the session data, or empty if absent or corrupt
   */
  public Optional<SessionData> get(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      return Optional.empty();
    }
    Optional<String> value = sessionStore.get(key(tokenId));
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      SessionData data = objectMapper.readValue(value.get(), SessionData.class);
      if (data == null || data.userId() == null) {
        log.warn("Session jti={} has no user id; treating as absent", tokenId);
        return Optional.empty();
      }
      return Optional.of(data);
    } catch (JsonProcessingException e) {
      log.warn("Session jti={} is corrupt; treating as absent: {}", tokenId, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * Deletes the session. Deleting a missing session is not an error.
   *
   * @param tokenId the token id
   */
  public void delete(String tokenId) {
    requireTokenId(tokenId);
    sessionStore.delete(key(tokenId));
    log.debug("Deleted session jti={}", tokenId);
  }

  /**
   * Extends the session TTL to the default without altering its value.
   *
   * @param tokenId the token id
   * @return true if the session existed
   */
  public boolean refresh(String tokenId) {
    return refresh(tokenId, defaultTtl);
  }

  /**
   * Extends the session TTL without altering its value.
   *
   * @param tokenId the token id
   * @param ttl     new time to live; null or non-positive means the default TTL
   * @return true if the session existed
   */
  public boolean refresh(String tokenId, Duration ttl) {
    requireTokenId(tokenId);
    return sessionStore.expire(key(tokenId), isPositive(ttl) ? ttl : defaultTtl);
  }

  /**
   * Default TTL applied when none is given.
   *
   * @return the default ttl
   */
  public Duration defaultTtl() {
    return defaultTtl;
  }

  String key(String tokenId) {
    return keyPrefix + tokenId;
  }

  private static boolean isPositive(Duration ttl) {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }

  private static void requireTokenId(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
  }
}
