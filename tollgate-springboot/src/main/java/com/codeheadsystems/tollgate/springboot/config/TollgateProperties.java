package com.codeheadsystems.tollgate.springboot.config;

import com.codeheadsystems.tollgate.server.config.AuthConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tollgate")
public class TollgateProperties {

  private String jwtSecret = "";
  private String jwtIssuer = AuthConfig.DEFAULT_ISSUER;
  private Duration tokenExpiry = AuthConfig.DEFAULT_TOKEN_TTL;
  private long sessionTtlSeconds = AuthConfig.DEFAULT_SESSION_TTL.toSeconds();
  private String sessionKeyPrefix = AuthConfig.DEFAULT_SESSION_KEY_PREFIX;
  private boolean slidingExpiration = false;

  public String getJwtSecret() {
    return jwtSecret;
  }

  public void setJwtSecret(String jwtSecret) {
    this.jwtSecret = jwtSecret;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public Duration getTokenExpiry() {
    return tokenExpiry;
  }

  public void setTokenExpiry(Duration tokenExpiry) {
    this.tokenExpiry = tokenExpiry;
  }

  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  public String getSessionKeyPrefix() {
    return sessionKeyPrefix;
  }

  public void setSessionKeyPrefix(String sessionKeyPrefix) {
    this.sessionKeyPrefix = sessionKeyPrefix;
  }

  public boolean isSlidingExpiration() {
    return slidingExpiration;
  }

  public void setSlidingExpiration(boolean slidingExpiration) {
    this.slidingExpiration = slidingExpiration;
  }

  /**
   * Immutable core configuration built from these properties.
   *
   * @return the auth config
   */
  public AuthConfig toAuthConfig() {
    return new AuthConfig(
        jwtSecret,
        jwtIssuer,
        tokenExpiry,
        Duration.ofSeconds(sessionTtlSeconds),
        sessionKeyPrefix,
        slidingExpiration);
  }
}
