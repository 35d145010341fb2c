package com.codeheadsystems.tollgate.springboot.config;

import com.codeheadsystems.tollgate.server.auth.PasswordHasher;
import com.codeheadsystems.tollgate.server.auth.TokenIssuer;
import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.guard.AuthenticationGuard;
import com.codeheadsystems.tollgate.server.guard.AuthorizationGuard;
import com.codeheadsystems.tollgate.server.manager.TollgateAuthManager;
import com.codeheadsystems.tollgate.server.session.SessionManager;
import com.codeheadsystems.tollgate.server.store.CredentialStore;
import com.codeheadsystems.tollgate.server.store.InMemoryCredentialStore;
import com.codeheadsystems.tollgate.server.store.InMemorySessionStore;
import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.springboot.security.BCryptPasswordHasher;
import com.codeheadsystems.tollgate.springboot.store.RedisSessionStore;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Registers the tollgate components. Every bean backs off when the application defines its own.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(TollgateProperties.class)
public class TollgateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TollgateAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Source of token ids. Override this bean to supply a custom implementation:
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() throws NoSuchAlgorithmException {
   *     return SecureRandom.getInstanceStrong();
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthConfig authConfig(TollgateProperties props) {
    AuthConfig config = props.toAuthConfig();
    log.info("Tollgate configured: {}", config);
    return config;
  }

  /**
   * Redis when Spring Boot has configured a {@link StringRedisTemplate}, otherwise an in-memory
   * store that loses every session on restart.
   */
  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore(ObjectProvider<StringRedisTemplate> redisTemplate) {
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (template != null) {
      log.info("Using Redis session store");
      return new RedisSessionStore(template);
    }
    log.warn("Using in-memory session store. All sessions will be lost on restart and are not "
        + "shared between instances. Do not use in production.");
    return new InMemorySessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialStore credentialStore() {
    return new InMemoryCredentialStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher() {
    return new BCryptPasswordHasher();
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenIssuer tokenIssuer(AuthConfig authConfig, SecureRandom secureRandom, Clock clock) {
    return new TokenIssuer(authConfig, secureRandom, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(SessionStore sessionStore, AuthConfig authConfig) {
    return new SessionManager(sessionStore, authConfig);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthenticationGuard authenticationGuard(TokenIssuer tokenIssuer, SessionManager sessionManager,
                                                 AuthConfig authConfig, Clock clock) {
    return new AuthenticationGuard(tokenIssuer, sessionManager, authConfig, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthorizationGuard authorizationGuard(AuthenticationGuard authenticationGuard) {
    return new AuthorizationGuard(authenticationGuard);
  }

  @Bean
  @ConditionalOnMissingBean
  public TollgateAuthManager tollgateAuthManager(CredentialStore credentialStore,
                                                 PasswordHasher passwordHasher,
                                                 TokenIssuer tokenIssuer,
                                                 SessionManager sessionManager,
                                                 Clock clock) {
    return new TollgateAuthManager(credentialStore, passwordHasher, tokenIssuer, sessionManager, clock);
  }
}
