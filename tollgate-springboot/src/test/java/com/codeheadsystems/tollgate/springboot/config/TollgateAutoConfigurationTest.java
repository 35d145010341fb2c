package com.codeheadsystems.tollgate.springboot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.codeheadsystems.tollgate.server.auth.PasswordHasher;
import com.codeheadsystems.tollgate.server.auth.TokenIssuer;
import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.config.ConfigurationException;
import com.codeheadsystems.tollgate.server.guard.AuthorizationGuard;
import com.codeheadsystems.tollgate.server.manager.TollgateAuthManager;
import com.codeheadsystems.tollgate.server.store.InMemorySessionStore;
import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.springboot.security.BCryptPasswordHasher;
import com.codeheadsystems.tollgate.springboot.store.RedisSessionStore;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.core.StringRedisTemplate;

class TollgateAutoConfigurationTest {

  private static final String SECRET = "tollgate.jwt-secret=auto-configuration-test-secret-of-32-bytes";

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TollgateAutoConfiguration.class));

  @Test
  void defaults_registerEveryComponentWithInMemoryStore() {
    runner.withPropertyValues(SECRET).run(context -> {
      assertThat(context).hasNotFailed();
      assertThat(context).hasSingleBean(TokenIssuer.class);
      assertThat(context).hasSingleBean(AuthorizationGuard.class);
      assertThat(context).hasSingleBean(TollgateAuthManager.class);
      assertThat(context).getBean(SessionStore.class).isInstanceOf(InMemorySessionStore.class);
      assertThat(context).getBean(PasswordHasher.class).isInstanceOf(BCryptPasswordHasher.class);
    });
  }

  @Test
  void redisTemplatePresent_selectsRedisStore() {
    runner.withPropertyValues(SECRET)
        .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class))
        .run(context -> assertThat(context).getBean(SessionStore.class)
            .isInstanceOf(RedisSessionStore.class));
  }

  @Test
  void userSessionStore_winsOverDefaults() {
    InMemorySessionStore custom = new InMemorySessionStore();
    runner.withPropertyValues(SECRET)
        .withBean(SessionStore.class, () -> custom)
        .run(context -> assertThat(context).getBean(SessionStore.class).isSameAs(custom));
  }

  @Test
  void properties_bindIntoAuthConfig() {
    runner.withPropertyValues(SECRET,
            "tollgate.jwt-issuer=acme",
            "tollgate.token-expiry=30m",
            "tollgate.session-ttl-seconds=600",
            "tollgate.session-key-prefix=auth:",
            "tollgate.sliding-expiration=true")
        .run(context -> {
          AuthConfig config = context.getBean(AuthConfig.class);
          assertThat(config.issuer()).isEqualTo("acme");
          assertThat(config.tokenTtl()).isEqualTo(Duration.ofMinutes(30));
          assertThat(config.sessionTtl()).isEqualTo(Duration.ofSeconds(600));
          assertThat(config.sessionKeyPrefix()).isEqualTo("auth:");
          assertThat(config.slidingExpiration()).isTrue();
        });
  }

  @Test
  void missingSecret_failsStartup() {
    runner.run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
    });
  }

  @Test
  void shortSecret_failsStartup() {
    runner.withPropertyValues("tollgate.jwt-secret=short").run(context -> {
      assertThat(context).hasFailed();
      assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
    });
  }
}
