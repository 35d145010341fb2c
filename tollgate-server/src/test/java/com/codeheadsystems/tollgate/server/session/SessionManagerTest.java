package com.codeheadsystems.tollgate.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tollgate.server.config.AuthConfig;
import com.codeheadsystems.tollgate.server.model.Role;
import com.codeheadsystems.tollgate.server.store.InMemorySessionStore;
import com.codeheadsystems.tollgate.server.store.SessionData;
import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import com.codeheadsystems.tollgate.server.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionManagerTest {

  private static final String SECRET = "test-secret-must-be-at-least-32-bytes!";
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final SessionData DATA =
      new SessionData("u1", "alice@example.com", Role.USER, START);

  @Mock private SessionStore failingStore;

  private MutableClock clock;
  private InMemorySessionStore store;
  private SessionManager sessionManager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemorySessionStore(clock);
    sessionManager = new SessionManager(store, AuthConfig.withDefaults(SECRET));
  }

  @Test
  void createThenGet_returnsSameData() {
    sessionManager.create("jti-1", DATA);

    assertThat(sessionManager.exists("jti-1")).isTrue();
    assertThat(sessionManager.get("jti-1")).contains(DATA);
  }

  @Test
  void create_storesJsonUnderPrefixedKey() {
    sessionManager.create("jti-1", DATA);

    assertThat(store.get("session:jti-1")).hasValueSatisfying(json -> assertThat(json)
        .contains("\"userId\":\"u1\"")
        .contains("\"email\":\"alice@example.com\"")
        .contains("\"role\":\"USER\"")
        .contains("\"createdAt\":\"2024-01-01T00:00:00Z\""));
    assertThat(sessionManager.key("jti-1")).isEqualTo("session:jti-1");
  }

  @Test
  void create_withoutRole_omitsRoleField() {
    sessionManager.create("jti-1", new SessionData("u1", "alice@example.com", null, START));

    assertThat(store.get("session:jti-1")).hasValueSatisfying(json ->
        assertThat(json).doesNotContain("role"));
    assertThat(sessionManager.get("jti-1")).hasValueSatisfying(d -> assertThat(d.role()).isNull());
  }

  @Test
  void create_customPrefix_usesIt() {
    AuthConfig config = new AuthConfig(SECRET, "tollgate", Duration.ofHours(1),
        Duration.ofHours(1), "auth:", false);
    SessionManager prefixed = new SessionManager(store, config);

    prefixed.create("jti-1", DATA);

    assertThat(store.exists("auth:jti-1")).isTrue();
    assertThat(store.exists("session:jti-1")).isFalse();
  }

  @Test
  void exists_unknownOrBlank_returnsFalse() {
    assertThat(sessionManager.exists("nope")).isFalse();
    assertThat(sessionManager.exists("")).isFalse();
    assertThat(sessionManager.exists(null)).isFalse();
  }

  @Test
  void session_expiresAfterDefaultTtl() {
    sessionManager.create("jti-1", DATA);

    clock.advance(Duration.ofSeconds(3599));
    assertThat(sessionManager.exists("jti-1")).isTrue();
    clock.advance(Duration.ofSeconds(1));
    assertThat(sessionManager.exists("jti-1")).isFalse();
  }

  @Test
  void create_explicitTtl_isHonoured() {
    sessionManager.create("jti-1", DATA, Duration.ofSeconds(10));

    clock.advance(Duration.ofSeconds(11));
    assertThat(sessionManager.exists("jti-1")).isFalse();
  }

  @Test
  void create_nonPositiveTtl_fallsBackToDefault() {
    sessionManager.create("jti-1", DATA, Duration.ZERO);
    sessionManager.create("jti-2", DATA, Duration.ofSeconds(-5));

    clock.advance(Duration.ofSeconds(60));
    assertThat(sessionManager.exists("jti-1")).isTrue();
    assertThat(sessionManager.exists("jti-2")).isTrue();
  }

  @Test
  void get_corruptValue_returnsEmpty() {
    store.put("session:bad", "{not json", Duration.ofSeconds(60));
    store.put("session:nouser", "{\"email\":\"alice@example.com\"}", Duration.ofSeconds(60));

    assertThat(sessionManager.get("bad")).isEmpty();
    assertThat(sessionManager.get("nouser")).isEmpty();
  }

  @Test
  void get_unknownFields_areIgnored() {
    store.put("session:jti-1",
        "{\"userId\":\"u1\",\"email\":\"a@example.com\",\"extra\":true}", Duration.ofSeconds(60));

    assertThat(sessionManager.get("jti-1"))
        .hasValueSatisfying(d -> assertThat(d.userId()).isEqualTo("u1"));
  }

  @Test
  void delete_twice_isIdempotent() {
    sessionManager.create("jti-1", DATA);

    sessionManager.delete("jti-1");
    assertThatCode(() -> sessionManager.delete("jti-1")).doesNotThrowAnyException();
    assertThat(sessionManager.exists("jti-1")).isFalse();
    assertThat(sessionManager.get("jti-1")).isEmpty();
  }

  @Test
  void refresh_extendsTtlWithoutChangingValue() {
    sessionManager.create("jti-1", DATA, Duration.ofSeconds(10));
    clock.advance(Duration.ofSeconds(5));

    assertThat(sessionManager.refresh("jti-1", Duration.ofSeconds(30))).isTrue();
    clock.advance(Duration.ofSeconds(20));
    assertThat(sessionManager.get("jti-1")).contains(DATA);
  }

  @Test
  void refresh_missingSession_returnsFalse() {
    assertThat(sessionManager.refresh("nope")).isFalse();
  }

  @Test
  void blankTokenId_isRejectedForWrites() {
    assertThatThrownBy(() -> sessionManager.create(" ", DATA))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> sessionManager.delete(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void storeFailure_propagates() {
    when(failingStore.exists(anyString())).thenThrow(new StoreUnavailableException("down"));
    SessionManager failing = new SessionManager(failingStore, AuthConfig.withDefaults(SECRET));

    assertThatThrownBy(() -> failing.exists("jti-1"))
        .isInstanceOf(StoreUnavailableException.class);
  }
}
