package com.codeheadsystems.tollgate.springboot.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;

import com.codeheadsystems.tollgate.server.store.InMemorySessionStore;
import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class SessionStoreHealthIndicatorTest {

  @Mock private SessionStore sessionStore;

  @Test
  void health_reachableStore_up() {
    Health health = new SessionStoreHealthIndicator(new InMemorySessionStore()).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("store", "InMemorySessionStore");
  }

  @Test
  void health_unreachableStore_downWithReason() {
    doThrow(new StoreUnavailableException("Redis PING failed")).when(sessionStore).ping();

    Health health = new SessionStoreHealthIndicator(sessionStore).health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("reason", "Redis PING failed");
  }
}
