package com.codeheadsystems.tollgate.springboot.health;

import com.codeheadsystems.tollgate.server.store.SessionStore;
import com.codeheadsystems.tollgate.server.store.StoreUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class SessionStoreHealthIndicator implements HealthIndicator {

  private final SessionStore sessionStore;

  public SessionStoreHealthIndicator(SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  public Health health() {
    String type = sessionStore.getClass().getSimpleName();
    try {
      sessionStore.ping();
    } catch (StoreUnavailableException e) {
      return Health.down()
          .withDetail("store", type)
          .withDetail("reason", e.getMessage())
          .build();
    }
    return Health.up().withDetail("store", type).build();
  }
}
