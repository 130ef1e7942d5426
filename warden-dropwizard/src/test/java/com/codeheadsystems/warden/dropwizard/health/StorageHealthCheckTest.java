package com.codeheadsystems.warden.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.server.config.StorageBackend;
import com.codeheadsystems.warden.server.store.InMemoryChallengeStore;
import com.codeheadsystems.warden.server.store.InMemoryDeviceKeyStore;
import com.codeheadsystems.warden.server.store.Stores;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class StorageHealthCheckTest {

  private static Stores stores(boolean healthy) {
    return new Stores(StorageBackend.REDIS, new InMemoryChallengeStore(Duration.ofMinutes(5)),
        new InMemoryDeviceKeyStore(), () -> healthy, () -> { });
  }

  @Test
  void reachableBackend_healthy() {
    HealthCheck.Result result = new StorageHealthCheck(stores(true)).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("REDIS");
  }

  @Test
  void unreachableBackend_unhealthy() {
    HealthCheck.Result result = new StorageHealthCheck(stores(false)).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("not reachable");
  }
}
