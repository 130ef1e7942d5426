package com.codeheadsystems.warden.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.server.store.Stores;

/**
 * Health check that verifies the attestation storage backend answers.
 */
public class StorageHealthCheck extends HealthCheck {

  private final Stores stores;

  /**
   * Instantiates a new storage health check.
   *
   * @param stores the stores
   */
  public StorageHealthCheck(Stores stores) {
    this.stores = stores;
  }

  @Override
  protected Result check() {
    if (!stores.isHealthy()) {
      return Result.unhealthy("%s storage backend is not reachable", stores.backend());
    }
    return Result.healthy("backend=%s", stores.backend());
  }
}
