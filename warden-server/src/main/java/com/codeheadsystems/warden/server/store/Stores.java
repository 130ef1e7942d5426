package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.config.StorageBackend;
import java.util.function.BooleanSupplier;

/**
 * The pair of stores produced by {@link StoreFactory}, with the backend's lifecycle hooks.
 *
 * @param backend        which backend the stores use
 * @param challengeStore the challenge store
 * @param deviceKeyStore the device key store
 * @param healthProbe    returns true when the backend answers
 * @param closer         releases backend connections
 */
public record Stores(
    StorageBackend backend,
    ChallengeStore challengeStore,
    DeviceKeyStore deviceKeyStore,
    BooleanSupplier healthProbe,
    Runnable closer) implements AutoCloseable {

  public boolean isHealthy() {
    return healthProbe.getAsBoolean();
  }

  @Override
  public void close() {
    closer.run();
  }
}
