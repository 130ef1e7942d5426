package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.CounterAdvance;
import com.codeheadsystems.warden.server.model.DeviceKey;
import java.util.Optional;

/**
 * Storage abstraction for attested device keys and their replay counters.
 * <p>
 * Implementations must be thread-safe, and {@link #advanceCounter} must be a single atomic
 * compare-and-set per key id: of several concurrent calls presenting the same counter, at most
 * one is accepted, and the stored counter never decreases.
 */
public interface DeviceKeyStore {

  /**
   * Stores the key if its key id is not registered yet.
   *
   * @param deviceKey the key to register
   * @return true if stored, false if the key id already exists
   * @throws StoreException if the backend is unavailable
   */
  boolean register(DeviceKey deviceKey);

  /**
   * Stores the key, overwriting any existing registration and counter for the key id.
   *
   * @param deviceKey the key to store
   * @throws StoreException if the backend is unavailable
   */
  void replace(DeviceKey deviceKey);

  /**
   * Loads a registered key.
   *
   * @param keyId the key id
   * @return the key, or empty if it was never registered
   * @throws StoreException if the backend is unavailable
   */
  Optional<DeviceKey> get(String keyId);

  /**
   * Stores {@code presentedCounter} if it is strictly greater than the stored counter.
   *
   * @param keyId            the key id
   * @param presentedCounter counter value carried by the assertion
   * @return accepted with the new counter, replay rejected, or not found
   * @throws IllegalArgumentException if the counter is negative
   * @throws StoreException           if the backend is unavailable
   */
  CounterAdvance advanceCounter(String keyId, long presentedCounter);
}
