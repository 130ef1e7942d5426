package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.CounterAdvance;
import com.codeheadsystems.warden.server.model.DeviceKey;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DeviceKeyStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Counter updates run inside {@link ConcurrentHashMap#computeIfPresent}, which serializes
 * writers per key id. All registrations are lost on restart, and the state is not shared with
 * other instances.
 */
public class InMemoryDeviceKeyStore implements DeviceKeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDeviceKeyStore.class);

  private final ConcurrentHashMap<String, DeviceKey> store = new ConcurrentHashMap<>();

  public InMemoryDeviceKeyStore() {
    log.warn("Using InMemoryDeviceKeyStore: device keys will NOT survive restarts "
        + "and are not shared between instances.");
  }

  @Override
  public boolean register(DeviceKey deviceKey) {
    boolean stored = store.putIfAbsent(deviceKey.keyId(), deviceKey) == null;
    log.debug("register(): stored={}", stored);
    return stored;
  }

  @Override
  public void replace(DeviceKey deviceKey) {
    store.put(deviceKey.keyId(), deviceKey);
  }

  @Override
  public Optional<DeviceKey> get(String keyId) {
    return keyId == null ? Optional.empty() : Optional.ofNullable(store.get(keyId));
  }

  @Override
  public CounterAdvance advanceCounter(String keyId, long presentedCounter) {
    if (keyId == null) {
      return CounterAdvance.notFound();
    }
    if (presentedCounter < 0) {
      throw new IllegalArgumentException("Counter must not be negative: " + presentedCounter);
    }
    AtomicReference<CounterAdvance> outcome = new AtomicReference<>(CounterAdvance.notFound());
    store.computeIfPresent(keyId, (id, existing) -> {
      if (presentedCounter > existing.counter()) {
        outcome.set(CounterAdvance.accepted(presentedCounter));
        return existing.withCounter(presentedCounter);
      }
      outcome.set(CounterAdvance.replayRejected());
      return existing;
    });
    return outcome.get();
  }
}
