package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.CounterAdvance;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeviceKeyStore} shared between server instances through Redis.
 * <p>
 * Each key is a hash at {@code warden:device:<keyId>}. Registration and counter advancement are
 * Lua scripts, which Redis runs atomically, so the compare-and-set holds across instances.
 */
public class RedisDeviceKeyStore implements DeviceKeyStore {

  private static final Logger log = LoggerFactory.getLogger(RedisDeviceKeyStore.class);

  static final String KEY_PREFIX = "warden:device:";

  static final String FIELD_PLATFORM = "platform";
  static final String FIELD_PUBLIC_KEY = "publicKeyHandle";
  static final String FIELD_BOUND_IDENTIFIER = "boundIdentifier";
  static final String FIELD_COUNTER = "counter";
  static final String FIELD_CREATED_AT = "createdAt";

  static final String REGISTER_SCRIPT = """
      if redis.call('EXISTS', KEYS[1]) == 1 then
        return 0
      end
      redis.call('HSET', KEYS[1], 'platform', ARGV[1], 'publicKeyHandle', ARGV[2],
        'boundIdentifier', ARGV[3], 'counter', ARGV[4], 'createdAt', ARGV[5])
      return 1
      """;

  static final String REPLACE_SCRIPT = """
      redis.call('DEL', KEYS[1])
      redis.call('HSET', KEYS[1], 'platform', ARGV[1], 'publicKeyHandle', ARGV[2],
        'boundIdentifier', ARGV[3], 'counter', ARGV[4], 'createdAt', ARGV[5])
      return 1
      """;

  // 1 accepted, 0 replay, -1 unknown key. Counters are canonical non-negative decimals, compared
  // by length then digits; tonumber would round values above 2^53.
  static final String ADVANCE_SCRIPT = """
      local current = redis.call('HGET', KEYS[1], 'counter')
      if not current then
        return -1
      end
      local presented = ARGV[1]
      if #presented > #current or (#presented == #current and presented > current) then
        redis.call('HSET', KEYS[1], 'counter', ARGV[1])
        return 1
      end
      return 0
      """;

  private final RedisCommands<String, String> commands;

  public RedisDeviceKeyStore(RedisCommands<String, String> commands) {
    this.commands = commands;
  }

  @Override
  public boolean register(DeviceKey deviceKey) {
    requireNonNegative(deviceKey.counter());
    Long result = evalInteger(REGISTER_SCRIPT, deviceKey.keyId(), fields(deviceKey));
    boolean stored = result != null && result == 1L;
    log.debug("register(): stored={}", stored);
    return stored;
  }

  @Override
  public void replace(DeviceKey deviceKey) {
    requireNonNegative(deviceKey.counter());
    evalInteger(REPLACE_SCRIPT, deviceKey.keyId(), fields(deviceKey));
  }

  @Override
  public Optional<DeviceKey> get(String keyId) {
    if (keyId == null) {
      return Optional.empty();
    }
    Map<String, String> hash;
    try {
      hash = commands.hgetall(deviceKey(keyId));
    } catch (RedisException e) {
      throw new StoreException("Failed to load device key", e);
    }
    if (hash == null || hash.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toDeviceKey(keyId, hash));
  }

  @Override
  public CounterAdvance advanceCounter(String keyId, long presentedCounter) {
    if (keyId == null) {
      return CounterAdvance.notFound();
    }
    requireNonNegative(presentedCounter);
    Long result = evalInteger(ADVANCE_SCRIPT, keyId, Long.toString(presentedCounter));
    if (result == null) {
      throw new StoreException("Counter script returned no result", null);
    }
    if (result == 1L) {
      return CounterAdvance.accepted(presentedCounter);
    }
    if (result == 0L) {
      return CounterAdvance.replayRejected();
    }
    return CounterAdvance.notFound();
  }

  private Long evalInteger(String script, String keyId, String... args) {
    try {
      return commands.eval(script, ScriptOutputType.INTEGER, new String[]{deviceKey(keyId)}, args);
    } catch (RedisException e) {
      throw new StoreException("Device key script failed", e);
    }
  }

  private static String[] fields(DeviceKey deviceKey) {
    return new String[]{
        deviceKey.platform().name(),
        deviceKey.publicKeyHandle(),
        deviceKey.boundIdentifier() == null ? "" : deviceKey.boundIdentifier(),
        Long.toString(deviceKey.counter()),
        Long.toString(deviceKey.createdAt().toEpochMilli())
    };
  }

  private static DeviceKey toDeviceKey(String keyId, Map<String, String> hash) {
    try {
      String boundIdentifier = hash.get(FIELD_BOUND_IDENTIFIER);
      return new DeviceKey(
          keyId,
          Platform.valueOf(hash.get(FIELD_PLATFORM)),
          hash.get(FIELD_PUBLIC_KEY),
          boundIdentifier == null || boundIdentifier.isEmpty() ? null : boundIdentifier,
          Long.parseLong(hash.get(FIELD_COUNTER)),
          Instant.ofEpochMilli(Long.parseLong(hash.get(FIELD_CREATED_AT))));
    } catch (RuntimeException e) {
      throw new StoreException("Malformed device key record", e);
    }
  }

  private static void requireNonNegative(long counter) {
    if (counter < 0) {
      throw new IllegalArgumentException("Counter must not be negative: " + counter);
    }
  }

  static String deviceKey(String keyId) {
    return KEY_PREFIX + keyId;
  }
}
