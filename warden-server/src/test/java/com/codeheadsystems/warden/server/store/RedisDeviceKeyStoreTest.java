package com.codeheadsystems.warden.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.warden.server.model.CounterAdvance;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RedisDeviceKeyStoreTest {

  private static final String KEY_ID = "key-abcdefgh-1234";
  private static final String REDIS_KEY = "warden:device:" + KEY_ID;
  private static final Instant CREATED = Instant.ofEpochMilli(1_767_225_600_000L);

  @Mock private RedisCommands<String, String> commands;

  private RedisDeviceKeyStore store;

  @BeforeEach
  void setUp() {
    store = new RedisDeviceKeyStore(commands);
  }

  private static DeviceKey key(long counter) {
    return new DeviceKey(KEY_ID, Platform.IOS, "pk-1", "TEAM.com.example.app", counter, CREATED);
  }

  @Test
  void deviceKey_isNamespaced() {
    assertThat(RedisDeviceKeyStore.deviceKey(KEY_ID)).isEqualTo(REDIS_KEY);
  }

  @Test
  void register_scriptStores_returnsTrue() {
    when(commands.<Long>eval(eq(RedisDeviceKeyStore.REGISTER_SCRIPT), eq(ScriptOutputType.INTEGER),
        any(String[].class), any(String[].class))).thenReturn(1L);

    assertThat(store.register(key(0))).isTrue();
  }

  @Test
  void register_existing_returnsFalse() {
    when(commands.<Long>eval(eq(RedisDeviceKeyStore.REGISTER_SCRIPT), eq(ScriptOutputType.INTEGER),
        any(String[].class), any(String[].class))).thenReturn(0L);

    assertThat(store.register(key(0))).isFalse();
  }

  @Test
  void replace_runsReplaceScript() {
    store.replace(key(3));

    verify(commands).eval(eq(RedisDeviceKeyStore.REPLACE_SCRIPT), eq(ScriptOutputType.INTEGER),
        any(String[].class), any(String[].class));
  }

  @Test
  void get_readsHash() {
    when(commands.hgetall(REDIS_KEY)).thenReturn(Map.of(
        RedisDeviceKeyStore.FIELD_PLATFORM, "IOS",
        RedisDeviceKeyStore.FIELD_PUBLIC_KEY, "pk-1",
        RedisDeviceKeyStore.FIELD_BOUND_IDENTIFIER, "TEAM.com.example.app",
        RedisDeviceKeyStore.FIELD_COUNTER, "42",
        RedisDeviceKeyStore.FIELD_CREATED_AT, Long.toString(CREATED.toEpochMilli())));

    assertThat(store.get(KEY_ID)).contains(key(42));
  }

  @Test
  void get_missing_isEmpty() {
    when(commands.hgetall(REDIS_KEY)).thenReturn(Map.of());

    assertThat(store.get(KEY_ID)).isEmpty();
  }

  @Test
  void get_malformedRecord_throwsStoreException() {
    when(commands.hgetall(REDIS_KEY)).thenReturn(Map.of(RedisDeviceKeyStore.FIELD_PLATFORM, "PALM"));

    assertThatThrownBy(() -> store.get(KEY_ID)).isInstanceOf(StoreException.class);
  }

  @Test
  void advanceCounter_mapsScriptResult() {
    when(commands.<Long>eval(eq(RedisDeviceKeyStore.ADVANCE_SCRIPT), eq(ScriptOutputType.INTEGER),
        any(String[].class), any(String[].class))).thenReturn(1L, 0L, -1L);

    assertThat(store.advanceCounter(KEY_ID, 6)).isEqualTo(CounterAdvance.accepted(6));
    assertThat(store.advanceCounter(KEY_ID, 6).status()).isEqualTo(CounterAdvance.Status.REPLAY_REJECTED);
    assertThat(store.advanceCounter(KEY_ID, 6).status()).isEqualTo(CounterAdvance.Status.NOT_FOUND);
  }

  @Test
  void advanceCounter_redisFailure_throwsStoreException() {
    when(commands.<Long>eval(eq(RedisDeviceKeyStore.ADVANCE_SCRIPT), eq(ScriptOutputType.INTEGER),
        any(String[].class), any(String[].class)))
        .thenThrow(new RedisConnectionException("down"));

    assertThatThrownBy(() -> store.advanceCounter(KEY_ID, 6))
        .isInstanceOf(StoreException.class)
        .hasCauseInstanceOf(RedisConnectionException.class);
  }

  @Test
  void advanceCounter_negativeCounter_neverReachesRedis() {
    assertThatThrownBy(() -> store.advanceCounter(KEY_ID, -1)).isInstanceOf(IllegalArgumentException.class);

    verifyNoInteractions(commands);
  }
}
