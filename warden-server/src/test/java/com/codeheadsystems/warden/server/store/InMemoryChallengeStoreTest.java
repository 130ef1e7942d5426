package com.codeheadsystems.warden.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.server.util.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryChallengeStoreTest {

  private static final Duration TIMEOUT = Duration.ofMinutes(5);

  private MutableClock clock;
  private InMemoryChallengeStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    store = new InMemoryChallengeStore(TIMEOUT, clock);
  }

  @Test
  void generate_returnsBase64UrlNonceOf256Bits() {
    String nonce = store.generate("dev-1");

    assertThat(nonce).hasSize(43).matches("[A-Za-z0-9_-]+");
  }

  @Test
  void generate_blankIdentifier_throws() {
    assertThatThrownBy(() -> store.generate(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.generate(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void validate_isSingleUse() {
    String nonce = store.generate("dev-1");

    assertThat(store.validate("dev-1", nonce)).isTrue();
    assertThat(store.validate("dev-1", nonce)).isFalse();
  }

  @Test
  void validate_wrongIdentifier_failsWithoutConsuming() {
    String nonce = store.generate("dev-1");

    assertThat(store.validate("dev-2", nonce)).isFalse();
    assertThat(store.validate("dev-1", nonce)).isTrue();
  }

  @Test
  void validate_unknownOrMalformedNonce_fails() {
    store.generate("dev-1");

    assertThat(store.validate("dev-1", "not-a-nonce")).isFalse();
    assertThat(store.validate("dev-1", null)).isFalse();
    assertThat(store.validate(null, "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA")).isFalse();
    assertThat(store.validate("dev-1", "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA")).isFalse();
  }

  @Test
  void validate_afterExpiry_failsAndReclaims() {
    String nonce = store.generate("dev-1");

    clock.advance(Duration.ofMinutes(6));

    assertThat(store.validate("dev-1", nonce)).isFalse();
    assertThat(store.size()).isZero();
  }

  @Test
  void validate_atExactExpiry_stillValid() {
    String nonce = store.generate("dev-1");

    clock.advance(TIMEOUT);

    assertThat(store.validate("dev-1", nonce)).isTrue();
  }

  @Test
  void generate_multipleOutstandingPerIdentifier() {
    String first = store.generate("dev-1");
    String second = store.generate("dev-1");

    assertThat(first).isNotEqualTo(second);
    assertThat(store.validate("dev-1", second)).isTrue();
    assertThat(store.validate("dev-1", first)).isTrue();
  }

  @Test
  void purgeExpired_removesOnlyExpired() {
    store.generate("dev-1");
    store.generate("dev-2");
    clock.advance(Duration.ofMinutes(3));
    String fresh = store.generate("dev-3");
    clock.advance(Duration.ofMinutes(3));

    assertThat(store.purgeExpired()).isEqualTo(2);
    assertThat(store.size()).isEqualTo(1);
    assertThat(store.validate("dev-3", fresh)).isTrue();
  }

  @Test
  void validate_concurrentCallers_exactlyOneWins() throws Exception {
    String nonce = store.generate("dev-1");
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<Boolean> attempt = () -> {
          start.await();
          return store.validate("dev-1", nonce);
        };
        results.add(executor.submit(attempt));
      }
      start.countDown();

      int wins = 0;
      for (Future<Boolean> result : results) {
        if (result.get()) {
          wins++;
        }
      }
      assertThat(wins).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void generate_atCapacity_refusesNewChallenges() {
    InMemoryChallengeStore capped = new InMemoryChallengeStore(TIMEOUT, 3, clock);
    for (int i = 0; i < 3; i++) {
      capped.generate("attacker");
    }

    assertThatThrownBy(() -> capped.generate("attacker"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Too many outstanding challenges");
    assertThat(capped.size()).isEqualTo(3);
  }

  @Test
  void generate_atCapacity_reclaimsExpiredBeforeRefusing() {
    InMemoryChallengeStore capped = new InMemoryChallengeStore(TIMEOUT, 2, clock);
    capped.generate("dev-1");
    capped.generate("dev-1");
    clock.advance(TIMEOUT.plusSeconds(1));

    String nonce = capped.generate("dev-2");

    assertThat(capped.size()).isEqualTo(1);
    assertThat(capped.validate("dev-2", nonce)).isTrue();
  }

  @Test
  void generate_consumedChallengesFreeCapacity() {
    InMemoryChallengeStore capped = new InMemoryChallengeStore(TIMEOUT, 1, clock);
    String first = capped.generate("dev-1");
    assertThat(capped.validate("dev-1", first)).isTrue();

    assertThat(capped.generate("dev-1")).isNotEqualTo(first);
  }
}
