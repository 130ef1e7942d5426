package com.codeheadsystems.warden.server.manager;

import static com.codeheadsystems.warden.server.model.VerificationFailure.ATTESTATION_REQUIRED;
import static com.codeheadsystems.warden.server.model.VerificationFailure.INVALID_ASSERTION;
import static com.codeheadsystems.warden.server.model.VerificationFailure.INVALID_ATTESTATION;
import static com.codeheadsystems.warden.server.model.VerificationFailure.KEY_NOT_FOUND;
import static com.codeheadsystems.warden.server.model.VerificationFailure.REPLAY_DETECTED;
import static com.codeheadsystems.warden.server.model.VerificationFailure.UNSUPPORTED_PLATFORM;

import com.codeheadsystems.warden.server.config.AttestationConfig;
import com.codeheadsystems.warden.server.config.ReRegistrationPolicy;
import com.codeheadsystems.warden.server.model.AssertionData;
import com.codeheadsystems.warden.server.model.AttestationData;
import com.codeheadsystems.warden.server.model.AttestedKey;
import com.codeheadsystems.warden.server.model.CounterAdvance;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;
import com.codeheadsystems.warden.server.model.VerificationResult;
import com.codeheadsystems.warden.server.store.ChallengeStore;
import com.codeheadsystems.warden.server.store.DeviceKeyStore;
import com.codeheadsystems.warden.server.store.StoreException;
import com.codeheadsystems.warden.server.util.Deadline;
import com.codeheadsystems.warden.server.util.LogMasking;
import com.codeheadsystems.warden.server.verifier.PlatformVerificationException;
import com.codeheadsystems.warden.server.verifier.PlatformVerifier;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic orchestrator for device attestation and assertion checks.
 * <p>
 * Holds no per-device state of its own: challenges live in the {@link ChallengeStore} and
 * registered keys with their replay counters in the {@link DeviceKeyStore}, so the same logic
 * serves a single process or a fleet sharing one backend.
 * <p>
 * Every check returns a {@link VerificationResult}. Platform, storage and timeout problems are
 * logged here with their detail and reported to callers as
 * {@link com.codeheadsystems.warden.server.model.VerificationFailure#INVALID_ATTESTATION} or
 * {@link com.codeheadsystems.warden.server.model.VerificationFailure#INVALID_ASSERTION}.
 * Nothing is retried. Platform and store calls both run on the verifier pool and are abandoned at
 * the deadline; a store write that lands after that is reported as a failure, never a success.
 * <p>
 * Keys from platforms without an assertion protocol (Play Integrity) carry client-chosen ids.
 * They are registered as {@code <platform>:<keyId>} so they never share an entry with an App
 * Attest key, and a fresh attestation refreshes their record instead of conflicting with it.
 * Client key ids may therefore not contain {@value #KEY_NAMESPACE_SEPARATOR}.
 */
public class AttestationManager {

  private static final Logger log = LoggerFactory.getLogger(AttestationManager.class);

  /**
   * Upper bound on concurrent calls into platform verifiers (vendor endpoints may block).
   */
  private static final int VERIFIER_THREADS = 16;

  static final String KEY_NAMESPACE_SEPARATOR = ":";

  private final AttestationConfig config;
  private final ChallengeStore challengeStore;
  private final DeviceKeyStore deviceKeyStore;
  private final Map<Platform, PlatformVerifier> verifiers;
  private final ExecutorService verifierExecutor;
  private final Clock clock;

  private final ScheduledExecutorService challengeReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "attestation-challenge-reaper");
        t.setDaemon(true);
        return t;
      });

  public AttestationManager(AttestationConfig config,
                            ChallengeStore challengeStore,
                            DeviceKeyStore deviceKeyStore,
                            List<PlatformVerifier> verifiers) {
    this(config, challengeStore, deviceKeyStore, verifiers,
        Executors.newFixedThreadPool(VERIFIER_THREADS, r -> {
          Thread t = new Thread(r, "attestation-verifier");
          t.setDaemon(true);
          return t;
        }),
        Clock.systemUTC());
  }

  public AttestationManager(AttestationConfig config,
                            ChallengeStore challengeStore,
                            DeviceKeyStore deviceKeyStore,
                            List<PlatformVerifier> verifiers,
                            ExecutorService verifierExecutor,
                            Clock clock) {
    this.config = config.validate();
    this.challengeStore = challengeStore;
    this.deviceKeyStore = deviceKeyStore;
    this.verifiers = new EnumMap<>(Platform.class);
    for (PlatformVerifier verifier : verifiers) {
      this.verifiers.put(verifier.platform(), verifier);
    }
    this.verifierExecutor = verifierExecutor;
    this.clock = clock;
    long sweepSeconds = Math.max(1, config.challengeTimeout().toSeconds());
    challengeReaper.scheduleAtFixedRate(this::sweepChallenges, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
    log.info("AttestationManager(enabled={}, ios={}, android={}, reRegistration={})",
        config.enabled(), config.iosEnabled(), config.androidEnabled(), config.reRegistrationPolicy());
  }

  /**
   * Stops the challenge reaper and the verifier threads.
   * <p>
   * In Dropwizard, register this instance's lifecycle as a {@code Managed} component.
   */
  public void shutdown() {
    challengeReaper.shutdown();
    verifierExecutor.shutdownNow();
  }

  public boolean isEnabled() {
    return config.enabled();
  }

  public Deadline defaultDeadline() {
    return Deadline.after(config.verificationTimeout(), clock);
  }

  // ── Challenges ───────────────────────────────────────────────────────────

  /**
   * Issues a single-use challenge for the identifier. Challenges are issued even when
   * attestation is disabled, so clients can always complete the handshake.
   *
   * @param identifier caller-supplied identifier
   * @return the challenge nonce
   * @throws IllegalArgumentException if the identifier is blank
   * @throws StoreException           if the challenge store is unavailable
   */
  public String generateChallenge(String identifier) {
    log.debug("generateChallenge(identifier={})", LogMasking.mask(identifier));
    return challengeStore.generate(identifier);
  }

  /**
   * Removes expired challenges from the store.
   *
   * @return how many were removed
   */
  public int purgeExpiredChallenges() {
    return challengeStore.purgeExpired();
  }

  private void sweepChallenges() {
    try {
      purgeExpiredChallenges();
    } catch (RuntimeException e) {
      log.warn("Challenge sweep failed; will retry on the next run", e);
    }
  }

  // ── Attestation ──────────────────────────────────────────────────────────

  public VerificationResult verify(AttestationData data) {
    return verify(data, defaultDeadline());
  }

  /**
   * Verifies an initial attestation and registers the attested device key.
   *
   * @param data     the evidence, null when the client sent none
   * @param deadline when to give up
   * @return verified, or the reason for rejection
   */
  public VerificationResult verify(AttestationData data, Deadline deadline) {
    if (!config.enabled()) {
      log.trace("verify(): attestation disabled, passing through");
      return VerificationResult.passThrough();
    }
    if (data == null) {
      log.warn("Attestation required but not provided");
      return VerificationResult.rejected(ATTESTATION_REQUIRED);
    }
    Platform platform = data.platform() == null ? Platform.UNSPECIFIED : data.platform();
    String keyId = data.keyId();
    Optional<PlatformVerifier> verifier = verifierFor(platform);
    if (verifier.isEmpty()) {
      log.warn("Attestation for unsupported platform {} (keyId={})", platform, LogMasking.mask(keyId));
      return VerificationResult.rejected(UNSUPPORTED_PLATFORM, keyId, platform);
    }

    if (keyId != null && keyId.contains(KEY_NAMESPACE_SEPARATOR)) {
      return invalidAttestation("key id contains a reserved character", keyId, platform);
    }

    log.debug("verify(platform={}, keyId={})", platform, LogMasking.mask(keyId));
    try {
      if (deadline.isExpired()) {
        return invalidAttestation("deadline passed before the challenge check", keyId, platform);
      }
      if (!callWithin(deadline, () -> challengeStore.validate(data.challengeIdentifier(), data.challenge()))) {
        return invalidAttestation("challenge missing, expired or already used", keyId, platform);
      }
      AttestedKey attested = callWithin(deadline,
          () -> verifier.get().verifyAttestation(data, data.challenge(), data.boundIdentifier()));
      if (deadline.isExpired()) {
        return invalidAttestation("deadline passed before registration", keyId, platform);
      }
      boolean assertable = verifier.get().supportsAssertions();
      DeviceKey deviceKey = new DeviceKey(registryKeyId(platform, assertable, attested.deviceId()), platform,
          attested.publicKeyHandle(), verifier.get().boundIdentifier(), attested.initialCounter(), clock.instant());
      if (!callWithin(deadline, () -> register(deviceKey, !assertable))) {
        return invalidAttestation("key id already registered", keyId, platform);
      }
      log.info("Attestation verified (platform={}, keyId={})", platform, LogMasking.mask(keyId));
      return VerificationResult.verified(keyId, platform);
    } catch (PlatformVerificationException e) {
      return invalidAttestation("platform rejected evidence: " + e.getMessage(), keyId, platform);
    } catch (TimeoutException e) {
      return invalidAttestation("deadline passed waiting for the platform or the store", keyId, platform);
    } catch (StoreException e) {
      log.error("Attestation store failure (keyId={})", LogMasking.mask(keyId), e);
      return VerificationResult.rejected(INVALID_ATTESTATION, keyId, platform);
    } catch (RuntimeException e) {
      log.error("Unexpected attestation failure (keyId={})", LogMasking.mask(keyId), e);
      return VerificationResult.rejected(INVALID_ATTESTATION, keyId, platform);
    }
  }

  /**
   * Store key under which an attested key is registered. App Attest key ids are derived from the
   * key itself and are used as is; any other platform's ids are prefixed with the platform.
   */
  static String registryKeyId(Platform platform, boolean assertable, String deviceId) {
    return assertable ? deviceId : platform.name().toLowerCase(Locale.ROOT) + KEY_NAMESPACE_SEPARATOR + deviceId;
  }

  private boolean register(DeviceKey deviceKey, boolean refreshOnConflict) {
    if (deviceKeyStore.register(deviceKey)) {
      return true;
    }
    Optional<DeviceKey> existing = deviceKeyStore.get(deviceKey.keyId());
    if (existing.isPresent() && existing.get().platform() != deviceKey.platform()) {
      log.warn("Key id is registered for {}, refusing {} attestation (keyId={})",
          existing.get().platform(), deviceKey.platform(), LogMasking.mask(deviceKey.keyId()));
      return false;
    }
    if (refreshOnConflict) {
      log.debug("Re-attestation refreshes key (keyId={})", LogMasking.mask(deviceKey.keyId()));
      deviceKeyStore.replace(deviceKey);
      return true;
    }
    if (config.reRegistrationPolicy() == ReRegistrationPolicy.REPLACE) {
      log.info("Re-attestation replaces existing key (keyId={})", LogMasking.mask(deviceKey.keyId()));
      deviceKeyStore.replace(deviceKey);
      return true;
    }
    return false;
  }

  private VerificationResult invalidAttestation(String detail, String keyId, Platform platform) {
    log.warn("Attestation rejected (platform={}, keyId={}): {}", platform, LogMasking.mask(keyId), detail);
    return VerificationResult.rejected(INVALID_ATTESTATION, keyId, platform);
  }

  // ── Assertion ────────────────────────────────────────────────────────────

  public VerificationResult verifyAssertion(AssertionData data) {
    return verifyAssertion(data, defaultDeadline());
  }

  /**
   * Verifies an assertion from a registered key and advances its replay counter.
   *
   * @param data     the assertion, null when the client sent none
   * @param deadline when to give up
   * @return verified, or the reason for rejection
   */
  public VerificationResult verifyAssertion(AssertionData data, Deadline deadline) {
    if (!config.enabled()) {
      log.trace("verifyAssertion(): attestation disabled, passing through");
      return VerificationResult.passThrough();
    }
    if (data == null) {
      log.warn("Assertion required but not provided");
      return VerificationResult.rejected(ATTESTATION_REQUIRED);
    }
    String keyId = data.keyId();
    log.debug("verifyAssertion(keyId={})", LogMasking.mask(keyId));
    Platform platform = null;
    try {
      if (deadline.isExpired()) {
        return invalidAssertion("deadline passed before key lookup", keyId, null);
      }
      Optional<DeviceKey> stored = callWithin(deadline, () -> deviceKeyStore.get(keyId));
      if (stored.isEmpty()) {
        log.info("Assertion for unknown key (keyId={}), re-attestation required", LogMasking.mask(keyId));
        return VerificationResult.rejected(KEY_NOT_FOUND, keyId, null);
      }
      DeviceKey deviceKey = stored.get();
      platform = deviceKey.platform();
      Optional<PlatformVerifier> verifier = verifierFor(platform);
      if (verifier.isEmpty()) {
        return invalidAssertion("platform no longer enabled", keyId, platform);
      }
      long presented = callWithin(deadline, () -> verifier.get().verifyAssertion(data, deviceKey));
      if (presented < 0) {
        return invalidAssertion("negative counter " + presented, keyId, platform);
      }
      if (deadline.isExpired()) {
        return invalidAssertion("deadline passed before counter update", keyId, platform);
      }
      CounterAdvance advance = callWithin(deadline, () -> deviceKeyStore.advanceCounter(keyId, presented));
      return switch (advance.status()) {
        case ACCEPTED -> {
          log.debug("Assertion verified (keyId={}, counter={})", LogMasking.mask(keyId), advance.counter());
          yield VerificationResult.verified(keyId, platform);
        }
        case REPLAY_REJECTED -> {
          log.warn("Assertion replay detected (keyId={}, presented counter={})", LogMasking.mask(keyId), presented);
          yield VerificationResult.rejected(REPLAY_DETECTED, keyId, platform);
        }
        case NOT_FOUND -> VerificationResult.rejected(KEY_NOT_FOUND, keyId, platform);
      };
    } catch (PlatformVerificationException e) {
      return invalidAssertion("platform rejected assertion: " + e.getMessage(), keyId, platform);
    } catch (TimeoutException e) {
      return invalidAssertion("deadline passed waiting for the platform or the store", keyId, platform);
    } catch (StoreException e) {
      log.error("Assertion store failure (keyId={})", LogMasking.mask(keyId), e);
      return VerificationResult.rejected(INVALID_ASSERTION, keyId, platform);
    } catch (RuntimeException e) {
      log.error("Unexpected assertion failure (keyId={})", LogMasking.mask(keyId), e);
      return VerificationResult.rejected(INVALID_ASSERTION, keyId, platform);
    }
  }

  private VerificationResult invalidAssertion(String detail, String keyId, Platform platform) {
    log.warn("Assertion rejected (keyId={}): {}", LogMasking.mask(keyId), detail);
    return VerificationResult.rejected(INVALID_ASSERTION, keyId, platform);
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private Optional<PlatformVerifier> verifierFor(Platform platform) {
    boolean enabled = switch (platform) {
      case IOS -> config.iosEnabled();
      case ANDROID -> config.androidEnabled();
      case UNSPECIFIED -> false;
    };
    return enabled ? Optional.ofNullable(verifiers.get(platform)) : Optional.empty();
  }

  /**
   * Runs a platform or store call on the verifier pool and waits no longer than the deadline.
   * On timeout the call is cancelled.
   */
  private <T> T callWithin(Deadline deadline, BoundedCall<T> call)
      throws PlatformVerificationException, TimeoutException {
    Future<T> future = verifierExecutor.submit(call::call);
    try {
      return future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new TimeoutException("Interrupted while waiting for platform verification");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof PlatformVerificationException pve) {
        throw pve;
      }
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      throw new IllegalStateException("Bounded call failed", cause);
    }
  }

  @FunctionalInterface
  private interface BoundedCall<T> {
    T call() throws PlatformVerificationException;
  }
}
