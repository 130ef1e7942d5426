package com.codeheadsystems.warden.dropwizard;

import com.codeheadsystems.warden.dropwizard.health.StorageHealthCheck;
import com.codeheadsystems.warden.server.config.AttestationConfig;
import com.codeheadsystems.warden.server.manager.AttestationManager;
import com.codeheadsystems.warden.server.resource.AttestationFailureExceptionMapper;
import com.codeheadsystems.warden.server.resource.AttestationResource;
import com.codeheadsystems.warden.server.store.StoreFactory;
import com.codeheadsystems.warden.server.store.Stores;
import com.codeheadsystems.warden.server.verifier.AppAttestTrustRoot;
import com.codeheadsystems.warden.server.verifier.AppAttestVerifier;
import com.codeheadsystems.warden.server.verifier.PlatformVerifier;
import com.codeheadsystems.warden.server.verifier.PlayIntegrityAccessor;
import com.codeheadsystems.warden.server.verifier.PlayIntegrityVerifier;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires warden device attestation into an existing Dropwizard application.
 * <p>
 * Registers the {@code /attestation} JAX-RS resource and its error mapper, a storage health
 * check, and a managed lifecycle that stops background work on shutdown. Requires a
 * {@link WardenConfiguration} in the application's YAML config.
 * <p>
 * With attestation disabled, or for local development without platform checks:
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>());
 * }</pre>
 * <p>
 * In production supply the App Attest trust root and a Play Integrity access token source for
 * the platforms you enable:
 * <pre>{@code
 *   bootstrap.addBundle(new WardenBundle<>(appleTrustRoot,
 *       () -> googleCredentials.refreshIfExpired().getAccessToken()));
 * }</pre>
 */
@Singleton
public class WardenBundle<C extends WardenConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(WardenBundle.class);

  private final AppAttestTrustRoot appAttestTrustRoot;
  private final Supplier<String> playIntegrityAccessToken;
  private final StoreFactory storeFactory;

  /**
   * Creates a bundle without platform trust roots. Starting it with a platform enabled fails.
   */
  public WardenBundle() {
    this(null, null);
  }

  /**
   * Creates a bundle with the platform trust roots. Either may be null when its platform is not
   * enabled.
   *
   * @param appAttestTrustRoot       Apple App Attest chain-of-trust validation
   * @param playIntegrityAccessToken OAuth access token for the Play Integrity API
   */
  @Inject
  public WardenBundle(AppAttestTrustRoot appAttestTrustRoot, Supplier<String> playIntegrityAccessToken) {
    this.appAttestTrustRoot = appAttestTrustRoot;
    this.playIntegrityAccessToken = playIntegrityAccessToken;
    this.storeFactory = new StoreFactory();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    AttestationConfig config = configuration.toAttestationConfig().validate();
    if (!config.enabled()) {
      log.warn("Device attestation is DISABLED; every request passes attestation checks.");
    }
    List<PlatformVerifier> verifiers = buildVerifiers(config, configuration, environment);
    Stores stores = storeFactory.create(
        configuration.getStorageBackend(),
        configuration.getRedisUri(),
        config.challengeTimeout(),
        Duration.ofMillis(configuration.getRedisCommandTimeoutMillis()),
        configuration.getMaxOutstandingChallenges());

    AttestationManager attestationManager = new AttestationManager(
        config, stores.challengeStore(), stores.deviceKeyStore(), verifiers);
    environment.jersey().register(new AttestationResource(attestationManager));
    environment.jersey().register(new AttestationFailureExceptionMapper());
    environment.healthChecks().register("attestation-storage", new StorageHealthCheck(stores));
    environment.lifecycle().manage(new WardenLifecycle(attestationManager, stores));
  }

  private List<PlatformVerifier> buildVerifiers(AttestationConfig config, C configuration, Environment environment) {
    List<PlatformVerifier> verifiers = new ArrayList<>();
    if (config.iosEnabled()) {
      if (appAttestTrustRoot == null) {
        throw new IllegalStateException("iosAppId is configured but no AppAttestTrustRoot was "
            + "supplied to the WardenBundle constructor.");
      }
      verifiers.add(new AppAttestVerifier(appAttestTrustRoot, config.iosAppId(), config.iosEnvironment()));
    }
    if (config.androidEnabled()) {
      if (playIntegrityAccessToken == null) {
        throw new IllegalStateException("androidPackageName is configured but no Play Integrity access "
            + "token supplier was supplied to the WardenBundle constructor.");
      }
      PlayIntegrityAccessor accessor = new PlayIntegrityAccessor(
          HttpClient.newBuilder().connectTimeout(config.verificationTimeout()).build(),
          environment.getObjectMapper(),
          URI.create(configuration.getPlayIntegrityEndpoint()),
          playIntegrityAccessToken,
          config.verificationTimeout());
      verifiers.add(new PlayIntegrityVerifier(accessor, config.androidPackageName(),
          config.requireStrongIntegrity(), config.challengeTimeout(), config.allowedClockSkew(),
          Clock.systemUTC()));
    }
    return verifiers;
  }
}
