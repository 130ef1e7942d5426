package com.codeheadsystems.warden.dropwizard;

import com.codeheadsystems.warden.server.config.AttestationConfig;
import com.codeheadsystems.warden.server.config.ReRegistrationPolicy;
import com.codeheadsystems.warden.server.config.StorageBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Dropwizard configuration for warden device attestation.
 * <p>
 * Attestation is off unless {@code enabled} is true. When enabled, at least one platform must be
 * configured: {@code iosAppId} for Apple App Attest, {@code androidPackageName} for Google Play
 * Integrity.
 * <p>
 * {@code storageBackend} has no default. {@code MEMORY} keeps challenges and device keys in
 * process (single instance, lost on restart); {@code REDIS} shares them through
 * {@code redisUri} across every instance behind the load balancer.
 */
public class WardenConfiguration extends Configuration {

  /**
   * Master switch. When false every attestation and assertion check passes.
   */
  private boolean enabled = false;

  /**
   * App Attest App ID, {@code TEAMID.bundle.id}. Empty disables iOS.
   */
  private String iosAppId = "";

  /**
   * App Attest environment: {@code production} or {@code development}.
   */
  @NotEmpty
  private String iosEnvironment = "production";

  /**
   * Android package name checked against Play Integrity verdicts. Empty disables Android.
   */
  private String androidPackageName = "";

  /**
   * Require {@code MEETS_STRONG_INTEGRITY} (hardware-backed) instead of
   * {@code MEETS_DEVICE_INTEGRITY}.
   */
  private boolean requireStrongIntegrity = false;

  /**
   * Lifetime of an issued challenge, in seconds.
   */
  @Min(1)
  private long challengeTimeoutSeconds = 300;

  /**
   * Tolerated difference between our clock and the vendor's verdict timestamps, in seconds.
   */
  @Min(0)
  private long allowedClockSkewSeconds = 30;

  /**
   * Upper bound on a single attestation or assertion check, vendor calls included.
   */
  @Min(1)
  private long verificationTimeoutMillis = 10_000;

  /**
   * What to do when an already registered key id is attested again: {@code REJECT} or
   * {@code REPLACE}.
   */
  @NotNull
  private ReRegistrationPolicy reRegistrationPolicy = ReRegistrationPolicy.REJECT;

  /**
   * Where challenges and device keys live: {@code MEMORY} or {@code REDIS}.
   */
  @NotNull
  private StorageBackend storageBackend;

  /**
   * Redis URI, e.g. {@code redis://redis.internal:6379/0}. Required for {@code REDIS}.
   */
  private String redisUri = "";

  /**
   * Timeout applied to every Redis command.
   */
  @Min(1)
  private long redisCommandTimeoutMillis = 2_000;

  /**
   * Cap on unconsumed, unexpired challenges across all clients. Issuance beyond it answers 503.
   */
  @Min(1)
  private int maxOutstandingChallenges = 100_000;

  /**
   * Base URI of the Play Integrity API.
   */
  @NotEmpty
  private String playIntegrityEndpoint = "https://playintegrity.googleapis.com/v1/";

  /**
   * Translates this configuration into the framework-agnostic settings.
   *
   * @return the attestation settings, not yet validated
   */
  public AttestationConfig toAttestationConfig() {
    return AttestationConfig.builder()
        .enabled(enabled)
        .iosAppId(iosAppId)
        .iosEnvironment(iosEnvironment)
        .androidPackageName(androidPackageName)
        .requireStrongIntegrity(requireStrongIntegrity)
        .challengeTimeout(Duration.ofSeconds(challengeTimeoutSeconds))
        .allowedClockSkew(Duration.ofSeconds(allowedClockSkewSeconds))
        .verificationTimeout(Duration.ofMillis(verificationTimeoutMillis))
        .reRegistrationPolicy(reRegistrationPolicy)
        .build();
  }

  /**
   * Is enabled boolean.
   *
   * @return the boolean
   */
  @JsonProperty
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Sets enabled.
   *
   * @param enabled the enabled
   */
  @JsonProperty
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Gets ios app id.
   *
   * @return the ios app id
   */
  @JsonProperty
  public String getIosAppId() {
    return iosAppId;
  }

  /**
   * Sets ios app id.
   *
   * @param iosAppId the ios app id
   */
  @JsonProperty
  public void setIosAppId(String iosAppId) {
    this.iosAppId = iosAppId;
  }

  @JsonProperty
  public String getIosEnvironment() {
    return iosEnvironment;
  }

  @JsonProperty
  public void setIosEnvironment(String iosEnvironment) {
    this.iosEnvironment = iosEnvironment;
  }

  /**
   * Gets android package name.
   *
   * @return the android package name
   */
  @JsonProperty
  public String getAndroidPackageName() {
    return androidPackageName;
  }

  /**
   * Sets android package name.
   *
   * @param androidPackageName the android package name
   */
  @JsonProperty
  public void setAndroidPackageName(String androidPackageName) {
    this.androidPackageName = androidPackageName;
  }

  @JsonProperty
  public boolean isRequireStrongIntegrity() {
    return requireStrongIntegrity;
  }

  @JsonProperty
  public void setRequireStrongIntegrity(boolean requireStrongIntegrity) {
    this.requireStrongIntegrity = requireStrongIntegrity;
  }

  /**
   * Gets challenge timeout seconds.
   *
   * @return the challenge timeout seconds
   */
  @JsonProperty
  public long getChallengeTimeoutSeconds() {
    return challengeTimeoutSeconds;
  }

  /**
   * Sets challenge timeout seconds.
   *
   * @param challengeTimeoutSeconds the challenge timeout seconds
   */
  @JsonProperty
  public void setChallengeTimeoutSeconds(long challengeTimeoutSeconds) {
    this.challengeTimeoutSeconds = challengeTimeoutSeconds;
  }

  @JsonProperty
  public long getAllowedClockSkewSeconds() {
    return allowedClockSkewSeconds;
  }

  @JsonProperty
  public void setAllowedClockSkewSeconds(long allowedClockSkewSeconds) {
    this.allowedClockSkewSeconds = allowedClockSkewSeconds;
  }

  @JsonProperty
  public long getVerificationTimeoutMillis() {
    return verificationTimeoutMillis;
  }

  @JsonProperty
  public void setVerificationTimeoutMillis(long verificationTimeoutMillis) {
    this.verificationTimeoutMillis = verificationTimeoutMillis;
  }

  /**
   * Gets re-registration policy.
   *
   * @return the re-registration policy
   */
  @JsonProperty
  public ReRegistrationPolicy getReRegistrationPolicy() {
    return reRegistrationPolicy;
  }

  /**
   * Sets re-registration policy.
   *
   * @param reRegistrationPolicy the re-registration policy
   */
  @JsonProperty
  public void setReRegistrationPolicy(ReRegistrationPolicy reRegistrationPolicy) {
    this.reRegistrationPolicy = reRegistrationPolicy;
  }

  /**
   * Gets storage backend.
   *
   * @return the storage backend
   */
  @JsonProperty
  public StorageBackend getStorageBackend() {
    return storageBackend;
  }

  /**
   * Sets storage backend.
   *
   * @param storageBackend the storage backend
   */
  @JsonProperty
  public void setStorageBackend(StorageBackend storageBackend) {
    this.storageBackend = storageBackend;
  }

  @JsonProperty
  public String getRedisUri() {
    return redisUri;
  }

  @JsonProperty
  public void setRedisUri(String redisUri) {
    this.redisUri = redisUri;
  }

  @JsonProperty
  public long getRedisCommandTimeoutMillis() {
    return redisCommandTimeoutMillis;
  }

  @JsonProperty
  public void setRedisCommandTimeoutMillis(long redisCommandTimeoutMillis) {
    this.redisCommandTimeoutMillis = redisCommandTimeoutMillis;
  }

  @JsonProperty
  public int getMaxOutstandingChallenges() {
    return maxOutstandingChallenges;
  }

  @JsonProperty
  public void setMaxOutstandingChallenges(int maxOutstandingChallenges) {
    this.maxOutstandingChallenges = maxOutstandingChallenges;
  }

  @JsonProperty
  public String getPlayIntegrityEndpoint() {
    return playIntegrityEndpoint;
  }

  @JsonProperty
  public void setPlayIntegrityEndpoint(String playIntegrityEndpoint) {
    this.playIntegrityEndpoint = playIntegrityEndpoint;
  }
}
