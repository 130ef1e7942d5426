package com.codeheadsystems.warden.server.config;

import java.time.Duration;

/**
 * Framework-agnostic attestation settings.
 * <p>
 * A platform is enabled when attestation is enabled and the platform's bound identifier
 * (App ID for iOS, package name for Android) is configured.
 *
 * @param enabled                master switch; when false every request passes through
 * @param iosAppId               App Attest App ID, {@code TEAMID.bundle.id}
 * @param iosEnvironment         {@code production} or {@code development}
 * @param androidPackageName     Play Integrity package name
 * @param requireStrongIntegrity require hardware-backed device integrity on Android
 * @param challengeTimeout       lifetime of an issued challenge
 * @param allowedClockSkew       tolerated clock difference for vendor verdict timestamps
 * @param verificationTimeout    default deadline for a single verification
 * @param reRegistrationPolicy   behaviour when a key id is attested twice
 */
public record AttestationConfig(
    boolean enabled,
    String iosAppId,
    String iosEnvironment,
    String androidPackageName,
    boolean requireStrongIntegrity,
    Duration challengeTimeout,
    Duration allowedClockSkew,
    Duration verificationTimeout,
    ReRegistrationPolicy reRegistrationPolicy) {

  public static final Duration DEFAULT_CHALLENGE_TIMEOUT = Duration.ofMinutes(5);

  public static Builder builder() {
    return new Builder();
  }

  public boolean iosEnabled() {
    return enabled && iosAppId != null && !iosAppId.isBlank();
  }

  public boolean androidEnabled() {
    return enabled && androidPackageName != null && !androidPackageName.isBlank();
  }

  /**
   * Checks the settings are consistent.
   *
   * @return this config
   * @throws IllegalStateException if attestation is enabled without any platform configured,
   *                               or a duration is not positive
   */
  public AttestationConfig validate() {
    if (enabled && !iosEnabled() && !androidEnabled()) {
      throw new IllegalStateException("Attestation is enabled but no platform is configured "
          + "(set iosAppId or androidPackageName)");
    }
    requirePositive(challengeTimeout, "challengeTimeout");
    requirePositive(verificationTimeout, "verificationTimeout");
    if (allowedClockSkew == null || allowedClockSkew.isNegative()) {
      throw new IllegalStateException("allowedClockSkew must not be negative");
    }
    if (reRegistrationPolicy == null) {
      throw new IllegalStateException("reRegistrationPolicy must be set");
    }
    return this;
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new IllegalStateException(name + " must be positive");
    }
  }

  /**
   * Builder with the same defaults as the Dropwizard configuration.
   */
  public static class Builder {
    private boolean enabled;
    private String iosAppId = "";
    private String iosEnvironment = "production";
    private String androidPackageName = "";
    private boolean requireStrongIntegrity;
    private Duration challengeTimeout = DEFAULT_CHALLENGE_TIMEOUT;
    private Duration allowedClockSkew = Duration.ofSeconds(30);
    private Duration verificationTimeout = Duration.ofSeconds(10);
    private ReRegistrationPolicy reRegistrationPolicy = ReRegistrationPolicy.REJECT;

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder iosAppId(String iosAppId) {
      this.iosAppId = iosAppId;
      return this;
    }

    public Builder iosEnvironment(String iosEnvironment) {
      this.iosEnvironment = iosEnvironment;
      return this;
    }

    public Builder androidPackageName(String androidPackageName) {
      this.androidPackageName = androidPackageName;
      return this;
    }

    public Builder requireStrongIntegrity(boolean requireStrongIntegrity) {
      this.requireStrongIntegrity = requireStrongIntegrity;
      return this;
    }

    public Builder challengeTimeout(Duration challengeTimeout) {
      this.challengeTimeout = challengeTimeout;
      return this;
    }

    public Builder allowedClockSkew(Duration allowedClockSkew) {
      this.allowedClockSkew = allowedClockSkew;
      return this;
    }

    public Builder verificationTimeout(Duration verificationTimeout) {
      this.verificationTimeout = verificationTimeout;
      return this;
    }

    public Builder reRegistrationPolicy(ReRegistrationPolicy reRegistrationPolicy) {
      this.reRegistrationPolicy = reRegistrationPolicy;
      return this;
    }

    public AttestationConfig build() {
      return new AttestationConfig(enabled, iosAppId, iosEnvironment, androidPackageName,
          requireStrongIntegrity, challengeTimeout, allowedClockSkew, verificationTimeout,
          reRegistrationPolicy);
    }
  }
}
