package com.codeheadsystems.warden.server.model;

import java.util.Optional;

/**
 * Result of a single attestation or assertion check.
 *
 * @param failure  the rejection reason, or null when verified
 * @param keyId    key identifier involved, when known; for logging only
 * @param platform platform involved, when known; for logging only
 */
public record VerificationResult(VerificationFailure failure, String keyId, Platform platform) {

  private static final VerificationResult PASS_THROUGH = new VerificationResult(null, null, null);

  public static VerificationResult verified(String keyId, Platform platform) {
    return new VerificationResult(null, keyId, platform);
  }

  /**
   * Result used when attestation is disabled and every request is let through.
   *
   * @return a verified result without metadata
   */
  public static VerificationResult passThrough() {
    return PASS_THROUGH;
  }

  public static VerificationResult rejected(VerificationFailure failure, String keyId, Platform platform) {
    return new VerificationResult(failure, keyId, platform);
  }

  public static VerificationResult rejected(VerificationFailure failure) {
    return new VerificationResult(failure, null, null);
  }

  public boolean isVerified() {
    return failure == null;
  }

  public Optional<VerificationFailure> failureReason() {
    return Optional.ofNullable(failure);
  }
}
