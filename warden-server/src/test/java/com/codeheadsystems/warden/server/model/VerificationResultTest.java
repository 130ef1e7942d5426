package com.codeheadsystems.warden.server.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VerificationResultTest {

  @Test
  void verified_hasNoFailure() {
    VerificationResult result = VerificationResult.verified("key-1", Platform.IOS);

    assertThat(result.isVerified()).isTrue();
    assertThat(result.failureReason()).isEmpty();
    assertThat(result.keyId()).isEqualTo("key-1");
  }

  @Test
  void passThrough_isVerifiedWithoutMetadata() {
    VerificationResult result = VerificationResult.passThrough();

    assertThat(result.isVerified()).isTrue();
    assertThat(result.keyId()).isNull();
    assertThat(result.platform()).isNull();
  }

  @Test
  void rejected_carriesFailure() {
    VerificationResult result = VerificationResult.rejected(VerificationFailure.REPLAY_DETECTED, "key-1", Platform.IOS);

    assertThat(result.isVerified()).isFalse();
    assertThat(result.failureReason()).contains(VerificationFailure.REPLAY_DETECTED);
  }

  @Test
  void failureCodes_areStable() {
    assertThat(VerificationFailure.ATTESTATION_REQUIRED.code()).isEqualTo("attestation_required");
    assertThat(VerificationFailure.UNSUPPORTED_PLATFORM.code()).isEqualTo("unsupported_platform");
    assertThat(VerificationFailure.INVALID_ATTESTATION.code()).isEqualTo("invalid_attestation");
    assertThat(VerificationFailure.INVALID_ASSERTION.code()).isEqualTo("invalid_assertion");
    assertThat(VerificationFailure.KEY_NOT_FOUND.code()).isEqualTo("key_not_found");
    assertThat(VerificationFailure.REPLAY_DETECTED.code()).isEqualTo("replay_detected");
  }
}
