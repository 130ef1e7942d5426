package com.codeheadsystems.warden.server.model;

/**
 * The externally visible reasons an attestation or assertion is rejected.
 * <p>
 * Platform and storage detail is deliberately collapsed into these kinds; the detail only
 * appears in server logs.
 */
public enum VerificationFailure {
  ATTESTATION_REQUIRED("attestation_required", "Device attestation is required for this request"),
  UNSUPPORTED_PLATFORM("unsupported_platform", "Unsupported platform for attestation"),
  INVALID_ATTESTATION("invalid_attestation", "Device attestation verification failed"),
  INVALID_ASSERTION("invalid_assertion", "Invalid assertion"),
  KEY_NOT_FOUND("key_not_found", "Attestation key not found, re-attestation required"),
  REPLAY_DETECTED("replay_detected", "Assertion replay detected");

  private final String code;
  private final String message;

  VerificationFailure(String code, String message) {
    this.code = code;
    this.message = message;
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }
}
