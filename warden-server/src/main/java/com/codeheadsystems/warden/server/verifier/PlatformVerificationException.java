package com.codeheadsystems.warden.server.verifier;

/**
 * Thrown by a {@link PlatformVerifier} when evidence does not verify.
 * <p>
 * The {@link Reason} is kept for logs only; callers outside the server see a single
 * invalid-attestation or invalid-assertion error.
 */
public class PlatformVerificationException extends Exception {

  private final Reason reason;

  /**
   * Instantiates a new Platform verification exception.
   *
   * @param reason  the failure classification
   * @param message the message
   */
  public PlatformVerificationException(final Reason reason, final String message) {
    this(reason, message, null);
  }

  /**
   * Instantiates a new Platform verification exception.
   *
   * @param reason  the failure classification
   * @param message the message
   * @param cause   the cause
   */
  public PlatformVerificationException(final Reason reason, final String message, final Throwable cause) {
    super(reason + ": " + message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Why verification failed.
   */
  public enum Reason {
    MALFORMED_EVIDENCE,
    BAD_SIGNATURE,
    UNTRUSTED_CHAIN,
    IDENTIFIER_MISMATCH,
    CHALLENGE_MISMATCH,
    INTEGRITY_TOO_WEAK,
    STALE_EVIDENCE,
    UNSUPPORTED_OPERATION,
    VENDOR_UNAVAILABLE
  }
}
