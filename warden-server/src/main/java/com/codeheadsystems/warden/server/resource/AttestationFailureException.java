package com.codeheadsystems.warden.server.resource;

import com.codeheadsystems.warden.server.model.VerificationFailure;

/**
 * Thrown by {@link AttestationResource} when a check is rejected. Rendered by
 * {@link AttestationFailureExceptionMapper}.
 */
public class AttestationFailureException extends RuntimeException {

  private final VerificationFailure failure;

  public AttestationFailureException(VerificationFailure failure) {
    super(failure.message());
    this.failure = failure;
  }

  public VerificationFailure failure() {
    return failure;
  }
}
