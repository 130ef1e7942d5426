package com.codeheadsystems.warden.server.resource;

import com.codeheadsystems.warden.model.ErrorResponse;
import com.codeheadsystems.warden.server.model.VerificationFailure;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Renders rejected checks as {@code {"error": ..., "message": ...}} with a stable status code.
 */
@Provider
public class AttestationFailureExceptionMapper implements ExceptionMapper<AttestationFailureException> {

  /**
   * HTTP status for a failure kind. Missing credentials are 401, rejected evidence 403.
   *
   * @param failure the failure
   * @return the status code
   */
  public static int statusFor(VerificationFailure failure) {
    return switch (failure) {
      case ATTESTATION_REQUIRED, KEY_NOT_FOUND -> 401;
      case UNSUPPORTED_PLATFORM -> 400;
      case INVALID_ATTESTATION, INVALID_ASSERTION, REPLAY_DETECTED -> 403;
    };
  }

  public static ErrorResponse bodyFor(VerificationFailure failure) {
    return new ErrorResponse(failure.code(), failure.message());
  }

  @Override
  public Response toResponse(AttestationFailureException exception) {
    VerificationFailure failure = exception.failure();
    return Response.status(statusFor(failure))
        .type(MediaType.APPLICATION_JSON)
        .entity(bodyFor(failure))
        .build();
  }
}
