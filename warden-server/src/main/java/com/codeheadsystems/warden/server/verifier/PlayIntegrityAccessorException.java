package com.codeheadsystems.warden.server.verifier;

/**
 * The Play Integrity API could not be reached or refused the request.
 */
public class PlayIntegrityAccessorException extends RuntimeException {

  /**
   * Instantiates a new Play Integrity accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PlayIntegrityAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
