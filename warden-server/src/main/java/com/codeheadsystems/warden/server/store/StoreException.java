package com.codeheadsystems.warden.server.store;

/**
 * Raised when a storage backend cannot be reached or returns something unexpected.
 * <p>
 * Never shown to clients; the attestation manager logs it and reports a generic failure.
 */
public class StoreException extends RuntimeException {

  /**
   * Instantiates a new Store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
