package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * A single-use challenge issued to a client.
 *
 * @param identifier caller-supplied identifier the challenge is bound to
 * @param nonce      random base64url token
 * @param issuedAt   when the challenge was created
 * @param expiresAt  after this instant the challenge never validates
 */
public record Challenge(String identifier, String nonce, Instant issuedAt, Instant expiresAt) {

  /**
   * Whether the challenge has expired at the given instant.
   *
   * @param now the current time
   * @return true once {@code now} is after {@link #expiresAt()}
   */
  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }
}
