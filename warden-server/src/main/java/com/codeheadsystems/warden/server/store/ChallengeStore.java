package com.codeheadsystems.warden.server.store;

/**
 * Storage abstraction for single-use attestation challenges.
 * <p>
 * Implementations must be thread-safe. Several challenges may be outstanding for the same
 * identifier at once; issuing a new challenge never invalidates earlier ones. The number of
 * outstanding challenges across all identifiers is capped, so issuance cannot grow the store
 * without bound.
 */
public interface ChallengeStore {

  /**
   * Default cap on outstanding challenges.
   */
  int DEFAULT_MAX_OUTSTANDING = 100_000;

  /**
   * Creates and stores a new challenge for the identifier.
   *
   * @param identifier caller-supplied identifier the challenge is bound to
   * @return the nonce
   * @throws IllegalArgumentException if the identifier is null or blank
   * @throws IllegalStateException    if the store already holds the maximum number of
   *                                  outstanding challenges
   * @throws StoreException           if the backend is unavailable
   */
  String generate(String identifier);

  /**
   * Consumes the challenge if it exists, has not expired, has not been consumed and was issued
   * for the identifier. Concurrent calls for the same pair return true at most once.
   *
   * @param identifier the identifier the challenge was issued for
   * @param nonce      the nonce presented by the client
   * @return true exactly once for a valid challenge, false otherwise
   * @throws StoreException if the backend is unavailable
   */
  boolean validate(String identifier, String nonce);

  /**
   * Removes expired challenges.
   *
   * @return how many challenges were removed
   */
  int purgeExpired();
}
