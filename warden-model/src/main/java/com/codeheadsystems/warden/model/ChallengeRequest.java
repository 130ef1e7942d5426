package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model asking the server to issue a single-use attestation challenge.
 * <p>
 * The identifier is chosen by the client (typically a device-scoped session id) and must be
 * presented again together with the nonce when the attestation is submitted.
 * <p>
 * Used by: {@code POST /attestation/challenge}
 *
 * @param identifier caller-supplied identifier the challenge is bound to
 */
public record ChallengeRequest(@JsonProperty("identifier") String identifier) {

  /**
   * Returns the identifier, failing if it is absent.
   *
   * @return the identifier
   * @throws IllegalArgumentException if the identifier is null or blank
   */
  public String requiredIdentifier() {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Missing required field: identifier");
    }
    return identifier;
  }
}
