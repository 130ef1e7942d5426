package com.codeheadsystems.warden.server.model;

/**
 * Evidence submitted for an initial attestation.
 *
 * @param platform        the platform that produced the evidence
 * @param token           raw attestation evidence as sent by the client
 * @param keyId           platform-assigned key identifier
 * @param identifier      identifier the challenge was issued for; when null the key id is used
 * @param challenge       challenge nonce the evidence is bound to
 * @param boundIdentifier bundle or package identifier claimed by the client, may be null
 */
public record AttestationData(
    Platform platform,
    String token,
    String keyId,
    String identifier,
    String challenge,
    String boundIdentifier) {

  /**
   * The identifier to validate the challenge against.
   *
   * @return the explicit identifier, or the key id when none was given
   */
  public String challengeIdentifier() {
    return identifier == null || identifier.isBlank() ? keyId : identifier;
  }
}
