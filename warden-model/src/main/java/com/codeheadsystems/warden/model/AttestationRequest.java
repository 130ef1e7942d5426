package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an initial device attestation (device key registration).
 * <p>
 * The client obtains a challenge from {@code POST /attestation/challenge}, has the platform
 * attest a freshly generated key over that challenge, and submits the resulting evidence here.
 * <p>
 * Used by: {@code POST /attestation/attest}
 *
 * @param platform        platform name, {@code ios}/{@code apple} or {@code android}/{@code google}
 * @param token           platform attestation evidence (App Attest object or Play Integrity token)
 * @param keyId           platform-assigned key identifier
 * @param identifier      identifier the challenge was issued for
 * @param challenge       the challenge nonce returned by the server
 * @param boundIdentifier optional bundle/package identifier; defaults to the configured one
 */
public record AttestationRequest(
    @JsonProperty("platform") String platform,
    @JsonProperty("token") String token,
    @JsonProperty("keyId") String keyId,
    @JsonProperty("identifier") String identifier,
    @JsonProperty("challenge") String challenge,
    @JsonProperty("boundIdentifier") String boundIdentifier) {
}
