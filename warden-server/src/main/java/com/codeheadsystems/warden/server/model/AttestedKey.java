package com.codeheadsystems.warden.server.model;

/**
 * Identity and key material established by a successful platform attestation.
 *
 * @param deviceId        the verified key identifier
 * @param publicKeyHandle opaque reference to the attested public key
 * @param initialCounter  the counter value carried by the attestation
 */
public record AttestedKey(String deviceId, String publicKeyHandle, long initialCounter) {
}
