package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * A device key registered after a successful attestation.
 *
 * @param keyId           platform-assigned key identifier, unique per device and app install
 * @param platform        platform that attested the key
 * @param publicKeyHandle opaque reference to the verified public key material
 * @param boundIdentifier bundle or package identifier the key is scoped to
 * @param counter         last accepted signature counter
 * @param createdAt       registration time
 */
public record DeviceKey(
    String keyId,
    Platform platform,
    String publicKeyHandle,
    String boundIdentifier,
    long counter,
    Instant createdAt) {

  /**
   * Copy of this key with a new counter value.
   *
   * @param newCounter the counter to store
   * @return the updated key
   */
  public DeviceKey withCounter(long newCounter) {
    return new DeviceKey(keyId, platform, publicKeyHandle, boundIdentifier, newCounter, createdAt);
  }
}
