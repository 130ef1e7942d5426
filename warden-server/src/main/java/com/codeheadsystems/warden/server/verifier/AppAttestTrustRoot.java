package com.codeheadsystems.warden.server.verifier;

import com.codeheadsystems.warden.server.model.AttestedKey;

/**
 * Apple App Attest chain-of-trust validation, supplied by the embedding application.
 * <p>
 * Implementations validate the attestation certificate chain against Apple's App Attest root,
 * the nonce, App ID and environment, and verify assertion signatures with the stored key.
 */
public interface AppAttestTrustRoot {

  /**
   * Validates an App Attest attestation object.
   *
   * @param keyId             the key id reported by the device
   * @param attestationObject the CBOR attestation object
   * @param clientDataHash    SHA-256 of the challenge the device attested over
   * @param appId             expected {@code TEAMID.bundle.id}
   * @param production        whether the production App Attest environment is expected
   * @return the attested key; the handle must let {@link #verifyAssertion} find the public key
   * @throws PlatformVerificationException if the attestation is invalid
   */
  AttestedKey verifyAttestation(String keyId, byte[] attestationObject, byte[] clientDataHash,
                                String appId, boolean production)
      throws PlatformVerificationException;

  /**
   * Validates an App Attest assertion signature.
   *
   * @param keyId           the registered key id
   * @param assertion       the CBOR assertion
   * @param clientDataHash  SHA-256 of the request data the assertion signs
   * @param publicKeyHandle handle returned by {@link #verifyAttestation}
   * @param appId           expected {@code TEAMID.bundle.id}
   * @return the sign counter carried by the assertion
   * @throws PlatformVerificationException if the signature does not verify
   */
  long verifyAssertion(String keyId, byte[] assertion, byte[] clientDataHash,
                       String publicKeyHandle, String appId)
      throws PlatformVerificationException;
}
