package com.codeheadsystems.warden.server.verifier;

import com.codeheadsystems.warden.server.model.AssertionData;
import com.codeheadsystems.warden.server.model.AttestationData;
import com.codeheadsystems.warden.server.model.AttestedKey;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;

/**
 * Verifies platform evidence against the vendor's root of trust. One implementation per
 * {@link Platform}.
 * <p>
 * Implementations check signatures and identity only. Challenge consumption and counter
 * monotonicity belong to the caller.
 */
public interface PlatformVerifier {

  /**
   * The platform this verifier handles.
   *
   * @return the platform
   */
  Platform platform();

  /**
   * The bundle or package identifier keys verified here are scoped to.
   *
   * @return the configured identifier
   */
  String boundIdentifier();

  /**
   * Verifies an initial attestation.
   *
   * @param data            the submitted evidence
   * @param challengeNonce  the challenge the evidence must be bound to, already validated
   * @param boundIdentifier the identifier the client claims, or null to use the configured one
   * @return the verified key identity
   * @throws PlatformVerificationException if the evidence does not verify
   */
  AttestedKey verifyAttestation(AttestationData data, String challengeNonce, String boundIdentifier)
      throws PlatformVerificationException;

  /**
   * Verifies an assertion made with a registered key and returns the counter it carries.
   *
   * @param data      the submitted assertion
   * @param deviceKey the stored key the assertion claims to come from
   * @return the counter presented by the assertion
   * @throws PlatformVerificationException if the assertion does not verify
   */
  long verifyAssertion(AssertionData data, DeviceKey deviceKey) throws PlatformVerificationException;

  /**
   * Whether this platform has a per-request assertion protocol. Platforms without one prove
   * integrity by attesting again, and their key ids are not bound to a key.
   *
   * @return true if {@link #verifyAssertion} can succeed
   */
  default boolean supportsAssertions() {
    return true;
  }
}
