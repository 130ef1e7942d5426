package com.codeheadsystems.warden.server.verifier;

import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.IDENTIFIER_MISMATCH;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.MALFORMED_EVIDENCE;

import com.codeheadsystems.warden.server.model.AssertionData;
import com.codeheadsystems.warden.server.model.AttestationData;
import com.codeheadsystems.warden.server.model.AttestedKey;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;
import com.codeheadsystems.warden.server.util.LogMasking;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * iOS {@link PlatformVerifier} for Apple App Attest.
 * <p>
 * Performs the request-level checks itself (evidence present and decodable, App ID match) and
 * hands the cryptographic validation to an {@link AppAttestTrustRoot}.
 */
public class AppAttestVerifier implements PlatformVerifier {

  private static final Logger log = LoggerFactory.getLogger(AppAttestVerifier.class);
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final AppAttestTrustRoot trustRoot;
  private final String appId;
  private final boolean production;

  /**
   * Instantiates a new App Attest verifier.
   *
   * @param trustRoot   the vendor trust root
   * @param appId       the App ID, {@code TEAMID.bundle.id}
   * @param environment {@code production} or {@code development}
   */
  public AppAttestVerifier(AppAttestTrustRoot trustRoot, String appId, String environment) {
    if (appId == null || appId.isBlank()) {
      throw new IllegalStateException("iOS App ID must be configured for App Attest");
    }
    this.trustRoot = trustRoot;
    this.appId = appId;
    this.production = !"development".equalsIgnoreCase(environment);
    log.info("AppAttestVerifier(appId={}, production={})", appId, production);
  }

  @Override
  public Platform platform() {
    return Platform.IOS;
  }

  @Override
  public String boundIdentifier() {
    return appId;
  }

  @Override
  public AttestedKey verifyAttestation(AttestationData data, String challengeNonce, String boundIdentifier)
      throws PlatformVerificationException {
    log.debug("verifyAttestation(keyId={})", LogMasking.mask(data.keyId()));
    if (data.keyId() == null || data.keyId().isBlank()) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "missing key id");
    }
    checkBoundIdentifier(boundIdentifier);
    byte[] attestationObject = decode(data.token(), "attestation token");
    byte[] clientDataHash = sha256(challengeNonce.getBytes(StandardCharsets.UTF_8));

    AttestedKey attested = trustRoot.verifyAttestation(
        data.keyId(), attestationObject, clientDataHash, appId, production);
    if (!data.keyId().equals(attested.deviceId())) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH,
          "attested key id does not match the submitted key id");
    }
    return attested;
  }

  @Override
  public long verifyAssertion(AssertionData data, DeviceKey deviceKey) throws PlatformVerificationException {
    log.debug("verifyAssertion(keyId={})", LogMasking.mask(deviceKey.keyId()));
    if (!appId.equals(deviceKey.boundIdentifier())) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH, "key is bound to a different App ID");
    }
    byte[] assertion = decode(data.assertion(), "assertion");
    if (data.clientData() == null || data.clientData().length == 0) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "missing client data");
    }
    return trustRoot.verifyAssertion(
        deviceKey.keyId(), assertion, sha256(data.clientData()), deviceKey.publicKeyHandle(), appId);
  }

  private void checkBoundIdentifier(String boundIdentifier) throws PlatformVerificationException {
    if (boundIdentifier != null && !boundIdentifier.isBlank() && !appId.equals(boundIdentifier)) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH, "App ID does not match configuration");
    }
  }

  private static byte[] decode(String value, String what) throws PlatformVerificationException {
    if (value == null || value.isBlank()) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "missing " + what);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "invalid " + what + " encoding", e);
    }
  }

  static byte[] sha256(byte[] bytes) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(bytes);
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError("All Java implementations are required to support SHA-256", e);
    }
  }
}
