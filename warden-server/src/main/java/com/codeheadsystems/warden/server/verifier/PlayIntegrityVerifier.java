package com.codeheadsystems.warden.server.verifier;

import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.CHALLENGE_MISMATCH;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.IDENTIFIER_MISMATCH;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.INTEGRITY_TOO_WEAK;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.MALFORMED_EVIDENCE;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.STALE_EVIDENCE;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.UNSUPPORTED_OPERATION;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.UNTRUSTED_CHAIN;
import static com.codeheadsystems.warden.server.verifier.PlatformVerificationException.Reason.VENDOR_UNAVAILABLE;

import com.codeheadsystems.warden.server.model.AssertionData;
import com.codeheadsystems.warden.server.model.AttestationData;
import com.codeheadsystems.warden.server.model.AttestedKey;
import com.codeheadsystems.warden.server.model.DeviceKey;
import com.codeheadsystems.warden.server.model.Platform;
import com.codeheadsystems.warden.server.util.LogMasking;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Android {@link PlatformVerifier} for Google Play Integrity.
 * <p>
 * The token is decoded by Google through {@link PlayIntegrityAccessor}; this class evaluates the
 * returned verdict. Play Integrity has no per-request assertion protocol, so
 * {@link #verifyAssertion} always fails.
 */
public class PlayIntegrityVerifier implements PlatformVerifier {

  private static final Logger log = LoggerFactory.getLogger(PlayIntegrityVerifier.class);

  static final String PLAY_RECOGNIZED = "PLAY_RECOGNIZED";
  static final String MEETS_DEVICE_INTEGRITY = "MEETS_DEVICE_INTEGRITY";
  static final String MEETS_STRONG_INTEGRITY = "MEETS_STRONG_INTEGRITY";
  static final String HANDLE_PREFIX = "play-integrity:";

  private final PlayIntegrityAccessor accessor;
  private final String packageName;
  private final boolean requireStrongIntegrity;
  private final Duration maxVerdictAge;
  private final Duration allowedClockSkew;
  private final Clock clock;

  /**
   * Instantiates a new Play Integrity verifier.
   *
   * @param accessor               the Play Integrity API client
   * @param packageName            the app's package name
   * @param requireStrongIntegrity require {@code MEETS_STRONG_INTEGRITY}
   * @param maxVerdictAge          oldest acceptable verdict, normally the challenge timeout
   * @param allowedClockSkew       tolerated clock difference with Google
   * @param clock                  the clock
   */
  public PlayIntegrityVerifier(PlayIntegrityAccessor accessor,
                               String packageName,
                               boolean requireStrongIntegrity,
                               Duration maxVerdictAge,
                               Duration allowedClockSkew,
                               Clock clock) {
    if (packageName == null || packageName.isBlank()) {
      throw new IllegalStateException("Android package name must be configured for Play Integrity");
    }
    this.accessor = accessor;
    this.packageName = packageName;
    this.requireStrongIntegrity = requireStrongIntegrity;
    this.maxVerdictAge = maxVerdictAge;
    this.allowedClockSkew = allowedClockSkew;
    this.clock = clock;
    log.info("PlayIntegrityVerifier(packageName={}, requireStrongIntegrity={})", packageName, requireStrongIntegrity);
  }

  @Override
  public Platform platform() {
    return Platform.ANDROID;
  }

  @Override
  public String boundIdentifier() {
    return packageName;
  }

  @Override
  public AttestedKey verifyAttestation(AttestationData data, String challengeNonce, String boundIdentifier)
      throws PlatformVerificationException {
    log.debug("verifyAttestation(keyId={})", LogMasking.mask(data.keyId()));
    if (data.token() == null || data.token().isBlank()) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "missing integrity token");
    }
    if (data.keyId() == null || data.keyId().isBlank()) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "missing key id");
    }
    if (boundIdentifier != null && !boundIdentifier.isBlank() && !packageName.equals(boundIdentifier)) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH, "package name does not match configuration");
    }

    PlayIntegrityVerdict verdict;
    try {
      verdict = accessor.decode(packageName, data.token());
    } catch (PlayIntegrityAccessorException e) {
      throw new PlatformVerificationException(VENDOR_UNAVAILABLE, e.getMessage(), e);
    }
    evaluate(verdict, challengeNonce);
    return new AttestedKey(data.keyId(), HANDLE_PREFIX + data.keyId(), 0L);
  }

  @Override
  public boolean supportsAssertions() {
    return false;
  }

  @Override
  public long verifyAssertion(AssertionData data, DeviceKey deviceKey) throws PlatformVerificationException {
    throw new PlatformVerificationException(UNSUPPORTED_OPERATION, "Play Integrity does not support assertions");
  }

  void evaluate(PlayIntegrityVerdict verdict, String challengeNonce) throws PlatformVerificationException {
    PlayIntegrityVerdict.TokenPayload payload = verdict == null ? null : verdict.tokenPayloadExternal();
    if (payload == null || payload.requestDetails() == null || payload.appIntegrity() == null
        || payload.deviceIntegrity() == null) {
      throw new PlatformVerificationException(MALFORMED_EVIDENCE, "incomplete integrity verdict");
    }

    PlayIntegrityVerdict.RequestDetails request = payload.requestDetails();
    if (!packageName.equals(request.requestPackageName())) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH, "verdict was requested by another package");
    }
    if (request.nonce() == null || request.nonce().isBlank()
        || !stripPadding(challengeNonce).equals(stripPadding(request.nonce()))) {
      throw new PlatformVerificationException(CHALLENGE_MISMATCH, "verdict nonce does not match challenge");
    }
    checkFreshness(request.timestampMillis());

    PlayIntegrityVerdict.AppIntegrity app = payload.appIntegrity();
    if (!PLAY_RECOGNIZED.equals(app.appRecognitionVerdict())) {
      throw new PlatformVerificationException(UNTRUSTED_CHAIN,
          "app not recognized by Play: " + app.appRecognitionVerdict());
    }
    if (app.packageName() != null && !packageName.equals(app.packageName())) {
      throw new PlatformVerificationException(IDENTIFIER_MISMATCH, "verdict is for another package");
    }

    List<String> deviceVerdicts = payload.deviceIntegrity().deviceRecognitionVerdict();
    if (deviceVerdicts == null || !meetsIntegrity(deviceVerdicts)) {
      throw new PlatformVerificationException(INTEGRITY_TOO_WEAK,
          "device verdict " + deviceVerdicts + " does not meet "
              + (requireStrongIntegrity ? MEETS_STRONG_INTEGRITY : MEETS_DEVICE_INTEGRITY));
    }
  }

  private boolean meetsIntegrity(List<String> deviceVerdicts) {
    if (requireStrongIntegrity) {
      return deviceVerdicts.contains(MEETS_STRONG_INTEGRITY);
    }
    return deviceVerdicts.contains(MEETS_DEVICE_INTEGRITY) || deviceVerdicts.contains(MEETS_STRONG_INTEGRITY);
  }

  private void checkFreshness(long timestampMillis) throws PlatformVerificationException {
    Instant issued = Instant.ofEpochMilli(timestampMillis);
    Instant now = clock.instant();
    if (issued.isAfter(now.plus(allowedClockSkew))) {
      throw new PlatformVerificationException(STALE_EVIDENCE, "verdict timestamp is in the future");
    }
    if (issued.isBefore(now.minus(maxVerdictAge).minus(allowedClockSkew))) {
      throw new PlatformVerificationException(STALE_EVIDENCE, "verdict is too old");
    }
  }

  private static String stripPadding(String value) {
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == '=') {
      end--;
    }
    return value.substring(0, end);
  }
}
