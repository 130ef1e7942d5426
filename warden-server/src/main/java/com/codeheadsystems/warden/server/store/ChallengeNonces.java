package com.codeheadsystems.warden.server.store;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Generates and sanity-checks challenge nonces.
 */
final class ChallengeNonces {

  // 256 bits.
  static final int NONCE_LENGTH = 32;

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Pattern WELL_FORMED = Pattern.compile("[A-Za-z0-9_-]{43}");

  private ChallengeNonces() {
  }

  static String generate() {
    byte[] nonce = new byte[NONCE_LENGTH];
    SECURE_RANDOM.nextBytes(nonce);
    return ENCODER.encodeToString(nonce);
  }

  /**
   * Whether the value could have been produced by {@link #generate()}.
   */
  static boolean isWellFormed(String nonce) {
    return nonce != null && WELL_FORMED.matcher(nonce).matches();
  }

  static String requireIdentifier(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Challenge identifier is required");
    }
    return identifier;
  }
}
