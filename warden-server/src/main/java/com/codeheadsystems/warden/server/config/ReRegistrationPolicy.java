package com.codeheadsystems.warden.server.config;

/**
 * What an attestation does when its key id is already registered.
 */
public enum ReRegistrationPolicy {
  /**
   * Keep the existing key and counter; the new attestation fails.
   */
  REJECT,
  /**
   * The new attestation supersedes the stored key, including its counter.
   */
  REPLACE
}
