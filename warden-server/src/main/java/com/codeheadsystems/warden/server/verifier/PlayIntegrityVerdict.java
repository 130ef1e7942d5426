package com.codeheadsystems.warden.server.verifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Decoded Play Integrity verdict, as returned by {@code decodeIntegrityToken}.
 * Only the fields the verifier evaluates are mapped.
 *
 * @param tokenPayloadExternal the decoded payload
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayIntegrityVerdict(
    @JsonProperty("tokenPayloadExternal") TokenPayload tokenPayloadExternal) {

  /**
   * The verdict payload.
   *
   * @param requestDetails  what the app asked for
   * @param appIntegrity    app recognition verdict
   * @param deviceIntegrity device recognition verdict
   * @param accountDetails  licensing verdict
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TokenPayload(
      @JsonProperty("requestDetails") RequestDetails requestDetails,
      @JsonProperty("appIntegrity") AppIntegrity appIntegrity,
      @JsonProperty("deviceIntegrity") DeviceIntegrity deviceIntegrity,
      @JsonProperty("accountDetails") AccountDetails accountDetails) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RequestDetails(
      @JsonProperty("requestPackageName") String requestPackageName,
      @JsonProperty("nonce") String nonce,
      @JsonProperty("timestampMillis") long timestampMillis) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AppIntegrity(
      @JsonProperty("appRecognitionVerdict") String appRecognitionVerdict,
      @JsonProperty("packageName") String packageName,
      @JsonProperty("certificateSha256Digest") List<String> certificateSha256Digest,
      @JsonProperty("versionCode") long versionCode) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DeviceIntegrity(
      @JsonProperty("deviceRecognitionVerdict") List<String> deviceRecognitionVerdict) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AccountDetails(
      @JsonProperty("appLicensingVerdict") String appLicensingVerdict) {
  }
}
