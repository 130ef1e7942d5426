package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for a per-request assertion made with a previously attested device key.
 * <p>
 * Used by: {@code POST /attestation/assert}
 *
 * @param assertion        base64-encoded assertion produced by the device key
 * @param clientDataBase64 base64-encoded request-bound data the assertion signs
 * @param keyId            key identifier registered during attestation
 */
public record AssertionRequest(
    @JsonProperty("assertion") String assertion,
    @JsonProperty("clientData") String clientDataBase64,
    @JsonProperty("keyId") String keyId) {

  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Decodes the client data.
   *
   * @return the raw client data bytes
   * @throws IllegalArgumentException if the field is missing or not valid base64
   */
  public byte[] clientData() {
    if (clientDataBase64 == null || clientDataBase64.isBlank()) {
      throw new IllegalArgumentException("Missing required field: clientData");
    }
    try {
      return B64D.decode(clientDataBase64);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: clientData", e);
    }
  }
}
