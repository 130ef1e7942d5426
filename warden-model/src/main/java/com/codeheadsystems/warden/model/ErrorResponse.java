package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stable error body returned when a request fails attestation or assertion checks.
 *
 * @param error   machine-readable error code, e.g. {@code replay_detected}
 * @param message human-readable description
 */
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
