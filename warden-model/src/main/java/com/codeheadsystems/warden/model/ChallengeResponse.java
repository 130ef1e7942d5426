package com.codeheadsystems.warden.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying a freshly issued challenge nonce.
 *
 * @param challenge base64url-encoded nonce; valid once, until it expires
 */
public record ChallengeResponse(@JsonProperty("challenge") String challenge) {
}
