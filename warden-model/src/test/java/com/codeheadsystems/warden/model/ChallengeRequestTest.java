package com.codeheadsystems.warden.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ChallengeRequestTest {

  @Test
  void requiredIdentifier_present_returnsIt() {
    assertThat(new ChallengeRequest("dev-1").requiredIdentifier()).isEqualTo("dev-1");
  }

  @Test
  void requiredIdentifier_blank_throwsIAE() {
    assertThatThrownBy(() -> new ChallengeRequest("  ").requiredIdentifier())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("identifier");
  }

  @Test
  void requiredIdentifier_null_throwsIAE() {
    assertThatThrownBy(() -> new ChallengeRequest(null).requiredIdentifier())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
