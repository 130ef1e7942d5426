package com.codeheadsystems.warden.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.server.config.AttestationConfig;
import com.codeheadsystems.warden.server.config.ReRegistrationPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class WardenConfigurationTest {

  @Test
  void defaults_translateToDisabledAttestation() {
    AttestationConfig config = new WardenConfiguration().toAttestationConfig().validate();

    assertThat(config.enabled()).isFalse();
    assertThat(config.challengeTimeout()).isEqualTo(Duration.ofMinutes(5));
    assertThat(config.allowedClockSkew()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.verificationTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.reRegistrationPolicy()).isEqualTo(ReRegistrationPolicy.REJECT);
  }

  @Test
  void defaults_capOutstandingChallenges() {
    assertThat(new WardenConfiguration().getMaxOutstandingChallenges()).isEqualTo(100_000);
  }

  @Test
  void platformSettings_areCarriedOver() {
    WardenConfiguration configuration = new WardenConfiguration();
    configuration.setEnabled(true);
    configuration.setAndroidPackageName("com.example.app");
    configuration.setRequireStrongIntegrity(true);
    configuration.setChallengeTimeoutSeconds(60);
    configuration.setReRegistrationPolicy(ReRegistrationPolicy.REPLACE);

    AttestationConfig config = configuration.toAttestationConfig().validate();

    assertThat(config.androidEnabled()).isTrue();
    assertThat(config.iosEnabled()).isFalse();
    assertThat(config.requireStrongIntegrity()).isTrue();
    assertThat(config.challengeTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.reRegistrationPolicy()).isEqualTo(ReRegistrationPolicy.REPLACE);
  }
}
