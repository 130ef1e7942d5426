package com.codeheadsystems.warden.server.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogMaskingTest {

  @Test
  void mask_longValue_keepsFirstAndLastFour() {
    assertThat(LogMasking.mask("abcdefghijklmnop")).isEqualTo("abcd***mnop");
  }

  @Test
  void mask_nineCharacters_isPartiallyShown() {
    assertThat(LogMasking.mask("123456789")).isEqualTo("1234***6789");
  }

  @Test
  void mask_shortValue_fullyHidden() {
    assertThat(LogMasking.mask("12345678")).isEqualTo("***");
    assertThat(LogMasking.mask("")).isEqualTo("***");
  }

  @Test
  void mask_null_fullyHidden() {
    assertThat(LogMasking.mask(null)).isEqualTo("***");
  }
}
