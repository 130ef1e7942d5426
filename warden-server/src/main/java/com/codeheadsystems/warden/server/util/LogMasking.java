package com.codeheadsystems.warden.server.util;

/**
 * Masks device identifiers before they reach the logs.
 */
public final class LogMasking {

  private LogMasking() {
  }

  /**
   * Keeps the first and last four characters of longer values.
   *
   * @param value the value to mask, may be null
   * @return {@code abcd***wxyz}, or {@code ***} for values of eight characters or fewer
   */
  public static String mask(String value) {
    if (value == null || value.length() <= 8) {
      return "***";
    }
    return value.substring(0, 4) + "***" + value.substring(value.length() - 4);
  }
}
