package com.codeheadsystems.warden.server.model;

import java.util.Locale;

/**
 * Mobile platform that produced a piece of attestation evidence.
 * <p>
 * A closed set: anything the server does not recognize is {@link #UNSPECIFIED} and is rejected
 * by the attestation flow as an unsupported platform.
 */
public enum Platform {
  UNSPECIFIED,
  IOS,
  ANDROID;

  /**
   * Parses the platform name sent by clients. Accepts {@code ios}/{@code apple} and
   * {@code android}/{@code google}, case-insensitively.
   *
   * @param name the platform name, may be null
   * @return the platform, or {@link #UNSPECIFIED} when the name is not recognized
   */
  public static Platform fromName(String name) {
    if (name == null) {
      return UNSPECIFIED;
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "ios", "apple" -> IOS;
      case "android", "google" -> ANDROID;
      default -> UNSPECIFIED;
    };
  }
}
