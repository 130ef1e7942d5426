package com.codeheadsystems.warden.server.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caller-supplied point in time by which a verification must finish.
 */
public final class Deadline {

  private final Clock clock;
  private final Instant expiresAt;

  private Deadline(Clock clock, Instant expiresAt) {
    this.clock = clock;
    this.expiresAt = expiresAt;
  }

  public static Deadline after(Duration timeout) {
    return after(timeout, Clock.systemUTC());
  }

  public static Deadline after(Duration timeout, Clock clock) {
    return new Deadline(clock, clock.instant().plus(timeout));
  }

  public static Deadline at(Instant expiresAt, Clock clock) {
    return new Deadline(clock, expiresAt);
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  /**
   * Time left before the deadline.
   *
   * @return the remaining time, never negative
   */
  public Duration remaining() {
    Duration remaining = Duration.between(clock.instant(), expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  @Override
  public String toString() {
    return "Deadline{expiresAt=" + expiresAt + '}';
  }
}
