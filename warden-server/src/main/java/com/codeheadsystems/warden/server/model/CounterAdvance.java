package com.codeheadsystems.warden.server.model;

/**
 * Outcome of an attempt to advance a device key's replay counter.
 *
 * @param status  what happened
 * @param counter the stored counter after the call; only meaningful when accepted
 */
public record CounterAdvance(Status status, long counter) {

  private static final CounterAdvance REPLAY = new CounterAdvance(Status.REPLAY_REJECTED, -1);
  private static final CounterAdvance MISSING = new CounterAdvance(Status.NOT_FOUND, -1);

  public static CounterAdvance accepted(long newCounter) {
    return new CounterAdvance(Status.ACCEPTED, newCounter);
  }

  public static CounterAdvance replayRejected() {
    return REPLAY;
  }

  public static CounterAdvance notFound() {
    return MISSING;
  }

  public boolean isAccepted() {
    return status == Status.ACCEPTED;
  }

  /**
   * Counter advance status.
   */
  public enum Status {
    ACCEPTED,
    REPLAY_REJECTED,
    NOT_FOUND
  }
}
