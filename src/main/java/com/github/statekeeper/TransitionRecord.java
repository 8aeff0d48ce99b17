package com.github.statekeeper;

/**
 * Append-only log entry describing one accepted state change.
 */
public final class TransitionRecord {
  private final String from;
  private final String to;
  private final long timestampMillis;

  TransitionRecord(final String from, final String to, final long timestampMillis) {
    this.from = from;
    this.to = to;
    this.timestampMillis = timestampMillis;
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  @Override
  public String toString() {
    return "TransitionRecord [from=" + from + ", to=" + to + ", timestampMillis="
        + timestampMillis + "]";
  }
}
