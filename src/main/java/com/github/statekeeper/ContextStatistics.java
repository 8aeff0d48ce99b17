package com.github.statekeeper;

/**
 * Simple statistics holder for a context.
 */
public final class ContextStatistics {
  private final long startMillis = System.currentTimeMillis();
  String contextId;
  long acceptedTransitions;
  long rejectedRequests;
  long evictedRecords;
  // used to track activity level of a context
  long lastTouchTimeMillis;

  public String getContextId() {
    return contextId;
  }

  public long getAcceptedTransitions() {
    return acceptedTransitions;
  }

  public long getRejectedRequests() {
    return rejectedRequests;
  }

  public long getEvictedRecords() {
    return evictedRecords;
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "ContextStatistics [contextId=" + contextId + ", acceptedTransitions="
        + acceptedTransitions + ", rejectedRequests=" + rejectedRequests + ", evictedRecords="
        + evictedRecords + ", lastTouchTimeMillis=" + lastTouchTimeMillis + ", aliveTimeMillis="
        + getAliveTimeMillis() + "]";
  }

}
