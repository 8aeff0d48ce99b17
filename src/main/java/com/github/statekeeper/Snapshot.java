package com.github.statekeeper;

import java.util.UUID;

/**
 * Immutable deep copy of an owner's state at one instant. Only a {@link SnapshotStore} creates
 * these.
 */
public final class Snapshot<S> {
  // auto-generated
  private final String id = UUID.randomUUID().toString();
  private final long createdMillis = System.currentTimeMillis();

  // already a private copy, never handed out directly
  private final S state;

  Snapshot(final S state) {
    this.state = state;
  }

  public String getId() {
    return id;
  }

  public long getCreatedMillis() {
    return createdMillis;
  }

  /**
   * Returns a fresh deep copy of the captured state on every call, so callers are free to mutate
   * what they get back.
   */
  public S getState() throws StateKeeperException {
    return StateCloner.deepCopy(state);
  }

  @Override
  public String toString() {
    return "Snapshot [id=" + id + ", createdMillis=" + createdMillis + "]";
  }
}
