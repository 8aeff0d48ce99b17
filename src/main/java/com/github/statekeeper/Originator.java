package com.github.statekeeper;

/**
 * The owner whose state a {@link SnapshotStore} captures and restores. The store never looks inside
 * the state; it only deep-copies it.
 */
public interface Originator<S> {

  /**
   * Report the current state. The store takes its own copy, so returning a live reference is fine.
   */
  S captureState();

  /**
   * Replace the current state wholesale with the given one.
   */
  void restoreState(final S state);

}
