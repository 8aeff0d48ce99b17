package com.github.statekeeper;

/**
 * Implemented by user value types that want to live inside a snapshot. {@link StateCloner} calls
 * {@link #copy()} instead of trying to take the object apart structurally.
 *
 * Implementations must return an instance that shares no mutable state with the receiver. Nested
 * mutable members can be copied via {@link StateCloner#deepCopy(Object)}.
 */
public interface Copyable<T> {

  T copy() throws StateKeeperException;

}
