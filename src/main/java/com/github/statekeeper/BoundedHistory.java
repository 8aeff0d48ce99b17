package com.github.statekeeper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import com.github.statekeeper.StateKeeperException.Code;

/**
 * A reversible mutation log with a fixed upper bound. Entries are pushed and popped at the newest
 * end; once the log is full, every push evicts the oldest entry and hands it back to the caller.
 *
 * Both the undo/redo stacks of a {@link SnapshotStore} and the transition history of a
 * {@link StateContext} are kept in one of these.
 *
 * Not thread-safe. Owners are expected to confine it to a single logical actor.
 */
public final class BoundedHistory<E> implements Iterable<E> {
  private final int maxDepth;

  // oldest entry at the head, newest at the tail
  private final Deque<E> entries = new ArrayDeque<>();

  public BoundedHistory(final int maxDepth) throws StateKeeperException {
    if (maxDepth <= 0) {
      throw new StateKeeperException(Code.INVALID_CONFIG,
          "History depth must be positive, found " + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  /**
   * Append the entry as the newest one. Returns the evicted oldest entry iff the push overflowed
   * the configured depth.
   */
  public Optional<E> push(final E entry) throws StateKeeperException {
    if (entry == null) {
      throw new StateKeeperException(Code.INVALID_STATE, "Cannot push a null history entry");
    }
    entries.addLast(entry);
    if (entries.size() > maxDepth) {
      return Optional.of(entries.removeFirst());
    }
    return Optional.empty();
  }

  /**
   * Remove and return the newest entry, if any.
   */
  public Optional<E> pop() {
    return Optional.ofNullable(entries.pollLast());
  }

  public Optional<E> peek() {
    return Optional.ofNullable(entries.peekLast());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public void clear() {
    entries.clear();
  }

  /**
   * Copy of all retained entries, oldest first.
   */
  public List<E> toList() {
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }

  /**
   * Iterates oldest to newest. Removal is not supported.
   */
  @Override
  public Iterator<E> iterator() {
    return toList().iterator();
  }

  @Override
  public String toString() {
    return "BoundedHistory [maxDepth=" + maxDepth + ", size=" + entries.size() + "]";
  }
}
