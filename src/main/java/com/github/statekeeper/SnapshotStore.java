package com.github.statekeeper;

import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statekeeper.SnapshotStoreConfiguration.SnapshotStoreConfigurationBuilder;
import com.github.statekeeper.StateKeeperException.Code;

/**
 * Undo/redo over an opaque state value belonging to one {@link Originator}.
 *
 * Notes for users:<br>
 * 1. a store belongs to exactly one owner. It is not thread-safe, operations on one owner have to
 * be issued by one logical actor in order. Separate owners with separate stores share nothing and
 * can run on separate threads.<br>
 *
 * 2. every snapshot is a deep copy taken via {@link StateCloner}. States holding cycles or types
 * outside the supported set are rejected loudly at save time.<br>
 *
 * 3. {@link #save(Object)} always invalidates the redo stack. Branching history is not
 * supported.<br>
 *
 * 4. an undo or redo with nothing to undo or redo is a no-op returning an empty Optional. It never
 * throws and never touches the other stack.<br>
 *
 * 5. both stacks are bounded by {@link SnapshotStoreConfiguration#getMaxDepth()}. Overflow evicts
 * the oldest snapshot.<br>
 */
public final class SnapshotStore<S> {
  private static final Logger logger = LogManager.getLogger(SnapshotStore.class.getSimpleName());

  private final String storeId = UUID.randomUUID().toString();

  private final Originator<S> owner;
  private final SnapshotStoreConfiguration config;

  private final BoundedHistory<Snapshot<S>> undoStack;
  private final BoundedHistory<Snapshot<S>> redoStack;

  private long totalSaves;
  private long totalUndos;
  private long totalRedos;
  private long totalEvictions;

  public SnapshotStore(final Originator<S> owner) throws StateKeeperException {
    this(owner, SnapshotStoreConfigurationBuilder.newBuilder().build());
  }

  public SnapshotStore(final Originator<S> owner, final SnapshotStoreConfiguration config)
      throws StateKeeperException {
    if (owner == null) {
      throw new StateKeeperException(Code.INVALID_COLLABORATOR, "Snapshot owner cannot be null");
    }
    if (config == null) {
      throw new StateKeeperException(Code.INVALID_CONFIG, "Snapshot store config cannot be null");
    }
    this.owner = owner;
    this.config = config;
    this.undoStack = new BoundedHistory<>(config.getMaxDepth());
    this.redoStack = new BoundedHistory<>(config.getMaxDepth());
    logInfo(storeId, "Created snapshot store with " + config);
  }

  /**
   * Deep-copy the given state into a new snapshot without touching either stack. A null state
   * cannot be restored and is refused with {@link Code#INVALID_STATE}.
   */
  public Snapshot<S> capture(final S state) throws StateKeeperException {
    if (state == null) {
      throw new StateKeeperException(Code.INVALID_STATE, "Cannot snapshot a null state");
    }
    return new Snapshot<>(StateCloner.deepCopy(state));
  }

  /**
   * Capture the owner's current state and push it onto the undo stack.
   */
  public void save() throws StateKeeperException {
    save(owner.captureState());
  }

  /**
   * Capture the given state, push it onto the undo stack and discard the redo stack.
   */
  public void save(final S state) throws StateKeeperException {
    final Snapshot<S> snapshot = capture(state);
    push(undoStack, snapshot, "undo");
    if (!redoStack.isEmpty()) {
      logDebug(storeId, "Discarding " + redoStack.size() + " redo snapshots");
      redoStack.clear();
    }
    totalSaves++;
    logDebug(storeId, "Saved " + snapshot);
  }

  /**
   * Pop the newest snapshot off the undo stack for the caller to apply. The owner's current state
   * is captured onto the redo stack first. Returns empty when there is nothing to undo.
   */
  public Optional<Snapshot<S>> undo() throws StateKeeperException {
    if (undoStack.isEmpty()) {
      logDebug(storeId, "Nothing to undo");
      return Optional.empty();
    }
    // capture before popping so that a failed capture leaves both stacks untouched
    final Snapshot<S> current = capture(owner.captureState());
    final Optional<Snapshot<S>> previous = undoStack.pop();
    push(redoStack, current, "redo");
    totalUndos++;
    logDebug(storeId, "Undo to " + previous.get());
    return previous;
  }

  /**
   * Pop the newest snapshot off the redo stack for the caller to apply. The owner's current state
   * is captured onto the undo stack first. Returns empty when there is nothing to redo.
   */
  public Optional<Snapshot<S>> redo() throws StateKeeperException {
    if (redoStack.isEmpty()) {
      logDebug(storeId, "Nothing to redo");
      return Optional.empty();
    }
    final Snapshot<S> current = capture(owner.captureState());
    final Optional<Snapshot<S>> next = redoStack.pop();
    push(undoStack, current, "undo");
    totalRedos++;
    logDebug(storeId, "Redo to " + next.get());
    return next;
  }

  /**
   * {@link #undo()} and apply the popped snapshot to the owner. Returns true iff something was
   * undone.
   */
  public boolean undoAndRestore() throws StateKeeperException {
    final Optional<Snapshot<S>> snapshot = undo();
    if (snapshot.isPresent()) {
      owner.restoreState(snapshot.get().getState());
      return true;
    }
    return false;
  }

  /**
   * {@link #redo()} and apply the popped snapshot to the owner. Returns true iff something was
   * redone.
   */
  public boolean redoAndRestore() throws StateKeeperException {
    final Optional<Snapshot<S>> snapshot = redo();
    if (snapshot.isPresent()) {
      owner.restoreState(snapshot.get().getState());
      return true;
    }
    return false;
  }

  public boolean canUndo() {
    return !undoStack.isEmpty();
  }

  public boolean canRedo() {
    return !redoStack.isEmpty();
  }

  /**
   * Drop every snapshot from both stacks. Counters are kept.
   */
  public void clear() {
    undoStack.clear();
    redoStack.clear();
    logInfo(storeId, "Cleared undo and redo stacks");
  }

  public SnapshotStoreStatistics stats() {
    return new SnapshotStoreStatistics(storeId, undoStack.size(), redoStack.size(), totalSaves,
        totalUndos, totalRedos, totalEvictions);
  }

  public String getId() {
    return storeId;
  }

  public SnapshotStoreConfiguration getConfiguration() {
    return config;
  }

  private void push(final BoundedHistory<Snapshot<S>> stack, final Snapshot<S> snapshot,
      final String stackName) throws StateKeeperException {
    final Optional<Snapshot<S>> evicted = stack.push(snapshot);
    if (evicted.isPresent()) {
      totalEvictions++;
      logWarning(storeId, String.format("%s stack is full at %d, evicted oldest %s", stackName,
          stack.getMaxDepth(), evicted.get()));
    }
  }

  private static void logWarning(final String storeId, final String message) {
    logger.warn(new StringBuilder().append("[s:").append(storeId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String storeId, final String message) {
    logger.info(new StringBuilder().append("[s:").append(storeId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String storeId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[s:").append(storeId).append("] ").append(message)
          .toString());
    }
  }

}
