package com.github.statekeeper;

import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statekeeper.StateKeeperException.Code;

/**
 * The owner of a current {@link Variant} out of a closed set, plus the history of every accepted
 * change to it.
 *
 * Notes for implementors:<br>
 * 1. {@link #setState(Variant)} is the only transition of the current variant and always appends
 * exactly one {@link TransitionRecord}. {@link #reset(Variant)} starts over without a record.<br>
 *
 * 2. events are delegated to the current variant, which answers with {@link #accept} or
 * {@link #reject}. A rejection is logged and returned; it never throws and never touches the
 * history.<br>
 *
 * 3. the initial variant is assigned at construction and is not recorded as a transition.<br>
 *
 * 4. a context is not thread-safe. One logical actor drives one context; distinct contexts share
 * nothing and may live on distinct threads.<br>
 */
public abstract class StateContext<V extends Variant> {
  private static final Logger logger = LogManager.getLogger(StateContext.class.getSimpleName());

  private final String contextId;
  private final StateContextConfiguration config;
  private final BoundedHistory<TransitionRecord> history;
  private final ContextStatistics contextStats;

  private V currentState;
  private long transitionCount;

  protected StateContext(final String contextId, final V initialState,
      final StateContextConfiguration config) throws StateKeeperException {
    if (initialState == null) {
      throw new StateKeeperException(Code.INVALID_STATE, "Initial state cannot be null");
    }
    if (config == null) {
      throw new StateKeeperException(Code.INVALID_CONFIG, "Context config cannot be null");
    }
    this.contextId = contextId;
    this.config = config;
    this.history = new BoundedHistory<>(config.getMaxHistoryDepth());
    this.contextStats = new ContextStatistics();
    this.contextStats.contextId = contextId;
    this.currentState = initialState;
    touch();
    logInfo(contextId, "Created context in state " + initialState.getName());
  }

  /**
   * Swap the current variant and record the change.
   */
  public void setState(final V nextState) throws StateKeeperException {
    if (nextState == null) {
      throw new StateKeeperException(Code.INVALID_STATE);
    }
    final String from = currentState.getName();
    currentState = nextState;
    transitionCount++;
    contextStats.acceptedTransitions++;
    touch();
    final Optional<TransitionRecord> evicted =
        history.push(new TransitionRecord(from, nextState.getName(), System.currentTimeMillis()));
    if (evicted.isPresent()) {
      contextStats.evictedRecords++;
      logDebug(contextId, "Evicted oldest transition record " + evicted.get());
    }
    logInfo(contextId, String.format("Transitioned %s->%s", from, nextState.getName()));
  }

  public V getCurrentState() {
    return currentState;
  }

  /**
   * Retained transition records, oldest first. At most
   * {@link StateContextConfiguration#getMaxHistoryDepth()} entries.
   */
  public List<TransitionRecord> getHistory() {
    return history.toList();
  }

  /**
   * Total accepted transitions over the lifetime of this context, including the ones whose records
   * have since been evicted.
   */
  public long getTransitionCount() {
    return transitionCount;
  }

  public String getContextId() {
    return contextId;
  }

  public StateContextConfiguration getConfiguration() {
    return config;
  }

  public ContextStatistics getStatistics() {
    return contextStats;
  }

  /**
   * Move to the given variant on behalf of the current one and report it as accepted.
   */
  protected TransitionResult accept(final V nextState, final String description)
      throws StateKeeperException {
    final String from = currentState.getName();
    logInfo(contextId, description);
    setState(nextState);
    return TransitionResult.accepted(from, nextState.getName(), description);
  }

  /**
   * Accept an event that keeps the current variant. Nothing is recorded since nothing changed.
   */
  protected TransitionResult stay(final String description) {
    final String current = currentState.getName();
    touch();
    logInfo(contextId, description);
    return TransitionResult.accepted(current, current, description);
  }

  /**
   * Drop the retained history and start over from the given variant without recording it. The
   * lifetime transition count is kept.
   */
  protected void reset(final V initialState) throws StateKeeperException {
    if (initialState == null) {
      throw new StateKeeperException(Code.INVALID_STATE, "Initial state cannot be null");
    }
    history.clear();
    currentState = initialState;
    touch();
    logInfo(contextId, "Reset to state " + initialState.getName());
  }

  /**
   * Decline an event in the current variant. Nothing but the statistics changes.
   */
  protected TransitionResult reject(final String description) {
    contextStats.rejectedRequests++;
    touch();
    logInfo(contextId, String.format("Rejected in state %s: %s", currentState.getName(),
        description));
    return TransitionResult.rejected(currentState.getName(), description);
  }

  protected void logInfo(final String message) {
    logInfo(contextId, message);
  }

  private void touch() {
    contextStats.lastTouchTimeMillis = System.currentTimeMillis();
  }

  private static void logInfo(final String contextId, final String message) {
    logger.info(new StringBuilder().append("[c:").append(contextId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String contextId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[c:").append(contextId).append("] ")
          .append(message).toString());
    }
  }

}
