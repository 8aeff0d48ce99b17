package com.github.statekeeper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An originator over a flat map of named values. Values themselves may be nested lists, maps,
 * dates and so on, as long as {@link StateCloner} can copy them.
 *
 * Pair it with a {@link SnapshotStore} to get undo/redo.
 */
public final class KeyValueDocument implements Originator<Map<String, Object>> {
  private Map<String, Object> state = new LinkedHashMap<>();

  public KeyValueDocument() {}

  public KeyValueDocument(final Map<String, Object> initialState) {
    if (initialState != null) {
      state.putAll(initialState);
    }
  }

  /**
   * Shallow merge: every key in the partial overwrites the current value, other keys are kept.
   */
  public void merge(final Map<String, Object> partial) {
    if (partial != null) {
      state.putAll(partial);
    }
  }

  public void put(final String key, final Object value) {
    state.put(key, value);
  }

  public Object get(final String key) {
    return state.get(key);
  }

  public Object remove(final String key) {
    return state.remove(key);
  }

  public Map<String, Object> view() {
    return Collections.unmodifiableMap(state);
  }

  @Override
  public Map<String, Object> captureState() {
    return state;
  }

  @Override
  public void restoreState(final Map<String, Object> restored) {
    state = new LinkedHashMap<>(restored);
  }

  @Override
  public String toString() {
    return "KeyValueDocument " + state;
  }
}
