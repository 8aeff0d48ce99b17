package com.github.statekeeper;

import com.github.statekeeper.SnapshotStoreConfiguration.SnapshotStoreConfigurationBuilder;
import com.github.statekeeper.StateKeeperException.Code;

/**
 * A plain-text buffer with a selection and a clipboard. Edits replace the current selection and
 * leave the caret right after the inserted text.
 *
 * Undo/redo is explicit: call {@link #checkpoint()} before an edit that should be undoable.
 */
public final class TextEditor implements Originator<EditorState> {
  private String content = "";
  private int selectionStart;
  private int selectionEnd;
  private String clipboard = "";

  private final SnapshotStore<EditorState> history;

  public TextEditor() throws StateKeeperException {
    this(SnapshotStoreConfigurationBuilder.newBuilder().build());
  }

  public TextEditor(final SnapshotStoreConfiguration config) throws StateKeeperException {
    this.history = new SnapshotStore<>(this, config);
  }

  public void insert(final String text) {
    final String inserted = text == null ? "" : text;
    content = content.substring(0, selectionStart) + inserted + content.substring(selectionEnd);
    final int caret = selectionStart + inserted.length();
    selectionStart = caret;
    selectionEnd = caret;
  }

  public void select(final int start, final int end) throws StateKeeperException {
    if (start < 0 || end < start || end > content.length()) {
      throw new StateKeeperException(Code.INVALID_EDIT, String.format(
          "Selection [%d, %d) is outside of [0, %d]", start, end, content.length()));
    }
    selectionStart = start;
    selectionEnd = end;
  }

  public void copy() {
    clipboard = content.substring(selectionStart, selectionEnd);
  }

  public void paste() {
    insert(clipboard);
  }

  public void delete() {
    insert("");
  }

  public void checkpoint() throws StateKeeperException {
    history.save();
  }

  public boolean undo() throws StateKeeperException {
    return history.undoAndRestore();
  }

  public boolean redo() throws StateKeeperException {
    return history.redoAndRestore();
  }

  public String getText() {
    return content;
  }

  public String getSelectedText() {
    return content.substring(selectionStart, selectionEnd);
  }

  public String getClipboard() {
    return clipboard;
  }

  public SnapshotStoreStatistics getHistoryStats() {
    return history.stats();
  }

  @Override
  public EditorState captureState() {
    return new EditorState(content, selectionStart, selectionEnd, clipboard);
  }

  @Override
  public void restoreState(final EditorState state) {
    content = state.getContent();
    selectionStart = state.getSelectionStart();
    selectionEnd = state.getSelectionEnd();
    clipboard = state.getClipboard();
  }
}
