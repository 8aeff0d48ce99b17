package com.github.statekeeper;

/**
 * Everything a {@link TextEditor} needs to restore itself: content, selection and clipboard.
 */
public final class EditorState implements Copyable<EditorState> {
  private final String content;
  private final int selectionStart;
  private final int selectionEnd;
  private final String clipboard;

  public EditorState(final String content, final int selectionStart, final int selectionEnd,
      final String clipboard) {
    this.content = content;
    this.selectionStart = selectionStart;
    this.selectionEnd = selectionEnd;
    this.clipboard = clipboard;
  }

  @Override
  public EditorState copy() {
    return new EditorState(content, selectionStart, selectionEnd, clipboard);
  }

  public String getContent() {
    return content;
  }

  public int getSelectionStart() {
    return selectionStart;
  }

  public int getSelectionEnd() {
    return selectionEnd;
  }

  public String getClipboard() {
    return clipboard;
  }

  @Override
  public String toString() {
    return "EditorState [content=" + content + ", selectionStart=" + selectionStart
        + ", selectionEnd=" + selectionEnd + ", clipboard=" + clipboard + "]";
  }
}
