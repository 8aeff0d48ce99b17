package com.github.statekeeper;

/**
 * Unified single exception that's thrown by snapshot stores and state contexts. The idea is to use
 * the code enum to encapsulate the various contract violations. Note that domain rejections (an
 * illegal transition, an undo with nothing to undo) are never reported via this exception, they
 * come back as results.
 */
public final class StateKeeperException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateKeeperException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateKeeperException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateKeeperException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNSERIALIZABLE_STATE(
        "State contains a cycle or a value type that cannot be deep-copied into a snapshot"),
    // 2.
    INVALID_STATE("Null state is invalid"),
    // 3.
    INVALID_CONFIG("Configuration is invalid"),
    // 4.
    INVALID_COLLABORATOR("Collaborator cannot be null"),
    // 5.
    INVALID_EDIT("Requested edit falls outside the bounds of the document");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
