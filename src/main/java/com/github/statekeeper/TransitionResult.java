package com.github.statekeeper;

import java.util.Optional;

/**
 * This object encapsulates the outcome of delivering an event to a {@link StateContext}.
 *
 * Accepted events carry the name of the variant the context moved to. Rejected events leave the
 * context where it was, report an empty {@link #getTo()} and typically explain themselves in
 * {@link #description}. A rejection is a normal outcome, not an error.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final boolean accepted;
  private final String from;
  private final String to;
  private final String description;

  private TransitionResult(final boolean accepted, final String from, final String to,
      final String description) {
    this.accepted = accepted;
    this.from = from;
    this.to = to;
    this.description = description;
  }

  public static TransitionResult accepted(final String from, final String to,
      final String description) {
    return new TransitionResult(true, from, to, description);
  }

  public static TransitionResult rejected(final String from, final String description) {
    return new TransitionResult(false, from, null, description);
  }

  public boolean isAccepted() {
    return accepted;
  }

  public String getFrom() {
    return from;
  }

  public Optional<String> getTo() {
    return Optional.ofNullable(to);
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "TransitionResult [accepted=" + accepted + ", from=" + from + ", to=" + to
        + ", description=" + description + "]";
  }
}
