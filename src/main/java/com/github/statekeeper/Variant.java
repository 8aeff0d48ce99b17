package com.github.statekeeper;

/**
 * One member of a closed set of named behaviors that a {@link StateContext} can be in. Variants are
 * stateless; everything mutable lives in the context. Enums are the natural way to implement
 * this.
 */
public interface Variant {

  String getName();

  /**
   * Terminal variants end the regular flow. Some of them may still accept compensating events, e.g.
   * returning a delivered order.
   */
  boolean isTerminal();

}
