package com.github.statekeeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.github.statekeeper.StateContextConfiguration.StateContextConfigurationBuilder;

/**
 * A small acceptor over {a, b, c}. A word is accepted iff reading it reaches
 * {@link AutomatonState#FINAL_C} without hitting an invalid symbol first. Symbols after the final
 * state are not read.
 *
 * Self-loops (A on 'a', B on 'b') are accepted without a state change, so they leave no
 * transition record. Every {@link #run(String)} starts over from {@link AutomatonState#INITIAL}.
 */
public final class Automaton extends StateContext<AutomatonState> {
  private final List<Character> inputHistory = new ArrayList<>();

  public Automaton() throws StateKeeperException {
    this(StateContextConfigurationBuilder.newBuilder().build());
  }

  public Automaton(final StateContextConfiguration config) throws StateKeeperException {
    super(UUID.randomUUID().toString(), AutomatonState.INITIAL, config);
  }

  /**
   * Convenience for running a word through a fresh automaton.
   */
  public static boolean accepts(final String input) throws StateKeeperException {
    return new Automaton().run(input);
  }

  public TransitionResult feed(final char symbol) throws StateKeeperException {
    inputHistory.add(symbol);
    return getCurrentState().process(symbol, this);
  }

  /**
   * Start over from the initial state and feed the word symbol by symbol. Stops at the first
   * rejected symbol or once the final state is reached. Returns true iff the automaton ends in its
   * final state.
   */
  public boolean run(final String input) throws StateKeeperException {
    inputHistory.clear();
    reset(AutomatonState.INITIAL);
    logInfo("Reading input \"" + input + "\"");
    for (int index = 0; index < input.length(); index++) {
      final TransitionResult result = feed(input.charAt(index));
      if (!result.isAccepted()) {
        logInfo("Input rejected at position " + index);
        return false;
      }
      if (getCurrentState().isTerminal()) {
        break;
      }
    }
    final boolean accepted = getCurrentState().isTerminal();
    logInfo("Input " + (accepted ? "accepted" : "rejected"));
    return accepted;
  }

  public List<Character> getInputHistory() {
    return Collections.unmodifiableList(new ArrayList<>(inputHistory));
  }
}
