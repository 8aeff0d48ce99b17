package com.github.statekeeper;

/**
 * States of an {@link Automaton} reading symbols from the alphabet {a, b, c}.
 *
 * INITIAL: a->A, b->B<br>
 * A: a->A, b->B, c->FINAL_C<br>
 * B: a->A, b->B, c->FINAL_C<br>
 * FINAL_C: rejects everything<br>
 */
public enum AutomatonState implements Variant {
  INITIAL("Initial", false) {
    @Override
    TransitionResult process(final char symbol, final Automaton automaton)
        throws StateKeeperException {
      switch (symbol) {
        case 'a':
          return automaton.accept(A, "Read 'a', moving to A");
        case 'b':
          return automaton.accept(B, "Read 'b', moving to B");
        default:
          return invalidSymbol(symbol, automaton);
      }
    }
  },

  A("A", false) {
    @Override
    TransitionResult process(final char symbol, final Automaton automaton)
        throws StateKeeperException {
      switch (symbol) {
        case 'a':
          return automaton.stay("Read 'a', staying in A");
        case 'b':
          return automaton.accept(B, "Read 'b', moving to B");
        case 'c':
          return automaton.accept(FINAL_C, "Read 'c', moving to final state C");
        default:
          return invalidSymbol(symbol, automaton);
      }
    }
  },

  B("B", false) {
    @Override
    TransitionResult process(final char symbol, final Automaton automaton)
        throws StateKeeperException {
      switch (symbol) {
        case 'a':
          return automaton.accept(A, "Read 'a', moving to A");
        case 'b':
          return automaton.stay("Read 'b', staying in B");
        case 'c':
          return automaton.accept(FINAL_C, "Read 'c', moving to final state C");
        default:
          return invalidSymbol(symbol, automaton);
      }
    }
  },

  FINAL_C("FinalC", true) {
    @Override
    TransitionResult process(final char symbol, final Automaton automaton) {
      return automaton.reject("Final state reached, ignoring '" + symbol + "'");
    }
  };

  private final String name;
  private final boolean terminal;

  private AutomatonState(final String name, final boolean terminal) {
    this.name = name;
    this.terminal = terminal;
  }

  abstract TransitionResult process(final char symbol, final Automaton automaton)
      throws StateKeeperException;

  private static TransitionResult invalidSymbol(final char symbol, final Automaton automaton) {
    return automaton.reject("Invalid symbol '" + symbol + "'");
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean isTerminal() {
    return terminal;
  }
}
