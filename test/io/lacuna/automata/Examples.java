package io.lacuna.automata;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

/**
 * Small automata shared between tests.
 */
final class Examples {

  private Examples() {
  }

  /**
   * words over {0, 1} ending in 0, non-deterministically
   */
  static Automaton endsInZero() {
    return new Automaton()
            .addState("q0")
            .addState("q1")
            .addSymbol("0")
            .addSymbol("1")
            .toggleFinalState("q1")
            .setTransition("q0", "0", "q0", "q1")
            .setTransition("q0", "1", "q0");
  }

  /**
   * words over {0, 1} whose second to last symbol is 1
   */
  static Automaton secondToLastIsOne() {
    return new Automaton()
            .addState("p")
            .addState("q")
            .addState("r")
            .addSymbol("0")
            .addSymbol("1")
            .toggleFinalState("r")
            .setTransition("p", "0", "p")
            .setTransition("p", "1", "p", "q")
            .setTransition("q", "0", "r")
            .setTransition("q", "1", "r");
  }

  /**
   * words over {0, 1} starting with 1
   */
  static Automaton startsWithOne() {
    return new Automaton()
            .addState("s")
            .addState("t")
            .addSymbol("0")
            .addSymbol("1")
            .toggleFinalState("t")
            .setTransition("s", "1", "t")
            .setTransition("t", "0", "t")
            .setTransition("t", "1", "t");
  }

  /**
   * words over {0, 1} of even length
   */
  static Automaton evenLength() {
    return new Automaton()
            .addState("even")
            .addState("odd")
            .addSymbol("0")
            .addSymbol("1")
            .toggleFinalState("even")
            .setTransition("even", "0", "odd")
            .setTransition("even", "1", "odd")
            .setTransition("odd", "0", "even")
            .setTransition("odd", "1", "even");
  }

  static RegularGrammar grammar(String initialSymbol, IMap<String, ISet<String>> productions) {
    return new RegularGrammar() {
      @Override
      public String initialSymbol() {
        return initialSymbol;
      }

      @Override
      public IMap<String, ISet<String>> productions() {
        return productions;
      }
    };
  }

  static ISet<String> set(String... values) {
    return LinearSet.of(values);
  }
}
