package io.lacuna.automata;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;

/**
 * A right-linear grammar, as consumed by {@link Automaton#fromGrammar(RegularGrammar)}.  Each production is either
 * {@link #EMPTY}, a single terminal, or a terminal followed by a non-terminal.
 */
public interface RegularGrammar {

  /** the production of the empty word */
  String EMPTY = "&";

  String initialSymbol();

  /**
   * @return a map of each non-terminal onto its productions
   */
  IMap<String, ISet<String>> productions();
}
