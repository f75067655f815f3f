package io.lacuna.automata;

import java.util.List;

/**
 * Signals that an operation on an {@link Automaton} could not be completed.  The automaton it was invoked on is
 * left unchanged.
 */
public class AutomatonException extends RuntimeException {

  public enum Kind {
    /** a referenced target state is not a member of the state set */
    UNKNOWN_STATE,
    /** a state or symbol named by a strict operation does not exist */
    UNKNOWN_SYMBOL_OR_STATE,
    /** the operation is only defined for deterministic automata */
    NON_DETERMINISTIC,
    /** the operands are defined over different alphabets */
    ALPHABET_MISMATCH,
    /** there are too many states for the requested naming scheme */
    CAPACITY_EXCEEDED
  }

  private final Kind kind;
  private final List<String> names;

  AutomatonException(Kind kind, List<String> names, String message) {
    super(message);
    this.kind = kind;
    this.names = List.copyOf(names);
  }

  static AutomatonException unknownStates(List<String> states) {
    return new AutomatonException(Kind.UNKNOWN_STATE, states, "state(s) " + String.join(", ", states) + " do not exist");
  }

  static AutomatonException unknownState(String state) {
    return new AutomatonException(Kind.UNKNOWN_SYMBOL_OR_STATE, List.of(state), "state " + state + " does not exist");
  }

  static AutomatonException unknownSymbol(String symbol) {
    return new AutomatonException(Kind.UNKNOWN_SYMBOL_OR_STATE, List.of(symbol), "symbol " + symbol + " does not exist");
  }

  static AutomatonException nonDeterministic() {
    return new AutomatonException(Kind.NON_DETERMINISTIC, List.of(), "automaton is non-deterministic");
  }

  static AutomatonException alphabetMismatch(List<String> a, List<String> b) {
    return new AutomatonException(Kind.ALPHABET_MISMATCH, List.of(), "alphabets differ: " + a + " vs " + b);
  }

  static AutomatonException capacityExceeded(long states, int capacity) {
    return new AutomatonException(
            Kind.CAPACITY_EXCEEDED,
            List.of(),
            "cannot give " + states + " states alphabetic names, at most " + capacity + " are supported");
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @return the states or symbols which caused the failure, if any
   */
  public List<String> names() {
    return names;
  }
}
