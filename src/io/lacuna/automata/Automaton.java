package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A mutable finite automaton over textual states and symbols, which may or may not be deterministic.
 * <p>
 * The structural mutators ({@link #addState(String)}, {@link #setTransition(String, String, ISet)}, etc.) modify
 * the automaton and return it.  The derived operations ({@link #determinize()}, {@link #minimize()},
 * {@link #union(Automaton)}, etc.) leave both the automaton and their arguments untouched, and return a new one.
 */
public class Automaton {

  private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

  /** the final state every terminal production of a grammar leads to */
  public static final String GRAMMAR_SINK = "X";

  String initial;
  LinearSet<String> states, alphabet, accept;

  // state -> symbol -> targets, never containing an empty target set or an empty row
  LinearMap<String, LinearMap<String, LinearSet<String>>> transitions;

  public Automaton() {
    this(null, new LinearSet<>(), new LinearSet<>(), new LinearSet<>(), new LinearMap<>());
  }

  private Automaton(
          String initial,
          LinearSet<String> states,
          LinearSet<String> alphabet,
          LinearSet<String> accept,
          LinearMap<String, LinearMap<String, LinearSet<String>>> transitions) {
    this.initial = initial;
    this.states = states;
    this.alphabet = alphabet;
    this.accept = accept;
    this.transitions = transitions;
  }

  /**
   * @return an automaton built from the given collections, with every invariant checked
   */
  public static Automaton of(
          ISet<String> states,
          ISet<String> alphabet,
          String initial,
          ISet<String> finalStates,
          Iterable<Transition> transitions) {

    if (initial == null ? states.size() > 0 : !states.contains(initial)) {
      throw AutomatonException.unknownStates(List.of(String.valueOf(initial)));
    }

    List<String> missing = Utils.sorted(finalStates).stream()
            .filter(s -> !states.contains(s))
            .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw AutomatonException.unknownStates(missing);
    }

    Automaton a = new Automaton(initial, Utils.copy(states), Utils.copy(alphabet), Utils.copy(finalStates), new LinearMap<>());
    for (Transition t : transitions) {
      LinearSet<String> targets = Utils.copy(a.targets(t.source(), t.symbol()));
      t.targets().forEach(targets::add);
      a.setTransition(t.source(), t.symbol(), targets);
    }
    return a;
  }

  /// canned automata

  /**
   * @return an automaton that accepts any word over {@code alphabet}
   */
  public static Automaton any(ISet<String> alphabet) {
    Automaton a = new Automaton().addState("q0").toggleFinalState("q0");
    alphabet.forEach(a::addSymbol);
    alphabet.forEach(symbol -> a.setTransition("q0", symbol, LinearSet.of("q0")));
    return a;
  }

  /**
   * @return an automaton that rejects any word over {@code alphabet}
   */
  public static Automaton none(ISet<String> alphabet) {
    Automaton a = new Automaton().addState("q0");
    alphabet.forEach(a::addSymbol);
    return a;
  }

  /**
   * @return an automaton accepting the language generated by {@code grammar}
   */
  public static Automaton fromGrammar(RegularGrammar grammar) {
    IMap<String, ISet<String>> productions = grammar.productions();
    String start = grammar.initialSymbol();

    LinearSet<String> nonTerminals = Utils.copy(productions.keys()).add(start);
    for (ISet<String> ps : productions.values()) {
      ps.stream()
              .filter(p -> p.length() == 2)
              .forEach(p -> nonTerminals.add(p.substring(1)));
    }

    String sink = Utils.fresh(GRAMMAR_SINK, nonTerminals);

    Automaton a = new Automaton().addState(start);
    Utils.sorted(nonTerminals).forEach(a::addState);
    a.addState(sink).toggleFinalState(sink);

    if (productions.get(start).map(ps -> ps.contains(RegularGrammar.EMPTY)).orElse(false)) {
      a.toggleFinalState(start);
    }

    for (String nonTerminal : Utils.sorted(productions.keys())) {
      for (String production : Utils.sorted(productions.get(nonTerminal).get())) {
        if (production.equals(RegularGrammar.EMPTY)) {
          continue;
        }
        if (production.isEmpty() || production.length() > 2) {
          throw new IllegalArgumentException("invalid production for " + nonTerminal + ": '" + production + "'");
        }

        String symbol = production.substring(0, 1);
        a.addSymbol(symbol);
        a.addTransition(nonTerminal, symbol, production.length() == 1 ? sink : production.substring(1));
      }
    }

    LOG.debug("converted grammar with {} non-terminals into {} states", nonTerminals.size(), a.size());
    return a;
  }

  /// store

  public Automaton addState(String state) {
    Objects.requireNonNull(state);
    states.add(state);
    if (initial == null) {
      initial = state;
    }
    return this;
  }

  /**
   * Removes {@code state}, along with every transition from it, to it, and its membership in the final states.  Has
   * no effect if the state doesn't exist, or is the initial state.
   */
  public Automaton removeState(String state) {
    if (!states.contains(state)) {
      return this;
    }
    if (state.equals(initial)) {
      LOG.debug("ignoring removal of initial state {}", state);
      return this;
    }

    states.remove(state);
    accept.remove(state);
    transitions.remove(state);

    for (String source : Utils.copy(transitions.keys())) {
      LinearMap<String, LinearSet<String>> row = transitions.get(source).get();
      for (String symbol : Utils.copy(row.keys())) {
        LinearSet<String> targets = row.get(symbol).get();
        if (targets.contains(state)) {
          targets.remove(state);
          if (targets.size() == 0) {
            row.remove(symbol);
          }
        }
      }
      if (row.size() == 0) {
        transitions.remove(source);
      }
    }

    return this;
  }

  public Automaton addSymbol(String symbol) {
    alphabet.add(Objects.requireNonNull(symbol));
    return this;
  }

  /**
   * Removes {@code symbol} and every transition on it.  Has no effect if the symbol doesn't exist.
   */
  public Automaton removeSymbol(String symbol) {
    if (!alphabet.contains(symbol)) {
      return this;
    }

    alphabet.remove(symbol);
    for (String source : Utils.copy(transitions.keys())) {
      LinearMap<String, LinearSet<String>> row = transitions.get(source).get();
      row.remove(symbol);
      if (row.size() == 0) {
        transitions.remove(source);
      }
    }

    return this;
  }

  /**
   * Makes {@code state} final if it isn't, and non-final if it is.
   *
   * @throws AutomatonException if the state doesn't exist
   */
  public Automaton toggleFinalState(String state) {
    if (!states.contains(state)) {
      throw AutomatonException.unknownState(state);
    }

    if (accept.contains(state)) {
      accept.remove(state);
    } else {
      accept.add(state);
    }
    return this;
  }

  /**
   * Replaces the targets of {@code state} on {@code symbol}.  An empty {@code targets} removes the transition.
   *
   * @throws AutomatonException if any of the states, or the symbol, don't exist
   */
  public Automaton setTransition(String state, String symbol, ISet<String> targets) {
    if (targets.size() == 0) {
      transitions.get(state).ifPresent(row -> {
        row.remove(symbol);
        if (row.size() == 0) {
          transitions.remove(state);
        }
      });
      return this;
    }

    List<String> missing = Utils.sorted(targets).stream()
            .filter(s -> !states.contains(s))
            .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw AutomatonException.unknownStates(missing);
    }
    if (!states.contains(state)) {
      throw AutomatonException.unknownState(state);
    }
    if (!alphabet.contains(symbol)) {
      throw AutomatonException.unknownSymbol(symbol);
    }

    transitions.getOrCreate(state, LinearMap::new).put(symbol, Utils.copy(targets));
    return this;
  }

  public Automaton setTransition(String state, String symbol, String... targets) {
    return setTransition(state, symbol, LinearSet.of(targets));
  }

  /**
   * Adds {@code target} to the targets of {@code state} on {@code symbol}.
   *
   * @throws AutomatonException if any of the states, or the symbol, don't exist
   */
  public Automaton addTransition(String state, String symbol, String target) {
    return setTransition(state, symbol, Utils.copy(targets(state, symbol)).add(target));
  }

  /// accessors

  /**
   * @return the initial state, or {@code null} if no state has been added yet
   */
  public String initialState() {
    return initial;
  }

  public ISet<String> states() {
    return states.clone();
  }

  public ISet<String> alphabet() {
    return alphabet.clone();
  }

  public ISet<String> finalStates() {
    return accept.clone();
  }

  public long size() {
    return states.size();
  }

  /**
   * @return the states reachable from {@code state} on {@code symbol}, which may be empty
   */
  public ISet<String> targets(String state, String symbol) {
    return targetsOf(state, symbol).<ISet<String>>map(LinearSet::clone).orElseGet(LinearSet::new);
  }

  /**
   * @return every entry of the transition function, ordered by source state and then symbol
   */
  public IList<Transition> transitions() {
    LinearList<Transition> result = new LinearList<>();
    for (String source : Utils.sorted(transitions.keys())) {
      LinearMap<String, LinearSet<String>> row = transitions.get(source).get();
      for (String symbol : Utils.sorted(row.keys())) {
        result.addLast(new Transition(source, symbol, row.get(symbol).get()));
      }
    }
    return result;
  }

  Optional<LinearSet<String>> targetsOf(String state, String symbol) {
    return transitions.get(state).flatMap(row -> row.get(symbol));
  }

  // the single target of a deterministic transition, or null if there is none
  String successor(String state, String symbol) {
    return targetsOf(state, symbol).map(s -> s.iterator().next()).orElse(null);
  }

  LinearSet<String> successors(String state) {
    return transitions.get(state)
            .map(row -> row.values().stream().flatMap(ISet::stream).collect(Sets.<String>linearCollector()))
            .orElseGet(LinearSet::new);
  }

  /// acceptance

  /**
   * @return true if the sequence of symbols in {@code word} is accepted
   */
  public boolean accept(Iterable<String> word) {
    if (initial == null) {
      return false;
    }

    LinearSet<String> current = LinearSet.of(initial);
    for (String symbol : word) {
      LinearSet<String> next = new LinearSet<>();
      for (String state : current) {
        targetsOf(state, symbol).ifPresent(targets -> targets.forEach(next::add));
      }
      current = next;
    }

    return current.containsAny(accept);
  }

  /**
   * @return true if {@code input}, where each character is a symbol, is accepted
   */
  public boolean accept(CharSequence input) {
    return accept(input.chars()
            .mapToObj(c -> String.valueOf((char) c))
            .collect(Collectors.toList()));
  }

  /// analysis

  /**
   * @return true if every transition leads to exactly one state
   */
  public boolean isDeterministic() {
    return transitions.values().stream()
            .flatMap(row -> row.values().stream())
            .allMatch(targets -> targets.size() == 1);
  }

  public boolean isEmpty() {
    return Analysis.isEmpty(this);
  }

  public boolean isFinite() {
    return Analysis.isFinite(this);
  }

  public ISet<String> reachableStates() {
    return Analysis.reachable(this);
  }

  /// derived automata

  /**
   * @return an equivalent deterministic automaton
   */
  public Automaton determinize() {
    Automaton a = clone();
    Determinizer.determinize(a);
    return a;
  }

  /**
   * @return the minimal equivalent automaton, without unreachable, dead, or equivalent states
   * @throws AutomatonException if this automaton is non-deterministic
   */
  public Automaton minimize() {
    Minimizer.requireDeterministic(this);
    Automaton a = clone();
    Minimizer.minimize(a);
    return a;
  }

  public Automaton removeUnreachable() {
    Automaton a = clone();
    Minimizer.removeUnreachable(a);
    return a;
  }

  public Automaton removeDead() {
    Automaton a = clone();
    Minimizer.removeDead(a);
    return a;
  }

  /**
   * @throws AutomatonException if this automaton is non-deterministic
   */
  public Automaton mergeEquivalent() {
    Minimizer.requireDeterministic(this);
    Automaton a = clone();
    Minimizer.mergeEquivalent(a);
    return a;
  }

  /**
   * @return an automaton accepting the words accepted by either this automaton or {@code other}
   * @throws AutomatonException if the alphabets differ, or this automaton has more than 26 states
   */
  public Automaton union(Automaton other) {
    return Combinators.union(clone(), other.clone());
  }

  /**
   * @return an automaton accepting every word over the alphabet that this automaton rejects
   */
  public Automaton complement() {
    return Combinators.complement(clone());
  }

  /**
   * @return an automaton accepting the words accepted by both this automaton and {@code other}
   * @throws AutomatonException if the alphabets differ
   */
  public Automaton intersection(Automaton other) {
    return Combinators.intersection(clone(), other.clone());
  }

  /**
   * @return a copy with the states renamed {@code q0} (the initial state) through {@code qn}
   */
  public Automaton renameSequential() {
    Automaton a = clone();
    Canonicalizer.sequential(a);
    return a;
  }

  /**
   * @return a copy with the states renamed {@code S} (the initial state) and {@code A} through {@code Z}
   * @throws AutomatonException if there are more than 26 states
   */
  public Automaton renameAlphabetic() {
    Canonicalizer.requireAlphabeticCapacity(this);
    Automaton a = clone();
    Canonicalizer.alphabetic(a);
    return a;
  }

  ///

  @Override
  public Automaton clone() {
    LinearMap<String, LinearMap<String, LinearSet<String>>> t = new LinearMap<>();
    for (String source : transitions.keys()) {
      LinearMap<String, LinearSet<String>> row = new LinearMap<>();
      LinearMap<String, LinearSet<String>> original = transitions.get(source).get();
      for (String symbol : original.keys()) {
        row.put(symbol, original.get(symbol).get().clone());
      }
      t.put(source, row);
    }

    return new Automaton(initial, states.clone(), alphabet.clone(), accept.clone(), t);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Automaton)) {
      return false;
    }
    Automaton a = (Automaton) o;
    return Objects.equals(initial, a.initial)
            && states.equals(a.states)
            && alphabet.equals(a.alphabet)
            && accept.equals(a.accept)
            && transitions().equals(a.transitions());
  }

  @Override
  public int hashCode() {
    return Objects.hash(initial, states, alphabet, accept);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("automaton[initial=").append(initial)
            .append(", states=").append(Utils.sorted(states))
            .append(", alphabet=").append(Utils.sorted(alphabet))
            .append(", final=").append(Utils.sorted(accept))
            .append(", transitions=[");
    transitions().forEach(t -> sb.append(t).append(", "));
    if (transitions.size() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    sb.append("]]");
    return sb.toString();
  }
}
