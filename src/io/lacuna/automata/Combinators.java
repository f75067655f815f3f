package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Union, complement, and intersection.  Each of these consumes the automata it is given, and returns the result.
 */
final class Combinators {

  private static final Logger LOG = LoggerFactory.getLogger(Combinators.class);

  /** the initial state synthesized by {@link #union(Automaton, Automaton)} */
  public static final String UNION_INITIAL = "qinitial";

  /** the state synthesized by {@link #complement(Automaton)} for every missing transition */
  public static final String DEAD_STATE = "qdead";

  private Combinators() {
  }

  static void requireSameAlphabet(Automaton a, Automaton b) {
    if (!a.alphabet.equals(b.alphabet)) {
      throw AutomatonException.alphabetMismatch(Utils.sorted(a.alphabet), Utils.sorted(b.alphabet));
    }
  }

  /**
   * @return {@code a}, modified to also accept everything {@code b} accepts
   */
  static Automaton union(Automaton a, Automaton b) {
    requireSameAlphabet(a, b);
    Canonicalizer.requireAlphabeticCapacity(a);

    if (b.initial == null) {
      return a;
    } else if (a.initial == null) {
      return b;
    }

    // disjoint namespaces: S, A..Z on one side and q0..qn on the other
    Canonicalizer.alphabetic(a);
    Canonicalizer.sequential(b);

    String first = a.initial;
    String second = b.initial;
    String init = Utils.fresh(UNION_INITIAL, a.states.clone().union(b.states));

    b.states.forEach(a.states::add);
    b.accept.forEach(a.accept::add);
    for (Transition t : b.transitions()) {
      a.transitions.getOrCreate(t.source(), LinearMap::new).put(t.symbol(), Utils.copy(t.targets()));
    }

    a.states.add(init);
    if (a.accept.contains(first) || a.accept.contains(second)) {
      a.accept.add(init);
    }

    for (String symbol : Utils.sorted(a.alphabet)) {
      LinearSet<String> targets = new LinearSet<>();
      a.targetsOf(first, symbol).ifPresent(s -> s.forEach(targets::add));
      a.targetsOf(second, symbol).ifPresent(s -> s.forEach(targets::add));
      if (targets.size() > 0) {
        a.transitions.getOrCreate(init, LinearMap::new).put(symbol, targets);
      }
    }
    a.initial = init;

    Canonicalizer.sequential(a);

    LOG.debug("union has {} states", a.size());
    return a;
  }

  /**
   * @return {@code a}, modified to accept exactly the words over its alphabet it previously rejected
   */
  static Automaton complement(Automaton a) {
    Determinizer.determinize(a);
    Canonicalizer.sequential(a);

    String dead = Utils.fresh(DEAD_STATE, a.states);
    a.addState(dead);

    for (String state : Utils.sorted(a.states)) {
      for (String symbol : Utils.sorted(a.alphabet)) {
        if (!a.targetsOf(state, symbol).isPresent()) {
          a.transitions.getOrCreate(state, LinearMap::new).put(symbol, LinearSet.of(dead));
        }
      }
    }

    for (String state : Utils.sorted(a.states)) {
      a.toggleFinalState(state);
    }

    LOG.debug("complement has {} states", a.size());
    return a;
  }

  /**
   * @return {@code a}, modified to accept only the words both it and {@code b} accept
   */
  static Automaton intersection(Automaton a, Automaton b) {
    requireSameAlphabet(a, b);

    // not(not(a) or not(b))
    Automaton notB = complement(b);
    Automaton notA = complement(a);
    return complement(union(notA, notB));
  }
}
