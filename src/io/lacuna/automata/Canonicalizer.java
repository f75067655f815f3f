package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renames every state of an automaton according to a fixed scheme, so that automata can be merged without their
 * names clashing.
 */
final class Canonicalizer {

  private static final Logger LOG = LoggerFactory.getLogger(Canonicalizer.class);

  public static final char ALPHABETIC_INITIAL = 'S';
  public static final int ALPHABETIC_CAPACITY = 26;

  private Canonicalizer() {
  }

  // q0 for the initial state, then q1..qn in the order of the current names
  static void sequential(Automaton a) {
    if (a.initial == null) {
      return;
    }

    LinearMap<String, String> names = new LinearMap<>();
    names.put(a.initial, "q0");
    int n = 1;
    for (String s : Utils.sorted(a.states)) {
      if (!s.equals(a.initial)) {
        names.put(s, "q" + n++);
      }
    }

    rename(a, names);
  }

  static void requireAlphabeticCapacity(Automaton a) {
    if (a.size() > ALPHABETIC_CAPACITY) {
      throw AutomatonException.capacityExceeded(a.size(), ALPHABETIC_CAPACITY);
    }
  }

  // S for the initial state, then A..Z without S in the order of the current names
  static void alphabetic(Automaton a) {
    requireAlphabeticCapacity(a);
    if (a.initial == null) {
      return;
    }

    LinearMap<String, String> names = new LinearMap<>();
    names.put(a.initial, String.valueOf(ALPHABETIC_INITIAL));
    char c = 'A';
    for (String s : Utils.sorted(a.states)) {
      if (s.equals(a.initial)) {
        continue;
      }
      if (c == ALPHABETIC_INITIAL) {
        c++;
      }
      names.put(s, String.valueOf(c++));
    }

    rename(a, names);
  }

  private static void rename(Automaton a, IMap<String, String> names) {
    LinearMap<String, LinearMap<String, LinearSet<String>>> transitions = new LinearMap<>();
    for (Transition t : a.transitions()) {
      transitions.getOrCreate(names.get(t.source()).get(), LinearMap::new)
              .put(t.symbol(), Utils.map(t.targets(), s -> names.get(s).get()));
    }

    a.initial = names.get(a.initial).get();
    a.states = Utils.map(a.states, s -> names.get(s).get());
    a.accept = Utils.map(a.accept, s -> names.get(s).get());
    a.transitions = transitions;

    LOG.trace("renamed {}", names);
  }
}
