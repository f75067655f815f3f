package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Removes unreachable and dead states from an automaton, and collapses equivalent states of a deterministic one.
 */
final class Minimizer {

  private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

  private static final Comparator<IList<String>> PAIR_ORDER =
          Comparator.<IList<String>, String>comparing(p -> p.nth(0)).thenComparing(p -> p.nth(1));

  private Minimizer() {
  }

  static void requireDeterministic(Automaton a) {
    if (!a.isDeterministic()) {
      throw AutomatonException.nonDeterministic();
    }
  }

  static void minimize(Automaton a) {
    requireDeterministic(a);

    long size = a.size();
    removeUnreachable(a);
    removeDead(a);
    mergeEquivalent(a);

    LOG.debug("minimized {} states into {}", size, a.size());
  }

  static void removeUnreachable(Automaton a) {
    ISet<String> reachable = Analysis.reachable(a);
    List<String> unreachable = Utils.sorted(a.states).stream()
            .filter(s -> !reachable.contains(s))
            .collect(Collectors.toList());

    unreachable.forEach(a::removeState);
    LOG.debug("removed {} unreachable states", unreachable.size());
  }

  // removes any states which can never reach an accept state
  static void removeDead(Automaton a) {
    LinearSet<String> alive = a.accept.clone();

    for (; ; ) {
      long prevSize = alive.size();
      for (String source : Utils.sorted(a.transitions.keys())) {
        if (!alive.contains(source) && a.successors(source).containsAny(alive)) {
          alive.add(source);
        }
      }

      if (prevSize == alive.size()) {
        break;
      }
    }

    List<String> dead = Utils.sorted(a.states).stream()
            .filter(s -> !alive.contains(s))
            .collect(Collectors.toList());

    dead.forEach(a::removeState);
    LOG.debug("removed {} dead states", dead.size());
  }

  // collapses any equivalent states
  static void mergeEquivalent(Automaton a) {
    requireDeterministic(a);

    ISet<IList<String>> undistinguishable = undistinguishablePairs(a);

    List<IList<String>> pairs = undistinguishable.stream()
            .sorted(PAIR_ORDER)
            .collect(Collectors.toList());

    LinearMap<String, String> mergedInto = new LinearMap<>();
    for (IList<String> pair : pairs) {
      String x = resolve(mergedInto, pair.nth(0));
      String y = resolve(mergedInto, pair.nth(1));
      if (x.equals(y)) {
        continue;
      }

      String kept, removed;
      if (y.equals(a.initial) || (!x.equals(a.initial) && y.compareTo(x) < 0)) {
        kept = y;
        removed = x;
      } else {
        kept = x;
        removed = y;
      }

      merge(a, kept, removed);
      mergedInto.put(removed, kept);
    }

    LOG.debug("merged {} equivalent states", mergedInto.size());
  }

  private static ISet<IList<String>> undistinguishablePairs(Automaton a) {
    List<String> states = Utils.sorted(a.states);

    // final and non-final states are distinguished by the empty word
    LinearSet<IList<String>> candidates = new LinearSet<>();
    for (int i = 0; i < states.size(); i++) {
      for (int j = i + 1; j < states.size(); j++) {
        String x = states.get(i);
        String y = states.get(j);
        if (a.accept.contains(x) == a.accept.contains(y)) {
          candidates.add(LinearList.of(x, y));
        }
      }
    }

    for (; ; ) {
      ISet<IList<String>> prev = candidates;
      candidates = prev.stream()
              .filter(p -> undistinguishable(a, p.nth(0), p.nth(1), prev))
              .collect(Sets.linearCollector());

      if (prev.size() == candidates.size()) {
        return candidates;
      }
    }
  }

  private static boolean undistinguishable(Automaton a, String x, String y, ISet<IList<String>> candidates) {
    for (String symbol : a.alphabet) {
      String tx = a.successor(x, symbol);
      String ty = a.successor(y, symbol);

      if (Objects.equals(tx, ty)) {
        continue;
      }
      if (tx == null || ty == null || !candidates.contains(pair(tx, ty))) {
        return false;
      }
    }
    return true;
  }

  private static IList<String> pair(String x, String y) {
    return x.compareTo(y) < 0 ? LinearList.of(x, y) : LinearList.of(y, x);
  }

  private static String resolve(IMap<String, String> mergedInto, String state) {
    String s = state;
    while (mergedInto.contains(s)) {
      s = mergedInto.get(s).get();
    }
    return s;
  }

  private static void merge(Automaton a, String kept, String removed) {
    for (LinearMap<String, LinearSet<String>> row : a.transitions.values()) {
      for (String symbol : Utils.copy(row.keys())) {
        if (row.get(symbol).get().contains(removed)) {
          row.put(symbol, LinearSet.of(kept));
        }
      }
    }

    a.removeState(removed);
    LOG.trace("merged {} into {}", removed, kept);
  }
}
