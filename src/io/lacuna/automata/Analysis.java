package io.lacuna.automata;

import io.lacuna.bifurcan.*;

import java.util.Iterator;

/**
 * Decidability queries over the language of an automaton.
 */
final class Analysis {

  private Analysis() {
  }

  static LinearSet<String> reachable(Automaton a) {
    LinearSet<String> states = new LinearSet<>();
    if (a.initial == null) {
      return states;
    }

    LinearList<String> queue = LinearList.of(a.initial);
    while (queue.size() > 0) {
      String s = queue.popFirst();
      if (!states.contains(s)) {
        states.add(s);
        Utils.sorted(a.successors(s)).stream()
                .filter(t -> !states.contains(t))
                .forEach(queue::addLast);
      }
    }

    return states;
  }

  static boolean isEmpty(Automaton a) {
    Automaton copy = a.clone();
    Minimizer.removeUnreachable(copy);
    return copy.accept.size() == 0;
  }

  /**
   * The language is infinite iff, once every unreachable and dead state is pruned, some cycle remains.
   */
  static boolean isFinite(Automaton a) {
    if (isEmpty(a)) {
      return true;
    }

    Automaton trimmed = a.clone();
    Minimizer.removeUnreachable(trimmed);
    Minimizer.removeDead(trimmed);

    return !hasCycle(trimmed);
  }

  // iterative depth-first search, where a back edge onto the current path is a cycle
  private static boolean hasCycle(Automaton a) {
    LinearSet<String> done = new LinearSet<>();
    LinearSet<String> onPath = new LinearSet<>();
    LinearList<String> path = new LinearList<>();
    LinearMap<String, Iterator<String>> pending = new LinearMap<>();

    path.addLast(a.initial);
    onPath.add(a.initial);
    pending.put(a.initial, Utils.sorted(a.successors(a.initial)).iterator());

    while (path.size() > 0) {
      String s = path.nth(path.size() - 1);
      Iterator<String> it = pending.get(s).get();

      if (it.hasNext()) {
        String t = it.next();
        if (onPath.contains(t)) {
          return true;
        }
        if (!done.contains(t)) {
          path.addLast(t);
          onPath.add(t);
          pending.put(t, Utils.sorted(a.successors(t)).iterator());
        }
      } else {
        path.popLast();
        onPath.remove(s);
        done.add(s);
      }
    }

    return false;
  }
}
