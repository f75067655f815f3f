package io.lacuna.automata;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Subset construction.  Every set of states that some transition can lead to is given a single state of its own,
 * named by concatenating the sorted names of its members.
 */
final class Determinizer {

  private static final Logger LOG = LoggerFactory.getLogger(Determinizer.class);

  private Determinizer() {
  }

  // reduces any divergent transitions to a single state
  static void determinize(Automaton a) {

    if (a.isDeterministic()) {
      return;
    }

    Automaton original = a.clone();

    // member set -> state name, singletons map to their only member
    LinearMap<ISet<String>, String> names = new LinearMap<>();
    LinearList<ISet<String>> queue = new LinearList<>();

    Function<ISet<String>, String> enqueue = members -> {
      Optional<String> name = names.get(members);
      if (name.isPresent()) {
        return name.get();
      }

      String n;
      if (members.size() == 1) {
        n = members.iterator().next();
      } else {
        n = Utils.fresh(String.join("", Utils.sorted(members)), a.states);
        a.states.add(n);
        if (members.containsAny(original.accept)) {
          a.accept.add(n);
        }
        queue.addLast(members);
        LOG.trace("synthesized {} for {}", n, Utils.sorted(members));
      }

      names.put(members, n);
      return n;
    };

    IList<Transition> entries = original.transitions();
    entries.forEach(t -> enqueue.apply(t.targets()));

    while (queue.size() > 0) {
      ISet<String> members = queue.popFirst();
      String name = names.get(members).get();

      for (String symbol : Utils.sorted(original.alphabet)) {
        LinearSet<String> reachable = new LinearSet<>();
        for (String m : members) {
          original.targetsOf(m, symbol).ifPresent(targets -> targets.forEach(reachable::add));
        }

        if (reachable.size() > 0) {
          a.transitions.getOrCreate(name, LinearMap::new).put(symbol, LinearSet.of(enqueue.apply(reachable)));
        }
      }
    }

    for (Transition t : entries) {
      a.transitions.get(t.source()).get().put(t.symbol(), LinearSet.of(names.get(t.targets()).get()));
    }

    LOG.debug("determinized {} states into {}, synthesizing {} composite states",
            original.size(), a.size(), a.size() - original.size());
  }
}
