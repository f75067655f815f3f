package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.Objects;

/**
 * A single entry of a transition function: the set of states reachable from {@code source} on {@code symbol}.
 */
public final class Transition {

  private final String source;
  private final String symbol;
  private final LinearSet<String> targets;

  public Transition(String source, String symbol, ISet<String> targets) {
    this.source = Objects.requireNonNull(source);
    this.symbol = Objects.requireNonNull(symbol);
    this.targets = Utils.copy(targets);
  }

  public static Transition of(String source, String symbol, String... targets) {
    return new Transition(source, symbol, LinearSet.of(targets));
  }

  public String source() {
    return source;
  }

  public String symbol() {
    return symbol;
  }

  public ISet<String> targets() {
    return targets.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition t = (Transition) o;
    return source.equals(t.source) && symbol.equals(t.symbol) && targets.equals(t.targets);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, symbol, targets);
  }

  @Override
  public String toString() {
    return "(" + source + ", " + symbol + ") -> " + Utils.sorted(targets);
  }
}
