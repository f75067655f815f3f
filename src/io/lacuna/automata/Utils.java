package io.lacuna.automata;

import io.lacuna.bifurcan.*;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * @author ztellman
 */
public class Utils {

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <V> LinearSet<V> copy(ISet<V> set) {
    return toSet(set.stream());
  }

  public static <U, V> LinearSet<V> map(ISet<U> set, Function<U, V> f) {
    if (set == null) {
      return null;
    }
    return toSet(set.stream().map(f));
  }

  public static <V extends Comparable<V>> List<V> sorted(ISet<V> set) {
    return set.stream().sorted().collect(Collectors.toList());
  }

  /**
   * @return {@code base}, with primes appended until it no longer collides with anything in {@code taken}
   */
  public static String fresh(String base, ISet<String> taken) {
    String name = base;
    while (taken.contains(name)) {
      name = name + "'";
    }
    return name;
  }
}
