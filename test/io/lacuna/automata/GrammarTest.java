package io.lacuna.automata;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearMap;
import org.junit.jupiter.api.Test;

import static io.lacuna.automata.Examples.set;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

  @Test
  public void testConversion() {
    // S -> aA | b | &, A -> aA | b
    IMap<String, ISet<String>> productions = new LinearMap<>();
    productions.put("S", set("aA", "b", "&"));
    productions.put("A", set("aA", "b"));

    Automaton a = Automaton.fromGrammar(Examples.grammar("S", productions));

    assertEquals("S", a.initialState());
    assertEquals(set("S", "A", "X"), a.states());
    assertEquals(set("a", "b"), a.alphabet());
    assertEquals(set("S", "X"), a.finalStates());
    assertEquals(set("X"), a.targets("S", "b"));
    assertEquals(set("A"), a.targets("A", "a"));

    Words.assertLanguage(a, w -> w.isEmpty() || w.matches("a*b"), 6);
  }

  @Test
  public void testNonDeterministicGrammar() {
    // S -> aS | a
    IMap<String, ISet<String>> productions = new LinearMap<>();
    productions.put("S", set("aS", "a"));

    Automaton a = Automaton.fromGrammar(Examples.grammar("S", productions));

    assertFalse(a.isDeterministic());
    assertEquals(set("S", "X"), a.targets("S", "a"));
    assertFalse(a.finalStates().contains("S"));
    Words.assertLanguage(a.determinize().minimize(), w -> w.length() > 0, 6);
  }

  @Test
  public void testSinkAvoidsNonTerminalNames() {
    // X -> aX | a
    IMap<String, ISet<String>> productions = new LinearMap<>();
    productions.put("X", set("aX", "a"));

    Automaton a = Automaton.fromGrammar(Examples.grammar("X", productions));

    assertEquals(set("X", "X'"), a.states());
    assertEquals(set("X'"), a.finalStates());
    Words.assertLanguage(a, w -> w.length() > 0, 5);
  }

  @Test
  public void testNonTerminalWithoutProductions() {
    // S -> aB | b, and B has no productions of its own
    IMap<String, ISet<String>> productions = new LinearMap<>();
    productions.put("S", set("aB", "b"));

    Automaton a = Automaton.fromGrammar(Examples.grammar("S", productions));

    assertTrue(a.states().contains("B"));
    assertFalse(a.finalStates().contains("B"));
    Words.assertLanguage(a, "b"::equals, 4);
  }

  @Test
  public void testInvalidProduction() {
    IMap<String, ISet<String>> productions = new LinearMap<>();
    productions.put("S", set("abc"));

    assertThrows(IllegalArgumentException.class, () -> Automaton.fromGrammar(Examples.grammar("S", productions)));
  }
}
