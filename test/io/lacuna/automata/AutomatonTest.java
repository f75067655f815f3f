package io.lacuna.automata;

import io.lacuna.bifurcan.LinearList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.lacuna.automata.Examples.set;
import static org.junit.jupiter.api.Assertions.*;

public class AutomatonTest {

  @Test
  public void testFirstStateIsInitial() {
    Automaton a = new Automaton();
    assertNull(a.initialState());
    assertFalse(a.accept(""));

    a.addState("b").addState("a");
    assertEquals("b", a.initialState());
    assertEquals(set("a", "b"), a.states());
  }

  @Test
  public void testAcceptTracesNonDeterministicRuns() {
    Automaton a = Examples.endsInZero();

    assertTrue(a.accept("0"));
    assertFalse(a.accept("1"));
    assertTrue(a.accept("00"));
    assertFalse(a.accept("01"));
    assertTrue(a.accept("1110"));
    assertFalse(a.accept(""));
    assertTrue(a.accept(List.of("1", "0")));

    // unknown symbols have no transitions
    assertFalse(a.accept("2"));
  }

  @Test
  public void testRemoveStateCascades() {
    Automaton a = new Automaton()
            .addState("q0")
            .addState("q1")
            .addState("q2")
            .addSymbol("a")
            .addSymbol("b")
            .toggleFinalState("q1")
            .setTransition("q0", "a", "q1", "q2")
            .setTransition("q0", "b", "q1")
            .setTransition("q1", "a", "q1")
            .setTransition("q2", "b", "q0");

    a.removeState("q1");

    assertEquals(set("q0", "q2"), a.states());
    assertEquals(set(), a.finalStates());
    assertEquals(set("q2"), a.targets("q0", "a"));
    assertEquals(set(), a.targets("q0", "b"));
    assertEquals(
            LinearList.of(Transition.of("q0", "a", "q2"), Transition.of("q2", "b", "q0")),
            a.transitions());

    a.removeState("q2");
    assertEquals(0, a.transitions().size());
  }

  @Test
  public void testInitialStateCannotBeRemoved() {
    Automaton a = Examples.endsInZero();
    Automaton before = a.clone();

    a.removeState("q0");
    a.removeState("nope");

    assertEquals(before, a);
  }

  @Test
  public void testRemoveSymbolCascades() {
    Automaton a = Examples.endsInZero().removeSymbol("0");

    assertEquals(set("1"), a.alphabet());
    assertEquals(LinearList.of(Transition.of("q0", "1", "q0")), a.transitions());

    a.removeSymbol("1");
    assertEquals(0, a.transitions().size());
    a.removeSymbol("1");
  }

  @Test
  public void testToggleFinalState() {
    Automaton a = Examples.endsInZero();

    a.toggleFinalState("q0");
    assertEquals(set("q0", "q1"), a.finalStates());
    assertTrue(a.accept(""));

    a.toggleFinalState("q0");
    assertEquals(set("q1"), a.finalStates());

    AutomatonException e = assertThrows(AutomatonException.class, () -> a.toggleFinalState("q9"));
    assertEquals(AutomatonException.Kind.UNKNOWN_SYMBOL_OR_STATE, e.kind());
    assertEquals(List.of("q9"), e.names());
  }

  @Test
  public void testSetTransitionWithNoTargetsRemovesIt() {
    Automaton a = Examples.endsInZero();

    a.setTransition("q0", "0", set());
    assertEquals(set(), a.targets("q0", "0"));
    assertFalse(a.accept("0"));

    // idempotent
    a.setTransition("q0", "0", set());
    a.setTransition("q1", "1", set());
    assertEquals(1, a.transitions().size());
  }

  @Test
  public void testSetTransitionNamesEveryUnknownTarget() {
    Automaton a = Examples.endsInZero();
    Automaton before = a.clone();

    AutomatonException e = assertThrows(
            AutomatonException.class,
            () -> a.setTransition("q0", "0", set("q0", "z", "y")));

    assertEquals(AutomatonException.Kind.UNKNOWN_STATE, e.kind());
    assertEquals(List.of("y", "z"), e.names());
    assertEquals(before, a);
  }

  @Test
  public void testSetTransitionRejectsUnknownSourceOrSymbol() {
    Automaton a = Examples.endsInZero();

    assertEquals(
            AutomatonException.Kind.UNKNOWN_SYMBOL_OR_STATE,
            assertThrows(AutomatonException.class, () -> a.setTransition("q9", "0", "q0")).kind());
    assertEquals(
            AutomatonException.Kind.UNKNOWN_SYMBOL_OR_STATE,
            assertThrows(AutomatonException.class, () -> a.setTransition("q0", "2", "q0")).kind());
  }

  @Test
  public void testAddTransitionAccumulates() {
    Automaton a = Examples.endsInZero().addTransition("q1", "1", "q0").addTransition("q1", "1", "q1");

    assertEquals(set("q0", "q1"), a.targets("q1", "1"));
    assertFalse(a.isDeterministic());
  }

  @Test
  public void testIsDeterministic() {
    assertFalse(Examples.endsInZero().isDeterministic());
    assertTrue(Examples.evenLength().isDeterministic());
    assertTrue(new Automaton().isDeterministic());
  }

  @Test
  public void testOfValidatesInvariants() {
    Automaton a = Automaton.of(
            set("q0", "q1"),
            set("0", "1"),
            "q0",
            set("q1"),
            List.of(Transition.of("q0", "0", "q0"), Transition.of("q0", "0", "q1"), Transition.of("q0", "1", "q0")));

    assertEquals(Examples.endsInZero(), a);

    assertEquals(
            AutomatonException.Kind.UNKNOWN_STATE,
            assertThrows(AutomatonException.class, () -> Automaton.of(set("q0"), set(), "q1", set(), List.of())).kind());
    assertEquals(
            AutomatonException.Kind.UNKNOWN_STATE,
            assertThrows(AutomatonException.class, () -> Automaton.of(set("q0"), set(), "q0", set("q1"), List.of())).kind());
    assertEquals(
            AutomatonException.Kind.UNKNOWN_STATE,
            assertThrows(
                    AutomatonException.class,
                    () -> Automaton.of(set("q0"), set("a"), "q0", set(), List.of(Transition.of("q0", "a", "q1")))).kind());
  }

  @Test
  public void testCloneIsIndependent() {
    Automaton a = Examples.endsInZero();
    Automaton b = a.clone();

    b.addTransition("q0", "1", "q1");
    b.removeState("q1");

    assertEquals(Examples.endsInZero(), a);
    assertNotEquals(a, b);
  }

  @Test
  public void testDerivedOperationsLeaveReceiverUntouched() {
    Automaton a = Examples.endsInZero();

    a.determinize();
    a.complement();
    a.union(Examples.startsWithOne());
    a.intersection(a);
    a.renameSequential();
    a.isEmpty();
    a.isFinite();

    assertEquals(Examples.endsInZero(), a);
  }

  @Test
  public void testCannedAutomata() {
    Automaton any = Automaton.any(set("a", "b"));
    Automaton none = Automaton.none(set("a", "b"));

    Words.assertLanguage(any, w -> true, 4);
    Words.assertLanguage(none, w -> false, 4);
    assertTrue(none.isEmpty());
    assertFalse(any.isFinite());
  }
}
