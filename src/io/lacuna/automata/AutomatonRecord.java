package io.lacuna.automata;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * The persisted form of an {@link Automaton}.  Every sequence is sorted, so that saving the same automaton twice
 * yields the same bytes.
 */
@JsonPropertyOrder({"states", "alphabet", "transitions", "initial_state", "final_states"})
public class AutomatonRecord {

  /**
   * A single transition, written as a {@code [state, symbol, [targets...]]} triple.
   */
  @JsonFormat(shape = JsonFormat.Shape.ARRAY)
  @JsonPropertyOrder({"state", "symbol", "targets"})
  public static class TransitionRecord {

    @JsonProperty("state")
    private String state;

    @JsonProperty("symbol")
    private String symbol;

    @JsonProperty("targets")
    private List<String> targets = new ArrayList<>();

    public TransitionRecord() {
    }

    public TransitionRecord(String state, String symbol, List<String> targets) {
      this.state = state;
      this.symbol = symbol;
      this.targets = targets;
    }

    public String getState() {
      return state;
    }

    public String getSymbol() {
      return symbol;
    }

    public List<String> getTargets() {
      return targets;
    }
  }

  @JsonProperty("states")
  private List<String> states = new ArrayList<>();

  @JsonProperty("alphabet")
  private List<String> alphabet = new ArrayList<>();

  @JsonProperty("transitions")
  private List<TransitionRecord> transitions = new ArrayList<>();

  @JsonProperty("initial_state")
  private String initialState;

  @JsonProperty("final_states")
  private List<String> finalStates = new ArrayList<>();

  public AutomatonRecord() {
  }

  public AutomatonRecord(
          List<String> states,
          List<String> alphabet,
          List<TransitionRecord> transitions,
          String initialState,
          List<String> finalStates) {
    this.states = states;
    this.alphabet = alphabet;
    this.transitions = transitions;
    this.initialState = initialState;
    this.finalStates = finalStates;
  }

  public List<String> getStates() {
    return states;
  }

  public List<String> getAlphabet() {
    return alphabet;
  }

  public List<TransitionRecord> getTransitions() {
    return transitions;
  }

  public String getInitialState() {
    return initialState;
  }

  public List<String> getFinalStates() {
    return finalStates;
  }
}
