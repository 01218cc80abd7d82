package com.github.fsm.serialization;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain-data, registry independent form of a state machine definition. This is what gets
 * persisted: states are carried by their canonical names and transition logic only by the names
 * it was registered under.
 */
public final class SerializableStateMachine {
  private String entityLabel;
  private String initialState;
  private List<String> states = new ArrayList<>();
  private List<SerializableTransition> transitions = new ArrayList<>();

  public SerializableStateMachine() {}

  public SerializableStateMachine(final String entityLabel, final String initialState,
      final List<String> states, final List<SerializableTransition> transitions) {
    this.entityLabel = entityLabel;
    this.initialState = initialState;
    setStates(states);
    setTransitions(transitions);
  }

  public String getEntityLabel() {
    return entityLabel;
  }

  public void setEntityLabel(String entityLabel) {
    this.entityLabel = entityLabel;
  }

  public String getInitialState() {
    return initialState;
  }

  public void setInitialState(String initialState) {
    this.initialState = initialState;
  }

  public List<String> getStates() {
    return states;
  }

  public void setStates(List<String> states) {
    this.states = states != null ? new ArrayList<>(states) : new ArrayList<>();
  }

  public List<SerializableTransition> getTransitions() {
    return transitions;
  }

  public void setTransitions(List<SerializableTransition> transitions) {
    this.transitions = transitions != null ? new ArrayList<>(transitions) : new ArrayList<>();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SerializableStateMachine)) {
      return false;
    }
    SerializableStateMachine other = (SerializableStateMachine) o;
    return Objects.equals(entityLabel, other.entityLabel)
        && Objects.equals(initialState, other.initialState) && Objects.equals(states, other.states)
        && Objects.equals(transitions, other.transitions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityLabel, initialState, states, transitions);
  }

  @Override
  public String toString() {
    return "SerializableStateMachine [entityLabel=" + entityLabel + ", initialState="
        + initialState + ", states=" + states + ", transitions=" + transitions + "]";
  }
}
