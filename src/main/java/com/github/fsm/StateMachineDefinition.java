package com.github.fsm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.fsm.StateMachineException.Code;

/**
 * Immutable description of a machine: the entity it governs, every state it may occupy, the
 * ordered transitions between them and the state it starts in.
 *
 * Transition order is significant, machines scan transitions in declaration order and the first
 * eligible one wins. States keep insertion order for serialization only.
 *
 * Once constructed a definition never changes, so one instance can be shared by any number of
 * machines across threads.
 */
public final class StateMachineDefinition<E extends Enum<E>, C> {
  private final String entityLabel;
  private final Set<State<E>> states;
  private final List<Transition<E, C>> transitions;
  private final State<E> initialState;

  /**
   * Every transition endpoint and the initial state must be members of {@code states}, otherwise
   * this fails with {@link Code#INVALID_DEFINITION}.
   */
  public StateMachineDefinition(final String entityLabel, final Collection<State<E>> states,
      final List<Transition<E, C>> transitions, final State<E> initialState)
      throws StateMachineException {
    if (states == null || transitions == null || initialState == null) {
      throw new StateMachineException(Code.INVALID_DEFINITION,
          "States, transitions and initial state are all required");
    }
    final Set<State<E>> stateSet = new LinkedHashSet<>(states);
    if (stateSet.contains(null)) {
      throw new StateMachineException(Code.INVALID_DEFINITION, "Null state in " + entityLabel);
    }
    if (!stateSet.contains(initialState)) {
      throw new StateMachineException(Code.INVALID_DEFINITION,
          "Initial state " + initialState.getName() + " is not a declared state");
    }
    for (final Transition<E, C> transition : transitions) {
      if (transition == null) {
        throw new StateMachineException(Code.INVALID_DEFINITION, "Null transition");
      }
      if (!stateSet.contains(transition.getFromState())
          || !stateSet.contains(transition.getToState())) {
        throw new StateMachineException(Code.INVALID_DEFINITION,
            "Transition references an undeclared state: " + transition);
      }
    }
    this.entityLabel = entityLabel;
    this.states = Collections.unmodifiableSet(stateSet);
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.initialState = initialState;
  }

  public String getEntityLabel() {
    return entityLabel;
  }

  public Set<State<E>> getStates() {
    return states;
  }

  public List<Transition<E, C>> getTransitions() {
    return transitions;
  }

  public State<E> getInitialState() {
    return initialState;
  }

  public Class<E> getStateType() {
    return initialState.getValue().getDeclaringClass();
  }

  /**
   * Transitions leaving the given state, in declaration order.
   */
  public List<Transition<E, C>> getTransitionsFrom(final State<E> state) {
    final List<Transition<E, C>> leaving = new ArrayList<>();
    for (final Transition<E, C> transition : transitions) {
      if (transition.getFromState().equals(state)) {
        leaving.add(transition);
      }
    }
    return leaving;
  }

  public Optional<State<E>> findState(final String name) {
    for (final State<E> state : states) {
      if (state.getName().equals(name)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "StateMachineDefinition [entityLabel=" + entityLabel + ", initialState="
        + initialState.getName() + ", states=" + states.size() + ", transitions="
        + transitions.size() + "]";
  }
}
