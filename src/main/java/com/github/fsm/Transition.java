package com.github.fsm;

import java.util.Optional;

import com.github.fsm.StateMachineException.Code;

/**
 * An immutable, directed edge between two states. A transition without a condition is always
 * eligible and one without a side effect does nothing when taken.
 *
 * The condition and side effect names are only bookkeeping for persistence: when a name is set,
 * the function next to it is the one that was registered under that name when this transition
 * was created, or the always/no-op default if that name could not be resolved.
 */
public final class Transition<E extends Enum<E>, C> {
  private final State<E> fromState;
  private final State<E> toState;
  private final Condition<C> condition;
  private final SideEffect<E, C> sideEffect;
  private final String conditionName;
  private final String sideEffectName;

  public Transition(final State<E> fromState, final State<E> toState) throws StateMachineException {
    this(fromState, toState, null, null, null, null);
  }

  public Transition(final State<E> fromState, final State<E> toState,
      final Condition<C> condition, final SideEffect<E, C> sideEffect, final String conditionName,
      final String sideEffectName) throws StateMachineException {
    if (fromState == null || toState == null) {
      throw new StateMachineException(Code.INVALID_DEFINITION,
          "Transition endpoints cannot be null: " + fromState + "->" + toState);
    }
    this.fromState = fromState;
    this.toState = toState;
    this.condition = condition != null ? condition : Condition.always();
    this.sideEffect = sideEffect;
    this.conditionName = conditionName;
    this.sideEffectName = sideEffectName;
  }

  public State<E> getFromState() {
    return fromState;
  }

  public State<E> getToState() {
    return toState;
  }

  public Condition<C> getCondition() {
    return condition;
  }

  public Optional<SideEffect<E, C>> getSideEffect() {
    return Optional.ofNullable(sideEffect);
  }

  public Optional<String> getConditionName() {
    return Optional.ofNullable(conditionName);
  }

  public Optional<String> getSideEffectName() {
    return Optional.ofNullable(sideEffectName);
  }

  boolean connects(final State<E> from, final State<E> to) {
    return fromState.equals(from) && toState.equals(to);
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState.getName() + ", toState=" + toState.getName()
        + ", conditionName=" + conditionName + ", sideEffectName=" + sideEffectName + "]";
  }
}
