package com.github.fsm;

import java.util.List;

/**
 * A running finite state machine: a cursor over the states of an immutable
 * {@link StateMachineDefinition}, moved only by successful transitions.
 *
 * Notes for users:<br>
 * 1. a machine starts in its definition's initial state<br>
 *
 * 2. transitions are looked up in declaration order, the first one leaving the current state for
 * the requested target whose condition holds is the one taken. Targeting the current state is no
 * exception, it only succeeds if a matching self-transition is declared<br>
 *
 * 3. a matched transition's side effect runs before the cursor moves. If it throws, the machine
 * stays where it was and the exception reaches the caller unchanged. The same goes for
 * conditions<br>
 *
 * 4. a machine instance is NOT thread-safe, callers sharing one across threads must serialize
 * access to it. The definition underneath can be shared freely<br>
 *
 * 5. everything runs on the caller's thread, there are no timeouts<br>
 */
public interface StateMachine<E extends Enum<E>, C> {

  /**
   * Report the current state of the state machine.
   */
  E getCurrentState();

  State<E> getCurrent();

  /**
   * Returns true iff a transition from the current state to target exists whose condition holds
   * for the given context. Never changes the current state.
   */
  boolean canTransitionTo(final E target, final C context) throws StateMachineException;

  /**
   * Transition the state machine to the target state. Returns true iff a transition was taken, in
   * which case its side effect has run once and the current state is target.
   */
  boolean tryTransitionTo(final E target, final C context) throws StateMachineException;

  /**
   * States reachable from the current state for the given context, in declaration order, without
   * duplicates.
   */
  List<E> getPermittedTargets(final C context) throws StateMachineException;

  StateMachineDefinition<E, C> getDefinition();

  /**
   * Reports the id of this StateMachine instance.
   */
  String getId();

  StateMachineConfiguration getConfiguration();

  StateMachineStatistics getStatistics();

}
