package com.github.fsm;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * Default {@link StateMachine}. Holds the only mutable piece of a machine, the current state, and
 * walks the definition's transitions in declaration order to move it.
 */
public final class StateMachineImpl<E extends Enum<E>, C> implements StateMachine<E, C> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineDefinition<E, C> definition;
  private final StateMachineConfiguration configuration;
  private final StateMachineStatistics machineStats;

  private State<E> current;

  public StateMachineImpl(final StateMachineDefinition<E, C> definition)
      throws StateMachineException {
    this(definition, StateMachineConfiguration.defaults());
  }

  public StateMachineImpl(final StateMachineDefinition<E, C> definition,
      final StateMachineConfiguration configuration) throws StateMachineException {
    if (definition == null || configuration == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION,
          "Definition and configuration are both required");
    }
    this.definition = definition;
    this.configuration = configuration;
    this.current = definition.getInitialState();
    this.machineStats = new StateMachineStatistics(machineId);
    logInfo(machineId, "Fired up state machine for " + definition.getEntityLabel() + " in "
        + current.getName());
  }

  @Override
  public E getCurrentState() {
    return current.getValue();
  }

  @Override
  public State<E> getCurrent() {
    return current;
  }

  @Override
  public boolean canTransitionTo(final E target, final C context) throws StateMachineException {
    return findTransition(target, context) != null;
  }

  @Override
  public boolean tryTransitionTo(final E target, final C context) throws StateMachineException {
    final Transition<E, C> transition = findTransition(target, context);
    if (transition == null) {
      machineStats.transitionRejections++;
      logDebug(machineId, String.format("No eligible transition from %s to %s",
          current.getName(), target));
      return false;
    }
    final State<E> fromState = current;
    if (transition.getSideEffect().isPresent()) {
      try {
        transition.getSideEffect().get().apply(context, fromState.getValue(), target);
      } catch (RuntimeException problem) {
        machineStats.sideEffectFailures++;
        logError(machineId, String.format("Side effect of %s->%s failed, staying in %s",
            fromState.getName(), target, fromState.getName()), problem);
        throw problem;
      }
    }
    current = transition.getToState();
    machineStats.transitionSuccesses++;
    machineStats.lastTransitionMillis = System.currentTimeMillis();
    logInfo(machineId, String.format("Successfully transitioned from %s->%s", fromState.getName(),
        current.getName()));
    return true;
  }

  @Override
  public List<E> getPermittedTargets(final C context) throws StateMachineException {
    checkContext(context);
    final List<E> targets = new ArrayList<>();
    for (final Transition<E, C> transition : definition.getTransitionsFrom(current)) {
      final E target = transition.getToState().getValue();
      if (!targets.contains(target) && transition.getCondition().test(context)) {
        targets.add(target);
      }
    }
    return targets;
  }

  @Override
  public StateMachineDefinition<E, C> getDefinition() {
    return definition;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  /**
   * First transition, in declaration order, from the current state to target whose condition
   * holds. Null if there is none.
   */
  private Transition<E, C> findTransition(final E target, final C context)
      throws StateMachineException {
    if (target == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION, "Target state cannot be null");
    }
    checkContext(context);
    final State<E> targetState = State.of(target);
    for (final Transition<E, C> transition : definition.getTransitions()) {
      if (transition.connects(current, targetState) && transition.getCondition().test(context)) {
        return transition;
      }
    }
    return null;
  }

  private void checkContext(final C context) throws StateMachineException {
    if (context == null && configuration.isContextRequired()) {
      throw new StateMachineException(Code.NULL_CONTEXT,
          "State machine id:" + machineId + " requires a non-null context");
    }
  }

  private static void logError(final String machineId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineImpl [machineId=" + machineId + ", entityLabel="
        + definition.getEntityLabel() + ", current=" + current.getName() + "]";
  }
}
