package com.github.fsm;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;
import com.github.fsm.serialization.SerializableStateMachine;
import com.github.fsm.serialization.SerializableTransition;

/**
 * Fluent builder of {@link StateMachineDefinition}s over an enum state type.
 *
 * Notes for users:<br>
 * 1. every state referenced through withInitialState() or addTransition() is added to the state
 * set, so a built definition never refers to an undeclared state<br>
 *
 * 2. addTransition() hands out a {@link TransitionBuilder} scoped to one from->to pair. Its done()
 * appends the finished transition and returns this builder. Transitions are evaluated by machines
 * in the order they were added here<br>
 *
 * 3. conditions and side effects can be given either inline, optionally with a name, or by the
 * name they were registered under in the {@link TransitionRegistry} set through withRegistry().
 * Only names survive toSerializable(), the functions themselves are never persisted<br>
 *
 * 4. build() can be called any number of times, each call snapshots the builder as it is at that
 * moment into a new definition<br>
 *
 * 5. a builder is not thread-safe<br>
 */
public final class StateMachineDefinitionBuilder<E extends Enum<E>, C> {
  private static final Logger logger =
      LogManager.getLogger(StateMachineDefinitionBuilder.class.getSimpleName());

  private final Class<E> stateType;
  private final String entityLabel;
  private final Set<State<E>> states = new LinkedHashSet<>();
  private final List<Transition<E, C>> transitions = new ArrayList<>();
  private State<E> initialState;
  private TransitionRegistry<E, C> registry;
  private StateMachineConfiguration configuration = StateMachineConfiguration.defaults();
  private BuilderPhase phase = BuilderPhase.CONFIGURING;

  public static <E extends Enum<E>, C> StateMachineDefinitionBuilder<E, C> create(
      final Class<E> stateType, final String entityLabel) {
    return new StateMachineDefinitionBuilder<>(stateType, entityLabel);
  }

  private StateMachineDefinitionBuilder(final Class<E> stateType, final String entityLabel) {
    if (stateType == null) {
      throw new IllegalArgumentException("State type cannot be null");
    }
    this.stateType = stateType;
    this.entityLabel = entityLabel;
  }

  /**
   * Sets the state new machines start in, adding it to the state set if it's not there yet.
   */
  public StateMachineDefinitionBuilder<E, C> withInitialState(final E state)
      throws StateMachineException {
    if (state == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION, "Initial state cannot be null");
    }
    initialState = State.of(state);
    states.add(initialState);
    phase = BuilderPhase.CONFIGURING;
    return this;
  }

  public StateMachineDefinitionBuilder<E, C> withRegistry(final TransitionRegistry<E, C> registry)
      throws StateMachineException {
    if (registry == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION, "Registry cannot be null");
    }
    this.registry = registry;
    phase = BuilderPhase.CONFIGURING;
    return this;
  }

  public StateMachineDefinitionBuilder<E, C> withConfiguration(
      final StateMachineConfiguration configuration) throws StateMachineException {
    if (configuration == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION,
          "Configuration cannot be null");
    }
    this.configuration = configuration;
    return this;
  }

  /**
   * Starts a transition between the given states. Both are added to the state set right away,
   * the transition itself only once {@link TransitionBuilder#done()} is called.
   */
  public TransitionBuilder addTransition(final E from, final E to) throws StateMachineException {
    if (from == null || to == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION,
          "Transition endpoints cannot be null: " + from + "->" + to);
    }
    final State<E> fromState = State.of(from);
    final State<E> toState = State.of(to);
    states.add(fromState);
    states.add(toState);
    phase = BuilderPhase.CONFIGURING;
    return new TransitionBuilder(fromState, toState);
  }

  public StateMachineDefinition<E, C> build() throws StateMachineException {
    requireInitialState();
    final StateMachineDefinition<E, C> definition =
        new StateMachineDefinition<>(entityLabel, states, transitions, initialState);
    phase = BuilderPhase.BUILT;
    logger.info("Built " + definition);
    return definition;
  }

  /**
   * Projects the builder's states and transitions into their persistable form. Transitions carry
   * the names of their condition and side effect, or no name where none was given.
   */
  public SerializableStateMachine toSerializable() throws StateMachineException {
    requireInitialState();
    final List<String> stateNames = new ArrayList<>(states.size());
    for (final State<E> state : states) {
      stateNames.add(state.getName());
    }
    final List<SerializableTransition> serializableTransitions =
        new ArrayList<>(transitions.size());
    for (final Transition<E, C> transition : transitions) {
      serializableTransitions.add(new SerializableTransition(transition.getFromState().getName(),
          transition.getToState().getName(), transition.getConditionName().orElse(null),
          transition.getSideEffectName().orElse(null)));
    }
    return new SerializableStateMachine(entityLabel, initialState.getName(), stateNames,
        serializableTransitions);
  }

  /**
   * Loads a persisted definition into this builder, on top of whatever it already holds. State
   * names must all map to values of the state enum or nothing is loaded. Condition and side effect
   * names are resolved against the given registry; names it does not know are handled per the
   * configured {@link NameResolutionMode}.
   */
  public StateMachineDefinitionBuilder<E, C> loadFrom(final SerializableStateMachine dto,
      final TransitionRegistry<E, C> registry) throws StateMachineException {
    if (dto == null || registry == null) {
      throw new StateMachineException(Code.INVALID_CONFIGURATION,
          "Serialized state machine and registry are both required");
    }
    if (!Objects.equals(entityLabel, dto.getEntityLabel())) {
      logger.warn("Loading a state machine persisted for '" + dto.getEntityLabel()
          + "' into a builder for '" + entityLabel + "', the builder's label is kept");
    }
    final State<E> loadedInitialState = parseState(dto.getInitialState());
    final List<State<E>> loadedStates = new ArrayList<>();
    for (final String name : dto.getStates()) {
      loadedStates.add(parseState(name));
    }
    final List<Transition<E, C>> loadedTransitions = new ArrayList<>();
    for (final SerializableTransition serialized : dto.getTransitions()) {
      if (serialized == null) {
        throw new StateMachineException(Code.INVALID_CONFIGURATION, "Null serialized transition");
      }
      final State<E> fromState = parseState(serialized.getFrom());
      final State<E> toState = parseState(serialized.getTo());
      final Condition<C> condition =
          resolveCondition(registry, serialized.getConditionName(), serialized);
      final SideEffect<E, C> sideEffect =
          resolveSideEffect(registry, serialized.getSideEffectName(), serialized);
      loadedTransitions.add(new Transition<>(fromState, toState, condition, sideEffect,
          serialized.getConditionName(), serialized.getSideEffectName()));
    }

    initialState = loadedInitialState;
    states.add(loadedInitialState);
    states.addAll(loadedStates);
    for (final Transition<E, C> transition : loadedTransitions) {
      states.add(transition.getFromState());
      states.add(transition.getToState());
      transitions.add(transition);
    }
    phase = BuilderPhase.CONFIGURING;
    logger.info(String.format("Loaded %d states and %d transitions for %s", loadedStates.size(),
        loadedTransitions.size(), dto.getEntityLabel()));
    return this;
  }

  public BuilderPhase getPhase() {
    return phase;
  }

  public String getEntityLabel() {
    return entityLabel;
  }

  public Class<E> getStateType() {
    return stateType;
  }

  private void requireInitialState() throws StateMachineException {
    if (initialState == null) {
      throw new StateMachineException(Code.MISSING_INITIAL_STATE,
          "Initial state not specified for " + entityLabel);
    }
  }

  private State<E> parseState(final String name) throws StateMachineException {
    if (name == null) {
      throw new StateMachineException(Code.UNKNOWN_STATE_NAME, "State name cannot be null");
    }
    try {
      return State.of(Enum.valueOf(stateType, name));
    } catch (IllegalArgumentException unknown) {
      throw new StateMachineException(Code.UNKNOWN_STATE_NAME,
          "'" + name + "' is not a value of " + stateType.getSimpleName(), unknown);
    }
  }

  private Condition<C> resolveCondition(final TransitionRegistry<E, C> registry,
      final String name, final SerializableTransition serialized) throws StateMachineException {
    if (name == null) {
      return null;
    }
    final Optional<Condition<C>> condition = registry.findCondition(name);
    if (condition.isPresent()) {
      return condition.get();
    }
    if (configuration.getNameResolutionMode() == NameResolutionMode.STRICT) {
      throw new StateMachineException(Code.UNKNOWN_CONDITION,
          "Condition '" + name + "' of " + serialized + " is not registered");
    }
    logger.warn("Condition '" + name + "' is not registered, " + serialized.getFrom() + "->"
        + serialized.getTo() + " will be unconditionally eligible");
    return null;
  }

  private SideEffect<E, C> resolveSideEffect(final TransitionRegistry<E, C> registry,
      final String name, final SerializableTransition serialized) throws StateMachineException {
    if (name == null) {
      return null;
    }
    final Optional<SideEffect<E, C>> sideEffect = registry.findSideEffect(name);
    if (sideEffect.isPresent()) {
      return sideEffect.get();
    }
    if (configuration.getNameResolutionMode() == NameResolutionMode.STRICT) {
      throw new StateMachineException(Code.UNKNOWN_SIDE_EFFECT,
          "Side effect '" + name + "' of " + serialized + " is not registered");
    }
    logger.warn("Side effect '" + name + "' is not registered, " + serialized.getFrom() + "->"
        + serialized.getTo() + " will not run it");
    return null;
  }

  /**
   * Short-lived builder for a single transition. It's finished by {@link #done()}, which can only
   * be called once.
   */
  public final class TransitionBuilder {
    private final State<E> fromState;
    private final State<E> toState;
    private Condition<C> condition;
    private SideEffect<E, C> sideEffect;
    private String conditionName;
    private String sideEffectName;
    private boolean finished;

    private TransitionBuilder(final State<E> fromState, final State<E> toState) {
      this.fromState = fromState;
      this.toState = toState;
    }

    public TransitionBuilder when(final Condition<C> condition) {
      return when(condition, null);
    }

    public TransitionBuilder when(final Condition<C> condition, final String name) {
      this.condition = condition;
      this.conditionName = name;
      return this;
    }

    /**
     * Uses the condition registered under the given name.
     */
    public TransitionBuilder when(final String name) throws StateMachineException {
      if (registry == null) {
        throw new StateMachineException(Code.INVALID_CONFIGURATION,
            "No registry set, call withRegistry() before referencing condition '" + name + "'");
      }
      final Optional<Condition<C>> registered = registry.findCondition(name);
      if (!registered.isPresent()) {
        throw new StateMachineException(Code.UNKNOWN_CONDITION,
            "Condition '" + name + "' not found in registry");
      }
      return when(registered.get(), name);
    }

    public TransitionBuilder withSideEffect(final SideEffect<E, C> sideEffect) {
      return withSideEffect(sideEffect, null);
    }

    public TransitionBuilder withSideEffect(final SideEffect<E, C> sideEffect, final String name) {
      this.sideEffect = sideEffect;
      this.sideEffectName = name;
      return this;
    }

    /**
     * Uses the side effect registered under the given name.
     */
    public TransitionBuilder withSideEffect(final String name) throws StateMachineException {
      if (registry == null) {
        throw new StateMachineException(Code.INVALID_CONFIGURATION,
            "No registry set, call withRegistry() before referencing side effect '" + name + "'");
      }
      final Optional<SideEffect<E, C>> registered = registry.findSideEffect(name);
      if (!registered.isPresent()) {
        throw new StateMachineException(Code.UNKNOWN_SIDE_EFFECT,
            "Side effect '" + name + "' not found in registry");
      }
      return withSideEffect(registered.get(), name);
    }

    public StateMachineDefinitionBuilder<E, C> done() throws StateMachineException {
      if (finished) {
        throw new StateMachineException(Code.INVALID_CONFIGURATION,
            "Transition " + fromState.getName() + "->" + toState.getName() + " is already done");
      }
      finished = true;
      transitions.add(new Transition<>(fromState, toState, condition, sideEffect, conditionName,
          sideEffectName));
      phase = BuilderPhase.CONFIGURING;
      return StateMachineDefinitionBuilder.this;
    }
  }
}
