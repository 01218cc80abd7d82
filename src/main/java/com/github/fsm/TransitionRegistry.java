package com.github.fsm;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Named lookup table of conditions and side effects. Transitions reference entries in here by
 * name so that a definition can be persisted without its functions and later be rehydrated.
 *
 * Registration is insert-or-overwrite, the last registration under a name wins. Null names and
 * functions are rejected. A registry is not synchronized: populate it up front, after which
 * concurrent lookups are safe. Registrations racing with lookups have to be guarded by the caller.
 */
public final class TransitionRegistry<E extends Enum<E>, C> {
  private static final Logger logger =
      LogManager.getLogger(TransitionRegistry.class.getSimpleName());

  private final Map<String, Condition<C>> conditions = new HashMap<>();
  private final Map<String, SideEffect<E, C>> sideEffects = new HashMap<>();

  public TransitionRegistry<E, C> registerCondition(final String name,
      final Condition<C> condition) {
    if (name == null || condition == null) {
      throw new IllegalArgumentException("Condition name and function are both required");
    }
    if (conditions.put(name, condition) != null && logger.isDebugEnabled()) {
      logger.debug("Overwrote condition registered as " + name);
    }
    return this;
  }

  public TransitionRegistry<E, C> registerSideEffect(final String name,
      final SideEffect<E, C> sideEffect) {
    if (name == null || sideEffect == null) {
      throw new IllegalArgumentException("Side effect name and function are both required");
    }
    if (sideEffects.put(name, sideEffect) != null && logger.isDebugEnabled()) {
      logger.debug("Overwrote side effect registered as " + name);
    }
    return this;
  }

  public Optional<Condition<C>> findCondition(final String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(conditions.get(name));
  }

  public Optional<SideEffect<E, C>> findSideEffect(final String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(sideEffects.get(name));
  }

  /**
   * Read-only view of all registered conditions.
   */
  public Map<String, Condition<C>> getConditions() {
    return Collections.unmodifiableMap(conditions);
  }

  /**
   * Read-only view of all registered side effects.
   */
  public Map<String, SideEffect<E, C>> getSideEffects() {
    return Collections.unmodifiableMap(sideEffects);
  }

  @Override
  public String toString() {
    return "TransitionRegistry [conditions=" + conditions.keySet() + ", sideEffects="
        + sideEffects.keySet() + "]";
  }
}
