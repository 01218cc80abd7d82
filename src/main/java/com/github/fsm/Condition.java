package com.github.fsm;

/**
 * Guard evaluated against the caller's context. Implementations are expected to be cheap and free
 * of side effects since a single transition attempt may evaluate them more than once.
 */
@FunctionalInterface
public interface Condition<C> {

  boolean test(C context);

  static <C> Condition<C> always() {
    return context -> true;
  }
}
