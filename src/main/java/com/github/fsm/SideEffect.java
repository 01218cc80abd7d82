package com.github.fsm;

/**
 * Action run on the caller's thread once a transition has been matched and before the machine
 * moves to the target state.
 */
@FunctionalInterface
public interface SideEffect<E extends Enum<E>, C> {

  void apply(C context, E from, E to);

}
