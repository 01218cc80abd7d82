package com.github.fsm;

/**
 * Lifecycle of a {@link StateMachineDefinitionBuilder}. A builder is configuring from the moment
 * it's created and becomes built after a successful build(). Configuring it again sends it back.
 */
public enum BuilderPhase {
  CONFIGURING,
  BUILT;
}
