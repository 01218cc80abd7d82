package com.github.fsm;

/**
 * How condition and side effect names found in a persisted definition are treated when they are
 * missing from the registry it gets loaded against.
 */
public enum NameResolutionMode {
  // substitute an always-true condition or a no-op side effect and carry on, logging a warning
  LENIENT,
  // fail the load with UNKNOWN_CONDITION or UNKNOWN_SIDE_EFFECT
  STRICT;
}
