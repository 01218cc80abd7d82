package com.github.fsm;

/**
 * Unified single exception that's thrown by this FSM, its builder and its codecs. The code enum
 * tells configuration mistakes apart from decode failures and runtime misuse. Exceptions raised by
 * user supplied conditions and side effects are never wrapped in this one, they reach the caller
 * as they were thrown.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_CONFIGURATION("Builder or machine configuration is invalid"),
    // 2.
    MISSING_INITIAL_STATE("Initial state was never specified"),
    // 3.
    UNKNOWN_CONDITION("Condition name is not registered"),
    // 4.
    UNKNOWN_SIDE_EFFECT("Side effect name is not registered"),
    // 5.
    UNKNOWN_STATE_NAME("State name does not map to any value of the state enum"),
    // 6.
    INVALID_DEFINITION(
        "State machine definition is structurally invalid, every referenced state must be declared"),
    // 7.
    NULL_CONTEXT("Transition context cannot be null"),
    // 8.
    SERIALIZATION_FAILURE("Failed to encode or decode the serializable state machine");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
