package com.github.fsm;

/**
 * This class encapsulates the configuration parameters shared by definition builders and
 * machines. Use the {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. nameResolutionMode decides what loading a persisted definition does with condition and side
 * effect names that are missing from the registry. LENIENT, the default, swaps in always-true and
 * no-op functions. STRICT fails the load instead.<br>
 * 2. contextRequired, on by default, makes machines reject a null context up front instead of
 * handing it to conditions.<br>
 */
public final class StateMachineConfiguration {
  private final NameResolutionMode nameResolutionMode;
  private final boolean contextRequired;

  private static final StateMachineConfiguration DEFAULTS =
      new StateMachineConfiguration(NameResolutionMode.LENIENT, true);

  public static StateMachineConfiguration defaults() {
    return DEFAULTS;
  }

  public NameResolutionMode getNameResolutionMode() {
    return nameResolutionMode;
  }

  public boolean isContextRequired() {
    return contextRequired;
  }

  public final static class StateMachineConfigurationBuilder {
    private NameResolutionMode nameResolutionMode = NameResolutionMode.LENIENT;
    private boolean contextRequired = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder nameResolutionMode(
        final NameResolutionMode nameResolutionMode) {
      this.nameResolutionMode = nameResolutionMode;
      return this;
    }

    public StateMachineConfigurationBuilder contextRequired(final boolean contextRequired) {
      this.contextRequired = contextRequired;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(nameResolutionMode, contextRequired);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (nameResolutionMode == null) {
      messages.append("NameResolutionMode cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [nameResolutionMode=" + nameResolutionMode
        + ", contextRequired=" + contextRequired + "]";
  }

  private StateMachineConfiguration(final NameResolutionMode nameResolutionMode,
      final boolean contextRequired) {
    this.nameResolutionMode = nameResolutionMode;
    this.contextRequired = contextRequired;
  }

}
