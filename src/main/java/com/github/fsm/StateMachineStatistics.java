package com.github.fsm;

/**
 * Simple statistics holder for a machine. Counters are updated by the owning machine and follow
 * its threading rules.
 */
public final class StateMachineStatistics {
  private final String machineId;
  private final long startTstampMillis = System.currentTimeMillis();
  int transitionSuccesses;
  int transitionRejections;
  int sideEffectFailures;
  long lastTransitionMillis;

  StateMachineStatistics(final String machineId) {
    this.machineId = machineId;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  /**
   * Attempts for which no eligible transition existed.
   */
  public int getTransitionRejections() {
    return transitionRejections;
  }

  public int getSideEffectFailures() {
    return sideEffectFailures;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", transitionSuccesses=" + transitionSuccesses
        + ", transitionRejections=" + transitionRejections + ", sideEffectFailures="
        + sideEffectFailures + ", lastTransitionMillis=" + lastTransitionMillis + "]";
  }

}
