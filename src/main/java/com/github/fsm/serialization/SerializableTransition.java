package com.github.fsm.serialization;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Name-only mirror of a transition. Condition and side effect names are optional and are left
 * out of the encoded form when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SerializableTransition {
  private String from;
  private String to;
  private String conditionName;
  private String sideEffectName;

  public SerializableTransition() {}

  public SerializableTransition(final String from, final String to, final String conditionName,
      final String sideEffectName) {
    this.from = from;
    this.to = to;
    this.conditionName = conditionName;
    this.sideEffectName = sideEffectName;
  }

  public String getFrom() {
    return from;
  }

  public void setFrom(String from) {
    this.from = from;
  }

  public String getTo() {
    return to;
  }

  public void setTo(String to) {
    this.to = to;
  }

  public String getConditionName() {
    return conditionName;
  }

  public void setConditionName(String conditionName) {
    this.conditionName = conditionName;
  }

  public String getSideEffectName() {
    return sideEffectName;
  }

  public void setSideEffectName(String sideEffectName) {
    this.sideEffectName = sideEffectName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SerializableTransition)) {
      return false;
    }
    SerializableTransition other = (SerializableTransition) o;
    return Objects.equals(from, other.from) && Objects.equals(to, other.to)
        && Objects.equals(conditionName, other.conditionName)
        && Objects.equals(sideEffectName, other.sideEffectName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to, conditionName, sideEffectName);
  }

  @Override
  public String toString() {
    return "SerializableTransition [from=" + from + ", to=" + to + ", conditionName="
        + conditionName + ", sideEffectName=" + sideEffectName + "]";
  }
}
