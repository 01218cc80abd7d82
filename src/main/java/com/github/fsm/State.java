package com.github.fsm;

import java.util.Objects;

/**
 * This object represents an immutable state, one value of the enum that enumerates the state
 * space of a machine. Identity is the state's name: two states are equal iff their names are.
 */
public final class State<E extends Enum<E>> {
  private final E value;
  private final String name;

  private State(final E value) {
    this.value = value;
    this.name = value.name();
  }

  public static <E extends Enum<E>> State<E> of(final E value) {
    Objects.requireNonNull(value, "state value");
    return new State<>(value);
  }

  public E getValue() {
    return value;
  }

  /**
   * Canonical name, the enum constant's declared identifier. This is what gets persisted.
   */
  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State<?> other = (State<?>) obj;
    return name.equals(other.name);
  }

  @Override
  public String toString() {
    return "State [name=" + name + "]";
  }
}
