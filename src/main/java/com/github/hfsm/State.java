package com.github.hfsm;

import com.github.hfsm.StateMachineException.Code;

/**
 * This object represents immutable metadata about a state. Whether a state is initial or terminal
 * is decided by the {@link StateMachineDefinition} it is declared in, so the same State may be
 * shared by several definitions.
 */
public final class State {
  final static int maxStateNameLength = 64;
  private final String name;

  public State(final String name) throws StateMachineException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxStateNameLength) {
      throw new StateMachineException(Code.INVALID_STATE_NAME,
          "Invalid state name: " + name + ". " + Code.INVALID_STATE_NAME.getDescription());
    }
    this.name = name.trim();
  }

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
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((State) obj).name);
  }

  @Override
  public String toString() {
    return "State [name=" + name + "]";
  }
}
