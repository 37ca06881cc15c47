package com.github.hfsm;

import com.github.hfsm.StateMachineException.Code;

/**
 * A named trigger that callers fire on an instance. Events are independent of the state set; the
 * same event may drive several transitions out of different states.
 */
public final class Event {
  final static int maxEventNameLength = 64;
  private final String name;

  public Event(final String name) throws StateMachineException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxEventNameLength) {
      throw new StateMachineException(Code.INVALID_EVENT_NAME,
          "Invalid event name: " + name + ". " + Code.INVALID_EVENT_NAME.getDescription());
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
    return name.equals(((Event) obj).name);
  }

  @Override
  public String toString() {
    return "Event [name=" + name + "]";
  }
}
