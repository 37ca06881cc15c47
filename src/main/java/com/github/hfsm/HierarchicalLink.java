package com.github.hfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One parent instance and its ordered children, eg. a bank transaction and the transactions it
 * settles. Children may be added and removed concurrently with broadcasts; every read works on a
 * snapshot of the children at that moment.
 */
public final class HierarchicalLink {
  private final StateMachineInstance parent;
  private final CopyOnWriteArrayList<StateMachineInstance> children = new CopyOnWriteArrayList<>();

  HierarchicalLink(final StateMachineInstance parent) {
    this.parent = parent;
  }

  public StateMachineInstance getParent() {
    return parent;
  }

  public List<StateMachineInstance> getChildren() {
    return Collections.unmodifiableList(new ArrayList<>(children));
  }

  public int size() {
    return children.size();
  }

  /**
   * Current state of every child, in link order. Children may be mid-transition, so this is a mix
   * of whatever each one has committed so far.
   */
  public List<State> childStates() {
    final List<State> states = new ArrayList<>(children.size());
    for (final StateMachineInstance child : children) {
      states.add(child.currentState());
    }
    return states;
  }

  boolean addChild(final StateMachineInstance child) {
    return children.addIfAbsent(child);
  }

  boolean removeChild(final StateMachineInstance child) {
    return children.remove(child);
  }

  @Override
  public String toString() {
    return "HierarchicalLink [parent=" + parent.getKey() + ", children=" + children.size() + "]";
  }
}
