package com.github.hfsm;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple statistics holder for an instance.
 */
public final class InstanceStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String instanceKey;
  final AtomicInteger transitionSuccesses = new AtomicInteger();
  final AtomicInteger transitionFailures = new AtomicInteger();
  final AtomicInteger afterActionFailures = new AtomicInteger();
  // used to track activity level of an instance
  volatile long lastTouchTimeMillis = startMillis;

  InstanceStatistics(final String instanceKey) {
    this.instanceKey = instanceKey;
  }

  public String getInstanceKey() {
    return instanceKey;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses.get();
  }

  public int getTransitionFailures() {
    return transitionFailures.get();
  }

  public int getAfterActionFailures() {
    return afterActionFailures.get();
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  void touch() {
    lastTouchTimeMillis = System.currentTimeMillis();
  }

  @Override
  public String toString() {
    return "InstanceStatistics [instanceKey=" + instanceKey + ", transitionSuccesses="
        + transitionSuccesses + ", transitionFailures=" + transitionFailures
        + ", afterActionFailures=" + afterActionFailures + ", lastTouchTimeMillis="
        + lastTouchTimeMillis + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

  /**
   * One entry of an instance's route: a state, when it was entered and how long it was held. The
   * entry for the current state has elapsedMillis of 0 until the state is left.
   */
  public final static class StateTimePair {
    public final String stateName;
    public final long startMillis;
    public volatile long elapsedMillis;

    StateTimePair(final String stateName, final long startMillis) {
      this.stateName = stateName;
      this.startMillis = startMillis;
    }

    @Override
    public String toString() {
      return "StateTimePair [stateName=" + stateName + ", elapsedMillis=" + elapsedMillis + "]";
    }
  }

}
