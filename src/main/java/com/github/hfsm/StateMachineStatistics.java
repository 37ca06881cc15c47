package com.github.hfsm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holder of statistics for an engine and all its bound instances. Instance stats are pre-cached for
 * sometime and lazily recomputed, as needed.
 */
public final class StateMachineStatistics {
  private final String engineId;
  private final Collection<StateMachineInstance> boundInstances;

  StateMachineStatistics(final String engineId,
      final Collection<StateMachineInstance> boundInstances) {
    this.engineId = engineId;
    this.boundInstances = boundInstances;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  private final List<InstanceStatistics> latestInstanceStats = new ArrayList<>();
  final AtomicInteger totalDefinitions = new AtomicInteger();
  final AtomicInteger totalBoundInstances = new AtomicInteger();
  final AtomicInteger totalUnboundInstances = new AtomicInteger();
  final AtomicInteger totalTransitionSuccesses = new AtomicInteger();
  final AtomicInteger totalTransitionFailures = new AtomicInteger();
  final AtomicInteger totalAfterActionFailures = new AtomicInteger();
  private long lastComputedMillis;
  private final long recomputeIntervalMillis = 60 * 1000L;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getEngineId() {
    return engineId;
  }

  /**
   * Report stats for all instances currently bound to the engine.
   */
  public synchronized List<InstanceStatistics> getInstanceStats() {
    if (lastComputedMillis == 0L
        || (lastComputedMillis + recomputeIntervalMillis < System.currentTimeMillis())) {
      refreshInstanceStats();
    }
    return Collections.unmodifiableList(new ArrayList<>(latestInstanceStats));
  }

  synchronized void refreshInstanceStats() {
    final List<InstanceStatistics> instanceStats = new ArrayList<>();
    for (final StateMachineInstance instance : boundInstances) {
      instanceStats.add(instance.getStatistics());
    }
    latestInstanceStats.clear();
    latestInstanceStats.addAll(instanceStats);
    lastComputedMillis = System.currentTimeMillis();
  }

  public synchronized long getLastComputedMillis() {
    return lastComputedMillis;
  }

  public int getTotalDefinitions() {
    return totalDefinitions.get();
  }

  public int getTotalBoundInstances() {
    return totalBoundInstances.get();
  }

  public int getTotalUnboundInstances() {
    return totalUnboundInstances.get();
  }

  /**
   * Instances bound and not yet unbound.
   */
  public int getLiveInstances() {
    return totalBoundInstances.get() - totalUnboundInstances.get();
  }

  public int getTotalTransitionSuccesses() {
    return totalTransitionSuccesses.get();
  }

  public int getTotalTransitionFailures() {
    return totalTransitionFailures.get();
  }

  public int getTotalAfterActionFailures() {
    return totalAfterActionFailures.get();
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [engineId=" + engineId + ", startTstampMillis="
        + startTstampMillis + ", totalDefinitions=" + totalDefinitions + ", totalBoundInstances="
        + totalBoundInstances + ", totalUnboundInstances=" + totalUnboundInstances
        + ", totalTransitionSuccesses=" + totalTransitionSuccesses + ", totalTransitionFailures="
        + totalTransitionFailures + ", totalAfterActionFailures=" + totalAfterActionFailures
        + "]";
  }

}
