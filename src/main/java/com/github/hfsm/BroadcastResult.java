package com.github.hfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-child outcome of broadcasting one event from a parent to all of its linked children. Every
 * child fire is independent: a failure on one child never blocks or rolls back its siblings.
 */
public final class BroadcastResult {
  private final String parentKey;
  private final String eventName;
  // K=child.key, V=outcome, in link order
  private final Map<String, TransitionResult> outcomes;

  BroadcastResult(final String parentKey, final String eventName,
      final Map<String, TransitionResult> outcomes) {
    this.parentKey = parentKey;
    this.eventName = eventName;
    this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
  }

  /**
   * Attribute under which a broadcast after-action leaves its result in the parent's context.
   */
  public static String contextKey(final String eventName) {
    return "broadcast:" + eventName;
  }

  public String getParentKey() {
    return parentKey;
  }

  public String getEventName() {
    return eventName;
  }

  public Map<String, TransitionResult> getOutcomes() {
    return outcomes;
  }

  public Map<String, TransitionResult> getFailures() {
    final Map<String, TransitionResult> failures = new LinkedHashMap<>();
    for (final Map.Entry<String, TransitionResult> outcome : outcomes.entrySet()) {
      if (!outcome.getValue().isSuccessful()) {
        failures.put(outcome.getKey(), outcome.getValue());
      }
    }
    return Collections.unmodifiableMap(failures);
  }

  public int getSuccessCount() {
    return outcomes.size() - getFailures().size();
  }

  /**
   * True if at least one child failed; the remaining children may still have transitioned.
   */
  public boolean isPartialFailure() {
    return !getFailures().isEmpty();
  }

  @Override
  public String toString() {
    return "BroadcastResult [parentKey=" + parentKey + ", eventName=" + eventName + ", children="
        + outcomes.size() + ", failures=" + getFailures().keySet() + "]";
  }
}
