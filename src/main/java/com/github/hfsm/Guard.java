package com.github.hfsm;

/**
 * A predicate deciding whether a candidate transition may be taken. Guards must not mutate the
 * instance; they may block on I/O (eg. reading related aggregates) since they are evaluated outside
 * of the per-instance commit lock.
 */
@FunctionalInterface
public interface Guard {

  boolean evaluate(final StateMachineInstance instance, final TransitionContext context)
      throws Exception;

}
