package com.github.hfsm;

/**
 * A side-effecting step attached to a transition. Before-actions run prior to the commit and abort
 * the transition by throwing. After-actions run once the new state is committed; when dispatched
 * asynchronously they may be invoked more than once and must tolerate duplicates.
 */
@FunctionalInterface
public interface Action {

  void execute(final StateMachineInstance instance, final TransitionContext context)
      throws Exception;

}
