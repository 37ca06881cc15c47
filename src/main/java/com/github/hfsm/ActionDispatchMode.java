package com.github.hfsm;

/**
 * This represents the mode used by the engine to run after-actions once a transition is committed.
 */
public enum ActionDispatchMode {
  // run after-actions on the caller thread before fire() returns.
  CALLER_THREAD,
  // hand after-actions, in declaration order, to the engine's action pool. fire() returns as soon
  // as the commit is done.
  ASYNC;
}
