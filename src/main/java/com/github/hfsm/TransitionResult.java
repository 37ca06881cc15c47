package com.github.hfsm;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.github.hfsm.StateMachineException.Code;

/**
 * This object encapsulates the outcome of firing an event on a {@link StateMachineInstance}.
 *
 * Successes are encoded with {@link #isSuccessful()} true and carry the committed
 * {@link #getToState()}; the transition happened even if some after-actions failed, in which case
 * those failures are reported via {@link #afterActions()} as {@link Code#AFTER_ACTION_FAILURE}
 * errors. Failures report {@link #isSuccessful()} as false, leave the instance in
 * {@link #getFromState()} and always carry an associated {@link #getError()}.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final boolean successful;
  private final Event event;
  private final State fromState;
  private final State toState;
  private final Transition transition;
  private final StateMachineException error;
  private final CompletableFuture<List<StateMachineException>> afterActions;

  private TransitionResult(final boolean successful, final Event event, final State fromState,
      final State toState, final Transition transition, final StateMachineException error,
      final CompletableFuture<List<StateMachineException>> afterActions) {
    this.successful = successful;
    this.event = event;
    this.fromState = fromState;
    this.toState = toState;
    this.transition = transition;
    this.error = error;
    this.afterActions = afterActions;
  }

  static TransitionResult committed(final Event event, final Transition transition,
      final CompletableFuture<List<StateMachineException>> afterActions) {
    return new TransitionResult(true, event, transition.getFromState(), transition.getToState(),
        transition, null, afterActions);
  }

  static TransitionResult rejected(final Event event, final State fromState,
      final Transition transition, final StateMachineException error) {
    return new TransitionResult(false, event, fromState, null, transition, error,
        CompletableFuture.completedFuture(Collections.<StateMachineException>emptyList()));
  }

  public boolean isSuccessful() {
    return successful;
  }

  public Event getEvent() {
    return event;
  }

  public State getFromState() {
    return fromState;
  }

  /**
   * Null unless the transition was committed.
   */
  public State getToState() {
    return toState;
  }

  /**
   * The state the instance was left in by this fire.
   */
  public State getResultingState() {
    return successful ? toState : fromState;
  }

  /**
   * The selected transition, if resolution got that far.
   */
  public Transition getTransition() {
    return transition;
  }

  public StateMachineException getError() {
    return error;
  }

  public Code getErrorCode() {
    return error == null ? null : error.getCode();
  }

  /**
   * Completes with the after-action failures of a committed transition, empty if all of them
   * succeeded. Already complete when after-actions are dispatched on the caller thread.
   */
  public CompletableFuture<List<StateMachineException>> afterActions() {
    return afterActions;
  }

  /**
   * After-action failures known so far; empty while asynchronously dispatched after-actions are
   * still running.
   */
  public List<StateMachineException> getAfterActionErrors() {
    if (!afterActions.isDone()) {
      return Collections.emptyList();
    }
    return afterActions.getNow(Collections.<StateMachineException>emptyList());
  }

  public boolean hasAfterActionErrors() {
    return !getAfterActionErrors().isEmpty();
  }

  @Override
  public String toString() {
    return "TransitionResult [successful=" + successful + ", event="
        + (event == null ? null : event.getName()) + ", fromState="
        + (fromState == null ? null : fromState.getName()) + ", toState="
        + (toState == null ? null : toState.getName()) + ", error=" + getErrorCode()
        + ", afterActionErrors=" + getAfterActionErrors().size() + "]";
  }
}
