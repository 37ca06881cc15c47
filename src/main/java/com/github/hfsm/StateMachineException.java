package com.github.hfsm;

/**
 * Unified single exception that's thrown and handled by this FSM engine. The idea is to use the
 * code enum to encapsulate various error/exception conditions. Definition and lifecycle problems are
 * thrown; transition outcomes are carried inside a {@link TransitionResult} instead.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  /**
   * True for outcomes where the state was left untouched and the caller may simply re-read the
   * instance and decide again.
   */
  public boolean isRecoverable() {
    return code.recoverable;
  }

  public static enum Code {
    // 1.
    INVALID_DEFINITION("State machine definition is malformed", false),
    // 2.
    NO_TRANSITION("No transition is declared for the event from the current state", true),
    // 3.
    GUARD_REJECTED("Candidate transitions existed but no guard passed", true),
    // 4.
    BEFORE_ACTION_FAILURE("A before-action failed, transition aborted and state unchanged", true),
    // 5.
    AFTER_ACTION_FAILURE(
        "An after-action failed, transition was committed but follow-up work did not complete",
        false),
    // 6.
    CONFLICT("Concurrent commit won the race, re-resolve against the fresh state", true),
    // 7.
    TIMEOUT("Guard or before-action evaluation exceeded its time bound", true),
    // 8.
    PARTIAL_FAILURE("Event broadcast failed on one or more linked instances", false),
    // 9.
    INVALID_STATE("State is null or not a member of the definition", false),
    // 10.
    INVALID_STATE_NAME(
        "State name cannot be blank or greater than " + State.maxStateNameLength + " characters",
        false),
    // 11.
    INVALID_EVENT_NAME(
        "Event name cannot be blank or greater than " + Event.maxEventNameLength + " characters",
        false),
    // 12.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid", false),
    // 13.
    MACHINE_NOT_ALIVE("State machine engine is not running and cannot service requests", false),
    // 14.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable.",
        true),
    // 15.
    PERSISTENCE_FAILURE("State persister failed to store the committed state", true),
    // 16.
    ILLEGAL_INSTANCE("State machine instance is unknown or bound to another engine", false),
    // 17.
    INTERRUPTED("State machine was interrupted", true),
    // 18.
    UNKNOWN_FAILURE(
        "State machine failed. Check exception stacktrace for more details of the failure", false);

    private final String description;
    private final boolean recoverable;

    private Code(final String description, final boolean recoverable) {
      this.description = description;
      this.recoverable = recoverable;
    }

    public String getDescription() {
      return description;
    }

    public boolean isRecoverable() {
      return recoverable;
    }
  }

}
