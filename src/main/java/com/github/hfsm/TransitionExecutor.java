package com.github.hfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hfsm.StateMachineException.Code;
import com.github.hfsm.StateMachineInstance.Snapshot;
import com.github.hfsm.Transition.Binding;

/**
 * Executes fires on behalf of an engine. The sequence for fire(event, context) is:<br>
 * 1. snapshot the instance's (state, version) and look up candidate transitions<br>
 * 2. evaluate guards in declaration order, first pass wins<br>
 * 3. run before-actions, any failure aborts with the state unchanged<br>
 * 4. commit under the instance write lock, re-validating the snapshot version and then
 * compare-and-setting the persister<br>
 * 5. run after-actions, on the caller thread or the action pool<br>
 *
 * Steps 2 and 3 hold no lock and, when a timeout applies, run on the evaluation pool so they can
 * be abandoned. The timeout bounds guard evaluation; once before-actions have started they run to
 * completion and decide the outcome, and an abandoned evaluation never starts them. Nothing is ever retried here; retries are the caller's policy.
 */
final class TransitionExecutor {
  private static final Logger logger =
      LogManager.getLogger(TransitionExecutor.class.getSimpleName());

  private final String engineId;
  private final StateMachineConfiguration config;
  private final StatePersister persister;
  private final StateMachineStatistics engineStats;
  private final ExecutorService evaluationPool;
  private final ExecutorService actionPool;
  private final AtomicBoolean engineAlive;

  // evaluation phases, the caller and the evaluation task race to move out of EVALUATING
  private static final int EVALUATING = 0;
  private static final int RUNNING_BEFORE_ACTIONS = 1;
  private static final int ABANDONED = 2;

  TransitionExecutor(final String engineId, final StateMachineConfiguration config,
      final StatePersister persister, final StateMachineStatistics engineStats,
      final ExecutorService evaluationPool, final ExecutorService actionPool,
      final AtomicBoolean engineAlive) {
    this.engineId = engineId;
    this.config = config;
    this.persister = persister;
    this.engineStats = engineStats;
    this.evaluationPool = evaluationPool;
    this.actionPool = actionPool;
    this.engineAlive = engineAlive;
  }

  long getLockAcquisitionMillis() {
    return config.getLockAcquisitionMillis();
  }

  TransitionResult fire(final StateMachineInstance instance, final Event event,
      final TransitionContext context) {
    final TransitionContext fireContext = context == null ? TransitionContext.empty() : context;
    final Snapshot seen = instance.snapshot();
    if (!engineAlive.get()) {
      return rejected(instance, event, seen.state, null, new StateMachineException(
          Code.MACHINE_NOT_ALIVE, "State machine engine id:" + engineId + " is not alive"));
    }
    if (event == null) {
      return rejected(instance, null, seen.state, null,
          new StateMachineException(Code.NO_TRANSITION, "Cannot fire a null event"));
    }

    // 1. candidates
    final List<Transition> candidates = instance.getDefinition().candidates(seen.state, event);
    if (candidates.isEmpty()) {
      return rejected(instance, event, seen.state, null,
          new StateMachineException(Code.NO_TRANSITION, String.format(
              "Invalid state %s for event %s", seen.state.getName(), event.getName())));
    }

    // 2 & 3. guards and before-actions
    final Resolution resolution = evaluate(instance, candidates, fireContext, true);
    if (resolution.error != null) {
      return rejected(instance, event, seen.state, resolution.transition, resolution.error);
    }
    final Transition transition = resolution.transition;

    // 4. commit
    final StateMachineException commitProblem = commit(instance, seen, transition);
    if (commitProblem != null) {
      return rejected(instance, event, seen.state, transition, commitProblem);
    }
    instance.getStatistics().transitionSuccesses.incrementAndGet();
    engineStats.totalTransitionSuccesses.incrementAndGet();
    logInfo(engineId, instance.getKey(), String.format("Successfully transitioned from %s->%s on %s",
        transition.getFromState().getName(), transition.getToState().getName(), event.getName()));

    // 5. after-actions, scheduled exactly once per commit
    return TransitionResult.committed(event, transition,
        dispatchAfterActions(instance, transition, fireContext));
  }

  TransitionResult rejectUnknownEvent(final StateMachineInstance instance,
      final String eventName) {
    return rejected(instance, null, instance.currentState(), null,
        new StateMachineException(Code.NO_TRANSITION, "Event " + eventName
            + " is not declared by " + instance.getDefinition().getName()));
  }

  boolean canFire(final StateMachineInstance instance, final Event event,
      final TransitionContext context) {
    if (!engineAlive.get() || event == null) {
      return false;
    }
    final List<Transition> candidates =
        instance.getDefinition().candidates(instance.currentState(), event);
    if (candidates.isEmpty()) {
      return false;
    }
    final Resolution resolution = evaluate(instance, candidates,
        context == null ? TransitionContext.empty() : context, false);
    if (resolution.error != null) {
      logDebug(engineId, instance.getKey(), "Cannot fire " + event.getName() + ": "
          + resolution.error.getMessage());
      return false;
    }
    return true;
  }

  private Resolution evaluate(final StateMachineInstance instance,
      final List<Transition> candidates, final TransitionContext context,
      final boolean runBeforeActions) {
    final long timeoutMillis = context.getTimeoutMillis() > 0L ? context.getTimeoutMillis()
        : config.getEvaluationTimeoutMillis();
    final AtomicInteger phase = new AtomicInteger(EVALUATING);
    if (timeoutMillis <= 0L) {
      return evaluateNow(instance, candidates, context, runBeforeActions, phase);
    }
    final Future<Resolution> evaluation;
    try {
      evaluation = evaluationPool.submit(new Callable<Resolution>() {
        @Override
        public Resolution call() {
          return evaluateNow(instance, candidates, context, runBeforeActions, phase);
        }
      });
    } catch (RejectedExecutionException rejected) {
      return Resolution.failed(null,
          new StateMachineException(Code.MACHINE_NOT_ALIVE, rejected));
    }
    try {
      return evaluation.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException timedOut) {
      if (!phase.compareAndSet(EVALUATING, ABANDONED)) {
        // before-actions already started, their outcome is the fire's outcome
        logWarning(engineId, instance.getKey(), "Evaluation exceeded " + timeoutMillis
            + " millis while before-actions were running, waiting for them to finish");
        return awaitBeforeActions(evaluation);
      }
      evaluation.cancel(true);
      return Resolution.failed(null, new StateMachineException(Code.TIMEOUT,
          "Guard evaluation exceeded " + timeoutMillis + " millis"));
    } catch (ExecutionException failure) {
      return Resolution.failed(null,
          new StateMachineException(Code.UNKNOWN_FAILURE, failure.getCause()));
    } catch (InterruptedException interrupted) {
      if (!phase.compareAndSet(EVALUATING, ABANDONED)) {
        final Resolution resolution = awaitBeforeActions(evaluation);
        Thread.currentThread().interrupt();
        return resolution;
      }
      evaluation.cancel(true);
      Thread.currentThread().interrupt();
      return Resolution.failed(null, new StateMachineException(Code.INTERRUPTED, interrupted));
    }
  }

  private static Resolution awaitBeforeActions(final Future<Resolution> evaluation) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return evaluation.get();
        } catch (InterruptedException again) {
          interrupted = true;
        } catch (ExecutionException failure) {
          return Resolution.failed(null,
              new StateMachineException(Code.UNKNOWN_FAILURE, failure.getCause()));
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private Resolution evaluateNow(final StateMachineInstance instance,
      final List<Transition> candidates, final TransitionContext context,
      final boolean runBeforeActions, final AtomicInteger phase) {
    Transition selected = null;
    for (final Transition candidate : candidates) {
      final Guard guard = candidate.getGuard();
      if (guard == null) {
        selected = candidate;
        break;
      }
      try {
        if (guard.evaluate(instance, context)) {
          selected = candidate;
          break;
        }
        logDebug(engineId, instance.getKey(),
            "Guard " + candidate.getGuardName() + " rejected " + candidate.getId());
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return Resolution.failed(candidate,
            new StateMachineException(Code.INTERRUPTED, interrupted));
      } catch (Exception problem) {
        return Resolution.failed(candidate, new StateMachineException(Code.GUARD_REJECTED,
            "Guard " + candidate.getGuardName() + " of " + candidate.getId() + " failed",
            problem));
      }
    }
    if (selected == null) {
      return Resolution.failed(null, new StateMachineException(Code.GUARD_REJECTED,
          "No guard passed among " + candidates.size() + " candidate transitions"));
    }
    // the caller may have given up on this evaluation while a guard ignored the interrupt
    if (!phase.compareAndSet(EVALUATING, RUNNING_BEFORE_ACTIONS)) {
      logDebug(engineId, instance.getKey(),
          "Evaluation of " + selected.getId() + " was abandoned, skipping before-actions");
      return Resolution.failed(selected, new StateMachineException(Code.TIMEOUT,
          "Evaluation of " + selected.getId() + " was abandoned"));
    }
    if (runBeforeActions) {
      for (final Binding<Action> beforeAction : selected.getBeforeActions()) {
        try {
          beforeAction.getFunction().execute(instance, context);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return Resolution.failed(selected,
              new StateMachineException(Code.INTERRUPTED, interrupted));
        } catch (Exception problem) {
          return Resolution.failed(selected, new StateMachineException(
              Code.BEFORE_ACTION_FAILURE,
              "Before-action " + beforeAction.getName() + " of " + selected.getId() + " failed",
              problem));
        }
      }
    }
    return Resolution.selected(selected);
  }

  /**
   * Returns null on success, else the reason nothing was committed.
   */
  private StateMachineException commit(final StateMachineInstance instance, final Snapshot seen,
      final Transition transition) {
    final WriteLock instanceWriteLock = instance.writeLock();
    try {
      if (!instanceWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        return new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to commit " + transition.getId());
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return new StateMachineException(Code.INTERRUPTED, interrupted);
    }
    try {
      final Snapshot current = instance.snapshot();
      if (current.version != seen.version) {
        return new StateMachineException(Code.CONFLICT,
            String.format("Instance moved from %s@%d to %s@%d while resolving %s",
                seen.state.getName(), seen.version, current.state.getName(), current.version,
                transition.getId()));
      }
      final PersistedState next =
          new PersistedState(transition.getToState().getName(), seen.version + 1);
      final boolean stored;
      try {
        stored = persister.compareAndSet(instance.getDefinition().getName(),
            instance.getEntityId(), seen.toPersisted(), next);
      } catch (StateMachineException | RuntimeException problem) {
        return new StateMachineException(Code.PERSISTENCE_FAILURE,
            "Failed to persist " + transition.getId(), problem);
      }
      if (!stored) {
        final StateMachineException conflict = new StateMachineException(Code.CONFLICT,
            "Persisted state of " + instance.getKey() + " no longer matches "
                + seen.toPersisted());
        try {
          final PersistedState fresh =
              persister.load(instance.getDefinition().getName(), instance.getEntityId());
          if (fresh != null) {
            instance.reload(fresh);
          }
        } catch (StateMachineException | RuntimeException reloadProblem) {
          logError(engineId, instance.getKey(), "Failed to reload state after conflict",
              reloadProblem);
          conflict.addSuppressed(reloadProblem);
        }
        return conflict;
      }
      instance.commit(transition.getToState(), next.getVersion());
      return null;
    } finally {
      instanceWriteLock.unlock();
    }
  }

  private CompletableFuture<List<StateMachineException>> dispatchAfterActions(
      final StateMachineInstance instance, final Transition transition,
      final TransitionContext context) {
    if (transition.getAfterActions().isEmpty()) {
      return CompletableFuture.completedFuture(Collections.<StateMachineException>emptyList());
    }
    if (config.getActionDispatchMode() == ActionDispatchMode.ASYNC) {
      try {
        return CompletableFuture.supplyAsync(() -> runAfterActions(instance, transition, context),
            actionPool);
      } catch (RejectedExecutionException rejected) {
        logWarning(engineId, instance.getKey(),
            "Action pool rejected after-actions of " + transition.getId() + ", running inline");
      }
    }
    return CompletableFuture.completedFuture(runAfterActions(instance, transition, context));
  }

  private List<StateMachineException> runAfterActions(final StateMachineInstance instance,
      final Transition transition, final TransitionContext context) {
    final List<StateMachineException> errors = new ArrayList<>();
    boolean interrupted = false;
    for (final Binding<Action> afterAction : transition.getAfterActions()) {
      try {
        afterAction.getFunction().execute(instance, context);
      } catch (Exception problem) {
        if (problem instanceof InterruptedException) {
          interrupted = true;
        }
        final StateMachineException error = new StateMachineException(Code.AFTER_ACTION_FAILURE,
            "After-action " + afterAction.getName() + " of " + transition.getId() + " failed",
            problem);
        errors.add(error);
        instance.getStatistics().afterActionFailures.incrementAndGet();
        engineStats.totalAfterActionFailures.incrementAndGet();
        logError(engineId, instance.getKey(), error.getMessage(), problem);
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return Collections.unmodifiableList(errors);
  }

  private TransitionResult rejected(final StateMachineInstance instance, final Event event,
      final State fromState, final Transition transition, final StateMachineException error) {
    instance.getStatistics().transitionFailures.incrementAndGet();
    engineStats.totalTransitionFailures.incrementAndGet();
    final String message = String.format("Failed to fire %s from %s, %s: %s",
        event == null ? null : event.getName(), fromState.getName(), error.getCode(),
        error.getMessage());
    if (error.isRecoverable()) {
      logWarning(engineId, instance.getKey(), message);
    } else {
      logError(engineId, instance.getKey(), message, error.getCause());
    }
    return TransitionResult.rejected(event, fromState, transition, error);
  }

  /**
   * Outcome of steps 2 and 3: either the selected transition or the reason resolution stopped.
   */
  private static final class Resolution {
    private final Transition transition;
    private final StateMachineException error;

    private Resolution(final Transition transition, final StateMachineException error) {
      this.transition = transition;
      this.error = error;
    }

    private static Resolution selected(final Transition transition) {
      return new Resolution(transition, null);
    }

    private static Resolution failed(final Transition transition,
        final StateMachineException error) {
      return new Resolution(transition, error);
    }
  }

  private static void logError(final String engineId, final String instanceKey,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(engineId).append("][i:")
        .append(instanceKey).append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String engineId, final String instanceKey,
      final String message) {
    logger.warn(new StringBuilder().append("[m:").append(engineId).append("][i:")
        .append(instanceKey).append("] ").append(message).toString());
  }

  private static void logInfo(final String engineId, final String instanceKey,
      final String message) {
    logger.info(new StringBuilder().append("[m:").append(engineId).append("][i:")
        .append(instanceKey).append("] ").append(message).toString());
  }

  private static void logDebug(final String engineId, final String instanceKey,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(engineId).append("][i:")
          .append(instanceKey).append("] ").append(message).toString());
    }
  }

}
