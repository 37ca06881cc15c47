package com.github.hfsm;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import com.github.hfsm.InstanceStatistics.StateTimePair;
import com.github.hfsm.StateMachineException.Code;

/**
 * Runtime binding of a shared {@link StateMachineDefinition} to one entity's current state.
 *
 * Notes for users:<br>
 * 1. instances are created by {@link StateMachineEngine#bind} when the entity is created (or loaded)
 * and should be dropped together with the entity<br>
 *
 * 2. {@link #fire(Event, TransitionContext)} is the only way to change the current state. It does
 * not expect any thread affinity, any thread may fire on any instance<br>
 *
 * 3. locking is per instance. Reading the current state never blocks; the write lock is only held
 * around the commit itself so fires on different instances never contend<br>
 */
public final class StateMachineInstance {
  private final StateMachineDefinition definition;
  private final String entityId;
  private final String key;
  private final TransitionExecutor executor;
  private final String engineId;

  private final ReentrantReadWriteLock superInstanceLock = new ReentrantReadWriteLock(true);
  private final ReadLock instanceReadLock = superInstanceLock.readLock();
  private final WriteLock instanceWriteLock = superInstanceLock.writeLock();

  // replaced wholesale on every commit, only while holding the write lock
  private volatile Snapshot snapshot;

  // bounded at routeCapacity, guarded by superInstanceLock
  private final Deque<StateTimePair> boundedStateRoute = new ArrayDeque<>();
  private final int routeCapacity;

  private final InstanceStatistics instanceStats;

  StateMachineInstance(final StateMachineDefinition definition, final String entityId,
      final State state, final long version, final TransitionExecutor executor,
      final String engineId, final int routeCapacity) {
    this.definition = definition;
    this.entityId = entityId;
    this.key = InMemoryStatePersister.key(definition.getName(), entityId);
    this.executor = executor;
    this.engineId = engineId;
    this.routeCapacity = routeCapacity;
    this.snapshot = new Snapshot(state, version);
    this.instanceStats = new InstanceStatistics(key);
    this.boundedStateRoute.addLast(new StateTimePair(state.getName(), System.currentTimeMillis()));
  }

  public StateMachineDefinition getDefinition() {
    return definition;
  }

  public String getEntityId() {
    return entityId;
  }

  /**
   * definitionName:entityId, unique per engine.
   */
  public String getKey() {
    return key;
  }

  String getEngineId() {
    return engineId;
  }

  /**
   * Read/report the current state. This is a snapshot; by the time the caller looks at it a
   * concurrent fire may already have moved the instance on.
   */
  public State currentState() {
    return snapshot.state;
  }

  /**
   * Number of commits applied to this entity so far, as tracked by the persister.
   */
  public long version() {
    return snapshot.version;
  }

  public boolean isTerminated() {
    return definition.isTerminal(snapshot.state);
  }

  public boolean canFire(final Event event, final TransitionContext context) {
    return executor.canFire(this, event, context);
  }

  public TransitionResult fire(final Event event, final TransitionContext context) {
    return executor.fire(this, event, context);
  }

  /**
   * Fire by event name, as received from an API callback or a job completion. An event unknown to
   * the definition yields {@link Code#NO_TRANSITION}.
   */
  public TransitionResult fire(final String eventName, final TransitionContext context) {
    final Event event = definition.findEvent(eventName);
    if (event == null) {
      return executor.rejectUnknownEvent(this, eventName);
    }
    return fire(event, context);
  }

  /**
   * Pull the route of visited states. Note that the overall path could be huge, so this only
   * reports the last routeCapacity entries and e'thing prior will have been pruned.
   */
  public StateTimePair[] getStateTransitionRoute() throws StateMachineException {
    try {
      if (instanceReadLock.tryLock(executor.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          return boundedStateRoute.toArray(new StateTimePair[boundedStateRoute.size()]);
        } finally {
          instanceReadLock.unlock();
        }
      } else {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to read state transition route");
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  public InstanceStatistics getStatistics() {
    return instanceStats;
  }

  Snapshot snapshot() {
    return snapshot;
  }

  WriteLock writeLock() {
    return instanceWriteLock;
  }

  /**
   * Callers must hold the write lock.
   */
  void commit(final State nextState, final long nextVersion) {
    final long now = System.currentTimeMillis();
    final StateTimePair leaving = boundedStateRoute.peekLast();
    if (leaving != null) {
      leaving.elapsedMillis = now - leaving.startMillis;
    }
    boundedStateRoute.addLast(new StateTimePair(nextState.getName(), now));
    while (boundedStateRoute.size() > routeCapacity) {
      boundedStateRoute.pollFirst();
    }
    snapshot = new Snapshot(nextState, nextVersion);
    instanceStats.touch();
  }

  /**
   * Re-sync from the persister after a lost compare-and-set. Callers must hold the write lock.
   */
  void reload(final PersistedState persisted) throws StateMachineException {
    final State state = definition.findState(persisted.getStateName());
    if (state == null) {
      throw new StateMachineException(Code.INVALID_STATE, "Persisted state "
          + persisted.getStateName() + " is not a member of " + definition.getName());
    }
    if (!state.equals(snapshot.state)) {
      commit(state, persisted.getVersion());
    } else {
      snapshot = new Snapshot(state, persisted.getVersion());
    }
  }

  @Override
  public String toString() {
    return "StateMachineInstance [key=" + key + ", currentState=" + snapshot.state.getName()
        + ", version=" + snapshot.version + "]";
  }

  /**
   * Immutable (state, version) pair read by fires to resolve transitions and re-validated at commit.
   */
  static final class Snapshot {
    final State state;
    final long version;

    Snapshot(final State state, final long version) {
      this.state = state;
      this.version = version;
    }

    PersistedState toPersisted() {
      return new PersistedState(state.getName(), version);
    }
  }

}
