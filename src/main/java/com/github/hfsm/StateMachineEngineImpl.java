package com.github.hfsm;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hfsm.StateMachineDefinition.DefinitionBuilder;
import com.github.hfsm.StateMachineException.Code;

/**
 * Default {@link StateMachineEngine}.
 *
 * The engine level read/write lock only guards the lifecycle: defining, binding and unbinding take
 * the read lock, demolish takes the write lock. Fires never touch it; they only ever lock the one
 * instance they commit on, so there is no global lock on the fire path.
 */
public final class StateMachineEngineImpl implements StateMachineEngine {
  private static final Logger logger =
      LogManager.getLogger(StateMachineEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();


  private final AtomicBoolean engineAlive = new AtomicBoolean();

  // K=definition.name, V=definition. Definitions are only ever added, never replaced.
  private final ConcurrentMap<String, StateMachineDefinition> definitionsTable =
      new ConcurrentHashMap<>();

  // K=instance.key, V=instance
  final ConcurrentMap<String, StateMachineInstance> allInstancesTable = new ConcurrentHashMap<>();

  // global engine level locks
  private final ReentrantReadWriteLock engineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock engineWriteLock = engineSuperLock.writeLock();
  private final ReadLock engineReadLock = engineSuperLock.readLock();

  private final StateMachineConfiguration config;
  private final StatePersister persister;
  private final StateMachineStatistics engineStats;
  private final ExecutorService evaluationPool;
  private final ExecutorService actionPool;
  private final TransitionExecutor executor;

  StateMachineEngineImpl(final StateMachineConfiguration config, final StatePersister persister)
      throws StateMachineException {
    logInfo(engineId, null, "Firing up state machine engine");
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "Cannot fire up an engine without a configuration");
    }
    this.config = config;
    this.persister = persister;
    this.engineStats = new StateMachineStatistics(engineId, allInstancesTable.values());
    this.evaluationPool = Executors.newFixedThreadPool(config.getEvaluationThreads(),
        new NamedDaemonThreadFactory("fsm-evaluator"));
    this.actionPool = Executors.newFixedThreadPool(config.getActionThreads(),
        new NamedDaemonThreadFactory("fsm-action"));
    this.executor = new TransitionExecutor(engineId, config, persister, engineStats,
        evaluationPool, actionPool, engineAlive);

    engineAlive.set(true);
    logInfo(engineId, null, "Successfully fired up state machine engine with " + config);

    StateMachineRegistry.getInstance().register(this);
  }

  @Override
  public StateMachineDefinition defineMachine(final DefinitionBuilder definitionBuilder)
      throws StateMachineException {
    engineAlive();
    if (definitionBuilder == null) {
      throw new StateMachineException(Code.INVALID_DEFINITION, "Definition builder is null");
    }
    final StateMachineDefinition definition = definitionBuilder.build();
    acquire(engineReadLock, "define machine");
    try {
      final StateMachineDefinition existing =
          definitionsTable.putIfAbsent(definition.getName(), definition);
      if (existing != null) {
        throw new StateMachineException(Code.INVALID_DEFINITION,
            "Definition " + definition.getName() + " is already defined");
      }
      engineStats.totalDefinitions.incrementAndGet();
      logInfo(engineId, null, "Successfully defined " + definition);
    } finally {
      engineReadLock.unlock();
    }
    return definition;
  }

  @Override
  public StateMachineDefinition findDefinition(final String definitionName) {
    return definitionName == null ? null : definitionsTable.get(definitionName);
  }

  @Override
  public StateMachineInstance bind(final StateMachineDefinition definition,
      final String entityId) throws StateMachineException {
    return bind(definition, entityId, Optional.<State>empty());
  }

  @Override
  public StateMachineInstance bind(final StateMachineDefinition definition,
      final String entityId, final Optional<State> initialStateOverride)
      throws StateMachineException {
    engineAlive();
    if (definition == null || definitionsTable.get(definition.getName()) != definition) {
      throw new StateMachineException(Code.INVALID_DEFINITION,
          "Definition " + (definition == null ? null : definition.getName())
              + " is not defined on engine " + engineId);
    }
    if (entityId == null || entityId.trim().isEmpty()) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE, "Entity id cannot be blank");
    }
    State initialState = definition.getInitialState();
    if (initialStateOverride != null && initialStateOverride.isPresent()) {
      initialState = initialStateOverride.get();
      if (!definition.hasState(initialState)) {
        throw new StateMachineException(Code.INVALID_STATE,
            initialState + " is not a member of " + definition.getName());
      }
    }

    acquire(engineReadLock, "bind instance");
    try {
      final String instanceKey = InMemoryStatePersister.key(definition.getName(), entityId);
      final StateMachineInstance bound = allInstancesTable.get(instanceKey);
      if (bound != null) {
        logDebug(engineId, instanceKey, "Instance is already bound");
        return bound;
      }
      final PersistedState persisted;
      try {
        persisted = persister.insertIfAbsent(definition.getName(), entityId,
            new PersistedState(initialState.getName(), 0L));
      } catch (RuntimeException problem) {
        throw new StateMachineException(Code.PERSISTENCE_FAILURE,
            "Failed to persist initial state of " + instanceKey, problem);
      }
      final State state = definition.findState(persisted.getStateName());
      if (state == null) {
        throw new StateMachineException(Code.INVALID_STATE, "Persisted state "
            + persisted.getStateName() + " of " + instanceKey + " is not a member of "
            + definition.getName());
      }
      final StateMachineInstance instance = new StateMachineInstance(definition, entityId, state,
          persisted.getVersion(), executor, engineId, config.getRouteCapacity());
      final StateMachineInstance raced = allInstancesTable.putIfAbsent(instanceKey, instance);
      if (raced != null) {
        return raced;
      }
      engineStats.totalBoundInstances.incrementAndGet();
      logInfo(engineId, instanceKey,
          "Bound instance in state " + state.getName() + "@" + persisted.getVersion());
      return instance;
    } finally {
      engineReadLock.unlock();
    }
  }

  @Override
  public StateMachineInstance lookupInstance(final String definitionName, final String entityId) {
    return allInstancesTable.get(InMemoryStatePersister.key(definitionName, entityId));
  }

  @Override
  public boolean unbind(final StateMachineInstance instance) throws StateMachineException {
    engineAlive();
    checkOwnership(instance);
    acquire(engineReadLock, "unbind instance");
    try {
      if (!allInstancesTable.remove(instance.getKey(), instance)) {
        return false;
      }
      try {
        persister.remove(instance.getDefinition().getName(), instance.getEntityId());
      } catch (RuntimeException problem) {
        throw new StateMachineException(Code.PERSISTENCE_FAILURE,
            "Failed to remove persisted state of " + instance.getKey(), problem);
      }
      engineStats.totalUnboundInstances.incrementAndGet();
      logInfo(engineId, instance.getKey(), "Unbound instance with " + instance.getStatistics());
      return true;
    } finally {
      engineReadLock.unlock();
    }
  }

  @Override
  public TransitionResult fire(final StateMachineInstance instance, final Event event,
      final TransitionContext context) {
    try {
      checkOwnership(instance);
    } catch (StateMachineException problem) {
      logWarning(engineId, instance == null ? null : instance.getKey(), problem.getMessage());
      return TransitionResult.rejected(event,
          instance == null ? null : instance.currentState(), null, problem);
    }
    return executor.fire(instance, event, context);
  }

  @Override
  public boolean canFire(final StateMachineInstance instance, final Event event,
      final TransitionContext context) {
    return instance != null && engineId.equals(instance.getEngineId())
        && executor.canFire(instance, event, context);
  }

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return engineStats;
  }

  @Override
  public boolean alive() {
    return engineAlive.get();
  }

  @Override
  public boolean demolish() throws StateMachineException {
    if (!engineAlive.get()) {
      logInfo(engineId, null, "State machine engine is already demolished");
      return true;
    }
    logInfo(engineId, null, "Demolishing state machine engine");
    acquire(engineWriteLock, "shutdown state machine engine");
    try {
      // 1. signal death
      engineAlive.set(false);

      // 2. let dispatched after-actions drain, abandon pending evaluations
      actionPool.shutdown();
      evaluationPool.shutdownNow();
      final long drainMillis = config.getActionDrainMillis();
      try {
        if (!actionPool.awaitTermination(drainMillis, TimeUnit.MILLISECONDS)) {
          logWarning(engineId, null, "After-actions still running after " + drainMillis
              + " millis, interrupting them");
          runInline(actionPool.shutdownNow());
        }
      } catch (InterruptedException exception) {
        runInline(actionPool.shutdownNow());
        Thread.currentThread().interrupt();
      }

      // 3. print engine stats
      engineStats.refreshInstanceStats();
      logInfo(engineId, null, engineStats.toString());

      // 4. forget instances and definitions, persisted records stay with the persister
      allInstancesTable.clear();
      definitionsTable.clear();

      // 5. unregister self
      StateMachineRegistry.getInstance().unregister(engineId);

      logInfo(engineId, null, "Successfully shut down state machine engine");
      return true;
    } finally {
      engineWriteLock.unlock();
    }
  }

  /**
   * Queued after-actions belong to committed transitions, so they run here rather than being
   * dropped. Each task completes its own afterActions() future.
   */
  private void runInline(final List<Runnable> queued) {
    if (queued.isEmpty()) {
      return;
    }
    logWarning(engineId, null, "Running " + queued.size() + " queued after-action batches inline");
    for (final Runnable task : queued) {
      task.run();
    }
  }

  private void checkOwnership(final StateMachineInstance instance) throws StateMachineException {
    if (instance == null) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE, "Instance cannot be null");
    }
    if (!engineId.equals(instance.getEngineId())) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE,
          "Instance " + instance.getKey() + " is bound to another engine");
    }
  }

  private void acquire(final Lock lock, final String operation)
      throws StateMachineException {
    try {
      if (!lock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  private void engineAlive() throws StateMachineException {
    if (!engineAlive.get()) {
      throw new StateMachineException(Code.MACHINE_NOT_ALIVE,
          "State machine engine id:" + engineId + " is not alive");
    }
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

  /**
   * Names pool threads after their pool and marks them daemon so a forgotten engine never keeps the
   * jvm alive.
   */
  private static final class NamedDaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    private NamedDaemonThreadFactory(final String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }

}
