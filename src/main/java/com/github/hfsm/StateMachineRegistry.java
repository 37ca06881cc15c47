package com.github.hfsm;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps track of every live engine in the jvm. Periodically logs a per-engine summary of live
 * instances and fire outcomes, and demolishes whatever is still registered at jvm shutdown.
 */
final class StateMachineRegistry {
  private static final Logger logger =
      LogManager.getLogger(StateMachineRegistry.class.getSimpleName());

  private final static long summaryPeriodSeconds = 300L;

  private static final StateMachineRegistry instance = new StateMachineRegistry();

  // K=engine.id
  private final ConcurrentMap<String, StateMachineEngine> enginesById = new ConcurrentHashMap<>();
  private final AtomicBoolean open = new AtomicBoolean();
  private final ScheduledExecutorService summaryReporter;

  static StateMachineRegistry getInstance() {
    return instance;
  }

  void register(final StateMachineEngine engine) {
    enginesById.putIfAbsent(engine.getId(), engine);
  }

  void unregister(final String engineId) {
    enginesById.remove(engineId);
  }

  StateMachineEngine lookup(final String engineId) {
    return enginesById.get(engineId);
  }

  int size() {
    return enginesById.size();
  }

  /**
   * One line per registered engine followed by a line of totals across them.
   */
  String summarize() {
    final StringBuilder summary = new StringBuilder("State machine engines: ");
    summary.append(enginesById.size());
    int live = 0;
    long successes = 0L;
    long failures = 0L;
    for (final StateMachineEngine engine : enginesById.values()) {
      final StateMachineStatistics stats = engine.getStatistics();
      live += stats.getLiveInstances();
      successes += stats.getTotalTransitionSuccesses();
      failures += stats.getTotalTransitionFailures();
      summary.append("\n    [m:").append(stats.getEngineId()).append("] definitions=")
          .append(stats.getTotalDefinitions()).append(", liveInstances=")
          .append(stats.getLiveInstances()).append(", fires=")
          .append(stats.getTotalTransitionSuccesses()).append('/')
          .append(stats.getTotalTransitionFailures()).append(" ok/failed")
          .append(", failureRate=")
          .append(failureRate(stats.getTotalTransitionSuccesses(),
              stats.getTotalTransitionFailures()))
          .append("%, afterActionFailures=").append(stats.getTotalAfterActionFailures());
    }
    summary.append("\n    total liveInstances=").append(live).append(", fires=")
        .append(successes).append('/').append(failures).append(" ok/failed, failureRate=")
        .append(failureRate(successes, failures)).append('%');
    return summary.toString();
  }

  static long failureRate(final long successes, final long failures) {
    final long fires = successes + failures;
    return fires == 0L ? 0L : Math.round(100.0 * failures / fires);
  }

  /**
   * Returns how many engines were demolished.
   */
  synchronized int demolish() {
    if (!open.compareAndSet(true, false)) {
      logger.info("State machine registry is already closed");
      return 0;
    }
    summaryReporter.shutdownNow();
    logger.info("Closing state machine registry. " + summarize());
    int demolished = 0;
    // engine.demolish() unregisters, so walk a copy
    for (final StateMachineEngine engine : new ArrayList<>(enginesById.values())) {
      if (!engine.alive()) {
        continue;
      }
      try {
        engine.demolish();
        demolished++;
      } catch (StateMachineException problem) {
        logger.error("Failed to demolish engine " + engine.getId() + " on registry close",
            problem);
      }
    }
    enginesById.clear();
    return demolished;
  }

  private StateMachineRegistry() {
    summaryReporter = Executors.newSingleThreadScheduledExecutor(runnable -> {
      final Thread thread = new Thread(runnable, "fsm-stats-reporter");
      thread.setDaemon(true);
      return thread;
    });
    summaryReporter.scheduleAtFixedRate(() -> {
      if (!enginesById.isEmpty()) {
        logger.info(summarize());
      }
    }, summaryPeriodSeconds, summaryPeriodSeconds, TimeUnit.SECONDS);
    StateMachineDestructor.install(this);
    open.set(true);
    logger.info("Opened state machine registry, summarizing engines every "
        + summaryPeriodSeconds + " seconds");
  }

}
