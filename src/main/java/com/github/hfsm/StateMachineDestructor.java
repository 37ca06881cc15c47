package com.github.hfsm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Jvm shutdown hook that closes the registry, giving asynchronously dispatched after-actions of
 * every engine still alive a chance to run.
 */
final class StateMachineDestructor extends Thread {
  private static final Logger logger =
      LogManager.getLogger(StateMachineDestructor.class.getSimpleName());

  private final StateMachineRegistry registry;

  static StateMachineDestructor install(final StateMachineRegistry registry) {
    final StateMachineDestructor destructor = new StateMachineDestructor(registry);
    Runtime.getRuntime().addShutdownHook(destructor);
    return destructor;
  }

  @Override
  public void run() {
    final long startMillis = System.currentTimeMillis();
    final int demolished = registry.demolish();
    logger.info("Demolished " + demolished + " engines at jvm shutdown in "
        + (System.currentTimeMillis() - startMillis) + " millis");
  }

  private StateMachineDestructor(final StateMachineRegistry registry) {
    super("fsm-destructor");
    this.registry = registry;
  }

}
