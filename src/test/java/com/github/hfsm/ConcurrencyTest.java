package com.github.hfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.github.hfsm.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.hfsm.StateMachineDefinition.DefinitionBuilder;
import com.github.hfsm.StateMachineEngine.StateMachineEngineBuilder;
import com.github.hfsm.StateMachineException.Code;
import com.github.hfsm.Transition.TransitionBuilder;

/**
 * Tests for concurrent fires on the same and on different instances.
 */
public final class ConcurrencyTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private StateMachineEngine engine;
  private ExecutorService workers;

  @Before
  public void setUp() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .actionDispatchMode(ActionDispatchMode.CALLER_THREAD).lockAcquisitionMillis(2000L)
        .build();
    engine = StateMachineEngineBuilder.newBuilder().config(config).build();
    workers = Executors.newFixedThreadPool(8);
  }

  @After
  public void tearDown() throws StateMachineException {
    workers.shutdownNow();
    engine.demolish();
  }

  @Test
  public void testSameInstanceCommitsExactlyOnce() throws Exception {
    final AtomicInteger dispatched = new AtomicInteger();
    final StateMachineDefinition definition = engine.defineMachine(DefinitionBuilder
        .newBuilder("deposit").initialState("depositing").terminalState("deposited")
        .events("bank_transaction_succeeded")
        .action("dispatchNextTransfer", (instance, context) -> dispatched.incrementAndGet())
        .transition(TransitionBuilder.newBuilder().from("depositing")
            .on("bank_transaction_succeeded").to("deposited").after("dispatchNextTransfer")));
    final StateMachineInstance instance = engine.bind(definition, "d-1");

    final int threads = 8;
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<TransitionResult>> results = new ArrayList<>();
    for (int iter = 0; iter < threads; iter++) {
      results.add(workers.submit(new Callable<TransitionResult>() {
        @Override
        public TransitionResult call() throws Exception {
          start.await();
          return instance.fire("bank_transaction_succeeded", TransitionContext.empty());
        }
      }));
    }
    start.countDown();

    int successes = 0;
    for (final Future<TransitionResult> future : results) {
      final TransitionResult result = future.get(10, TimeUnit.SECONDS);
      if (result.isSuccessful()) {
        successes++;
      } else {
        // losers either saw the old state and lost the commit, or saw the new one
        assertTrue(result.getErrorCode() == Code.CONFLICT
            || result.getErrorCode() == Code.NO_TRANSITION);
      }
    }
    assertEquals(1, successes);
    assertEquals(1, dispatched.get());
    assertEquals(1L, instance.version());
    assertEquals(definition.findState("deposited"), instance.currentState());
    assertEquals(threads - 1, instance.getStatistics().getTransitionFailures());
  }

  @Test
  public void testSlowGuardDoesNotBlockOtherInstances() throws Exception {
    final CountDownLatch guardEntered = new CountDownLatch(1);
    final CountDownLatch releaseGuard = new CountDownLatch(1);
    final StateMachineDefinition definition = engine.defineMachine(DefinitionBuilder
        .newBuilder("upload").initialState("received").terminalState("scanned").events("scan")
        .guard("virusScan", (instance, context) -> {
          if ("slow".equals(instance.getEntityId())) {
            guardEntered.countDown();
            return releaseGuard.await(10, TimeUnit.SECONDS);
          }
          return true;
        })
        .transition(TransitionBuilder.newBuilder().from("received").on("scan").to("scanned")
            .guard("virusScan")));
    final StateMachineInstance slow = engine.bind(definition, "slow");
    final StateMachineInstance fast = engine.bind(definition, "fast");

    final Future<TransitionResult> slowResult = workers.submit(new Callable<TransitionResult>() {
      @Override
      public TransitionResult call() {
        return slow.fire("scan", TransitionContext.empty());
      }
    });
    assertTrue(guardEntered.await(10, TimeUnit.SECONDS));

    // 1. a fire on another instance goes straight through
    final TransitionResult fastResult = fast.fire("scan", TransitionContext.empty());
    assertTrue(fastResult.isSuccessful());
    assertTrue(fast.isTerminated());

    // 2. reads on the blocked instance do not wait either
    assertEquals(definition.getInitialState(), slow.currentState());
    assertEquals(1, slow.getStateTransitionRoute().length);

    releaseGuard.countDown();
    assertTrue(slowResult.get(10, TimeUnit.SECONDS).isSuccessful());
    assertTrue(slow.isTerminated());
  }

  @Test
  public void testManyInstancesInParallel() throws Exception {
    final StateMachineDefinition definition =
        engine.defineMachine(StateMachineEngineTest.pipeline("pipeline"));
    final int instances = 200;
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<Boolean>> results = new ArrayList<>();
    for (int iter = 0; iter < instances; iter++) {
      final String entityId = "job-" + iter;
      results.add(workers.submit(new Callable<Boolean>() {
        @Override
        public Boolean call() throws Exception {
          start.await();
          final StateMachineInstance instance = engine.bind(definition, entityId);
          return instance.fire("start", TransitionContext.empty()).isSuccessful()
              && instance.fire("finish", TransitionContext.empty()).isSuccessful();
        }
      }));
    }
    start.countDown();
    for (final Future<Boolean> result : results) {
      assertTrue(result.get(30, TimeUnit.SECONDS));
    }
    assertEquals(instances, engine.getStatistics().getTotalBoundInstances());
    assertEquals(2 * instances, engine.getStatistics().getTotalTransitionSuccesses());
    assertEquals(0, engine.getStatistics().getTotalTransitionFailures());
  }

}
