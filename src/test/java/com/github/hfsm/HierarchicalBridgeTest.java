package com.github.hfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

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
 * Tests for parent/child links, downward broadcast and upward aggregation.
 *
 * Batch:: draft -> processing -> completed, once every item is done or skipped<br>
 * Item:: pending -> working -> done|skipped<br>
 */
public final class HierarchicalBridgeTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private StateMachineEngine engine;
  private HierarchicalBridge bridge;
  private StateMachineDefinition batchDefinition;
  private StateMachineDefinition itemDefinition;
  private final AtomicInteger batchesClosed = new AtomicInteger();

  @Before
  public void setUp() throws StateMachineException {
    engine = newEngine();
    bridge = new HierarchicalBridge();
    batchDefinition = engine.defineMachine(batch(bridge));
    itemDefinition = engine.defineMachine(item(bridge));
  }

  @After
  public void tearDown() throws StateMachineException {
    engine.demolish();
  }

  @Test
  public void testBroadcastStartsAllChildren() throws StateMachineException {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-1");
    final List<StateMachineInstance> items = newItems(batch, 3);

    final TransitionContext context = TransitionContext.empty();
    final TransitionResult result = batch.fire("start", context);
    assertTrue(result.isSuccessful());
    assertFalse(result.hasAfterActionErrors());
    for (final StateMachineInstance item : items) {
      assertEquals(itemDefinition.findState("working"), item.currentState());
    }

    final BroadcastResult broadcast =
        context.getAttribute(BroadcastResult.contextKey("begin"), BroadcastResult.class);
    assertNotNull(broadcast);
    assertEquals(batch.getKey(), broadcast.getParentKey());
    assertEquals("begin", broadcast.getEventName());
    assertEquals(3, broadcast.getOutcomes().size());
    assertEquals(3, broadcast.getSuccessCount());
    assertFalse(broadcast.isPartialFailure());
  }

  @Test
  public void testEmptyBroadcast() throws StateMachineException {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-empty");
    final TransitionContext context = TransitionContext.empty();
    final TransitionResult result = batch.fire("start", context);
    assertTrue(result.isSuccessful());
    assertFalse(result.hasAfterActionErrors());
    final BroadcastResult broadcast =
        context.getAttribute(BroadcastResult.contextKey("begin"), BroadcastResult.class);
    assertTrue(broadcast.getOutcomes().isEmpty());
    assertFalse(broadcast.isPartialFailure());

    // no children means the batch can never be complete
    assertFalse(batch.canFire(batchDefinition.findEvent("item_done"), TransitionContext.empty()));
  }

  @Test
  public void testOutOfOrderCompletion() throws StateMachineException {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-2");
    final List<StateMachineInstance> items = newItems(batch, 3);
    assertTrue(batch.fire("start", TransitionContext.empty()).isSuccessful());

    // 1. the last item finishes first, the batch waits
    TransitionResult result = items.get(2).fire("finish", TransitionContext.empty());
    assertTrue(result.isSuccessful());
    assertFalse(result.hasAfterActionErrors());
    assertEquals(batchDefinition.findState("processing"), batch.currentState());

    // 2. then the first one
    assertTrue(items.get(0).fire("finish", TransitionContext.empty()).isSuccessful());
    assertEquals(batchDefinition.findState("processing"), batch.currentState());

    // 3. skipping the middle one completes the batch
    result = items.get(1).fire("skip", TransitionContext.empty());
    assertTrue(result.isSuccessful());
    assertFalse(result.hasAfterActionErrors());
    assertEquals(batchDefinition.findState("completed"), batch.currentState());
    assertTrue(batch.isTerminated());
    assertEquals(1, batchesClosed.get());
  }

  @Test
  public void testDuplicateReportIsIgnored() throws Exception {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-3");
    final List<StateMachineInstance> items = newItems(batch, 1);
    assertTrue(batch.fire("start", TransitionContext.empty()).isSuccessful());
    assertTrue(items.get(0).fire("finish", TransitionContext.empty()).isSuccessful());
    assertTrue(batch.isTerminated());

    // the same child reports again, eg. a redelivered job completion
    bridge.reportToParentAction("item_done").execute(items.get(0), TransitionContext.empty());
    assertEquals(batchDefinition.findState("completed"), batch.currentState());
    assertEquals(1, batchesClosed.get());
    assertEquals(2L, batch.version());
  }

  @Test
  public void testConcurrentCompletionClosesOnce() throws Exception {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-4");
    final int children = 16;
    final List<StateMachineInstance> items = newItems(batch, children);
    assertTrue(batch.fire("start", TransitionContext.empty()).isSuccessful());

    final ExecutorService workers = Executors.newFixedThreadPool(children);
    try {
      final CountDownLatch start = new CountDownLatch(1);
      final List<Future<TransitionResult>> results = new ArrayList<>();
      for (final StateMachineInstance item : items) {
        results.add(workers.submit(new Callable<TransitionResult>() {
          @Override
          public TransitionResult call() throws Exception {
            start.await();
            return item.fire("finish", TransitionContext.empty());
          }
        }));
      }
      start.countDown();
      for (final Future<TransitionResult> future : results) {
        final TransitionResult result = future.get(10, TimeUnit.SECONDS);
        assertTrue(result.isSuccessful());
        assertFalse(result.hasAfterActionErrors());
      }
    } finally {
      workers.shutdownNow();
    }
    assertEquals(batchDefinition.findState("completed"), batch.currentState());
    assertEquals(1, batchesClosed.get());
    assertEquals(2L, batch.version());
  }

  @Test
  public void testOrphanReport() throws StateMachineException {
    final StateMachineInstance orphan = engine.bind(itemDefinition, "orphan");
    assertTrue(orphan.fire("begin", TransitionContext.empty()).isSuccessful());
    final TransitionResult result = orphan.fire("finish", TransitionContext.empty());
    assertTrue(result.isSuccessful());
    assertFalse(result.hasAfterActionErrors());
    assertNull(bridge.findParent(orphan));
  }

  @Test
  public void testReportToDeadParentFails() throws StateMachineException {
    final StateMachineEngine parentEngine = newEngine();
    final StateMachineDefinition remoteBatches = parentEngine.defineMachine(batch(bridge));
    final StateMachineInstance batch = parentEngine.bind(remoteBatches, "b-remote");
    final StateMachineInstance child = engine.bind(itemDefinition, "i-remote");
    bridge.link(batch, child);
    assertTrue(batch.fire("start", TransitionContext.empty()).isSuccessful());
    assertEquals(itemDefinition.findState("working"), child.currentState());
    parentEngine.demolish();

    final TransitionResult result = child.fire("finish", TransitionContext.empty());
    // the child still moved, the report did not land
    assertTrue(result.isSuccessful());
    assertEquals(1, result.getAfterActionErrors().size());
    final StateMachineException reported =
        (StateMachineException) result.getAfterActionErrors().get(0).getCause();
    assertEquals(Code.MACHINE_NOT_ALIVE, reported.getCode());
  }

  @Test
  public void testLinking() throws StateMachineException {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-5");
    final StateMachineInstance otherBatch = engine.bind(batchDefinition, "b-6");
    final StateMachineInstance item = engine.bind(itemDefinition, "i-5");

    // 1. link, relinking is a no-op
    final HierarchicalLink link = bridge.link(batch, item);
    assertSame(link, bridge.link(batch, item));
    assertEquals(1, link.size());
    assertSame(batch, link.getParent());
    assertSame(link, bridge.findLink(batch));
    assertSame(batch, bridge.findParent(item));
    assertEquals(itemDefinition.getInitialState(), link.childStates().get(0));
    assertNull(bridge.findLink(otherBatch));

    // 2. one parent per child, no self links, no nulls
    assertLinkRefused(otherBatch, item);
    assertLinkRefused(batch, batch);
    assertLinkRefused(null, item);
    assertLinkRefused(batch, null);

    // 3. unlink frees the child for another parent
    assertTrue(bridge.unlink(batch, item));
    assertFalse(bridge.unlink(batch, item));
    assertFalse(bridge.unlink(otherBatch, item));
    assertEquals(0, link.size());
    assertNull(bridge.findParent(item));
    bridge.link(otherBatch, item);
    assertSame(otherBatch, bridge.findParent(item));
  }

  @Test
  public void testConcurrentLinkAndUnlinkStayConsistent() throws Exception {
    final StateMachineInstance batch = engine.bind(batchDefinition, "b-7");
    // every item starts linked, one thread unlinks them while another relinks them
    final List<StateMachineInstance> items = newItems(batch, 500);
    final ExecutorService workers = Executors.newFixedThreadPool(2);
    try {
      final CountDownLatch start = new CountDownLatch(1);
      final Future<Void> unlinker = workers.submit(new Callable<Void>() {
        @Override
        public Void call() throws Exception {
          start.await();
          for (final StateMachineInstance item : items) {
            bridge.unlink(batch, item);
          }
          return null;
        }
      });
      final Future<Void> relinker = workers.submit(new Callable<Void>() {
        @Override
        public Void call() throws Exception {
          start.await();
          for (final StateMachineInstance item : items) {
            bridge.link(batch, item);
          }
          return null;
        }
      });
      start.countDown();
      unlinker.get(30, TimeUnit.SECONDS);
      relinker.get(30, TimeUnit.SECONDS);
    } finally {
      workers.shutdownNow();
    }

    // each item is listed under the batch exactly when it maps back to the batch
    final List<StateMachineInstance> listed = bridge.findLink(batch).getChildren();
    for (final StateMachineInstance item : items) {
      final StateMachineInstance parent = bridge.findParent(item);
      if (listed.contains(item)) {
        assertSame(batch, parent);
      } else {
        assertNull(parent);
      }
    }
  }

  private void assertLinkRefused(final StateMachineInstance parent,
      final StateMachineInstance child) {
    try {
      bridge.link(parent, child);
      fail("Expected link to be refused");
    } catch (StateMachineException problem) {
      assertEquals(Code.ILLEGAL_INSTANCE, problem.getCode());
    }
  }

  private List<StateMachineInstance> newItems(final StateMachineInstance batch, final int count)
      throws StateMachineException {
    final List<StateMachineInstance> items = new ArrayList<>(count);
    for (int iter = 0; iter < count; iter++) {
      final StateMachineInstance item =
          engine.bind(itemDefinition, batch.getEntityId() + "-item-" + iter);
      bridge.link(batch, item);
      items.add(item);
    }
    return items;
  }

  private DefinitionBuilder batch(final HierarchicalBridge bridge) {
    return DefinitionBuilder.newBuilder("batch").initialState("draft").state("processing")
        .terminalState("completed").events("start", "item_done")
        .guard("allItemsSettled", bridge.allChildrenIn("done", "skipped"))
        .action("beginItems", bridge.broadcastAction("begin"))
        .action("closeBatch", (instance, context) -> batchesClosed.incrementAndGet())
        .transition(TransitionBuilder.newBuilder().from("draft").on("start").to("processing")
            .after("beginItems"))
        .transition(TransitionBuilder.newBuilder().from("processing").on("item_done")
            .to("completed").guard("allItemsSettled").after("closeBatch"));
  }

  private static DefinitionBuilder item(final HierarchicalBridge bridge) {
    return DefinitionBuilder.newBuilder("item").initialState("pending").state("working")
        .terminalStates("done", "skipped").events("begin", "finish", "skip")
        .action("reportDone", bridge.reportToParentAction("item_done"))
        .transition(TransitionBuilder.newBuilder().from("pending").on("begin").to("working"))
        .transition(TransitionBuilder.newBuilder().from("working").on("finish").to("done")
            .after("reportDone"))
        .transition(TransitionBuilder.newBuilder().from("working").on("skip").to("skipped")
            .after("reportDone"));
  }

  private static StateMachineEngine newEngine() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .actionDispatchMode(ActionDispatchMode.CALLER_THREAD).lockAcquisitionMillis(2000L)
        .build();
    return StateMachineEngineBuilder.newBuilder().config(config).build();
  }

}
