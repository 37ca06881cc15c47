package com.github.hfsm;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hfsm.StateMachineException.Code;

/**
 * Couples instances of different machines into parent/child hierarchies and carries transition
 * outcomes across them.
 *
 * Downward, a parent after-action built by {@link #broadcastAction(String)} fires an event on every
 * linked child. Each child is fired and committed on its own; failures are collected into a
 * {@link BroadcastResult} and surfaced as a single {@link Code#PARTIAL_FAILURE}.
 *
 * Upward, a child after-action built by {@link #reportToParentAction(String)} fires an event on the
 * parent, whose transition is typically guarded by {@link #allChildrenIn(String...)}. That guard
 * reads the children's current states through the link rather than counting reports, so it stays
 * correct when children complete out of order or report more than once.
 */
public final class HierarchicalBridge {
  private static final Logger logger =
      LogManager.getLogger(HierarchicalBridge.class.getSimpleName());

  // parent outcomes that mean "not ready yet" or "someone else already moved it"
  private static final Set<Code> benignParentOutcomes =
      Collections.unmodifiableSet(EnumSet.of(Code.GUARD_REJECTED, Code.NO_TRANSITION, Code.CONFLICT));

  // K=parent.key
  private final ConcurrentMap<String, HierarchicalLink> linksByParent = new ConcurrentHashMap<>();
  // K=child.key
  private final ConcurrentMap<String, StateMachineInstance> parentsByChild =
      new ConcurrentHashMap<>();

  /**
   * Link a child to a parent. A child has at most one parent; linking it again to the same parent
   * is a no-op.
   */
  public HierarchicalLink link(final StateMachineInstance parent, final StateMachineInstance child)
      throws StateMachineException {
    if (parent == null || child == null) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE, "Cannot link null instances");
    }
    if (parent.getKey().equals(child.getKey())) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE,
          "Instance " + parent.getKey() + " cannot be its own child");
    }
    checkUnclaimed(parent, child, parentsByChild.get(child.getKey()));
    HierarchicalLink link = linksByParent.get(parent.getKey());
    if (link == null) {
      final HierarchicalLink fresh = new HierarchicalLink(parent);
      link = linksByParent.putIfAbsent(parent.getKey(), fresh);
      if (link == null) {
        link = fresh;
      }
    }
    // both maps change under the parent's link so unlink never sees one without the other
    synchronized (link) {
      checkUnclaimed(parent, child, parentsByChild.putIfAbsent(child.getKey(), parent));
      if (link.addChild(child)) {
        logger.info("Linked child " + child.getKey() + " to parent " + parent.getKey());
      }
    }
    return link;
  }

  private static void checkUnclaimed(final StateMachineInstance parent,
      final StateMachineInstance child, final StateMachineInstance existingParent)
      throws StateMachineException {
    if (existingParent != null && existingParent != parent) {
      throw new StateMachineException(Code.ILLEGAL_INSTANCE, "Instance " + child.getKey()
          + " is already linked to parent " + existingParent.getKey());
    }
  }

  public boolean unlink(final StateMachineInstance parent, final StateMachineInstance child) {
    if (parent == null || child == null) {
      return false;
    }
    final HierarchicalLink link = linksByParent.get(parent.getKey());
    if (link == null) {
      return false;
    }
    synchronized (link) {
      if (!link.removeChild(child)) {
        return false;
      }
      parentsByChild.remove(child.getKey(), parent);
    }
    logger.info("Unlinked child " + child.getKey() + " from parent " + parent.getKey());
    return true;
  }

  /**
   * Returns null if the instance has never been linked as a parent.
   */
  public HierarchicalLink findLink(final StateMachineInstance parent) {
    return parent == null ? null : linksByParent.get(parent.getKey());
  }

  /**
   * Returns null if the instance has no parent.
   */
  public StateMachineInstance findParent(final StateMachineInstance child) {
    return child == null ? null : parentsByChild.get(child.getKey());
  }

  /**
   * Fire the named event on every child of the parent, each with its own context derived from the
   * given one. Never throws; look at {@link BroadcastResult#getFailures()}.
   */
  public BroadcastResult broadcast(final StateMachineInstance parent, final String eventName,
      final TransitionContext context) {
    final HierarchicalLink link = findLink(parent);
    final List<StateMachineInstance> children =
        link == null ? Collections.<StateMachineInstance>emptyList() : link.getChildren();
    final Map<String, TransitionResult> outcomes = new LinkedHashMap<>();
    for (final StateMachineInstance child : children) {
      final TransitionContext childContext =
          context == null ? TransitionContext.empty() : context.derive();
      TransitionResult outcome;
      try {
        outcome = child.fire(eventName, childContext);
      } catch (RuntimeException problem) {
        outcome = TransitionResult.rejected(child.getDefinition().findEvent(eventName),
            child.currentState(), null, new StateMachineException(Code.UNKNOWN_FAILURE,
                "Firing " + eventName + " on " + child.getKey() + " blew up", problem));
      }
      outcomes.put(child.getKey(), outcome);
    }
    final BroadcastResult result = new BroadcastResult(parent.getKey(), eventName, outcomes);
    if (result.isPartialFailure()) {
      logger.warn("Broadcast of " + eventName + " from " + parent.getKey() + " failed on "
          + result.getFailures().keySet() + ", " + result.getSuccessCount() + " of "
          + outcomes.size() + " children transitioned");
    } else {
      logger.info("Broadcast of " + eventName + " from " + parent.getKey() + " reached "
          + outcomes.size() + " children");
    }
    return result;
  }

  /**
   * After-action broadcasting the named event to the children of the instance it runs on. The
   * {@link BroadcastResult} is left in the context under {@link BroadcastResult#contextKey(String)}.
   */
  public Action broadcastAction(final String eventName) {
    return new Action() {
      @Override
      public void execute(final StateMachineInstance instance, final TransitionContext context)
          throws StateMachineException {
        final BroadcastResult result = broadcast(instance, eventName, context);
        if (context != null) {
          context.putAttribute(BroadcastResult.contextKey(eventName), result);
        }
        if (result.isPartialFailure()) {
          throw new StateMachineException(Code.PARTIAL_FAILURE,
              "Broadcast of " + eventName + " from " + instance.getKey() + " failed on "
                  + result.getFailures().keySet());
        }
      }
    };
  }

  /**
   * Guard passing only when the instance has at least one child and every child currently sits in
   * one of the given states.
   */
  public Guard allChildrenIn(final String... stateNames) {
    final Set<String> accepted = new HashSet<>(Arrays.asList(stateNames));
    return new Guard() {
      @Override
      public boolean evaluate(final StateMachineInstance instance,
          final TransitionContext context) {
        final HierarchicalLink link = findLink(instance);
        if (link == null || link.size() == 0) {
          return false;
        }
        for (final State childState : link.childStates()) {
          if (!accepted.contains(childState.getName())) {
            return false;
          }
        }
        return true;
      }
    };
  }

  /**
   * After-action firing the named event on the parent of the instance it runs on. Orphans are
   * skipped with a warning.
   */
  public Action reportToParentAction(final String eventName) {
    return new Action() {
      @Override
      public void execute(final StateMachineInstance child, final TransitionContext context)
          throws StateMachineException {
        final StateMachineInstance parent = findParent(child);
        if (parent == null) {
          logger.warn("Instance " + child.getKey() + " has no parent to report " + eventName);
          return;
        }
        final TransitionResult result = parent.fire(eventName,
            context == null ? TransitionContext.empty() : context.derive());
        if (result.isSuccessful()) {
          logger.info("Report of " + eventName + " from " + child.getKey() + " moved parent "
              + parent.getKey() + " to " + result.getToState().getName());
        } else if (benignParentOutcomes.contains(result.getErrorCode())) {
          if (logger.isDebugEnabled()) {
            logger.debug("Report of " + eventName + " from " + child.getKey()
                + " left parent " + parent.getKey() + " in "
                + result.getFromState().getName() + ": " + result.getErrorCode());
          }
        } else {
          throw new StateMachineException(result.getErrorCode(), "Reporting " + eventName
              + " from " + child.getKey() + " to " + parent.getKey() + " failed",
              result.getError());
        }
      }
    };
  }

}
