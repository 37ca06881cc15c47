package com.github.hfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, fully resolved transition: fromState --event--> toState, an optional guard and the
 * ordered before/after actions. Transitions are only ever created by
 * {@link StateMachineDefinition.DefinitionBuilder#build()}, which resolves the names collected by a
 * {@link TransitionBuilder} against the guards and actions registered on the definition.
 */
public final class Transition {
  private final String id;
  private final State fromState;
  private final Event event;
  private final State toState;
  private final Binding<Guard> guard;
  private final List<Binding<Action>> beforeActions;
  private final List<Binding<Action>> afterActions;

  Transition(final State fromState, final Event event, final State toState,
      final Binding<Guard> guard, final List<Binding<Action>> beforeActions,
      final List<Binding<Action>> afterActions) {
    this.fromState = fromState;
    this.event = event;
    this.toState = toState;
    this.guard = guard;
    this.beforeActions = Collections.unmodifiableList(new ArrayList<>(beforeActions));
    this.afterActions = Collections.unmodifiableList(new ArrayList<>(afterActions));
    this.id = transitionId(fromState, event, toState);
  }

  static String transitionId(final State fromState, final Event event, final State toState) {
    return fromState.getName() + "-[" + event.getName() + "]->" + toState.getName();
  }

  public String getId() {
    return id;
  }

  public State getFromState() {
    return fromState;
  }

  public Event getEvent() {
    return event;
  }

  public State getToState() {
    return toState;
  }

  public boolean isGuarded() {
    return guard != null;
  }

  public String getGuardName() {
    return guard == null ? null : guard.getName();
  }

  Guard getGuard() {
    return guard == null ? null : guard.getFunction();
  }

  List<Binding<Action>> getBeforeActions() {
    return beforeActions;
  }

  List<Binding<Action>> getAfterActions() {
    return afterActions;
  }

  public List<String> getBeforeActionNames() {
    return names(beforeActions);
  }

  public List<String> getAfterActionNames() {
    return names(afterActions);
  }

  private static List<String> names(final List<Binding<Action>> bindings) {
    final List<String> names = new ArrayList<>(bindings.size());
    for (final Binding<Action> binding : bindings) {
      names.add(binding.getName());
    }
    return Collections.unmodifiableList(names);
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", guard=" + getGuardName() + ", beforeActions="
        + getBeforeActionNames() + ", afterActions=" + getAfterActionNames() + "]";
  }

  /**
   * A guard or action registered on a definition under a name.
   */
  static final class Binding<T> {
    private final String name;
    private final T function;

    Binding(final String name, final T function) {
      this.name = name;
      this.function = function;
    }

    String getName() {
      return name;
    }

    T getFunction() {
      return function;
    }
  }

  /**
   * Declarative description of a transition. Guards and actions are referenced by the names they
   * were registered under on the {@link StateMachineDefinition.DefinitionBuilder}; dangling
   * references fail the definition build.
   */
  public final static class TransitionBuilder {
    private String fromState;
    private String event;
    private String toState;
    private String guard;
    private final List<String> beforeActions = new ArrayList<>();
    private final List<String> afterActions = new ArrayList<>();

    public static TransitionBuilder newBuilder() {
      return new TransitionBuilder();
    }

    public TransitionBuilder from(final String fromState) {
      this.fromState = fromState;
      return this;
    }

    public TransitionBuilder on(final String event) {
      this.event = event;
      return this;
    }

    public TransitionBuilder to(final String toState) {
      this.toState = toState;
      return this;
    }

    public TransitionBuilder guard(final String guard) {
      this.guard = guard;
      return this;
    }

    public TransitionBuilder before(final String... actions) {
      for (final String action : actions) {
        this.beforeActions.add(action);
      }
      return this;
    }

    public TransitionBuilder after(final String... actions) {
      for (final String action : actions) {
        this.afterActions.add(action);
      }
      return this;
    }

    String getFromState() {
      return fromState;
    }

    String getEvent() {
      return event;
    }

    String getToState() {
      return toState;
    }

    String getGuard() {
      return guard;
    }

    List<String> getBeforeActions() {
      return beforeActions;
    }

    List<String> getAfterActions() {
      return afterActions;
    }

    @Override
    public String toString() {
      return fromState + "-[" + event + "]->" + toState;
    }

    private TransitionBuilder() {}
  }
}
