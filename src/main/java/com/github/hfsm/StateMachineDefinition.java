package com.github.hfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.hfsm.StateMachineException.Code;
import com.github.hfsm.Transition.Binding;
import com.github.hfsm.Transition.TransitionBuilder;

/**
 * Immutable declarative description of the states, events and transitions of one entity type. A
 * definition is validated once when built and then shared read-only by every
 * {@link StateMachineInstance} of that type, so no locking is needed to read it.
 *
 * Use the {@code DefinitionBuilder} to build it.
 */
public final class StateMachineDefinition {
  private final String name;
  private final State initialState;
  private final Set<State> states;
  private final Set<State> terminalStates;
  private final Set<Event> events;
  private final List<Transition> transitions;

  // K=fromState, V=(K=event, V=candidate transitions in declaration order)
  private final Map<State, Map<Event, List<Transition>>> transitionTable;

  private StateMachineDefinition(final String name, final State initialState,
      final Set<State> states, final Set<State> terminalStates, final Set<Event> events,
      final List<Transition> transitions) {
    this.name = name;
    this.initialState = initialState;
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    this.terminalStates = Collections.unmodifiableSet(new LinkedHashSet<>(terminalStates));
    this.events = Collections.unmodifiableSet(new LinkedHashSet<>(events));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));

    final Map<State, Map<Event, List<Transition>>> table = new LinkedHashMap<>();
    for (final Transition transition : transitions) {
      Map<Event, List<Transition>> byEvent = table.get(transition.getFromState());
      if (byEvent == null) {
        byEvent = new LinkedHashMap<>();
        table.put(transition.getFromState(), byEvent);
      }
      List<Transition> candidates = byEvent.get(transition.getEvent());
      if (candidates == null) {
        candidates = new ArrayList<>();
        byEvent.put(transition.getEvent(), candidates);
      }
      candidates.add(transition);
    }
    final Map<State, Map<Event, List<Transition>>> frozen = new LinkedHashMap<>();
    for (final Map.Entry<State, Map<Event, List<Transition>>> entry : table.entrySet()) {
      final Map<Event, List<Transition>> byEvent = new LinkedHashMap<>();
      for (final Map.Entry<Event, List<Transition>> candidates : entry.getValue().entrySet()) {
        byEvent.put(candidates.getKey(), Collections.unmodifiableList(candidates.getValue()));
      }
      frozen.put(entry.getKey(), Collections.unmodifiableMap(byEvent));
    }
    this.transitionTable = Collections.unmodifiableMap(frozen);
  }

  public String getName() {
    return name;
  }

  public State getInitialState() {
    return initialState;
  }

  public Set<State> getStates() {
    return states;
  }

  public Set<State> getTerminalStates() {
    return terminalStates;
  }

  public Set<Event> getEvents() {
    return events;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public boolean hasState(final State state) {
    return state != null && states.contains(state);
  }

  public boolean isTerminal(final State state) {
    return state != null && terminalStates.contains(state);
  }

  /**
   * Returns null if no state by that name is declared.
   */
  public State findState(final String stateName) {
    if (stateName == null) {
      return null;
    }
    for (final State state : states) {
      if (state.getName().equals(stateName.trim())) {
        return state;
      }
    }
    return null;
  }

  /**
   * Returns null if no event by that name is declared.
   */
  public Event findEvent(final String eventName) {
    if (eventName == null) {
      return null;
    }
    for (final Event event : events) {
      if (event.getName().equals(eventName.trim())) {
        return event;
      }
    }
    return null;
  }

  /**
   * Lookup the candidate transitions for the given (fromState, event) pair, in declaration order.
   * Never returns null.
   */
  public List<Transition> candidates(final State fromState, final Event event) {
    final Map<Event, List<Transition>> byEvent = transitionTable.get(fromState);
    if (byEvent == null) {
      return Collections.emptyList();
    }
    final List<Transition> candidates = byEvent.get(event);
    return candidates == null ? Collections.<Transition>emptyList() : candidates;
  }

  @Override
  public String toString() {
    return "StateMachineDefinition [name=" + name + ", initialState=" + initialState.getName()
        + ", states=" + states.size() + ", events=" + events.size() + ", transitions="
        + transitions + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to declare a definition. Nothing is checked until
   * {@link #build()}, which reports every violation it finds in a single
   * {@link Code#INVALID_DEFINITION} exception.
   */
  public final static class DefinitionBuilder {
    private final String name;
    private final List<String> initialStates = new ArrayList<>();
    private final List<String> states = new ArrayList<>();
    private final Set<String> terminalStates = new LinkedHashSet<>();
    private final List<String> events = new ArrayList<>();
    private final Map<String, Guard> guards = new LinkedHashMap<>();
    private final Map<String, Action> actions = new LinkedHashMap<>();
    private final List<TransitionBuilder> transitions = new ArrayList<>();
    private final StringBuilder registrationProblems = new StringBuilder();

    public static DefinitionBuilder newBuilder(final String name) {
      return new DefinitionBuilder(name);
    }

    public DefinitionBuilder initialState(final String state) {
      initialStates.add(state);
      if (!states.contains(state)) {
        states.add(state);
      }
      return this;
    }

    public DefinitionBuilder state(final String state) {
      states.add(state);
      return this;
    }

    public DefinitionBuilder states(final String... states) {
      for (final String state : states) {
        this.states.add(state);
      }
      return this;
    }

    public DefinitionBuilder terminalState(final String state) {
      terminalStates.add(state);
      if (!states.contains(state)) {
        states.add(state);
      }
      return this;
    }

    public DefinitionBuilder terminalStates(final String... states) {
      for (final String state : states) {
        terminalState(state);
      }
      return this;
    }

    public DefinitionBuilder event(final String event) {
      events.add(event);
      return this;
    }

    public DefinitionBuilder events(final String... events) {
      for (final String event : events) {
        this.events.add(event);
      }
      return this;
    }

    public DefinitionBuilder guard(final String guardName, final Guard guard) {
      if (guardName == null || guard == null) {
        registrationProblems.append("Guard name and function cannot be null. ");
      } else if (guards.put(guardName, guard) != null) {
        registrationProblems.append("Duplicate guard: ").append(guardName).append(". ");
      }
      return this;
    }

    public DefinitionBuilder action(final String actionName, final Action action) {
      if (actionName == null || action == null) {
        registrationProblems.append("Action name and function cannot be null. ");
      } else if (actions.put(actionName, action) != null) {
        registrationProblems.append("Duplicate action: ").append(actionName).append(". ");
      }
      return this;
    }

    public DefinitionBuilder transition(final TransitionBuilder transition) {
      transitions.add(transition);
      return this;
    }

    public StateMachineDefinition build() throws StateMachineException {
      final StringBuilder messages = new StringBuilder(registrationProblems);
      if (name == null || name.trim().isEmpty()) {
        messages.append("Definition name cannot be blank. ");
      }

      final Map<String, State> declaredStates = new LinkedHashMap<>();
      for (final String stateName : states) {
        final State state = toState(stateName, messages);
        if (state == null) {
          continue;
        }
        if (declaredStates.put(state.getName(), state) != null) {
          messages.append("Duplicate state: ").append(state.getName()).append(". ");
        }
      }
      if (declaredStates.isEmpty()) {
        messages.append("At least one state must be declared. ");
      }
      if (initialStates.size() != 1) {
        messages.append("Exactly one initial state must be declared, found ")
            .append(initialStates.size()).append(". ");
      }

      final Map<String, Event> declaredEvents = new LinkedHashMap<>();
      for (final String eventName : events) {
        final Event event = toEvent(eventName, messages);
        if (event == null) {
          continue;
        }
        if (declaredEvents.put(event.getName(), event) != null) {
          messages.append("Duplicate event: ").append(event.getName()).append(". ");
        }
        if (declaredStates.containsKey(event.getName())) {
          messages.append("Event name collides with state name: ").append(event.getName())
              .append(". ");
        }
      }

      final Set<State> terminals = new LinkedHashSet<>();
      for (final String terminalName : terminalStates) {
        final State terminal = declaredStates.get(terminalName == null ? null : terminalName.trim());
        if (terminal != null) {
          terminals.add(terminal);
        }
      }

      final List<Transition> resolved = new ArrayList<>();
      for (final TransitionBuilder declared : transitions) {
        final Transition transition =
            resolve(declared, declaredStates, declaredEvents, terminals, messages);
        if (transition != null) {
          resolved.add(transition);
        }
      }

      if (messages.length() > 0) {
        throw new StateMachineException(Code.INVALID_DEFINITION,
            "Definition " + name + " is invalid: " + messages.toString().trim());
      }
      final State initial = declaredStates.get(initialStates.get(0).trim());
      return new StateMachineDefinition(name.trim(), initial,
          new LinkedHashSet<>(declaredStates.values()), terminals,
          new LinkedHashSet<>(declaredEvents.values()), resolved);
    }

    private Transition resolve(final TransitionBuilder declared,
        final Map<String, State> declaredStates, final Map<String, Event> declaredEvents,
        final Set<State> terminals, final StringBuilder messages) {
      if (declared == null) {
        messages.append("Transition cannot be null. ");
        return null;
      }
      final int problemsBefore = messages.length();
      final State from = lookup(declaredStates, declared.getFromState());
      final State to = lookup(declaredStates, declared.getToState());
      final Event event = lookup(declaredEvents, declared.getEvent());
      if (from == null) {
        messages.append("Transition ").append(declared).append(" has undeclared fromState. ");
      } else if (terminals.contains(from)) {
        messages.append("Transition ").append(declared).append(" leaves terminal state. ");
      }
      if (to == null) {
        messages.append("Transition ").append(declared).append(" has undeclared toState. ");
      }
      if (event == null) {
        messages.append("Transition ").append(declared).append(" has undeclared event. ");
      }

      Binding<Guard> guard = null;
      if (declared.getGuard() != null) {
        final Guard function = guards.get(declared.getGuard());
        if (function == null) {
          messages.append("Transition ").append(declared).append(" references unknown guard ")
              .append(declared.getGuard()).append(". ");
        } else {
          guard = new Binding<>(declared.getGuard(), function);
        }
      }
      final List<Binding<Action>> before = bindActions(declared, declared.getBeforeActions(),
          messages);
      final List<Binding<Action>> after = bindActions(declared, declared.getAfterActions(),
          messages);
      if (messages.length() > problemsBefore) {
        return null;
      }
      return new Transition(from, event, to, guard, before, after);
    }

    private List<Binding<Action>> bindActions(final TransitionBuilder declared,
        final List<String> actionNames, final StringBuilder messages) {
      final List<Binding<Action>> bindings = new ArrayList<>(actionNames.size());
      for (final String actionName : actionNames) {
        final Action function = actions.get(actionName);
        if (function == null) {
          messages.append("Transition ").append(declared).append(" references unknown action ")
              .append(actionName).append(". ");
        } else {
          bindings.add(new Binding<>(actionName, function));
        }
      }
      return bindings;
    }

    private static <T> T lookup(final Map<String, T> declared, final String name) {
      return name == null ? null : declared.get(name.trim());
    }

    private static State toState(final String stateName, final StringBuilder messages) {
      try {
        return new State(stateName);
      } catch (StateMachineException problem) {
        messages.append(problem.getMessage()).append(' ');
        return null;
      }
    }

    private static Event toEvent(final String eventName, final StringBuilder messages) {
      try {
        return new Event(eventName);
      } catch (StateMachineException problem) {
        messages.append(problem.getMessage()).append(' ');
        return null;
      }
    }

    private DefinitionBuilder(final String name) {
      this.name = name;
    }
  }

}
