package com.github.hfsm;

import java.util.Optional;

import com.github.hfsm.StateMachineDefinition.DefinitionBuilder;

/**
 * An embeddable Finite State Machine engine with transactional guard/action semantics.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this engine is thread-safe<br>
 *
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * engines, just create as many as needed. Every engine registers itself with a process-wide
 * registry that demolishes it on jvm shutdown<br>
 *
 * 3. definitions are immutable and meant to be declared once per entity type and reused by every
 * instance of that type. There's no need to declare a definition for every entity<br>
 *
 * 4. instances are bound per entity. Firing events does not expect any thread affinity (meaning the
 * caller does not have to use the same thread to change states) and fires on different instances
 * never contend with each other<br>
 *
 * 5. the outcome of a fire is always returned as a {@link TransitionResult}, never thrown. Only
 * configuration and lifecycle problems surface as {@link StateMachineException}<br>
 *
 * 6. guards and actions are plain functions handed to the definition. All state management is done
 * within the confines of the engine and its persister and doesn't spill out<br>
 */
public interface StateMachineEngine {

  ///// Definition API /////
  /**
   * Validate and register a definition under its name. Definitions cannot be redefined for the
   * lifetime of the engine.
   */
  StateMachineDefinition defineMachine(final DefinitionBuilder definitionBuilder)
      throws StateMachineException;

  /**
   * Lookup a registered definition by name. Returns null if there is none.
   */
  StateMachineDefinition findDefinition(final String definitionName);


  ///// Instance API /////
  /**
   * Bind an entity to a definition in the definition's initial state. If the persister already
   * knows the entity, the instance is rehydrated from the persisted record instead.
   */
  StateMachineInstance bind(final StateMachineDefinition definition, final String entityId)
      throws StateMachineException;

  /**
   * Same as {@link #bind(StateMachineDefinition, String)} but starting a new entity in the given
   * state, which must be a member of the definition.
   */
  StateMachineInstance bind(final StateMachineDefinition definition, final String entityId,
      final Optional<State> initialStateOverride) throws StateMachineException;

  /**
   * Returns null if the entity is not bound to this engine.
   */
  StateMachineInstance lookupInstance(final String definitionName, final String entityId);

  /**
   * Forget an instance, eg. because its entity was deleted. The persisted record is removed too.
   */
  boolean unbind(final StateMachineInstance instance) throws StateMachineException;

  /**
   * Fire an event on an instance. According to the current state and the guards, the engine will
   * make the right transition or report why it could not.
   */
  TransitionResult fire(final StateMachineInstance instance, final Event event,
      final TransitionContext context);

  /**
   * Check whether some transition for the event would pass its guard right now. Runs no actions.
   */
  boolean canFire(final StateMachineInstance instance, final Event event,
      final TransitionContext context);


  ///// Non-instance specific overall engine functions /////
  /**
   * Reports the id of this engine. You can have as many engines as you like.
   */
  String getId();

  /**
   * Returns the config that this engine is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this engine.
   */
  StateMachineStatistics getStatistics();

  /**
   * Check if the engine is alive.
   */
  boolean alive();

  /**
   * Shutdown the engine, its thread pools and clear all bound instances and definitions.
   */
  boolean demolish() throws StateMachineException;

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class StateMachineEngineBuilder {
    private StateMachineConfiguration config;
    private StatePersister persister;

    public static StateMachineEngineBuilder newBuilder() {
      return new StateMachineEngineBuilder();
    }

    public StateMachineEngineBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Optional, defaults to an {@link InMemoryStatePersister}.
     */
    public StateMachineEngineBuilder persister(final StatePersister persister) {
      this.persister = persister;
      return this;
    }

    public StateMachineEngine build() throws StateMachineException {
      return new StateMachineEngineImpl(config,
          persister == null ? new InMemoryStatePersister() : persister);
    }

    private StateMachineEngineBuilder() {}
  }

}
