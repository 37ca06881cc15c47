package com.github.hfsm;

/**
 * Contract the entity/persistence layer implements so that commits are durable. The engine calls
 * {@link #compareAndSet} while holding the instance's commit lock; it must store the new state in
 * the same transaction boundary as the entity and only if the stored record still matches the
 * expected one.
 *
 * Implementations signal infrastructure problems by throwing; a lost race is reported by returning
 * false.
 */
public interface StatePersister {

  /**
   * Store the initial record for an entity unless one already exists. Returns the record that is
   * stored after the call, which is the pre-existing one when the entity was already known.
   */
  PersistedState insertIfAbsent(final String definitionName, final String entityId,
      final PersistedState initial) throws StateMachineException;

  /**
   * Returns null if the entity is unknown.
   */
  PersistedState load(final String definitionName, final String entityId)
      throws StateMachineException;

  /**
   * Atomically replace expected by next. Returns false, without modifying anything, if the stored
   * record is not expected.
   */
  boolean compareAndSet(final String definitionName, final String entityId,
      final PersistedState expected, final PersistedState next) throws StateMachineException;

  boolean remove(final String definitionName, final String entityId)
      throws StateMachineException;

}
