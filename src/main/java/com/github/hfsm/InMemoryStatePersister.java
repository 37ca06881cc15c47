package com.github.hfsm;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-local {@link StatePersister} backed by a concurrent map. This is the default persister of
 * an engine and what tests run against; real deployments plug in their entity store instead.
 */
public final class InMemoryStatePersister implements StatePersister {
  private static final Logger logger =
      LogManager.getLogger(InMemoryStatePersister.class.getSimpleName());

  // K=definitionName:entityId
  private final ConcurrentMap<String, PersistedState> records = new ConcurrentHashMap<>();

  @Override
  public PersistedState insertIfAbsent(final String definitionName, final String entityId,
      final PersistedState initial) {
    final PersistedState existing = records.putIfAbsent(key(definitionName, entityId), initial);
    if (existing != null && logger.isDebugEnabled()) {
      logger.debug("Rehydrating " + key(definitionName, entityId) + " from " + existing);
    }
    return existing == null ? initial : existing;
  }

  @Override
  public PersistedState load(final String definitionName, final String entityId) {
    return records.get(key(definitionName, entityId));
  }

  @Override
  public boolean compareAndSet(final String definitionName, final String entityId,
      final PersistedState expected, final PersistedState next) {
    return records.replace(key(definitionName, entityId), expected, next);
  }

  @Override
  public boolean remove(final String definitionName, final String entityId) {
    return records.remove(key(definitionName, entityId)) != null;
  }

  public int size() {
    return records.size();
  }

  static String key(final String definitionName, final String entityId) {
    return definitionName + ':' + entityId;
  }

}
