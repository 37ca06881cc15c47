package com.github.hfsm;

import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caller supplied data handed to every guard and action of a single fire. Attributes are
 * thread-safe since async after-actions may read them on another thread. Null values are not
 * allowed.
 */
public final class TransitionContext {
  private final String contextId = UUID.randomUUID().toString();
  private final ConcurrentMap<String, Object> attributes = new ConcurrentHashMap<>();
  // 0 means fall back to the engine's configured evaluation timeout
  private final long timeoutMillis;

  private TransitionContext(final Map<String, Object> attributes, final long timeoutMillis) {
    this.attributes.putAll(attributes);
    this.timeoutMillis = timeoutMillis < 0L ? 0L : timeoutMillis;
  }

  public static TransitionContext empty() {
    return new TransitionContext(Collections.<String, Object>emptyMap(), 0L);
  }

  /**
   * A fresh context carrying a copy of this one's attributes and timeout, used when one fire fans
   * out into fires on other instances.
   */
  public TransitionContext derive() {
    return new TransitionContext(attributes, timeoutMillis);
  }

  public String getContextId() {
    return contextId;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public Object getAttribute(final String key) {
    return attributes.get(key);
  }

  public <T> T getAttribute(final String key, final Class<T> type) {
    final Object value = attributes.get(key);
    return type.isInstance(value) ? type.cast(value) : null;
  }

  public boolean hasAttribute(final String key) {
    return attributes.containsKey(key);
  }

  public void putAttribute(final String key, final Object value) {
    attributes.put(key, value);
  }

  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  @Override
  public String toString() {
    return "TransitionContext [contextId=" + contextId + ", timeoutMillis=" + timeoutMillis
        + ", attributes=" + attributes.keySet() + "]";
  }

  public final static class TransitionContextBuilder {
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private long timeoutMillis;

    public static TransitionContextBuilder newBuilder() {
      return new TransitionContextBuilder();
    }

    public TransitionContextBuilder attribute(final String key, final Object value) {
      attributes.put(key, value);
      return this;
    }

    public TransitionContextBuilder timeoutMillis(final long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public TransitionContext build() {
      return new TransitionContext(attributes, timeoutMillis);
    }

    private TransitionContextBuilder() {}
  }

}
