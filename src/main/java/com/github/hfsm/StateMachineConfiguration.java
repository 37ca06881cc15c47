package com.github.hfsm;

/**
 * This class encapsulates all the configuration parameters for the StateMachineEngine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. lockAcquisitionMillis bounds how long a fire waits for an instance's commit lock. If this is
 * not set, a default of 100 millis is used.<br>
 * 2. evaluationTimeoutMillis bounds guard plus before-action evaluation for fires whose context
 * does not carry its own timeout. 0 means unbounded, in which case evaluation happens on the caller
 * thread.<br>
 * 3. routeCapacity bounds the per-instance route of visited states. Defaults to 100.<br>
 * 4. actionDrainMillis bounds how long demolish waits for running after-actions before
 * interrupting them. Queued after-actions still run, inline on the demolishing thread. Defaults to
 * 5 seconds.<br>
 */
public final class StateMachineConfiguration {
  private final ActionDispatchMode actionDispatchMode;
  private final long lockAcquisitionMillis;
  private final long evaluationTimeoutMillis;
  private final int routeCapacity;
  private final int evaluationThreads;
  private final int actionThreads;
  private final long actionDrainMillis;

  public ActionDispatchMode getActionDispatchMode() {
    return actionDispatchMode;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public long getEvaluationTimeoutMillis() {
    return evaluationTimeoutMillis;
  }

  public int getRouteCapacity() {
    return routeCapacity;
  }

  public int getEvaluationThreads() {
    return evaluationThreads;
  }

  public int getActionThreads() {
    return actionThreads;
  }

  public long getActionDrainMillis() {
    return actionDrainMillis;
  }

  public final static class StateMachineConfigurationBuilder {
    private ActionDispatchMode actionDispatchMode;
    private long lockAcquisitionMillis;
    private long evaluationTimeoutMillis;
    private int routeCapacity;
    private int evaluationThreads;
    private int actionThreads;
    private long actionDrainMillis;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder actionDispatchMode(
        final ActionDispatchMode actionDispatchMode) {
      this.actionDispatchMode = actionDispatchMode;
      return this;
    }

    public StateMachineConfigurationBuilder lockAcquisitionMillis(long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public StateMachineConfigurationBuilder evaluationTimeoutMillis(long evaluationTimeoutMillis) {
      this.evaluationTimeoutMillis = evaluationTimeoutMillis;
      return this;
    }

    public StateMachineConfigurationBuilder routeCapacity(int routeCapacity) {
      this.routeCapacity = routeCapacity;
      return this;
    }

    public StateMachineConfigurationBuilder evaluationThreads(int evaluationThreads) {
      this.evaluationThreads = evaluationThreads;
      return this;
    }

    public StateMachineConfigurationBuilder actionThreads(int actionThreads) {
      this.actionThreads = actionThreads;
      return this;
    }

    public StateMachineConfigurationBuilder actionDrainMillis(long actionDrainMillis) {
      this.actionDrainMillis = actionDrainMillis;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(actionDispatchMode, lockAcquisitionMillis,
              evaluationTimeoutMillis, routeCapacity, evaluationThreads, actionThreads,
              actionDrainMillis);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (actionDispatchMode == null) {
      messages.append("ActionDispatchMode cannot be null. ");
    }
    if (evaluationTimeoutMillis < 0L) {
      messages.append("evaluationTimeoutMillis cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [actionDispatchMode=" + actionDispatchMode
        + ", lockAcquisitionMillis=" + lockAcquisitionMillis + ", evaluationTimeoutMillis="
        + evaluationTimeoutMillis + ", routeCapacity=" + routeCapacity + ", evaluationThreads="
        + evaluationThreads + ", actionThreads=" + actionThreads + ", actionDrainMillis=" + actionDrainMillis + "]";
  }

  private StateMachineConfiguration(final ActionDispatchMode actionDispatchMode,
      final long lockAcquisitionMillis, final long evaluationTimeoutMillis,
      final int routeCapacity, final int evaluationThreads, final int actionThreads,
      final long actionDrainMillis) {
    this.actionDispatchMode = actionDispatchMode;
    this.lockAcquisitionMillis = lockAcquisitionMillis <= 0L ? 100L : lockAcquisitionMillis;
    this.evaluationTimeoutMillis = evaluationTimeoutMillis;
    this.routeCapacity = routeCapacity <= 0 ? 100 : routeCapacity;
    this.evaluationThreads = evaluationThreads <= 0 ? 4 : evaluationThreads;
    this.actionThreads = actionThreads <= 0 ? 4 : actionThreads;
    this.actionDrainMillis = actionDrainMillis <= 0L ? 5 * 1000L : actionDrainMillis;
  }

}
