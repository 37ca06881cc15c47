package com.github.hfsm;

/**
 * The durable record of one instance: the name of its current state plus a version that increases
 * by one with every commit. Persisters compare both when doing a compare-and-set.
 */
public final class PersistedState {
  private final String stateName;
  private final long version;

  public PersistedState(final String stateName, final long version) {
    this.stateName = stateName;
    this.version = version;
  }

  public String getStateName() {
    return stateName;
  }

  public long getVersion() {
    return version;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((stateName == null) ? 0 : stateName.hashCode());
    result = prime * result + (int) (version ^ (version >>> 32));
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final PersistedState other = (PersistedState) obj;
    if (version != other.version) {
      return false;
    }
    return stateName == null ? other.stateName == null : stateName.equals(other.stateName);
  }

  @Override
  public String toString() {
    return "PersistedState [stateName=" + stateName + ", version=" + version + "]";
  }
}
