package dbgate.model;

public enum HealthState {
  HEALTHY,
  DEGRADED,
  CRITICAL;

  /** The worse of two states. */
  public HealthState worst(HealthState other) {
    return compareTo(other) >= 0 ? this : other;
  }
}
