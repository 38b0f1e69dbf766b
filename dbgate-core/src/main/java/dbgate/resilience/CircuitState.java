package dbgate.resilience;

public enum CircuitState {
  /** Calls flow; consecutive failures are counted. */
  CLOSED,
  /** Calls are rejected until the recovery timeout elapses. */
  OPEN,
  /** Probing: calls flow, one failure reopens, enough successes close. */
  HALF_OPEN
}
