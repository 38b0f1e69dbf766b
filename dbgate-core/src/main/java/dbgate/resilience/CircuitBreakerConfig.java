package dbgate.resilience;

import dbgate.error.DatabaseException;

import java.time.Duration;

/**
 * Thresholds of a {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive failures that open a closed circuit
 * @param recoveryTimeout  time an open circuit waits before admitting trial calls
 * @param successThreshold consecutive trial successes that close a half-open circuit
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, int successThreshold) {

  public static final CircuitBreakerConfig DEFAULT =
      new CircuitBreakerConfig(5, Duration.ofSeconds(60), 3);

  public CircuitBreakerConfig {
    if (failureThreshold < 1) {
      throw DatabaseException.configuration("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    if (successThreshold < 1) {
      throw DatabaseException.configuration("successThreshold must be >= 1, got: " + successThreshold);
    }
    if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
      throw DatabaseException.configuration("recoveryTimeout must be >= 0");
    }
  }
}
