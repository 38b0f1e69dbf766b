package dbgate.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a health check.
 *
 * @param error detail of the failure that caused a non-healthy state
 */
public record HealthStatus(HealthState state, Duration latency, Optional<String> error, Instant checkedAt) {
  public HealthStatus {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(latency, "latency");
    Objects.requireNonNull(error, "error");
    Objects.requireNonNull(checkedAt, "checkedAt");
  }

  public static HealthStatus healthy(Duration latency) {
    return new HealthStatus(HealthState.HEALTHY, latency, Optional.empty(), Instant.now());
  }

  public static HealthStatus degraded(Duration latency, String error) {
    return new HealthStatus(HealthState.DEGRADED, latency, Optional.of(error), Instant.now());
  }

  public static HealthStatus critical(Duration latency, String error) {
    return new HealthStatus(HealthState.CRITICAL, latency, Optional.of(error), Instant.now());
  }

  public boolean isHealthy() {
    return state == HealthState.HEALTHY;
  }
}
