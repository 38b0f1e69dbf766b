package dbgate.pool;

import java.time.Instant;

/**
 * Point-in-time view of a pool.
 *
 * @param total   live connections: idle, in use, or being opened
 * @param active  connections held by callers or being opened for them
 * @param idle    connections ready for reuse
 * @param pending callers waiting for a connection
 */
public record PoolStatus(
    String engineId,
    int total,
    int active,
    int idle,
    int pending,
    int maxConnections,
    Instant createdAt,
    Instant lastActivity) {

  public boolean isSaturated() {
    return active >= maxConnections;
  }
}
