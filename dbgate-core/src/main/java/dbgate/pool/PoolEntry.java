package dbgate.pool;

import dbgate.spi.DatabaseConnection;
import dbgate.util.RequestIds;

import java.time.Duration;
import java.time.Instant;

/**
 * A live backend connection plus its pool bookkeeping. Mutated only under the pool's write lock
 * or by the single caller that currently holds it.
 */
final class PoolEntry {
  final String id;
  final DatabaseConnection connection;
  final Instant createdAt;
  Instant lastUsedAt;
  long usageCount;

  PoolEntry(DatabaseConnection connection, Instant createdAt) {
    this.id = RequestIds.nextConnectionId();
    this.connection = connection;
    this.createdAt = createdAt;
    this.lastUsedAt = createdAt;
  }

  boolean outlived(Duration maxLifetime, Instant now) {
    return Duration.between(createdAt, now).compareTo(maxLifetime) > 0;
  }

  boolean idleLongerThan(Duration idleTimeout, Instant now) {
    return Duration.between(lastUsedAt, now).compareTo(idleTimeout) > 0;
  }
}
