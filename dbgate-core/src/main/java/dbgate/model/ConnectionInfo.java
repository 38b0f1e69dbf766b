package dbgate.model;

import java.time.Instant;

/**
 * Descriptive data about one live backend connection.
 */
public record ConnectionInfo(
    String id,
    String database,
    String user,
    String serverVersion,
    Instant connectedAt,
    Instant lastActivity) {
}
