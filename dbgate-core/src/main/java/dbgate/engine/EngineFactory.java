package dbgate.engine;

import dbgate.config.DatabaseConfig;
import dbgate.spi.DatabaseEngine;

/**
 * Creates engines of one type from configuration.
 *
 * <p>Register implementations via {@code META-INF/services/dbgate.engine.EngineFactory}.
 *
 * @see Engines
 */
public interface EngineFactory {

    /**
     * Type name matched against {@link DatabaseConfig#engineType()} (case-insensitive).
     */
    String type();

    DatabaseEngine create(DatabaseConfig config);
}
