package dbgate.engine;

import dbgate.config.DatabaseConfig;
import dbgate.error.DatabaseException;
import dbgate.spi.DatabaseEngine;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of engine factories, selected by configured engine type.
 *
 * <p>Factories are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/dbgate.engine.EngineFactory}; more can be added with
 * {@link #register(EngineFactory)}.
 *
 * <pre>{@code
 * DatabaseEngine engine = Engines.create(config);
 * }</pre>
 */
public final class Engines {

  private static final Map<String, EngineFactory> BY_TYPE = new ConcurrentHashMap<>();

  static {
    ServiceLoader.load(EngineFactory.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .forEach(Engines::register);
  }

  private Engines() {
  }

  /**
   * Adds or replaces the factory for its type.
   */
  public static void register(EngineFactory factory) {
    BY_TYPE.put(factory.type().toLowerCase(Locale.ROOT), factory);
  }

  public static List<String> types() {
    return BY_TYPE.keySet().stream().sorted().toList();
  }

  /**
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if no factory handles the type
   */
  public static EngineFactory get(String type) {
    EngineFactory factory = BY_TYPE.get(type.toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw DatabaseException.configuration("Unknown engine type: " + type + ". Available: " + types());
    }
    return factory;
  }

  public static DatabaseEngine create(DatabaseConfig config) {
    DatabaseEngine engine = get(config.engineType()).create(config);
    engine.validateConfig(config.connection());
    return engine;
  }
}
