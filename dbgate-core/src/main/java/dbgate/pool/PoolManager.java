package dbgate.pool;

import dbgate.config.DatabaseConfig;
import dbgate.error.DatabaseException;
import dbgate.model.HealthStatus;
import dbgate.resilience.SafetyManager;
import dbgate.spi.DatabaseEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One {@link ConnectionPool} per registered engine identifier.
 *
 * <p>Each pool gets its own circuit breaker derived from the shared {@link SafetyManager}.
 * Lookups take the read lock; registration and removal take the write lock. Pools are started
 * and drained outside the lock.
 */
public final class PoolManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PoolManager.class.getName());

  private final SafetyManager safety;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, ConnectionPool> pools = new LinkedHashMap<>();

  public PoolManager(SafetyManager safety) {
    this.safety = Objects.requireNonNull(safety, "safety");
  }

  /**
   * Registers an engine and starts its pool.
   *
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if the identifier is taken
   */
  public ConnectionPool addEngine(String engineId, DatabaseEngine engine, DatabaseConfig config) {
    Objects.requireNonNull(engineId, "engineId");
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(config, "config");
    ConnectionPool pool = ConnectionPool.builder()
        .engineId(engineId)
        .engine(engine)
        .connectionConfig(config.connection())
        .poolConfig(config.pool())
        .features(config.features())
        .safety(safety.forEngine(engineId))
        .build();
    lock.writeLock().lock();
    try {
      if (pools.containsKey(engineId)) {
        throw DatabaseException.configuration("engine already registered: " + engineId);
      }
      pools.put(engineId, pool);
    } finally {
      lock.writeLock().unlock();
    }
    pool.start();
    logger.info("Registered engine '" + engineId + "' (" + engine.type() + ")");
    return pool;
  }

  /**
   * @throws DatabaseException {@code CONFIGURATION_ERROR} if no such engine is registered
   */
  public ConnectionPool getPool(String engineId) {
    return findPool(engineId)
        .orElseThrow(() -> DatabaseException.configuration("no engine registered as '" + engineId + "'"));
  }

  public Optional<ConnectionPool> findPool(String engineId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(pools.get(engineId));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Unregisters an engine, then drains and closes its pool before returning.
   *
   * @return {@code false} if nothing was registered under the identifier
   */
  public boolean removeEngine(String engineId) {
    ConnectionPool removed;
    lock.writeLock().lock();
    try {
      removed = pools.remove(engineId);
    } finally {
      lock.writeLock().unlock();
    }
    if (removed == null) {
      return false;
    }
    removed.close();
    logger.info("Removed engine '" + engineId + "'");
    return true;
  }

  public Set<String> engineIds() {
    lock.readLock().lock();
    try {
      return Set.copyOf(pools.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Map<String, HealthStatus> healthCheckAll() {
    Map<String, HealthStatus> result = new LinkedHashMap<>();
    for (ConnectionPool pool : snapshot()) {
      result.put(pool.engineId(), pool.healthCheck());
    }
    return result;
  }

  public Map<String, PoolStatus> statusAll() {
    Map<String, PoolStatus> result = new LinkedHashMap<>();
    for (ConnectionPool pool : snapshot()) {
      result.put(pool.engineId(), pool.status());
    }
    return result;
  }

  public SafetyManager safety() {
    return safety;
  }

  /**
   * Drains and closes every pool.
   */
  @Override
  public void close() {
    List<ConnectionPool> all;
    lock.writeLock().lock();
    try {
      all = new ArrayList<>(pools.values());
      pools.clear();
    } finally {
      lock.writeLock().unlock();
    }
    for (ConnectionPool pool : all) {
      try {
        pool.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Closing pool '" + pool.engineId() + "' failed", e);
      }
    }
  }

  private List<ConnectionPool> snapshot() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(pools.values());
    } finally {
      lock.readLock().unlock();
    }
  }
}
