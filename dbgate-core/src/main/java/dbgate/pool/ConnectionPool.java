package dbgate.pool;

import dbgate.config.ConnectionConfig;
import dbgate.config.FeatureConfig;
import dbgate.config.PoolConfig;
import dbgate.error.DatabaseException;
import dbgate.model.DatabaseFeature;
import dbgate.model.HealthState;
import dbgate.model.HealthStatus;
import dbgate.resilience.LoopGuard;
import dbgate.resilience.SafetyManager;
import dbgate.spi.DatabaseConnection;
import dbgate.spi.DatabaseEngine;
import dbgate.spi.MetricsExporter;
import dbgate.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of live connections to one engine.
 *
 * <p>The pool never has more than {@code maxConnections} live connections at once. A slot is
 * reserved under the write lock before a connection is opened. It is given back only once no
 * connection can exist for it any more: after a failed connect, after a timed-out connect has
 * finally returned and its late connection is closed, or after a retired connection is
 * physically closed. The bound therefore holds under any interleaving of acquire and release.
 * No lock is held while talking to the backend: connections are opened, pinged and closed
 * outside it. {@link #status()} takes only the read lock.
 *
 * <p>{@link #acquire()} first asks the safety layer for admission, then reuses the most recently
 * returned idle connection, closing any idle connection past {@code idleTimeout} or
 * {@code maxLifetime} it finds on the way. Waiting is not FIFO. Acquire runs under the safety
 * layer's pool timeout; release waits at most that long but is never abandoned half-way.
 *
 * <p>A maintenance task started by {@link #start()} evicts expired idle connections and tops
 * the pool up to {@code minConnections}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private static final int CONNECT_PENDING = 0;
  private static final int CONNECT_STARTED = 1;
  private static final int CONNECT_REVOKED = 2;

  private final String engineId;
  private final DatabaseEngine engine;
  private final ConnectionConfig connectionConfig;
  private final PoolConfig config;
  private final Set<DatabaseFeature> features;
  private final SafetyManager safety;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Instant createdAt;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Condition changed = lock.writeLock().newCondition();
  private final Deque<PoolEntry> idle = new ArrayDeque<>();
  private int live;
  private int active;
  private int waiting;
  private boolean closed;
  private volatile Instant lastActivity;

  private ScheduledExecutorService maintenance;

  private ConnectionPool(Builder builder) {
    this.engineId = Objects.requireNonNull(builder.engineId, "engineId");
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.connectionConfig = Objects.requireNonNull(builder.connectionConfig, "connectionConfig");
    this.config = builder.poolConfig != null ? builder.poolConfig : PoolConfig.defaults();
    this.safety = Objects.requireNonNull(builder.safety, "safety");
    this.metrics = safety.metrics();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    Set<DatabaseFeature> declared = engine.supportedFeatures();
    this.features = builder.featureFilter != null ? builder.featureFilter.effective(declared) : Set.copyOf(declared);
    this.createdAt = clock.instant();
    this.lastActivity = createdAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the maintenance task and fills the pool to {@code minConnections}.
   * Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (maintenance != null) {
      return;
    }
    if (isClosed()) {
      throw DatabaseException.poolError("pool '" + engineId + "' is closed");
    }
    long intervalMs = config.maintenanceInterval().toMillis();
    maintenance = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("dbgate-pool-" + engineId + "-"));
    maintenance.execute(this::maintain);
    maintenance.scheduleWithFixedDelay(this::maintain, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    logger.info("Pool '" + engineId + "' started (max=" + config.maxConnections()
        + ", min=" + config.minConnections() + ")");
  }

  /**
   * Borrows a connection, waiting at most {@code connectionTimeout} (and never longer than
   * the pool-operation timeout) for one to become available.
   *
   * @throws DatabaseException {@code TIMEOUT} when no connection became available in time,
   *         {@code CONNECTION_FAILED} when opening a new one failed, {@code POOL_ERROR} when closed,
   *         {@code CIRCUIT_OPEN} or {@code EMERGENCY_SHUTDOWN} when the safety layer refuses
   */
  public PooledConnection acquire() {
    safety.admit("acquire " + engineId);
    return safety.safePoolOperation("acquire " + engineId, this::acquireNow, orphan -> {
      if (orphan != null) {
        orphan.close();
      }
    });
  }

  private PooledConnection acquireNow() {
    long deadline = System.nanoTime() + config.connectionTimeout().toNanos();
    LoopGuard guard = new LoopGuard("acquire " + engineId, (long) config.maxConnections() * 4 + 16);
    while (guard.checkIteration()) {
      PoolEntry reused = null;
      boolean reserved = false;
      List<PoolEntry> expired = new ArrayList<>();
      try {
        lock.writeLock().lock();
        try {
          while (true) {
            if (closed) {
              throw DatabaseException.poolError("pool '" + engineId + "' is closed");
            }
            PoolEntry candidate = idle.pollFirst();
            if (candidate != null) {
              if (isExpired(candidate, clock.instant())) {
                expired.add(candidate);
                continue;
              }
              active++;
              reused = candidate;
              break;
            }
            if (live < config.maxConnections()) {
              live++;
              active++;
              reserved = true;
              break;
            }
            if (!expired.isEmpty()) {
              // their slots come free once they are closed
              break;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
              metrics.incrementAcquireTimeouts(engineId);
              throw DatabaseException.timeout("no connection to '" + engineId + "' available within "
                  + config.connectionTimeout().toMillis() + "ms");
            }
            waiting++;
            try {
              changed.awaitNanos(remaining);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              throw DatabaseException.poolError("interrupted while waiting for a connection to '" + engineId + "'");
            } finally {
              waiting--;
            }
          }
        } finally {
          lock.writeLock().unlock();
        }
      } finally {
        retireAll(expired, "expired");
      }

      if (reused == null && !reserved) {
        continue;
      }
      if (reused != null) {
        if (config.validateOnAcquire() && !alive(reused)) {
          discard(reused, "failed validation");
          continue;
        }
        return lend(reused);
      }
      PoolEntry opened;
      try {
        opened = openInSlot();
      } catch (RuntimeException e) {
        lock.writeLock().lock();
        try {
          active--;
          changed.signal();
        } finally {
          lock.writeLock().unlock();
        }
        throw e;
      }
      return lend(opened);
    }
    throw DatabaseException.poolError("acquire on '" + engineId + "' kept losing validated connections");
  }

  /**
   * Opens a connection for a slot the caller has already reserved. On failure the slot is
   * given back by whichever side last knows about the attempt: this method when the connect
   * never started or failed in time, the worker when a timed-out connect fails late, and the
   * orphan handler after closing a connection that arrived too late.
   */
  private PoolEntry openInSlot() {
    AtomicInteger phase = new AtomicInteger(CONNECT_PENDING);
    DatabaseConnection connection;
    try {
      connection = safety.withTimeout("connect " + engineId, safety.timeouts().connectionTimeout(), () -> {
        if (!phase.compareAndSet(CONNECT_PENDING, CONNECT_STARTED)) {
          return null;
        }
        try {
          return engine.connect(connectionConfig);
        } catch (RuntimeException | Error e) {
          freeSlots(1);
          throw e;
        }
      }, late -> {
        if (late != null) {
          closeLate(late);
          freeSlots(1);
        }
      });
    } catch (DatabaseException e) {
      if (phase.compareAndSet(CONNECT_PENDING, CONNECT_REVOKED)) {
        freeSlots(1);
      }
      safety.reportFailure(e);
      throw e;
    } catch (RuntimeException e) {
      if (phase.compareAndSet(CONNECT_PENDING, CONNECT_REVOKED)) {
        freeSlots(1);
      }
      throw e;
    }
    PoolEntry entry = new PoolEntry(connection, clock.instant());
    metrics.incrementConnectionsOpened(engineId);
    logger.fine("Opened " + entry.id + " to '" + engineId + "'");
    return entry;
  }

  private void closeLate(DatabaseConnection late) {
    try {
      late.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Closing a connection to '" + engineId + "' that arrived after its connect timed out failed", e);
    } finally {
      metrics.incrementConnectionsClosed(engineId);
    }
  }

  private PooledConnection lend(PoolEntry entry) {
    Instant now = clock.instant();
    entry.lastUsedAt = now;
    entry.usageCount++;
    lastActivity = now;
    metrics.incrementAcquired(engineId);
    metrics.recordLiveConnections(engineId, liveCount());
    return new PooledConnection(this, entry, features);
  }

  /**
   * Takes a connection back. Broken, closed or over-age connections are physically closed, and
   * their slot is freed only after the close. Waits at most the pool timeout; the hand-back is
   * never abandoned, so a connection cannot leak even when the caller was interrupted.
   */
  void release(PoolEntry entry, boolean broken) {
    safety.runToCompletion("release " + entry.id + " to " + engineId, () -> giveBack(entry, broken));
  }

  private void giveBack(PoolEntry entry, boolean broken) {
    Instant now = clock.instant();
    boolean reusable = !broken && !entry.outlived(config.maxLifetime(), now) && !entry.connection.isClosed();
    lock.writeLock().lock();
    try {
      active--;
      if (reusable && !closed) {
        entry.lastUsedAt = now;
        idle.addFirst(entry);
      } else {
        reusable = false;
      }
      if (closed) {
        changed.signalAll();
      } else {
        changed.signal();
      }
    } finally {
      lock.writeLock().unlock();
    }
    lastActivity = now;
    if (!reusable) {
      retire(entry, broken ? "broken" : "retired");
    }
    metrics.recordLiveConnections(engineId, liveCount());
  }

  private void discard(PoolEntry entry, String reason) {
    lock.writeLock().lock();
    try {
      active--;
    } finally {
      lock.writeLock().unlock();
    }
    retire(entry, reason);
  }

  /** Closes a connection that holds a slot, then frees the slot. */
  private void retire(PoolEntry entry, String reason) {
    try {
      closeConnection(entry, reason);
    } finally {
      freeSlots(1);
    }
  }

  private void retireAll(List<PoolEntry> entries, String reason) {
    if (entries.isEmpty()) {
      return;
    }
    try {
      closeAll(entries, reason);
    } finally {
      freeSlots(entries.size());
    }
  }

  private void freeSlots(int count) {
    lock.writeLock().lock();
    try {
      live -= count;
      changed.signalAll();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private boolean alive(PoolEntry entry) {
    try {
      return entry.connection.ping();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Ping of " + entry.id + " failed", e);
      return false;
    }
  }

  private boolean isExpired(PoolEntry entry, Instant now) {
    return entry.idleLongerThan(config.idleTimeout(), now) || entry.outlived(config.maxLifetime(), now);
  }

  /**
   * Runs one maintenance cycle: evicts expired idle connections, then tops up to the minimum.
   * Called by the scheduler; may also be invoked directly.
   */
  public void maintain() {
    if (isClosed()) {
      return;
    }
    try {
      evictExpired();
      fillToMinimum();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Maintenance of pool '" + engineId + "' failed", t);
    }
  }

  private void evictExpired() {
    List<PoolEntry> expired = new ArrayList<>();
    Instant now = clock.instant();
    lock.writeLock().lock();
    try {
      Iterator<PoolEntry> it = idle.iterator();
      while (it.hasNext()) {
        PoolEntry entry = it.next();
        if (isExpired(entry, now)) {
          it.remove();
          expired.add(entry);
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    retireAll(expired, "expired");
  }

  private void fillToMinimum() {
    LoopGuard guard = new LoopGuard("fill pool " + engineId, config.minConnections() + 1L);
    while (guard.checkIteration()) {
      lock.writeLock().lock();
      try {
        if (closed || live >= config.minConnections()) {
          return;
        }
        live++;
      } finally {
        lock.writeLock().unlock();
      }
      PoolEntry entry;
      try {
        entry = openInSlot();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Could not top up pool '" + engineId + "'", e);
        return;
      }
      boolean accepted;
      lock.writeLock().lock();
      try {
        accepted = !closed;
        if (accepted) {
          idle.addLast(entry);
          changed.signal();
        }
      } finally {
        lock.writeLock().unlock();
      }
      if (!accepted) {
        retire(entry, "pool closed");
        return;
      }
    }
  }

  /**
   * Checks the engine under the health-check timeout and folds in pool saturation:
   * a saturated pool with waiting callers is reported as degraded.
   */
  public HealthStatus healthCheck() {
    long started = System.nanoTime();
    HealthStatus engineHealth;
    try {
      engineHealth = safety.withTimeout("health " + engineId, safety.timeouts().healthCheckTimeout(),
          engine::healthCheck, null);
    } catch (DatabaseException e) {
      return HealthStatus.critical(Duration.ofNanos(System.nanoTime() - started), e.getMessage());
    }
    if (isClosed()) {
      return HealthStatus.critical(engineHealth.latency(), "pool '" + engineId + "' is closed");
    }
    PoolStatus status = status();
    if (engineHealth.state() == HealthState.HEALTHY && status.isSaturated() && status.pending() > 0) {
      return HealthStatus.degraded(engineHealth.latency(), "pool '" + engineId + "' saturated: "
          + status.active() + "/" + status.maxConnections() + " in use, " + status.pending() + " waiting");
    }
    return engineHealth;
  }

  public PoolStatus status() {
    lock.readLock().lock();
    try {
      return new PoolStatus(engineId, live, active, idle.size(), waiting,
          config.maxConnections(), createdAt, lastActivity);
    } finally {
      lock.readLock().unlock();
    }
  }

  public String engineId() {
    return engineId;
  }

  public DatabaseEngine engine() {
    return engine;
  }

  /** Capabilities callers of this pool may use: engine features narrowed by configuration. */
  public Set<DatabaseFeature> features() {
    return features;
  }

  public SafetyManager safety() {
    return safety;
  }

  public PoolConfig config() {
    return config;
  }

  public boolean isClosed() {
    lock.readLock().lock();
    try {
      return closed;
    } finally {
      lock.readLock().unlock();
    }
  }

  private int liveCount() {
    lock.readLock().lock();
    try {
      return live;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Closes idle connections, then waits up to {@code drainTimeout} for borrowed connections to
   * come back. Connections returned later are closed on release. Finally closes the engine.
   */
  @Override
  public void close() {
    List<PoolEntry> drained;
    lock.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      drained = new ArrayList<>(idle);
      idle.clear();
      changed.signalAll();
    } finally {
      lock.writeLock().unlock();
    }
    synchronized (this) {
      if (maintenance != null) {
        maintenance.shutdownNow();
      }
    }
    retireAll(drained, "pool closed");
    awaitDrained();
    try {
      engine.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Closing engine '" + engineId + "' failed", e);
    }
    metrics.recordLiveConnections(engineId, liveCount());
    logger.info("Pool '" + engineId + "' closed");
  }

  private void awaitDrained() {
    long deadline = System.nanoTime() + config.drainTimeout().toNanos();
    lock.writeLock().lock();
    try {
      while (active > 0) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0L) {
          logger.warning("Pool '" + engineId + "' closed with " + active
              + " connections still borrowed; they will be closed on release");
          return;
        }
        changed.awaitNanos(remaining);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warning("Interrupted while draining pool '" + engineId + "'");
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void closeAll(List<PoolEntry> entries, String reason) {
    for (PoolEntry entry : entries) {
      closeConnection(entry, reason);
    }
  }

  private void closeConnection(PoolEntry entry, String reason) {
    try {
      entry.connection.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Closing " + entry.id + " (" + reason + ") failed", e);
    } finally {
      metrics.incrementConnectionsClosed(engineId);
      logger.fine("Closed " + entry.id + " of '" + engineId + "' (" + reason + ")");
    }
  }

  public static final class Builder {
    private String engineId;
    private DatabaseEngine engine;
    private ConnectionConfig connectionConfig;
    private PoolConfig poolConfig;
    private FeatureConfig featureFilter;
    private SafetyManager safety;
    private Clock clock;

    private Builder() {
    }

    public Builder engineId(String engineId) {
      this.engineId = engineId;
      return this;
    }

    public Builder engine(DatabaseEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder connectionConfig(ConnectionConfig connectionConfig) {
      this.connectionConfig = connectionConfig;
      return this;
    }

    public Builder poolConfig(PoolConfig poolConfig) {
      this.poolConfig = poolConfig;
      return this;
    }

    public Builder features(FeatureConfig featureFilter) {
      this.featureFilter = featureFilter;
      return this;
    }

    public Builder safety(SafetyManager safety) {
      this.safety = safety;
      return this;
    }

    /** Clock for idle and lifetime checks, for tests. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ConnectionPool build() {
      return new ConnectionPool(this);
    }
  }
}
