package dbgate.resilience;

import dbgate.error.DatabaseException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Counts connection slots held by in-flight operations against a ceiling and owns the
 * process-wide emergency-shutdown flag.
 *
 * <p>Reads of the counter take the read lock; reservations and releases take the write lock.
 * A release without a matching reservation means the bookkeeping is broken and triggers an
 * emergency shutdown.
 */
public final class ResourceMonitor {
  private static final Logger logger = Logger.getLogger(ResourceMonitor.class.getName());

  public static final int DEFAULT_MAX_CONNECTIONS = 100;

  private final int maxConnections;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private int activeConnections;
  private volatile boolean emergencyShutdown;
  private volatile String shutdownReason;

  public ResourceMonitor() {
    this(DEFAULT_MAX_CONNECTIONS);
  }

  public ResourceMonitor(int maxConnections) {
    if (maxConnections < 1) {
      throw DatabaseException.configuration("maxConnections must be >= 1, got: " + maxConnections);
    }
    this.maxConnections = maxConnections;
  }

  /**
   * Takes one slot.
   *
   * @throws DatabaseException {@code RESOURCE_LIMIT_EXCEEDED} at the ceiling, or
   *         {@code EMERGENCY_SHUTDOWN} once shut down
   */
  public void incrementConnections() {
    lock.writeLock().lock();
    try {
      if (emergencyShutdown) {
        throw DatabaseException.emergencyShutdown("emergency shutdown active: " + shutdownReason);
      }
      if (activeConnections >= maxConnections) {
        throw DatabaseException.resourceLimit("connection limit reached (" + maxConnections + ")");
      }
      activeConnections++;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void decrementConnections() {
    boolean underflow = false;
    lock.writeLock().lock();
    try {
      if (activeConnections == 0) {
        underflow = true;
      } else {
        activeConnections--;
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (underflow) {
      triggerEmergencyShutdown("connection counter underflow");
    }
  }

  /**
   * Takes one slot and returns a handle that gives it back exactly once on close.
   */
  public Slot reserve() {
    incrementConnections();
    return new Slot();
  }

  public int activeConnections() {
    lock.readLock().lock();
    try {
      return activeConnections;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int maxConnections() {
    return maxConnections;
  }

  public boolean isEmergencyShutdown() {
    return emergencyShutdown;
  }

  public String shutdownReason() {
    return shutdownReason;
  }

  public void triggerEmergencyShutdown(String reason) {
    shutdownReason = reason;
    emergencyShutdown = true;
    logger.severe("Emergency shutdown triggered: " + reason);
  }

  /**
   * Manual intervention: clears the emergency flag.
   */
  public void resetEmergencyShutdown() {
    emergencyShutdown = false;
    shutdownReason = null;
    logger.info("Emergency shutdown reset");
  }

  /** One reserved slot. */
  public final class Slot implements AutoCloseable {
    private final AtomicBoolean released = new AtomicBoolean();

    private Slot() {
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        decrementConnections();
      }
    }
  }
}
