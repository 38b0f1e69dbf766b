package dbgate.resilience;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A call run on a worker thread and awaited by the caller with a deadline.
 *
 * <p>Exactly one side owns the outcome: either the caller picks it up, or the caller gives up
 * first and the worker hands whatever it finally produced to the orphan handler. The state
 * word arbitrates the race. Giving up interrupts the worker while it is inside the call; a
 * call abandoned before its worker started is skipped and the orphan handler receives
 * {@code null}. The orphan handler therefore runs if and only if the call was abandoned.
 */
final class TimedCall<T> implements Runnable {
  private static final Logger logger = Logger.getLogger(TimedCall.class.getName());

  private static final int RUNNING = 0;
  private static final int DONE = 1;
  private static final int ABANDONED = 2;

  private final String operation;
  private final Callable<T> callable;
  private final Consumer<? super T> orphanHandler;
  private final AtomicInteger state = new AtomicInteger(RUNNING);
  private final CountDownLatch finished = new CountDownLatch(1);
  private volatile T result;
  private volatile Throwable failure;
  private Thread runner;

  TimedCall(String operation, Callable<T> callable, Consumer<? super T> orphanHandler) {
    this.operation = operation;
    this.callable = callable;
    this.orphanHandler = orphanHandler;
  }

  @Override
  public void run() {
    boolean skipped;
    synchronized (this) {
      skipped = state.get() == ABANDONED;
      if (!skipped) {
        runner = Thread.currentThread();
      }
    }
    if (!skipped) {
      try {
        result = callable.call();
      } catch (Throwable t) {
        failure = t;
      } finally {
        synchronized (this) {
          runner = null;
        }
      }
    }
    if (!state.compareAndSet(RUNNING, DONE)) {
      handOff();
    }
    finished.countDown();
  }

  /**
   * Waits for the outcome.
   *
   * @return {@code true} if the call finished in time, {@code false} if it was abandoned
   */
  boolean await(long timeoutNanos) throws InterruptedException {
    if (finished.await(timeoutNanos, TimeUnit.NANOSECONDS)) {
      return true;
    }
    return !abandon();
  }

  /**
   * Gives up on the call unless it has already completed.
   *
   * @return {@code true} if this caller abandoned it
   */
  boolean abandon() {
    if (state.compareAndSet(RUNNING, ABANDONED)) {
      synchronized (this) {
        if (runner != null) {
          runner.interrupt();
        }
      }
      return true;
    }
    // completed between the deadline and the abandon attempt
    awaitUninterruptibly();
    return false;
  }

  T result() {
    return result;
  }

  Throwable failure() {
    return failure;
  }

  private void awaitUninterruptibly() {
    boolean interrupted = false;
    while (true) {
      try {
        finished.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void handOff() {
    // the abandon interrupt may have landed; it must not leak into cleanup or the next task
    Thread.interrupted();
    if (orphanHandler == null) {
      if (failure != null) {
        logger.log(Level.FINE, "Abandoned operation '" + operation + "' failed late", failure);
      }
      return;
    }
    try {
      orphanHandler.accept(failure == null ? result : null);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cleanup of abandoned operation '" + operation + "' failed", e);
    }
  }
}
