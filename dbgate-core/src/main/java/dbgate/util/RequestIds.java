package dbgate.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for requests, transactions and connections.
 *
 * <p>Initialized when the class loads and never reset. Callers read them and draw new
 * identifiers; they cannot set them. Transaction and connection identifiers are monotonic ULIDs,
 * so they sort by creation time across processes.
 */
public final class RequestIds {
  private static final Instant STARTED_AT = Instant.now();
  private static final AtomicLong REQUESTS = new AtomicLong();
  private static final AtomicLong TRANSACTIONS = new AtomicLong();
  private static final AtomicLong CONNECTIONS = new AtomicLong();

  private RequestIds() {
  }

  public static long nextRequestId() {
    return REQUESTS.incrementAndGet();
  }

  public static String nextTransactionId() {
    TRANSACTIONS.incrementAndGet();
    return "tx-" + UlidCreator.getMonotonicUlid();
  }

  public static String nextConnectionId() {
    CONNECTIONS.incrementAndGet();
    return "conn-" + UlidCreator.getMonotonicUlid();
  }

  public static long requestCount() {
    return REQUESTS.get();
  }

  public static long transactionCount() {
    return TRANSACTIONS.get();
  }

  public static long connectionCount() {
    return CONNECTIONS.get();
  }

  public static Instant startedAt() {
    return STARTED_AT;
  }
}
