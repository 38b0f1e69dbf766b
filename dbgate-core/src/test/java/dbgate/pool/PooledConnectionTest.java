package dbgate.pool;

import dbgate.StubEngine;
import dbgate.config.ConnectionConfig;
import dbgate.config.FeatureConfig;
import dbgate.config.PoolConfig;
import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.DatabaseFeature;
import dbgate.model.IsolationLevel;
import dbgate.model.Value;
import dbgate.resilience.CircuitBreakerConfig;
import dbgate.resilience.SafetyManager;
import dbgate.resilience.TimeoutConfig;
import dbgate.tx.CheckedPreparedStatement;
import dbgate.tx.ManagedBatch;
import dbgate.tx.ManagedTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class PooledConnectionTest {
  private final SafetyManager safety = SafetyManager.builder().build();
  private ConnectionPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
    safety.close();
  }

  private PooledConnection acquire(StubEngine engine, FeatureConfig features) {
    return acquire(engine, features, safety);
  }

  private PooledConnection acquire(StubEngine engine, FeatureConfig features, SafetyManager safety) {
    pool = ConnectionPool.builder()
        .engineId("stub")
        .engine(engine)
        .connectionConfig(ConnectionConfig.builder().build())
        .poolConfig(PoolConfig.builder().maxConnections(2).minConnections(0).build())
        .features(features)
        .safety(safety)
        .build();
    return pool.acquire();
  }

  @Test
  void unsupportedOperationsNeverReachBackend() {
    StubEngine engine = StubEngine.keyValue();
    try (PooledConnection conn = acquire(engine, null)) {
      assertEquals(ErrorKind.UNSUPPORTED_OPERATION,
          assertThrows(DatabaseException.class, conn::beginTransaction).kind());
      assertEquals(ErrorKind.UNSUPPORTED_OPERATION,
          assertThrows(DatabaseException.class, () -> conn.prepare("GET ?")).kind());
      assertEquals(ErrorKind.UNSUPPORTED_OPERATION,
          assertThrows(DatabaseException.class, conn::schema).kind());
    }
    assertEquals(0, engine.count("begin"));
    assertEquals(0, engine.count("prepare"));
    assertEquals(0, engine.count("schema"));
  }

  @Test
  void featureConfigNarrowsEngineCapabilities() {
    StubEngine engine = StubEngine.relational();
    FeatureConfig noTx = FeatureConfig.builder().enableTransactions(false).build();
    try (PooledConnection conn = acquire(engine, noTx)) {
      assertFalse(conn.supports(DatabaseFeature.TRANSACTIONS));
      assertFalse(conn.supports(DatabaseFeature.SAVEPOINTS));
      assertTrue(conn.supports(DatabaseFeature.PREPARED_STATEMENTS));
      assertThrows(DatabaseException.class, conn::beginTransaction);
    }
    assertEquals(0, engine.count("begin"));
  }

  @Test
  void statementsOnConnectionRejectedWhileTransactionOpen() {
    StubEngine engine = StubEngine.relational();
    try (PooledConnection conn = acquire(engine, null)) {
      ManagedTransaction tx = conn.beginTransaction(IsolationLevel.SERIALIZABLE, false);

      DatabaseException e = assertThrows(DatabaseException.class, () -> conn.query("SELECT 1"));
      assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
      assertThrows(DatabaseException.class, conn::beginTransaction);

      tx.commit();
      conn.query("SELECT 1");
    }
    assertTrue(engine.calls().contains("begin SERIALIZABLE"));
    assertEquals(1, engine.count("query SELECT 1"));
  }

  @Test
  void useAfterCloseIsRejected() {
    StubEngine engine = StubEngine.relational();
    PooledConnection conn = acquire(engine, null);
    conn.close();
    conn.close();

    assertFalse(conn.isValid());
    assertEquals(ErrorKind.VALIDATION_ERROR,
        assertThrows(DatabaseException.class, () -> conn.query("SELECT 1")).kind());
    assertEquals(1, pool.status().idle());
  }

  @Test
  void preparedStatementChecksParameterCount() {
    StubEngine engine = StubEngine.relational();
    try (PooledConnection conn = acquire(engine, null);
        CheckedPreparedStatement ps = conn.prepare("SELECT * FROM items WHERE id = ? AND name = ?")) {
      assertEquals(2, ps.parameterCount());
      DatabaseException e = assertThrows(DatabaseException.class, () -> ps.query(List.of(Value.of(1))));
      assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
      assertEquals(0, engine.count("prepared query"));

      assertEquals(Value.of(2L), ps.query(List.of(Value.of(1), Value.of("x"))).cell(0, "params"));
    }
    assertEquals(1, engine.count("prepared close"));
  }

  @Test
  void batchOnKeyValueEngine() {
    StubEngine engine = StubEngine.keyValue();
    try (PooledConnection conn = acquire(engine, null)) {
      ManagedBatch batch = conn.beginBatch();
      batch.queue("SET a", List.of(Value.of("1"))).queue("SET b", List.of(Value.of("2")));
      assertThrows(DatabaseException.class, () -> conn.execute("SET c"));

      assertEquals(2, batch.exec().size());
      assertFalse(batch.isOpen());
      conn.execute("SET c");
    }
    assertEquals("1", engine.store().get("a"));
    assertEquals("2", engine.store().get("b"));
  }

  @Test
  void closeDiscardsOpenBatch() {
    StubEngine engine = StubEngine.keyValue();
    PooledConnection conn = acquire(engine, null);
    conn.beginBatch().queue("SET a", List.of(Value.of("1")));
    conn.close();

    assertTrue(engine.calls().contains("discard"));
    assertTrue(engine.store().isEmpty());
  }

  @Test
  void failedPingInvalidates() {
    StubEngine engine = StubEngine.relational();
    PooledConnection conn = acquire(engine, null);
    engine.pingResult(false);

    assertFalse(conn.ping());
    assertTrue(conn.isBroken());
    conn.close();
    assertEquals(0, engine.live());
  }

  @Test
  void timedOutStatementBreaksConnectionAndCountsAgainstBreaker() throws Exception {
    SafetyManager strict = SafetyManager.builder()
        .timeouts(TimeoutConfig.builder().queryTimeout(Duration.ofMillis(100)).build())
        .build();
    StubEngine engine = StubEngine.relational().statementDelayMs(2_000);
    try {
      PooledConnection conn = acquire(engine, null, strict);

      DatabaseException e = assertThrows(DatabaseException.class, () -> conn.query("SELECT pg_sleep(2)"));

      assertEquals(ErrorKind.TIMEOUT, e.kind());
      assertTrue(conn.isBroken());
      assertEquals(1, strict.circuitBreaker().consecutiveFailures());
      conn.close();
      await(() -> engine.live() == 0 && pool.status().total() == 0);
      assertEquals(0, strict.resourceMonitor().activeConnections());
    } finally {
      pool.close();
      pool = null;
      strict.close();
    }
  }

  @Test
  void transactionStatementsRunUnderQueryTimeout() throws Exception {
    SafetyManager strict = SafetyManager.builder()
        .timeouts(TimeoutConfig.builder().queryTimeout(Duration.ofMillis(100)).build())
        .build();
    StubEngine engine = StubEngine.relational();
    try {
      PooledConnection conn = acquire(engine, null, strict);
      ManagedTransaction tx = conn.beginTransaction();
      engine.statementDelayMs(2_000);

      assertEquals(ErrorKind.TIMEOUT, assertThrows(DatabaseException.class,
          () -> tx.execute("UPDATE items SET name = 'x'", List.of())).kind());
      assertTrue(tx.isAbandoned());
      assertTrue(conn.isBroken());

      conn.close();
      await(() -> engine.live() == 0);
      assertTrue(engine.calls().contains("rollback on close"));
      assertEquals(0, engine.count("commit"));
    } finally {
      pool.close();
      pool = null;
      strict.close();
    }
  }

  @Test
  void backendFailuresOnBorrowedConnectionsOpenTheCircuit() {
    SafetyManager strict = SafetyManager.builder()
        .circuitBreaker(new CircuitBreakerConfig(2, Duration.ofSeconds(60), 1))
        .build();
    StubEngine engine = StubEngine.relational();
    try {
      acquire(engine, null, strict).close();
      engine.failStatements(DatabaseException.queryFailed("connection reset", null));
      for (int i = 0; i < 2; i++) {
        try (PooledConnection conn = pool.acquire()) {
          assertThrows(DatabaseException.class, () -> conn.execute("UPDATE items SET name = 'x'"));
        }
      }

      assertEquals(ErrorKind.CIRCUIT_OPEN, assertThrows(DatabaseException.class, pool::acquire).kind());
    } finally {
      pool.close();
      pool = null;
      strict.close();
    }
  }

  @Test
  void brokenConnectionSkipsCleanupCalls() {
    StubEngine engine = StubEngine.relational();
    PooledConnection conn = acquire(engine, null);
    ManagedTransaction tx = conn.beginTransaction();
    CheckedPreparedStatement ps = conn.prepare("SELECT * FROM items WHERE id = ?");
    conn.invalidate();

    conn.close();

    assertTrue(tx.isAbandoned());
    assertTrue(ps.isClosed());
    assertEquals(0, engine.count("prepared close"));
    assertEquals(0, engine.live());
    assertTrue(engine.calls().contains("rollback on close"));
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not met in time");
      Thread.sleep(10);
    }
  }
}
