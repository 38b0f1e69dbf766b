package dbgate;

import dbgate.config.ConnectionConfig;
import dbgate.config.DatabaseConfig;
import dbgate.config.PoolConfig;
import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.DatabaseSchema;
import dbgate.model.IsolationLevel;
import dbgate.model.Value;
import dbgate.resilience.CircuitBreakerConfig;
import dbgate.resilience.ResourceMonitor;
import dbgate.resilience.TimeoutConfig;
import dbgate.spi.CallerContext;
import dbgate.spi.ValidationResult;
import dbgate.tx.TransactionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseGatewayTest {
  private DatabaseGateway gateway;

  @AfterEach
  void tearDown() {
    if (gateway != null) {
      gateway.close();
    }
  }

  private static DatabaseConfig config() {
    return DatabaseConfig.builder()
        .engineType("stub")
        .connection(ConnectionConfig.builder().database("app").build())
        .pool(PoolConfig.builder().maxConnections(2).minConnections(0).drainTimeout(Duration.ofMillis(200)).build())
        .build();
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not met in time");
      Thread.sleep(10);
    }
  }

  @Test
  void queryAndCommandBorrowAndReturnConnection() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("main", config(), engine);

    Value params = gateway.executeQuery("SELECT * FROM items WHERE id = ?", List.of(Value.of(1)))
        .cell(0, "params");
    long affected = gateway.executeCommand("INSERT INTO items VALUES (?, ?)",
        List.of(Value.of(2), Value.of("b"))).rowsAffected();

    assertEquals(Value.of(1L), params);
    assertEquals(1, affected);
    assertEquals(1, engine.opened());
    assertEquals(0, gateway.poolManager().getPool("main").status().active());
    assertEquals("main", gateway.activeDatabase());
  }

  @Test
  void deniedStatementNeverReachesPool() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder()
        .validator((statement, caller) -> statement.contains("salary")
            ? ValidationResult.denied("salary data is restricted for " + caller.principal())
            : ValidationResult.APPROVED)
        .build();
    gateway.addDatabase("main", config(), engine);

    DatabaseException e = assertThrows(DatabaseException.class, () -> gateway.executeQuery(
        CallerContext.of("intern"), "SELECT salary FROM staff", List.of()));

    assertEquals(ErrorKind.SECURITY_VIOLATION, e.kind());
    assertTrue(e.getMessage().contains("intern"));
    assertEquals(0, engine.count("connect"));
  }

  @Test
  void warningStillExecutes() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder()
        .validator((statement, caller) -> ValidationResult.warning("full table scan"))
        .build();
    gateway.addDatabase("main", config(), engine);

    gateway.executeQuery("SELECT * FROM items", List.of());

    assertEquals(1, engine.count("query SELECT * FROM items"));
  }

  @Test
  void statementPolicyRejectsDisallowedOperation() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("main", config(), engine);

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> gateway.executeCommand("DROP TABLE items", List.of()));

    assertEquals(ErrorKind.SECURITY_VIOLATION, e.kind());
    assertEquals(0, engine.count("connect"));
  }

  @Test
  void transactionScenarioWithSavepoint() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("main", config(), engine);

    GatewayTransaction tx = gateway.beginTransaction(IsolationLevel.READ_COMMITTED);
    tx.execute("INSERT INTO items VALUES (1)", List.of());
    tx.savepoint("s1");
    tx.execute("INSERT INTO items VALUES (2)", List.of());
    tx.rollbackToSavepoint("s1");
    assertTrue(tx.info().savepoints().isEmpty());
    tx.commit();

    assertEquals(TransactionState.COMMITTED, tx.state());
    assertEquals(List.of("connect", "begin READ_COMMITTED", "tx execute INSERT INTO items VALUES (1)",
        "savepoint s1", "tx execute INSERT INTO items VALUES (2)", "rollback to s1", "commit"), engine.calls());
    assertEquals(0, gateway.poolManager().getPool("main").status().active());
    assertThrows(DatabaseException.class, tx::commit);
  }

  @Test
  void transactionStatementsArePreflighted() {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("main", config(), engine);

    try (GatewayTransaction tx = gateway.beginTransaction(IsolationLevel.SERIALIZABLE)) {
      DatabaseException e = assertThrows(DatabaseException.class,
          () -> tx.execute("TRUNCATE items", List.of()));
      assertEquals(ErrorKind.SECURITY_VIOLATION, e.kind());
    }

    assertEquals(0, engine.count("tx execute"));
    assertTrue(engine.calls().contains("rollback"));
    assertEquals(0, gateway.poolManager().getPool("main").status().active());
  }

  @Test
  void transactionsUnsupportedOnKeyValueEngine() {
    StubEngine engine = StubEngine.keyValue();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("cache", config(), engine);

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> gateway.beginTransaction(IsolationLevel.READ_COMMITTED));

    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, e.kind());
    assertEquals(0, engine.count("connect"));
  }

  @Test
  void savepointsUnsupportedOnDocumentEngine() {
    StubEngine engine = StubEngine.document();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("docs", config(), engine);

    GatewayTransaction tx = gateway.beginTransaction(IsolationLevel.READ_COMMITTED);
    DatabaseException e = assertThrows(DatabaseException.class, () -> tx.savepoint("s1"));
    tx.rollback();

    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, e.kind());
    assertEquals(0, engine.count("savepoint"));
    assertEquals(TransactionState.ROLLED_BACK, tx.state());
  }

  @Test
  void schemaIsCapabilityChecked() {
    StubEngine relational = StubEngine.relational();
    StubEngine keyValue = StubEngine.keyValue();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("main", config(), relational);
    gateway.addDatabase("cache", config(), keyValue);

    DatabaseSchema schema = gateway.getSchema();
    assertEquals(List.of("id"), schema.table("items").orElseThrow().primaryKeys());

    gateway.switchEngine("cache");
    assertEquals(ErrorKind.UNSUPPORTED_OPERATION,
        assertThrows(DatabaseException.class, gateway::getSchema).kind());
    assertEquals(0, keyValue.count("connect"));
  }

  @Test
  void switchAndRemoveDatabases() {
    StubEngine first = StubEngine.relational();
    StubEngine second = StubEngine.relational();
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("a", config(), first);
    gateway.addDatabase("b", config(), second);

    gateway.switchEngine("b");
    gateway.executeQuery("SELECT 1", List.of());
    assertEquals(0, first.count("query"));
    assertEquals(1, second.count("query"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR,
        assertThrows(DatabaseException.class, () -> gateway.switchEngine("zzz")).kind());
    assertEquals("b", gateway.activeDatabase());

    assertTrue(gateway.removeDatabase("b"));
    assertNull(gateway.activeDatabase());
    assertEquals(ErrorKind.CONFIGURATION_ERROR,
        assertThrows(DatabaseException.class, () -> gateway.executeQuery("SELECT 1", List.of())).kind());
  }

  @Test
  void noDatabaseIsConfigurationError() {
    gateway = DatabaseGateway.builder().build();

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> gateway.executeQuery("SELECT 1", List.of()));
    assertEquals(ErrorKind.CONFIGURATION_ERROR, e.kind());
  }

  @Test
  void repeatedBackendFailuresOpenTheCircuit() {
    StubEngine engine = StubEngine.relational();
    engine.failStatements(DatabaseException.queryFailed("relation does not exist", null));
    gateway = DatabaseGateway.builder()
        .circuitBreaker(new CircuitBreakerConfig(2, Duration.ofSeconds(60), 1))
        .build();
    gateway.addDatabase("main", config(), engine);

    for (int i = 0; i < 2; i++) {
      assertEquals(ErrorKind.QUERY_FAILED, assertThrows(DatabaseException.class,
          () -> gateway.executeQuery("SELECT 1", List.of())).kind());
    }
    DatabaseException e = assertThrows(DatabaseException.class,
        () -> gateway.executeQuery("SELECT 1", List.of()));

    assertEquals(ErrorKind.CIRCUIT_OPEN, e.kind());
    assertEquals(2, engine.count("query"));
  }

  @Test
  void emergencyShutdownRefusesEverything() {
    ResourceMonitor monitor = new ResourceMonitor();
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder().resourceMonitor(monitor).build();
    gateway.addDatabase("main", config(), engine);

    monitor.triggerEmergencyShutdown("operator request");

    assertEquals(ErrorKind.EMERGENCY_SHUTDOWN, assertThrows(DatabaseException.class,
        () -> gateway.executeQuery("SELECT 1", List.of())).kind());
    assertEquals(ErrorKind.EMERGENCY_SHUTDOWN, assertThrows(DatabaseException.class,
        () -> gateway.beginTransaction(IsolationLevel.READ_COMMITTED)).kind());
    assertEquals(0, engine.count("connect"));
  }

  @Test
  void slowQueryTimesOutAndItsConnectionIsDiscarded() throws Exception {
    StubEngine engine = StubEngine.relational().statementDelayMs(3_000);
    gateway = DatabaseGateway.builder()
        .timeouts(TimeoutConfig.builder().queryTimeout(Duration.ofMillis(150)).build())
        .build();
    gateway.addDatabase("main", config(), engine);

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> gateway.executeQuery("SELECT pg_sleep(3)", List.of()));

    assertEquals(ErrorKind.TIMEOUT, e.kind());
    assertEquals(1, gateway.poolManager().getPool("main").safety().circuitBreaker().consecutiveFailures());
    await(() -> engine.live() == 0);
    await(() -> gateway.safety().resourceMonitor().activeConnections() == 0);
  }

  @Test
  void timedOutTransactionIsAbandonedAndRolledBack() throws Exception {
    StubEngine engine = StubEngine.relational();
    gateway = DatabaseGateway.builder()
        .timeouts(TimeoutConfig.builder().queryTimeout(Duration.ofMillis(150)).build())
        .build();
    gateway.addDatabase("main", config(), engine);

    GatewayTransaction tx = gateway.beginTransaction(IsolationLevel.READ_COMMITTED);
    engine.statementDelayMs(3_000);

    assertEquals(ErrorKind.TIMEOUT, assertThrows(DatabaseException.class,
        () -> tx.execute("UPDATE items SET name = 'x'", List.of())).kind());
    assertTrue(tx.isAbandoned());
    assertEquals(ErrorKind.TRANSACTION_FAILED, assertThrows(DatabaseException.class, tx::commit).kind());

    await(() -> engine.live() == 0);
    assertTrue(engine.calls().contains("rollback on close"));
    assertEquals(0, engine.count("commit"));
    assertEquals(0, gateway.poolManager().getPool("main").status().total());
  }

  @Test
  void timedOutQueriesNeverLeakPoolSlots() throws Exception {
    StubEngine engine = StubEngine.relational().statementDelayMs(400);
    gateway = DatabaseGateway.builder()
        .timeouts(TimeoutConfig.builder().queryTimeout(Duration.ofMillis(100)).build())
        .circuitBreaker(new CircuitBreakerConfig(10, Duration.ofSeconds(60), 1))
        .build();
    gateway.addDatabase("main", config(), engine);

    for (int i = 0; i < 3; i++) {
      assertEquals(ErrorKind.TIMEOUT, assertThrows(DatabaseException.class,
          () -> gateway.executeQuery("SELECT pg_sleep(1)", List.of())).kind());
    }
    engine.statementDelayMs(0);

    assertEquals(Value.of(0L), gateway.executeQuery("SELECT 1", List.of()).cell(0, "params"));
    await(() -> gateway.poolManager().getPool("main").status().active() == 0);
    assertTrue(engine.maxLive() <= 2, "max live was " + engine.maxLive());
  }

  @Test
  void healthCheckCoversEveryDatabase() {
    gateway = DatabaseGateway.builder().build();
    gateway.addDatabase("a", config(), StubEngine.relational());
    gateway.addDatabase("b", config(), StubEngine.keyValue());

    assertEquals(2, gateway.healthCheck().size());
    assertTrue(gateway.healthCheck().values().stream().allMatch(h -> h.isHealthy()));
  }
}
