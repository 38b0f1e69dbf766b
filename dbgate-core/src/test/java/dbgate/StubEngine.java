package dbgate;

import dbgate.config.ConnectionConfig;
import dbgate.error.DatabaseException;
import dbgate.model.ColumnInfo;
import dbgate.model.ConnectionInfo;
import dbgate.model.DatabaseFeature;
import dbgate.model.DatabaseSchema;
import dbgate.model.ExecuteResult;
import dbgate.model.HealthStatus;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.TableInfo;
import dbgate.model.Value;
import dbgate.spi.CommandBatch;
import dbgate.spi.DatabaseConnection;
import dbgate.spi.DatabaseEngine;
import dbgate.spi.DatabasePreparedStatement;
import dbgate.spi.DatabaseTransaction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory engine that records every backend call and counts live connections.
 */
public final class StubEngine implements DatabaseEngine {
  private final Set<DatabaseFeature> features;
  private final List<String> calls = new CopyOnWriteArrayList<>();
  private final AtomicInteger live = new AtomicInteger();
  private final AtomicInteger maxLive = new AtomicInteger();
  private final AtomicInteger opened = new AtomicInteger();
  private final Map<String, String> store = new ConcurrentHashMap<>();

  private volatile boolean failConnect;
  private volatile RuntimeException statementFailure;
  private volatile RuntimeException commitFailure;
  private volatile long statementDelayMs;
  private volatile long connectDelayMs;
  private volatile boolean pingResult = true;
  private volatile HealthStatus health = HealthStatus.healthy(Duration.ofMillis(1));

  public StubEngine(Set<DatabaseFeature> features) {
    this.features = Set.copyOf(features);
  }

  /** Transactions, savepoints, prepared statements and schema introspection. */
  public static StubEngine relational() {
    return new StubEngine(EnumSet.of(DatabaseFeature.TRANSACTIONS, DatabaseFeature.SAVEPOINTS,
        DatabaseFeature.PREPARED_STATEMENTS, DatabaseFeature.SCHEMA_INTROSPECTION, DatabaseFeature.ACID));
  }

  /** Transactions without savepoints. */
  public static StubEngine document() {
    return new StubEngine(EnumSet.of(DatabaseFeature.TRANSACTIONS, DatabaseFeature.DOCUMENT_STORE));
  }

  /** Atomic batches only, no transactions. */
  public static StubEngine keyValue() {
    return new StubEngine(EnumSet.of(DatabaseFeature.ATOMIC_BATCH, DatabaseFeature.EVENTUAL_CONSISTENCY));
  }

  @Override
  public String type() {
    return "stub";
  }

  @Override
  public DatabaseConnection connect(ConnectionConfig config) {
    calls.add("connect");
    if (failConnect) {
      throw DatabaseException.connectionFailed("stub refused connection", null);
    }
    if (connectDelayMs > 0) {
      sleepUninterruptibly(connectDelayMs);
    }
    int now = live.incrementAndGet();
    maxLive.accumulateAndGet(now, Math::max);
    opened.incrementAndGet();
    return new StubConnection();
  }

  @Override
  public HealthStatus healthCheck() {
    calls.add("health");
    return health;
  }

  @Override
  public Set<DatabaseFeature> supportedFeatures() {
    return features;
  }

  public List<String> calls() {
    return List.copyOf(calls);
  }

  public long count(String prefix) {
    return calls.stream().filter(c -> c.startsWith(prefix)).count();
  }

  public int live() {
    return live.get();
  }

  public int maxLive() {
    return maxLive.get();
  }

  public int opened() {
    return opened.get();
  }

  public Map<String, String> store() {
    return store;
  }

  public StubEngine failConnect(boolean failConnect) {
    this.failConnect = failConnect;
    return this;
  }

  public StubEngine failStatements(RuntimeException failure) {
    this.statementFailure = failure;
    return this;
  }

  public StubEngine failCommit(RuntimeException failure) {
    this.commitFailure = failure;
    return this;
  }

  public StubEngine statementDelayMs(long statementDelayMs) {
    this.statementDelayMs = statementDelayMs;
    return this;
  }

  public StubEngine connectDelayMs(long connectDelayMs) {
    this.connectDelayMs = connectDelayMs;
    return this;
  }

  public StubEngine pingResult(boolean pingResult) {
    this.pingResult = pingResult;
    return this;
  }

  public StubEngine health(HealthStatus health) {
    this.health = health;
    return this;
  }

  private void statement(String call) {
    calls.add(call);
    if (statementDelayMs > 0) {
      try {
        Thread.sleep(statementDelayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw DatabaseException.queryFailed("interrupted", e);
      }
    }
    RuntimeException failure = statementFailure;
    if (failure != null) {
      throw failure;
    }
  }

  /** Like a driver stuck in a socket connect: interrupts are noticed only afterwards. */
  private static void sleepUninterruptibly(long millis) {
    long deadline = System.nanoTime() + millis * 1_000_000L;
    boolean interrupted = false;
    long remaining;
    while ((remaining = deadline - System.nanoTime()) > 0) {
      try {
        Thread.sleep(Math.max(1L, remaining / 1_000_000L));
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static QueryResult countResult(List<Value> params) {
    return new QueryResult(List.of(new ColumnInfo("params", "BIGINT", false)),
        List.of(List.of(Value.of((long) params.size()))), OptionalLong.of(1), Duration.ZERO);
  }

  final class StubConnection implements DatabaseConnection {
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile StubTransaction open;

    @Override
    public QueryResult query(String statement, List<Value> params) {
      statement("query " + statement);
      return countResult(params);
    }

    @Override
    public ExecuteResult execute(String statement, List<Value> params) {
      statement("execute " + statement);
      return ExecuteResult.of(1, Duration.ZERO);
    }

    @Override
    public DatabaseTransaction beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
      calls.add("begin " + isolationLevel);
      StubTransaction tx = new StubTransaction(this);
      open = tx;
      return tx;
    }

    @Override
    public DatabasePreparedStatement prepare(String statement) {
      calls.add("prepare " + statement);
      return new StubPreparedStatement(statement);
    }

    @Override
    public CommandBatch beginBatch() {
      calls.add("batch");
      return new StubBatch();
    }

    @Override
    public DatabaseSchema schema() {
      calls.add("schema");
      TableInfo items = new TableInfo("items", "public",
          List.of(new ColumnInfo("id", "BIGINT", false), new ColumnInfo("name", "VARCHAR", true)),
          List.of("id"));
      return new DatabaseSchema("stub", List.of(items), List.of());
    }

    @Override
    public boolean ping() {
      calls.add("ping");
      return pingResult && !closed.get();
    }

    @Override
    public ConnectionInfo info() {
      return new ConnectionInfo("stub", "stub", "stub", "1.0", Instant.EPOCH, Instant.EPOCH);
    }

    @Override
    public boolean isClosed() {
      return closed.get();
    }

    @Override
    public void close() {
      if (closed.compareAndSet(false, true)) {
        if (open != null) {
          open = null;
          calls.add("rollback on close");
        }
        live.decrementAndGet();
        calls.add("close");
      }
    }
  }

  final class StubTransaction implements DatabaseTransaction {
    private final StubConnection connection;

    StubTransaction(StubConnection connection) {
      this.connection = connection;
    }

    @Override
    public QueryResult query(String statement, List<Value> params) {
      statement("tx query " + statement);
      return countResult(params);
    }

    @Override
    public ExecuteResult execute(String statement, List<Value> params) {
      statement("tx execute " + statement);
      return ExecuteResult.of(1, Duration.ZERO);
    }

    @Override
    public void savepoint(String name) {
      calls.add("savepoint " + name);
    }

    @Override
    public void rollbackToSavepoint(String name) {
      calls.add("rollback to " + name);
    }

    @Override
    public void releaseSavepoint(String name) {
      calls.add("release " + name);
    }

    @Override
    public void commit() {
      calls.add("commit");
      connection.open = null;
      RuntimeException failure = commitFailure;
      if (failure != null) {
        throw failure;
      }
    }

    @Override
    public void rollback() {
      calls.add("rollback");
      connection.open = null;
    }
  }

  final class StubPreparedStatement implements DatabasePreparedStatement {
    private final String statement;
    private final int parameterCount;

    StubPreparedStatement(String statement) {
      this.statement = statement;
      this.parameterCount = (int) statement.chars().filter(c -> c == '?').count();
    }

    @Override
    public String statement() {
      return statement;
    }

    @Override
    public int parameterCount() {
      return parameterCount;
    }

    @Override
    public QueryResult query(List<Value> params) {
      StubEngine.this.statement("prepared query " + statement);
      return countResult(params);
    }

    @Override
    public ExecuteResult execute(List<Value> params) {
      StubEngine.this.statement("prepared execute " + statement);
      return ExecuteResult.of(1, Duration.ZERO);
    }

    @Override
    public void close() {
      calls.add("prepared close");
    }
  }

  /** Understands {@code SET key} with one text parameter. */
  final class StubBatch implements CommandBatch {
    private final List<String[]> queued = new ArrayList<>();

    @Override
    public void queue(String command, List<Value> params) {
      calls.add("queue " + command);
      String key = command.startsWith("SET ") ? command.substring(4) : command;
      queued.add(new String[] {key, params.isEmpty() ? "" : String.valueOf(params.get(0).toJava())});
    }

    @Override
    public List<ExecuteResult> exec() {
      calls.add("exec");
      List<ExecuteResult> results = new ArrayList<>();
      for (String[] kv : queued) {
        store.put(kv[0], kv[1]);
        results.add(ExecuteResult.of(1, Duration.ZERO));
      }
      return results;
    }

    @Override
    public void discard() {
      calls.add("discard");
      queued.clear();
    }
  }
}
