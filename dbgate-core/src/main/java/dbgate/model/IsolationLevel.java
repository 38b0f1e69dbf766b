package dbgate.model;

public enum IsolationLevel {
  READ_UNCOMMITTED("READ UNCOMMITTED"),
  READ_COMMITTED("READ COMMITTED"),
  REPEATABLE_READ("REPEATABLE READ"),
  SERIALIZABLE("SERIALIZABLE");

  private final String sql;

  IsolationLevel(String sql) {
    this.sql = sql;
  }

  /** The level as written in SQL {@code SET TRANSACTION ISOLATION LEVEL} clauses. */
  public String sql() {
    return sql;
  }
}
