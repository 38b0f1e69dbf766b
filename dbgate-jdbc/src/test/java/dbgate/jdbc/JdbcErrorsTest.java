package dbgate.jdbc;

import dbgate.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcErrorsTest {

  @Test
  void connectionStatesMapToConnectionFailed() {
    assertEquals(ErrorKind.CONNECTION_FAILED,
        JdbcErrors.translate("query", new SQLException("gone", "08006")).kind());
    assertEquals(ErrorKind.CONNECTION_FAILED,
        JdbcErrors.translate("query", new SQLTransientConnectionException("pool empty")).kind());
  }

  @Test
  void timeoutsMapToTimeout() {
    assertEquals(ErrorKind.TIMEOUT,
        JdbcErrors.translate("query", new SQLTimeoutException("slow", "57014")).kind());
  }

  @Test
  void rollbackStatesMapToTransactionFailed() {
    assertEquals(ErrorKind.TRANSACTION_FAILED,
        JdbcErrors.translate("commit", new SQLException("serialization failure", "40001")).kind());
  }

  @Test
  void everythingElseIsQueryFailed() {
    SQLException cause = new SQLException("syntax", "42601");

    var e = JdbcErrors.translate("query failed", cause);

    assertEquals(ErrorKind.QUERY_FAILED, e.kind());
    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().contains("query failed"));
    assertEquals(ErrorKind.QUERY_FAILED, JdbcErrors.translate("query", new SQLException("no state")).kind());
  }
}
