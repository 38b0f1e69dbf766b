package dbgate.jdbc;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps driver exceptions onto {@link DatabaseException} kinds by SQLState class.
 */
final class JdbcErrors {

  private JdbcErrors() {
  }

  static DatabaseException translate(String action, SQLException e) {
    String message = action + ": " + e.getMessage();
    if (e instanceof SQLTimeoutException) {
      return new DatabaseException(ErrorKind.TIMEOUT, message, e);
    }
    String state = e.getSQLState();
    if (e instanceof SQLTransientConnectionException || hasClass(state, "08")) {
      return DatabaseException.connectionFailed(message, e);
    }
    if (hasClass(state, "40")) {
      return DatabaseException.transactionFailed(message, e);
    }
    return DatabaseException.queryFailed(message, e);
  }

  private static boolean hasClass(String sqlState, String stateClass) {
    return sqlState != null && sqlState.startsWith(stateClass);
  }
}
