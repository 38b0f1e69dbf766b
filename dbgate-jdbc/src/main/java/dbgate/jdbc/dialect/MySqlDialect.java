package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.model.DatabaseFeature;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Locale;

/**
 * MySQL dialect. Also compatible with MariaDB.
 */
public final class MySqlDialect extends AbstractJdbcDialect {

  public MySqlDialect() {
    super(DatabaseFeature.JSON_SUPPORT, DatabaseFeature.FULL_TEXT_SEARCH,
        DatabaseFeature.STORED_PROCEDURES, DatabaseFeature.REPLICATION);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public List<String> productNames() {
    return List.of("MySQL", "MariaDB");
  }

  @Override
  public String versionSql() {
    return "SELECT VERSION()";
  }

  @Override
  public String url(ConnectionConfig config) {
    String url = networkUrl("jdbc:mysql:", config, 3306);
    String sslMode = sslMode(config.sslMode());
    return sslMode == null ? url : url + "?sslMode=" + sslMode;
  }

  /**
   * Connector/J reports no parameter metadata for client-side prepared statements, so markers
   * are counted in the text, skipping quoted strings, quoted identifiers, line comments
   * ({@code #} and {@code -- }) and block comments.
   */
  @Override
  public int parameterCount(PreparedStatement ps, String sql) {
    int count = 0;
    int length = sql.length();
    int i = 0;
    while (i < length) {
      char c = sql.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        i = skipQuoted(sql, i, c);
      } else if (c == '#' || isDashComment(sql, i)) {
        int eol = sql.indexOf('\n', i);
        i = eol < 0 ? length : eol + 1;
      } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        i = close < 0 ? length : close + 2;
      } else {
        if (c == '?') {
          count++;
        }
        i++;
      }
    }
    return count;
  }

  // MySQL needs whitespace after "--" for it to start a comment
  private static boolean isDashComment(String sql, int i) {
    if (sql.charAt(i) != '-' || i + 1 >= sql.length() || sql.charAt(i + 1) != '-') {
      return false;
    }
    return i + 2 == sql.length() || Character.isWhitespace(sql.charAt(i + 2));
  }

  /** Returns the index just past the literal or identifier opened at {@code start}. */
  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\\' && quote != '`') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        i++;
      }
    }
    return sql.length();
  }

  // Connector/J spells the libpq modes differently
  private static String sslMode(String mode) {
    if (mode == null) {
      return null;
    }
    switch (mode.toLowerCase(Locale.ROOT)) {
      case "disable":
        return "DISABLED";
      case "prefer":
        return "PREFERRED";
      case "require":
        return "REQUIRED";
      case "verify-ca":
        return "VERIFY_CA";
      case "verify-full":
        return "VERIFY_IDENTITY";
      default:
        return mode;
    }
  }
}
