package dbgate.jdbc;

import dbgate.error.DatabaseException;
import dbgate.jdbc.dialect.JdbcDialect;
import dbgate.model.ColumnInfo;
import dbgate.model.Value;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves {@link Value}s across the JDBC boundary.
 *
 * <p>Timestamps without a zone are read and written in the JVM default zone, so a value written
 * through this class reads back as the same instant.
 */
final class JdbcValues {

  private JdbcValues() {
  }

  static void bind(JdbcDialect dialect, PreparedStatement ps, List<Value> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      bind(dialect, ps, i + 1, params.get(i));
    }
  }

  private static void bind(JdbcDialect dialect, PreparedStatement ps, int index, Value value)
      throws SQLException {
    if (value == null || value instanceof Value.Null) {
      ps.setNull(index, Types.NULL);
    } else if (value instanceof Value.Bool b) {
      ps.setBoolean(index, b.value());
    } else if (value instanceof Value.Int64 n) {
      ps.setLong(index, n.value());
    } else if (value instanceof Value.Float64 d) {
      ps.setDouble(index, d.value());
    } else if (value instanceof Value.Text t) {
      ps.setString(index, t.value());
    } else if (value instanceof Value.Binary bin) {
      ps.setBytes(index, bin.value());
    } else if (value instanceof Value.Json json) {
      dialect.bindJson(ps, index, json.text());
    } else if (value instanceof Value.DateTime dt) {
      ps.setTimestamp(index, Timestamp.from(dt.value()));
    } else {
      throw DatabaseException.conversion("cannot bind " + value);
    }
  }

  static List<ColumnInfo> columns(ResultSetMetaData meta) throws SQLException {
    List<ColumnInfo> columns = new ArrayList<>(meta.getColumnCount());
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      columns.add(new ColumnInfo(meta.getColumnLabel(i), meta.getColumnTypeName(i),
          meta.isNullable(i) != ResultSetMetaData.columnNoNulls));
    }
    return columns;
  }

  static List<List<Value>> rows(JdbcDialect dialect, ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<List<Value>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Value> row = new ArrayList<>(count);
      for (int i = 1; i <= count; i++) {
        row.add(read(dialect, rs, i, meta.getColumnType(i), meta.getColumnTypeName(i)));
      }
      rows.add(row);
    }
    return rows;
  }

  static Value read(JdbcDialect dialect, ResultSet rs, int col, int sqlType, String typeName)
      throws SQLException {
    if (typeName != null && dialect.isJsonType(typeName)) {
      return Value.json(rs.getString(col));
    }
    switch (sqlType) {
      case Types.BOOLEAN:
      case Types.BIT: {
        boolean b = rs.getBoolean(col);
        return rs.wasNull() ? Value.NULL : Value.of(b);
      }
      case Types.TINYINT:
      case Types.SMALLINT:
      case Types.INTEGER:
      case Types.BIGINT: {
        long n = rs.getLong(col);
        return rs.wasNull() ? Value.NULL : Value.of(n);
      }
      case Types.REAL:
      case Types.FLOAT:
      case Types.DOUBLE: {
        double d = rs.getDouble(col);
        return rs.wasNull() ? Value.NULL : Value.of(d);
      }
      case Types.DECIMAL:
      case Types.NUMERIC:
        return Value.fromDecimal(rs.getBigDecimal(col));
      case Types.CHAR:
      case Types.VARCHAR:
      case Types.LONGVARCHAR:
      case Types.NCHAR:
      case Types.NVARCHAR:
      case Types.LONGNVARCHAR:
      case Types.CLOB:
      case Types.NCLOB:
      case Types.TIME:
      case Types.OTHER:
        return Value.of(rs.getString(col));
      case Types.BINARY:
      case Types.VARBINARY:
      case Types.LONGVARBINARY:
      case Types.BLOB:
        return Value.of(rs.getBytes(col));
      case Types.TIMESTAMP: {
        Timestamp ts = rs.getTimestamp(col);
        return ts == null ? Value.NULL : Value.of(ts.toInstant());
      }
      case Types.TIMESTAMP_WITH_TIMEZONE: {
        OffsetDateTime odt = rs.getObject(col, OffsetDateTime.class);
        return odt == null ? Value.NULL : Value.of(odt.toInstant());
      }
      case Types.DATE: {
        Date date = rs.getDate(col);
        return date == null ? Value.NULL : Value.of(Instant.ofEpochMilli(date.getTime()));
      }
      default:
        return Value.from(rs.getObject(col));
    }
  }
}
