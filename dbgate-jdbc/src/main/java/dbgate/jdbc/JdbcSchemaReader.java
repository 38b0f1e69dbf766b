package dbgate.jdbc;

import dbgate.model.ColumnInfo;
import dbgate.model.DatabaseSchema;
import dbgate.model.TableInfo;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads tables, columns, primary keys and views of the connection's current catalog and schema
 * from {@link DatabaseMetaData}.
 */
final class JdbcSchemaReader {
  // H2 2.x reports base tables as "BASE TABLE"
  private static final String[] TABLES = {"TABLE", "BASE TABLE"};
  private static final String[] VIEWS = {"VIEW"};

  private final Connection connection;

  JdbcSchemaReader(Connection connection) {
    this.connection = connection;
  }

  DatabaseSchema read() throws SQLException {
    DatabaseMetaData meta = connection.getMetaData();
    String catalog = connection.getCatalog();
    String schema = connection.getSchema();

    List<TableInfo> tables = new ArrayList<>();
    for (String name : names(meta, catalog, schema, "%", TABLES)) {
      tables.add(table(meta, catalog, schema, name));
    }
    List<String> views = names(meta, catalog, schema, "%", VIEWS);
    return new DatabaseSchema(catalog != null ? catalog : schema, tables, views);
  }

  /**
   * Looks a table up by name. Unquoted identifiers are stored upper- or lower-case depending on
   * the database, so the name is tried as given and then in the stored case.
   */
  Optional<TableInfo> readTable(String table) throws SQLException {
    DatabaseMetaData meta = connection.getMetaData();
    String catalog = connection.getCatalog();
    String schema = connection.getSchema();

    List<String> candidates = new ArrayList<>();
    candidates.add(table);
    if (meta.storesUpperCaseIdentifiers()) {
      candidates.add(table.toUpperCase(Locale.ROOT));
    } else if (meta.storesLowerCaseIdentifiers()) {
      candidates.add(table.toLowerCase(Locale.ROOT));
    }
    for (String candidate : candidates) {
      List<String> found = names(meta, catalog, schema, escape(meta, candidate), TABLES);
      if (!found.isEmpty()) {
        return Optional.of(table(meta, catalog, schema, found.get(0)));
      }
    }
    return Optional.empty();
  }

  private static List<String> names(DatabaseMetaData meta, String catalog, String schema,
      String pattern, String[] types) throws SQLException {
    List<String> names = new ArrayList<>();
    try (ResultSet rs = meta.getTables(catalog, schema, pattern, types)) {
      while (rs.next()) {
        names.add(rs.getString("TABLE_NAME"));
      }
    }
    return names;
  }

  private static TableInfo table(DatabaseMetaData meta, String catalog, String schema, String table)
      throws SQLException {
    List<ColumnInfo> columns = new ArrayList<>();
    try (ResultSet rs = meta.getColumns(catalog, schema, escape(meta, table), "%")) {
      while (rs.next()) {
        columns.add(new ColumnInfo(
            rs.getString("COLUMN_NAME"),
            rs.getString("TYPE_NAME"),
            rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls));
      }
    }

    // ordered by KEY_SEQ, the driver orders by column name
    Map<Short, String> keys = new TreeMap<>();
    try (ResultSet rs = meta.getPrimaryKeys(catalog, schema, table)) {
      while (rs.next()) {
        keys.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
      }
    }
    return new TableInfo(table, schema, columns, List.copyOf(keys.values()));
  }

  private static String escape(DatabaseMetaData meta, String name) throws SQLException {
    String escape = meta.getSearchStringEscape();
    if (escape == null || escape.isEmpty()) {
      return name;
    }
    return name.replace(escape, escape + escape)
        .replace("_", escape + "_")
        .replace("%", escape + "%");
  }
}
