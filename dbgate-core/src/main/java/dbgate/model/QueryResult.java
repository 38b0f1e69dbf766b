package dbgate.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Rows returned by a query, each an ordered list of values aligned with {@link #columns()}.
 *
 * @param totalRows empty when the backend cannot report the count cheaply
 */
public record QueryResult(
    List<ColumnInfo> columns,
    List<List<Value>> rows,
    OptionalLong totalRows,
    Duration latency) {

  public QueryResult {
    columns = List.copyOf(columns);
    rows = rows.stream().map(List::copyOf).toList();
    Objects.requireNonNull(totalRows, "totalRows");
    Objects.requireNonNull(latency, "latency");
    for (List<Value> row : rows) {
      if (row.size() != columns.size()) {
        throw new IllegalArgumentException(
            "row has " + row.size() + " cells, expected " + columns.size());
      }
    }
  }

  public int rowCount() {
    return rows.size();
  }

  public Value cell(int row, String column) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equalsIgnoreCase(column)) {
        return rows.get(row).get(i);
      }
    }
    throw new IllegalArgumentException("Unknown column: " + column);
  }

  public QueryResult withLatency(Duration latency) {
    return new QueryResult(columns, rows, totalRows, latency);
  }
}
