package dbgate.model;

import java.util.List;
import java.util.Objects;

public record TableInfo(String name, String schema, List<ColumnInfo> columns, List<String> primaryKeys) {
  public TableInfo {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    primaryKeys = List.copyOf(primaryKeys);
  }
}
