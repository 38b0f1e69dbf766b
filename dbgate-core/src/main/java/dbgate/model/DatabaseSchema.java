package dbgate.model;

import java.util.List;
import java.util.Optional;

public record DatabaseSchema(String databaseName, List<TableInfo> tables, List<String> views) {
  public DatabaseSchema {
    tables = List.copyOf(tables);
    views = List.copyOf(views);
  }

  public Optional<TableInfo> table(String name) {
    return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
  }
}
