package dbgate.model;

import java.util.Objects;

/**
 * Column descriptor of a result set or table.
 *
 * @param name         column name as reported by the backend
 * @param declaredType backend type name
 * @param nullable     whether the column accepts nulls
 */
public record ColumnInfo(String name, String declaredType, boolean nullable) {
  public ColumnInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(declaredType, "declaredType");
  }
}
