package dbgate.model;

import java.util.Locale;

/**
 * Coarse statement category derived from the leading keyword.
 */
public enum QueryType {
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  CREATE,
  DROP,
  ALTER,
  TRUNCATE,
  OTHER;

  public static QueryType classify(String statement) {
    if (statement == null) {
      return OTHER;
    }
    String trimmed = statement.stripLeading();
    int end = 0;
    while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
      end++;
    }
    String keyword = trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    switch (keyword) {
      case "SELECT":
      case "WITH":
      case "SHOW":
      case "EXPLAIN":
        return SELECT;
      case "INSERT":
        return INSERT;
      case "UPDATE":
        return UPDATE;
      case "DELETE":
        return DELETE;
      case "CREATE":
        return CREATE;
      case "DROP":
        return DROP;
      case "ALTER":
        return ALTER;
      case "TRUNCATE":
        return TRUNCATE;
      default:
        return OTHER;
    }
  }
}
