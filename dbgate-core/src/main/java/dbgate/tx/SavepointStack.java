package dbgate.tx;

import dbgate.error.DatabaseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Open savepoint names of one transaction, oldest first. Names are unique.
 */
final class SavepointStack {
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private final List<String> names = new ArrayList<>();

  static void validateName(String name) {
    if (name == null || !NAME.matcher(name).matches()) {
      throw DatabaseException.validation("invalid savepoint name: " + name);
    }
  }

  boolean contains(String name) {
    return names.contains(name);
  }

  void push(String name) {
    names.add(name);
  }

  /** Removes {@code name} and every savepoint opened after it. */
  void truncateFrom(String name) {
    int index = names.indexOf(name);
    if (index >= 0) {
      names.subList(index, names.size()).clear();
    }
  }

  /** Removes exactly {@code name}. */
  void remove(String name) {
    names.remove(name);
  }

  void clear() {
    names.clear();
  }

  List<String> snapshot() {
    return List.copyOf(names);
  }
}
