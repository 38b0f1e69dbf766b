package dbgate.model;

/**
 * Optional behaviors a backend may declare. The core consults the declared set before
 * attempting an operation and never special-cases a backend by name.
 */
public enum DatabaseFeature {
  TRANSACTIONS,
  SAVEPOINTS,
  PREPARED_STATEMENTS,
  SCHEMA_INTROSPECTION,
  /** Grouped commands applied all-or-nothing, without isolation or partial rollback. */
  ATOMIC_BATCH,
  STORED_PROCEDURES,
  JSON_SUPPORT,
  FULL_TEXT_SEARCH,
  REPLICATION,
  SHARDING,
  DOCUMENT_STORE,
  ACID,
  EVENTUAL_CONSISTENCY
}
