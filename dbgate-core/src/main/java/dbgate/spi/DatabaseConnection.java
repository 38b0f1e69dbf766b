package dbgate.spi;

import dbgate.error.DatabaseException;
import dbgate.model.ConnectionInfo;
import dbgate.model.DatabaseSchema;
import dbgate.model.ExecuteResult;
import dbgate.model.IsolationLevel;
import dbgate.model.QueryResult;
import dbgate.model.TableInfo;
import dbgate.model.Value;

import java.util.List;

/**
 * One live session against a backend, used by one caller at a time.
 *
 * <p>Adapters implement this directly. Callers never see it: the pool hands out a
 * {@link dbgate.pool.PooledConnection} that checks capabilities before delegating here.
 * Implementations must not retry internally.
 */
public interface DatabaseConnection {

    QueryResult query(String statement, List<Value> params);

    ExecuteResult execute(String statement, List<Value> params);

    /**
     * Starts a backend transaction. Only called when the engine declares
     * {@link dbgate.model.DatabaseFeature#TRANSACTIONS}.
     */
    DatabaseTransaction beginTransaction(IsolationLevel isolationLevel, boolean readOnly);

    /**
     * Prepares a statement. Only called when the engine declares
     * {@link dbgate.model.DatabaseFeature#PREPARED_STATEMENTS}.
     */
    DatabasePreparedStatement prepare(String statement);

    /**
     * Starts an atomic command group. Only called when the engine declares
     * {@link dbgate.model.DatabaseFeature#ATOMIC_BATCH}.
     */
    default CommandBatch beginBatch() {
        throw DatabaseException.unsupported("atomic batches are not supported");
    }

    DatabaseSchema schema();

    default TableInfo tableSchema(String table) {
        return schema().table(table)
            .orElseThrow(() -> DatabaseException.validation("table not found: " + table));
    }

    /**
     * Cheap liveness check.
     *
     * @return {@code false} when the connection is no longer usable
     */
    boolean ping();

    ConnectionInfo info();

    boolean isClosed();

    /**
     * Physically closes the session. Idempotent.
     */
    void close();
}
