package dbgate.spi;

import dbgate.error.DatabaseException;
import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.Value;

import java.util.List;

/**
 * Backend side of an open transaction.
 *
 * <p>Adapters only perform the I/O. State tracking, single-use enforcement and savepoint
 * bookkeeping live in {@link dbgate.tx.ManagedTransaction}, which guarantees each method
 * here is called at most once per terminal transition.
 */
public interface DatabaseTransaction {

    QueryResult query(String statement, List<Value> params);

    ExecuteResult execute(String statement, List<Value> params);

    default void savepoint(String name) {
        throw DatabaseException.unsupported("savepoints are not supported");
    }

    default void rollbackToSavepoint(String name) {
        throw DatabaseException.unsupported("savepoints are not supported");
    }

    default void releaseSavepoint(String name) {
        throw DatabaseException.unsupported("savepoints are not supported");
    }

    void commit();

    void rollback();
}
