package dbgate.spi;

import dbgate.model.ExecuteResult;
import dbgate.model.QueryResult;
import dbgate.model.Value;

import java.util.List;

/**
 * A statement compiled once by the backend and executed with positional parameters.
 */
public interface DatabasePreparedStatement extends AutoCloseable {

    String statement();

    int parameterCount();

    QueryResult query(List<Value> params);

    ExecuteResult execute(List<Value> params);

    @Override
    void close();
}
