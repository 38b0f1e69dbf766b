package dbgate.spi;

import dbgate.model.ExecuteResult;
import dbgate.model.Value;

import java.util.List;

/**
 * Grouped commands applied all-or-nothing when executed.
 *
 * <p>This is the atomic primitive of backends without transactions. It has no isolation
 * level, no savepoints and no partial rollback: queued commands are either all applied by
 * {@link #exec()} or all thrown away by {@link #discard()}.
 */
public interface CommandBatch {

    void queue(String command, List<Value> params);

    /**
     * Applies every queued command atomically.
     *
     * @return one result per queued command, in queue order
     */
    List<ExecuteResult> exec();

    void discard();
}
