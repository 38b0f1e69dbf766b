/**
 * Transaction, savepoint and batch orchestration over adapter handles.
 *
 * <p>These types enforce single use, savepoint stack discipline and capability checks so that
 * adapters only perform I/O.
 */
package dbgate.tx;
