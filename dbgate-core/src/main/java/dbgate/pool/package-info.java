/**
 * Connection pooling: bounded per-engine pools and the manager that keys them by engine id.
 */
package dbgate.pool;
