/**
 * Error taxonomy shared by every layer: a single unchecked {@link dbgate.error.DatabaseException}
 * tagged with an {@link dbgate.error.ErrorKind}.
 */
package dbgate.error;
