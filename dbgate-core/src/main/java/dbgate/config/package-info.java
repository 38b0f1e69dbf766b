/**
 * Immutable configuration objects, validated on construction.
 *
 * <p>Invalid values raise {@link dbgate.error.DatabaseException} with
 * {@link dbgate.error.ErrorKind#CONFIGURATION_ERROR}.
 */
package dbgate.config;
