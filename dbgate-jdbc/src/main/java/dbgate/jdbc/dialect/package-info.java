/**
 * SQL dialects of the JDBC engine and their {@link java.util.ServiceLoader} registry.
 */
package dbgate.jdbc.dialect;
