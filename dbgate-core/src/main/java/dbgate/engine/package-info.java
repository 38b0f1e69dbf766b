/**
 * Engine discovery: factories registered through {@link java.util.ServiceLoader}.
 */
package dbgate.engine;
