/**
 * Small shared helpers.
 */
package dbgate.util;
