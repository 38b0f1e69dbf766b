/**
 * Backend-neutral data model: values, capability flags, result sets and descriptors.
 */
package dbgate.model;
