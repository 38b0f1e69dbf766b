/**
 * Micrometer bridge for the gateway's pool and safety-layer metrics.
 *
 * @see dbgate.micrometer.MicrometerMetricsExporter
 */
package dbgate.micrometer;
