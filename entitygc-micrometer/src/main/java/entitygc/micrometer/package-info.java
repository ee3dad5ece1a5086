/**
 * Micrometer bridge for exporting sweep metrics to Prometheus, Grafana, and other backends.
 *
 * @see entitygc.micrometer.MicrometerMetricsExporter
 */
package entitygc.micrometer;
