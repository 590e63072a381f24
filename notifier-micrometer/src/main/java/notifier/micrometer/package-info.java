/**
 * Micrometer bridge for notifier metrics.
 *
 * @see notifier.micrometer.MicrometerMetricsExporter
 */
package notifier.micrometer;
