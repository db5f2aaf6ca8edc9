/**
 * Micrometer integration for feed relay metrics.
 *
 * @see io.feedrelay.micrometer.MicrometerMetricsExporter
 */
package io.feedrelay.micrometer;
