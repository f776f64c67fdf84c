/**
 * Micrometer integration: exports dispatcher counters, gauges and timings.
 *
 * @see io.dispatcher.micrometer.MicrometerMetricsExporter
 */
package io.dispatcher.micrometer;
