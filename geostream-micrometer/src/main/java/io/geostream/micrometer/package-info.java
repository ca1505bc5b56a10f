/**
 * Micrometer bridge for {@link io.geostream.spi.MetricsExporter}.
 */
package io.geostream.micrometer;
