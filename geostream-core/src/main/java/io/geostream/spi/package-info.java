/**
 * Service provider interfaces for the external collaborators: the feed
 * ({@link io.geostream.spi.FeedSource}), the archive
 * ({@link io.geostream.spi.ArchiveStore}) and metrics
 * ({@link io.geostream.spi.MetricsExporter}).
 */
package io.geostream.spi;
