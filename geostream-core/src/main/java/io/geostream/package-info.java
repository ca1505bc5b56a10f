/**
 * Geo-tagged post archiving worker.
 *
 * <p>{@link io.geostream.GeoStream} is the entry point: it subscribes to a
 * {@link io.geostream.spi.FeedSource}, keeps events that carry a geo signal and archives
 * each one as an individual JSON record in an {@link io.geostream.spi.ArchiveStore}.
 */
package io.geostream;
