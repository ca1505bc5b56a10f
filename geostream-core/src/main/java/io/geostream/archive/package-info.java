/**
 * Handoff of staged files to durable object storage.
 *
 * <p>{@link io.geostream.archive.ArchiveUploader} wraps one shared
 * {@link io.geostream.spi.ArchiveStore}, derives keys with an
 * {@link io.geostream.archive.ArchiveKeyStrategy} and bounds each upload with a timeout.
 */
package io.geostream.archive;
