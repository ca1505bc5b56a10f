/**
 * Subscription lifecycle: connect, deliver, reconnect with backoff.
 *
 * <p>{@link io.geostream.stream.StreamSupervisor} drives a
 * {@link io.geostream.spi.FeedSource}; {@link io.geostream.stream.RetryPolicy} decides how
 * long to wait between attempts.
 */
package io.geostream.stream;
