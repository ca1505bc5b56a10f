package io.geostream.spi;

import io.geostream.StreamListener;

/**
 * An open subscription returned by {@link FeedSource#connect}.
 *
 * <p>{@link #deliver} is called from exactly one thread. {@link #close} may be called from
 * any thread to abort a blocked {@code deliver}.
 */
public interface FeedConnection extends AutoCloseable {

    /**
     * Reads the stream and pushes every decoded event to the listener until the stream ends.
     *
     * <p>Returns normally when the remote side closes the stream cleanly or when
     * {@link #close()} is called. Exceptions thrown by the listener must not escape this method:
     * implementations route them to {@link StreamListener#onError}.
     *
     * @param listener the delivery callback
     * @throws io.geostream.stream.SubscriptionException if the stream fails or is disconnected
     */
    void deliver(StreamListener listener);

    /**
     * Aborts the subscription and releases the underlying transport. Idempotent.
     */
    @Override
    void close();
}
