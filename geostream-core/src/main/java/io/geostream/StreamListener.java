package io.geostream;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivery callback registered with a {@link io.geostream.stream.StreamSupervisor}.
 *
 * <p>The supervisor only knows this interface. {@link #onEvent} is invoked once per
 * decoded event on the supervisor's delivery thread; {@link #onError} receives
 * exceptions surfaced by the transport or by {@code onEvent} itself.
 *
 * <h2>Execution Model</h2>
 * <p>Listeners run <b>synchronously</b>: the next event is not read from the stream until
 * {@code onEvent} returns. A slow listener therefore throttles consumption, and the feed's
 * own buffering absorbs the difference.
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown from {@code onEvent} are routed to {@code onError} and never
 * terminate the subscription.
 *
 * @see io.geostream.handler.ArchivingEventHandler
 * @see io.geostream.dispatch.EventDispatcher
 */
public interface StreamListener {

    /**
     * Processes one decoded event.
     *
     * @param event the event
     */
    void onEvent(GeoEvent event);

    /**
     * Called for transport-level exceptions and for exceptions escaping {@link #onEvent}.
     * The default implementation logs at WARNING.
     *
     * @param error the failure
     */
    default void onError(Throwable error) {
        Logger.getLogger(StreamListener.class.getName())
                .log(Level.WARNING, "Stream delivery error", error);
    }
}
