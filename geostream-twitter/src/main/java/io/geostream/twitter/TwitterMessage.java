package io.geostream.twitter;

import io.geostream.GeoEvent;

import java.util.Objects;

/**
 * One decoded line of the streaming response.
 */
public sealed interface TwitterMessage {

    /**
     * A post, ready for delivery.
     *
     * @param event the decoded event
     */
    record Tweet(GeoEvent event) implements TwitterMessage {
        public Tweet {
            Objects.requireNonNull(event, "event");
        }
    }

    /**
     * A control notice ({@code delete}, {@code limit}, {@code warning}, {@code scrub_geo}, ...)
     * that carries no post.
     *
     * @param kind the top-level key naming the notice
     * @param body the raw line
     */
    record Control(String kind, String body) implements TwitterMessage {
    }

    /**
     * The server is about to close the stream.
     *
     * @param code   disconnect code, {@code 0} if absent
     * @param reason human-readable reason, may be empty
     */
    record Disconnect(int code, String reason) implements TwitterMessage {
    }
}
