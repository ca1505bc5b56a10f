package io.geostream;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable post delivered by a feed, carrying its optional geographic metadata and the
 * raw payload that gets archived.
 *
 * <p>The payload (JSON text or raw UTF-8 bytes) is stored verbatim and limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes. Use the {@linkplain Builder builder} or
 * {@link #ofJson(String, String)} to create instances.
 *
 * @see io.geostream.filter.GeoFilter
 */
public final class GeoEvent {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private final String id;
    private final Coordinates coordinates;
    private final Place place;
    private final Instant receivedAt;
    private final String payloadJson;
    private final byte[] payloadBytes;

    private GeoEvent(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.coordinates = builder.coordinates;
        this.place = builder.place;
        this.receivedAt = builder.receivedAt == null ? Instant.now() : builder.receivedAt;

        if (builder.payloadJson == null && builder.payloadBytes == null) {
            throw new IllegalArgumentException("payloadJson or payloadBytes must be set");
        }
        if (builder.payloadJson != null && builder.payloadBytes != null) {
            throw new IllegalArgumentException("Set either payloadJson or payloadBytes, not both");
        }

        if (builder.payloadJson != null) {
            this.payloadJson = builder.payloadJson;
            byte[] bytes = builder.payloadJson.getBytes(StandardCharsets.UTF_8);
            if (bytes.length > MAX_PAYLOAD_BYTES) {
                throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
            }
            this.payloadBytes = bytes;
        } else {
            if (builder.payloadBytes.length > MAX_PAYLOAD_BYTES) {
                throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
            }
            this.payloadBytes = Arrays.copyOf(builder.payloadBytes, builder.payloadBytes.length);
            this.payloadJson = new String(this.payloadBytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Creates a builder for the event with the given unique identifier.
     *
     * @param id the feed-assigned identifier
     * @return a new builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Creates an event without geographic metadata.
     *
     * @param id          the event identifier
     * @param payloadJson the JSON payload
     * @return a new event
     */
    public static GeoEvent ofJson(String id, String payloadJson) {
        return builder(id).payloadJson(payloadJson).build();
    }

    public String id() {
        return id;
    }

    /**
     * Returns the precise point of the post, or {@code null} if none was attached.
     *
     * @return the coordinates, or {@code null}
     */
    public Coordinates coordinates() {
        return coordinates;
    }

    /**
     * Returns the place the post was tagged with, or {@code null} if none was attached.
     *
     * @return the place, or {@code null}
     */
    public Place place() {
        return place;
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    public String payloadJson() {
        return payloadJson;
    }

    public byte[] payloadBytes() {
        return Arrays.copyOf(payloadBytes, payloadBytes.length);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GeoEvent{id=").append(id)
                .append(", receivedAt=").append(receivedAt);
        if (coordinates != null) {
            sb.append(", coordinates=").append(coordinates);
        }
        if (place != null) {
            sb.append(", place=").append(place.fullName() != null ? place.fullName() : place.name());
        }
        return sb.append(", payloadBytes=").append(payloadBytes.length).append('}').toString();
    }

    /**
     * Builder for {@link GeoEvent}.
     */
    public static final class Builder {
        private final String id;
        private Coordinates coordinates;
        private Place place;
        private Instant receivedAt;
        private String payloadJson;
        private byte[] payloadBytes;

        private Builder(String id) {
            this.id = id;
        }

        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder coordinates(double latitude, double longitude) {
            this.coordinates = new Coordinates(latitude, longitude);
            return this;
        }

        public Builder place(Place place) {
            this.place = place;
            return this;
        }

        /**
         * Sets the arrival time. Optional; defaults to {@link Instant#now()} at build time.
         *
         * @param receivedAt when the event was read from the stream
         * @return this builder
         */
        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        public Builder payloadBytes(byte[] payloadBytes) {
            this.payloadBytes = payloadBytes;
            return this;
        }

        /**
         * Builds the event.
         *
         * @return a new event
         * @throws NullPointerException     if {@code id} is null
         * @throws IllegalArgumentException if {@code id} is empty, no payload (or both payload
         *                                  forms) were set, or the payload is too large
         */
        public GeoEvent build() {
            return new GeoEvent(this);
        }
    }
}
