package io.geostream.twitter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.geostream.BoundingBox;
import io.geostream.Coordinates;
import io.geostream.GeoEvent;
import io.geostream.Place;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;

/**
 * Decodes one line of the v1.1 streaming API into a {@link TwitterMessage}.
 *
 * <p>Recognized fields of a post:
 * <ul>
 *   <li>{@code id_str} (or numeric {@code id}): the event id, required</li>
 *   <li>{@code coordinates.coordinates}: GeoJSON point, {@code [longitude, latitude]};
 *       dropped when not two numbers in range</li>
 *   <li>{@code place}: {@code name}, {@code full_name}, {@code country_code} and the
 *       {@code bounding_box} polygon, reduced to its envelope. Out-of-range corners are
 *       clamped, so a place is never lost to a bad box.</li>
 * </ul>
 * The original line is kept verbatim as the event payload.
 *
 * <p>Thread-safe.
 */
public final class TweetDecoder {
    static final Set<String> CONTROL_KINDS = Set.of(
            "delete", "limit", "warning", "scrub_geo", "status_withheld", "user_withheld", "friends");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TweetDecoder() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public TweetDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decodes one non-blank line.
     *
     * @param line the raw JSON line
     * @return the decoded message
     * @throws TweetDecodingException if the line is not a JSON object, or is a post without
     *                                an id
     */
    public TwitterMessage decode(String line) {
        Objects.requireNonNull(line, "line");
        String json = line.trim();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TweetDecodingException("Malformed JSON line: " + abbreviate(json), e);
        }
        if (root == null || !root.isObject()) {
            throw new TweetDecodingException("Expected a JSON object, got: " + abbreviate(json));
        }

        JsonNode disconnect = root.get("disconnect");
        if (disconnect != null && disconnect.isObject()) {
            return new TwitterMessage.Disconnect(disconnect.path("code").asInt(0),
                    disconnect.path("reason").asText(""));
        }
        for (String kind : CONTROL_KINDS) {
            if (root.has(kind)) {
                return new TwitterMessage.Control(kind, json);
            }
        }

        String id = root.path("id_str").asText("");
        if (id.isEmpty() && root.path("id").isNumber()) {
            id = root.get("id").asText();
        }
        if (id.isEmpty()) {
            throw new TweetDecodingException("Post has no id: " + abbreviate(json));
        }

        try {
            return new TwitterMessage.Tweet(GeoEvent.builder(id)
                    .coordinates(coordinates(root.get("coordinates")))
                    .place(place(root.get("place")))
                    .receivedAt(clock.instant())
                    .payloadJson(json)
                    .build());
        } catch (IllegalArgumentException e) {
            throw new TweetDecodingException("Invalid post " + id + ": " + e.getMessage(), e);
        }
    }

    private static Coordinates coordinates(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode point = node.get("coordinates");
        if (point == null || !point.isArray() || point.size() < 2
                || !point.get(0).isNumber() || !point.get(1).isNumber()) {
            return null;
        }
        double lon = point.get(0).asDouble();
        double lat = point.get(1).asDouble();
        if (!(lat >= -90 && lat <= 90) || !(lon >= -180 && lon <= 180)) {
            return null;
        }
        return new Coordinates(lat, lon);
    }

    private static Place place(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String fullName = textOrNull(node.get("full_name"));
        String name = textOrNull(node.get("name"));
        if (name == null) {
            name = fullName != null ? fullName : "";
        }
        return new Place(name, fullName, textOrNull(node.get("country_code")),
                envelope(node.path("bounding_box").path("coordinates")));
    }

    // Polygon as [[[lon, lat], ...]]; every ring is folded into one envelope, clamped to valid degrees.
    private static BoundingBox envelope(JsonNode polygon) {
        if (!polygon.isArray()) {
            return null;
        }
        double west = Double.POSITIVE_INFINITY;
        double south = Double.POSITIVE_INFINITY;
        double east = Double.NEGATIVE_INFINITY;
        double north = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (JsonNode ring : polygon) {
            for (JsonNode point : ring) {
                if (!point.isArray() || point.size() < 2
                        || !point.get(0).isNumber() || !point.get(1).isNumber()) {
                    continue;
                }
                double lon = clamp(point.get(0).asDouble(), 180);
                double lat = clamp(point.get(1).asDouble(), 90);
                if (Double.isNaN(lon) || Double.isNaN(lat)) {
                    continue;
                }
                west = Math.min(west, lon);
                east = Math.max(east, lon);
                south = Math.min(south, lat);
                north = Math.max(north, lat);
                any = true;
            }
        }
        return any ? new BoundingBox(west, south, east, north) : null;
    }

    private static double clamp(double value, double limit) {
        return Math.max(-limit, Math.min(limit, value));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
