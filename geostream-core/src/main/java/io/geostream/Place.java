package io.geostream;

import java.util.Objects;

/**
 * Named location attached to a post instead of (or in addition to) a precise point.
 *
 * <p>Only {@code name} is required. The bounding box is kept as delivered and may be
 * {@code null}; the geo filter looks at presence of the place, not at its shape.
 *
 * @param name        short place name, e.g. {@code "Denver"}
 * @param fullName    display name, e.g. {@code "Denver, CO"}; may be null
 * @param countryCode ISO country code; may be null
 * @param boundingBox extent of the place; may be null
 */
public record Place(String name, String fullName, String countryCode, BoundingBox boundingBox) {

    public Place {
        Objects.requireNonNull(name, "name");
    }

    /**
     * Creates a place with only a name and a bounding box.
     *
     * @param name        the place name
     * @param boundingBox the extent, may be null
     * @return a new place
     */
    public static Place of(String name, BoundingBox boundingBox) {
        return new Place(name, name, null, boundingBox);
    }
}
