package io.geostream;

/**
 * A precise point in decimal degrees.
 *
 * @param latitude  latitude in {@code [-90, 90]}
 * @param longitude longitude in {@code [-180, 180]}
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be in [-90, 90], got: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be in [-180, 180], got: " + longitude);
        }
    }
}
