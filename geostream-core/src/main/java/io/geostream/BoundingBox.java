package io.geostream;

import java.util.Locale;

/**
 * Geographic rectangle in decimal degrees, ordered {@code (west, south, east, north)}.
 *
 * <p>Used both as the subscription-wide stream filter and as the extent of a
 * {@link Place}. A box whose {@code west} is greater than its {@code east} crosses the
 * antimeridian.
 *
 * @param west  western longitude, in {@code [-180, 180]}
 * @param south southern latitude, in {@code [-90, 90]}
 * @param east  eastern longitude, in {@code [-180, 180]}
 * @param north northern latitude, in {@code [-90, 90]}, not below {@code south}
 */
public record BoundingBox(double west, double south, double east, double north) {

    /**
     * The contiguous United States, used as the default subscription filter.
     */
    public static final BoundingBox CONTIGUOUS_US =
            new BoundingBox(-124.848974, 24.396308, -66.885444, 49.384358);

    public BoundingBox {
        checkLongitude("west", west);
        checkLongitude("east", east);
        checkLatitude("south", south);
        checkLatitude("north", north);
        if (south > north) {
            throw new IllegalArgumentException("south must be <= north, got: " + south + " > " + north);
        }
    }

    /**
     * Parses a comma-separated {@code "west,south,east,north"} string.
     *
     * @param text the four coordinates
     * @return the parsed box
     * @throws IllegalArgumentException if the text does not hold four valid numbers
     */
    public static BoundingBox parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("bounding box text must not be blank");
        }
        String[] parts = text.trim().split("\\s*,\\s*");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Expected 4 comma-separated values (west,south,east,north), got: " + text);
        }
        double[] values = new double[4];
        for (int i = 0; i < 4; i++) {
            try {
                values[i] = Double.parseDouble(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: '" + parts[i] + "' in " + text, e);
            }
        }
        return new BoundingBox(values[0], values[1], values[2], values[3]);
    }

    /**
     * Returns {@code true} if the given point lies inside or on the edge of this box.
     *
     * @param coordinates the point to test
     * @return whether the point is covered
     */
    public boolean contains(Coordinates coordinates) {
        double lat = coordinates.latitude();
        double lon = coordinates.longitude();
        if (lat < south || lat > north) {
            return false;
        }
        if (west <= east) {
            return lon >= west && lon <= east;
        }
        return lon >= west || lon <= east;
    }

    /**
     * Formats the box as the {@code locations} parameter of a streaming filter request:
     * {@code west,south,east,north}.
     *
     * @return the comma-separated coordinates
     */
    public String toLocationsParameter() {
        return format(west) + "," + format(south) + "," + format(east) + "," + format(north);
    }

    private static String format(double value) {
        String text = String.format(Locale.ROOT, "%.6f", value);
        // Trim trailing zeros but keep at least one decimal digit
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '0' && text.charAt(end - 2) != '.') {
            end--;
        }
        return text.substring(0, end);
    }

    private static void checkLongitude(String name, double value) {
        if (Double.isNaN(value) || value < -180.0 || value > 180.0) {
            throw new IllegalArgumentException(name + " must be in [-180, 180], got: " + value);
        }
    }

    private static void checkLatitude(String name, double value) {
        if (Double.isNaN(value) || value < -90.0 || value > 90.0) {
            throw new IllegalArgumentException(name + " must be in [-90, 90], got: " + value);
        }
    }
}
