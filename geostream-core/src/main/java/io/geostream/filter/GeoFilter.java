package io.geostream.filter;

import io.geostream.GeoEvent;

/**
 * Accepts events that carry geographic metadata: a coordinate pair, a place, or both.
 *
 * <p>Only presence is checked. A place without a bounding box, or with an empty name,
 * still counts as a geo signal.
 */
public final class GeoFilter implements EventFilter {

    public static final GeoFilter INSTANCE = new GeoFilter();

    private GeoFilter() {
    }

    /**
     * Returns {@code true} iff the event has non-null coordinates or a non-null place.
     *
     * @param event the event to inspect
     * @return whether the event carries a geo signal
     */
    public static boolean hasGeoSignal(GeoEvent event) {
        return event.coordinates() != null || event.place() != null;
    }

    @Override
    public boolean accept(GeoEvent event) {
        return hasGeoSignal(event);
    }
}
