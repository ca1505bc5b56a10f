package io.geostream.filter;

import io.geostream.GeoEvent;

/**
 * Side-effect-free decision on whether an event should be archived.
 *
 * @see GeoFilter
 */
@FunctionalInterface
public interface EventFilter {

    /**
     * @param event the decoded event
     * @return {@code true} to archive the event, {@code false} to drop it
     */
    boolean accept(GeoEvent event);
}
