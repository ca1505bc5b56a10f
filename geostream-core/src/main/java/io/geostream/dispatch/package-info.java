/**
 * Optional worker pool between the stream reader and the event handler.
 *
 * <p>{@link io.geostream.dispatch.EventDispatcher} queues events and hands them to worker
 * threads; {@link io.geostream.dispatch.InFlightTracker} keeps one handling per event id.
 */
package io.geostream.dispatch;
