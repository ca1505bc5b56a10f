package io.geostream.dispatch;

/**
 * Tracks event ids currently being handled so a redelivered event is not processed twice
 * at the same time.
 */
public interface InFlightTracker {

  /**
   * @param eventId the event id
   * @return {@code true} if the id was free and is now held by the caller
   */
  boolean tryAcquire(String eventId);

  void release(String eventId);

  /**
   * @return the number of ids currently held
   */
  int size();
}
