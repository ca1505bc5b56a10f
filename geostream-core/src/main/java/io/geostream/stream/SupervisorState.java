package io.geostream.stream;

/**
 * Lifecycle of a {@link StreamSupervisor}.
 */
public enum SupervisorState {
  /** Built but not started. */
  IDLE,
  /** Opening a subscription through the feed source. */
  AUTHENTICATING,
  /** Connected; events are being delivered. */
  SUBSCRIBED,
  /** The subscription dropped; waiting out the reconnect backoff. */
  DISCONNECTED,
  /** Stopped for good: closed, fatal error, or reconnect attempts exhausted. */
  TERMINATED
}
