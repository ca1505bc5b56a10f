package io.geostream.stream;

import java.time.Duration;
import java.util.Objects;

/**
 * The stream subscription failed or was dropped. Recoverable: the
 * {@link StreamSupervisor} reconnects after a backoff.
 *
 * <p>When the upstream asks the client to slow down (rate limiting), {@link #retryAfter()}
 * carries the requested wait, which takes precedence over the computed backoff when longer.
 */
public class SubscriptionException extends RuntimeException {
  private final Duration retryAfter;

  public SubscriptionException(String message) {
    this(message, null, null);
  }

  public SubscriptionException(String message, Throwable cause) {
    this(message, cause, null);
  }

  /**
   * @param message    description of the failure
   * @param cause      underlying cause; may be null
   * @param retryAfter minimum wait requested by the upstream; may be null
   */
  public SubscriptionException(String message, Throwable cause, Duration retryAfter) {
    super(message, cause);
    if (retryAfter != null && retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must be >= 0, got: " + retryAfter);
    }
    this.retryAfter = retryAfter;
  }

  /**
   * Creates a rate-limit failure that asks for at least {@code retryAfter} before reconnecting.
   *
   * @param message    description of the failure
   * @param retryAfter requested wait
   * @return the exception
   */
  public static SubscriptionException rateLimited(String message, Duration retryAfter) {
    return new SubscriptionException(message, null, Objects.requireNonNull(retryAfter, "retryAfter"));
  }

  /**
   * @return the wait requested by the upstream, or {@code null} if none
   */
  public Duration retryAfter() {
    return retryAfter;
  }
}
