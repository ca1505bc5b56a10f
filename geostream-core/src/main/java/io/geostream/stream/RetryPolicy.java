package io.geostream.stream;

/**
 * Strategy for computing the delay before the next reconnect attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param attempts the number of consecutive failed attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
