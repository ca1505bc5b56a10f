package io.geostream.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), an id remains held until explicitly released.
 * When positive, stale entries are reclaimed after the TTL elapses, so an event stuck in a
 * hung upload can be delivered again.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inflight = new ConcurrentHashMap<>();
  private final long ttlMs;
  private final LongSupplier clock;
  private final AtomicInteger evictCounter = new AtomicInteger();

  /**
   * Creates a tracker with no TTL (entries persist until released).
   */
  public DefaultInFlightTracker() {
    this(0L);
  }

  /**
   * Creates a tracker with a time-to-live for stale entries.
   *
   * @param ttlMs time-to-live in milliseconds; 0 disables expiry
   */
  public DefaultInFlightTracker(long ttlMs) {
    this(ttlMs, System::currentTimeMillis);
  }

  DefaultInFlightTracker(long ttlMs, LongSupplier clock) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0, got: " + ttlMs);
    }
    this.ttlMs = ttlMs;
    this.clock = clock;
  }

  @Override
  public boolean tryAcquire(String eventId) {
    long now = clock.getAsLong();
    maybeEvictExpired(now);
    for (int attempt = 0; attempt < 10; attempt++) {
      Long existing = inflight.putIfAbsent(eventId, now);
      if (existing == null) {
        return true;
      }
      if (ttlMs > 0 && now - existing > ttlMs) {
        if (inflight.replace(eventId, existing, now)) {
          return true;
        }
        // Lost the race to another thread; look again
        continue;
      }
      return false;
    }
    return false;
  }

  private void maybeEvictExpired(long now) {
    if (ttlMs <= 0) return;
    // Sweep roughly every 1024 acquires
    if ((evictCounter.incrementAndGet() & 0x3FF) != 0) return;
    inflight.entrySet().removeIf(e -> now - e.getValue() > ttlMs * 2);
  }

  @Override
  public void release(String eventId) {
    inflight.remove(eventId);
  }

  @Override
  public int size() {
    return inflight.size();
  }
}
