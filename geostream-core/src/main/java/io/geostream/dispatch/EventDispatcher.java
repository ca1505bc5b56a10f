package io.geostream.dispatch;

import io.geostream.GeoEvent;
import io.geostream.StreamListener;
import io.geostream.spi.MetricsExporter;
import io.geostream.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded hand-off between the stream reader and a pool of worker threads.
 *
 * <p>Events offered through {@link #onEvent} are placed on a bounded queue and handled by
 * worker threads calling the delegate listener. When the queue is full, {@code onEvent}
 * blocks, so the stream reader slows down instead of dropping events. An
 * {@link InFlightTracker} keeps at most one handling per event id: a redelivery of an id that
 * is still queued or being handled is dropped and counted. Ordering across events is not
 * preserved.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see EventDispatcher.Builder
 */
public final class EventDispatcher implements StreamListener, AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<GeoEvent> queue;
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final StreamListener delegate;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private EventDispatcher(Builder builder) {
    this.delegate = Objects.requireNonNull(builder.delegate, "delegate");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    int workerCount = builder.workerCount;
    int queueCapacity = builder.queueCapacity;
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0, got: " + queueCapacity);
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0, got: " + builder.drainTimeoutMs);
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("geostream-worker-"));
    for (int i = 0; i < workerCount; i++) {
      workers.submit(this::workerLoop);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues an event, blocking while the queue is full.
   *
   * @param event the event to queue
   * @return {@code true} if queued; {@code false} if the dispatcher is closed, the id is
   *     already in flight, or the caller was interrupted while waiting
   */
  public boolean submit(GeoEvent event) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      logger.fine(() -> "Dispatcher closed; dropping event " + event.id());
      return false;
    }
    if (!inFlightTracker.tryAcquire(event.id())) {
      metrics.incrementDuplicateDropped();
      logger.fine(() -> "Event already in flight; dropping duplicate " + event.id());
      return false;
    }
    try {
      while (accepting.get()) {
        if (queue.offer(event, QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
          metrics.recordQueueDepth(queue.size());
          return true;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    inFlightTracker.release(event.id());
    return false;
  }

  @Override
  public void onEvent(GeoEvent event) {
    submit(event);
  }

  @Override
  public void onError(Throwable error) {
    delegate.onError(error);
  }

  public int queueDepth() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        GeoEvent event = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (event == null) {
          if (!running.get()) break;
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        dispatchEvent(event);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
      }
    }
  }

  private void dispatchEvent(GeoEvent event) {
    try {
      delegate.onEvent(event);
    } catch (RuntimeException e) {
      try {
        delegate.onError(e);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "Listener onError failed", ex);
      }
    } finally {
      inFlightTracker.release(event.id());
    }
  }

  /**
   * Initiates graceful shutdown: stops accepting new events, drains queued events within the
   * configured drain timeout, then interrupts worker threads.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private StreamListener delegate;
    private InFlightTracker inFlightTracker;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the listener that handles events on the worker threads, typically an
     * {@link io.geostream.handler.ArchivingEventHandler}.
     *
     * <p><b>Required.</b>
     *
     * @param delegate the listener
     * @return this builder
     */
    public Builder delegate(StreamListener delegate) {
      this.delegate = delegate;
      return this;
    }

    /**
     * Sets a custom in-flight tracker for deduplicating concurrent handling.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     *
     * @param inFlightTracker the tracker implementation
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the capacity of the bounded queue.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param queueCapacity maximum number of queued events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for queued events to be handled.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
