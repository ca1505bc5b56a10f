package io.geostream.stream;

import io.geostream.BoundingBox;
import io.geostream.GeoEvent;
import io.geostream.StreamListener;
import io.geostream.auth.AuthException;
import io.geostream.spi.FeedConnection;
import io.geostream.spi.FeedSource;
import io.geostream.spi.MetricsExporter;
import io.geostream.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the long-lived subscription to a {@link FeedSource} and keeps it alive.
 *
 * <p>The supervisor runs on one dedicated daemon thread. Each cycle authenticates and
 * subscribes with the configured bounding box, then blocks in
 * {@link FeedConnection#deliver} while events are pushed to the {@link StreamListener}.
 * When the stream ends or fails with a {@link SubscriptionException}, the supervisor waits
 * for the delay computed by its {@link RetryPolicy} and subscribes again. An
 * {@link AuthException} is fatal: the supervisor terminates and {@link #awaitTermination()}
 * rethrows it.
 *
 * <p>The consecutive-attempt counter resets once a subscription has stayed up for
 * {@code stableAfter}, so a worker that runs for days is not stuck at the maximum backoff
 * after one flaky hour.
 *
 * <p>Exceptions thrown by the listener are caught at the delivery boundary and passed to
 * {@link StreamListener#onError}; they never tear down the subscription.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see SupervisorState
 */
public final class StreamSupervisor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StreamSupervisor.class.getName());

    private static final long CLOSE_JOIN_TIMEOUT_MS = 10_000;

    private final FeedSource feedSource;
    private final BoundingBox filter;
    private final StreamListener listener;
    private final RetryPolicy retryPolicy;
    private final boolean reconnect;
    private final int maxReconnectAttempts;
    private final Duration stableAfter;
    private final MetricsExporter metrics;

    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile SupervisorState state = SupervisorState.IDLE;
    private volatile FeedConnection connection;
    private volatile RuntimeException fatalError;
    private volatile boolean closed;
    private Thread thread;
    // Written and read only by the supervisor thread
    private long lastUptimeNanos = -1L;

    private StreamSupervisor(Builder builder) {
        this.feedSource = Objects.requireNonNull(builder.feedSource, "feedSource");
        this.listener = Objects.requireNonNull(builder.listener, "listener");
        this.filter = builder.filter != null ? builder.filter : BoundingBox.CONTIGUOUS_US;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.reconnect = builder.reconnect;

        if (builder.maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0, got: " + builder.maxReconnectAttempts);
        }
        Duration stableAfter = Objects.requireNonNull(builder.stableAfter, "stableAfter");
        if (stableAfter.isNegative()) {
            throw new IllegalArgumentException("stableAfter must be >= 0, got: " + stableAfter);
        }
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.stableAfter = stableAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the subscription loop on a new daemon thread.
     *
     * @throws IllegalStateException if the supervisor was already started or closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("StreamSupervisor has been closed");
        }
        if (thread != null) {
            throw new IllegalStateException("StreamSupervisor already started");
        }
        thread = new DaemonThreadFactory("geostream-stream-").newThread(this::runLoop);
        thread.start();
    }

    public SupervisorState state() {
        return state;
    }

    public BoundingBox filter() {
        return filter;
    }

    /**
     * Blocks until the supervisor has terminated.
     *
     * @throws AuthException        if the supervisor stopped because authentication failed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
        rethrowFatal();
    }

    /**
     * Blocks until the supervisor has terminated or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if terminated, {@code false} if the timeout elapsed first
     * @throws AuthException        if the supervisor stopped because authentication failed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        rethrowFatal();
        return true;
    }

    private void rethrowFatal() {
        RuntimeException error = fatalError;
        if (error != null) {
            throw error;
        }
    }

    private void runLoop() {
        int attempts = 0;
        try {
            while (!closed) {
                SubscriptionException failure = null;
                state = SupervisorState.AUTHENTICATING;
                lastUptimeNanos = -1L;
                try {
                    subscribeAndDeliver();
                    if (!closed) {
                        logger.info("Stream ended by remote side");
                    }
                } catch (SubscriptionException e) {
                    failure = e;
                    if (!closed) {
                        logger.log(Level.WARNING, "Subscription failed: " + e.getMessage(), e);
                    }
                } catch (AuthException e) {
                    fatalError = e;
                    logger.log(Level.SEVERE, "Authentication failed; stopping stream supervisor", e);
                    break;
                } catch (RuntimeException e) {
                    fatalError = e;
                    logger.log(Level.SEVERE, "Unexpected failure; stopping stream supervisor", e);
                    break;
                }

                if (closed) {
                    break;
                }
                if (lastUptimeNanos >= stableAfter.toNanos()) {
                    attempts = 0;
                }
                state = SupervisorState.DISCONNECTED;
                if (!reconnect) {
                    logger.info("Reconnect disabled; stream supervisor stopping");
                    break;
                }
                attempts++;
                if (maxReconnectAttempts > 0 && attempts > maxReconnectAttempts) {
                    logger.warning("Giving up after " + maxReconnectAttempts + " reconnect attempts");
                    break;
                }
                long delayMs = reconnectDelayMs(attempts, failure);
                logger.info("Reconnecting in " + delayMs + " ms (attempt " + attempts + ")");
                metrics.incrementReconnects();
                if (closeSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = SupervisorState.TERMINATED;
            terminated.countDown();
        }
    }

    /**
     * Runs one subscription and records in {@link #lastUptimeNanos} how long it stayed up.
     */
    private void subscribeAndDeliver() {
        FeedConnection conn = feedSource.connect(filter);
        synchronized (this) {
            if (closed) {
                conn.close();
                return;
            }
            connection = conn;
        }
        long subscribedAt = System.nanoTime();
        state = SupervisorState.SUBSCRIBED;
        metrics.recordConnected(true);
        logger.info("Subscribed with locations=" + filter.toLocationsParameter());
        try {
            conn.deliver(new GuardedListener(listener, metrics));
        } finally {
            lastUptimeNanos = System.nanoTime() - subscribedAt;
            synchronized (this) {
                connection = null;
            }
            metrics.recordConnected(false);
            try {
                conn.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close feed connection", e);
            }
        }
    }

    private long reconnectDelayMs(int attempts, SubscriptionException failure) {
        long delayMs = Math.max(0L, retryPolicy.computeDelayMs(attempts));
        if (failure != null && failure.retryAfter() != null) {
            delayMs = Math.max(delayMs, failure.retryAfter().toMillis());
        }
        return delayMs;
    }

    /**
     * Stops the subscription loop, closes the live connection and joins the supervisor thread.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        Thread toJoin;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            closeSignal.countDown();
            FeedConnection conn = connection;
            if (conn != null) {
                try {
                    conn.close();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to close feed connection", e);
                }
            }
            toJoin = thread;
            if (toJoin == null) {
                state = SupervisorState.TERMINATED;
                terminated.countDown();
                return;
            }
        }
        if (toJoin == Thread.currentThread()) {
            return;
        }
        try {
            toJoin.join(CLOSE_JOIN_TIMEOUT_MS);
            if (toJoin.isAlive()) {
                logger.warning("Stream supervisor thread did not stop within "
                        + CLOSE_JOIN_TIMEOUT_MS + " ms; interrupting");
                toJoin.interrupt();
                toJoin.join(CLOSE_JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Routes listener failures to {@code onError} and counts received events.
     */
    private static final class GuardedListener implements StreamListener {
        private final StreamListener delegate;
        private final MetricsExporter metrics;

        GuardedListener(StreamListener delegate, MetricsExporter metrics) {
            this.delegate = delegate;
            this.metrics = metrics;
        }

        @Override
        public void onEvent(GeoEvent event) {
            metrics.incrementEventsReceived();
            try {
                delegate.onEvent(event);
            } catch (RuntimeException e) {
                onError(e);
            }
        }

        @Override
        public void onError(Throwable error) {
            try {
                delegate.onError(error);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener onError failed", e);
            }
        }
    }

    /**
     * Builder for {@link StreamSupervisor}.
     */
    public static final class Builder {
        private FeedSource feedSource;
        private BoundingBox filter;
        private StreamListener listener;
        private RetryPolicy retryPolicy;
        private boolean reconnect = true;
        private int maxReconnectAttempts;
        private Duration stableAfter = Duration.ofSeconds(60);
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the source that opens subscriptions.
         *
         * <p><b>Required.</b>
         *
         * @param feedSource the feed source
         * @return this builder
         */
        public Builder feedSource(FeedSource feedSource) {
            this.feedSource = feedSource;
            return this;
        }

        /**
         * Sets the geographic filter for the whole subscription.
         *
         * <p>Optional. Defaults to {@link BoundingBox#CONTIGUOUS_US}.
         *
         * @param filter the bounding box
         * @return this builder
         */
        public Builder filter(BoundingBox filter) {
            this.filter = filter;
            return this;
        }

        /**
         * Sets the callback receiving delivered events.
         *
         * <p><b>Required.</b>
         *
         * @param listener the stream listener
         * @return this builder
         */
        public Builder listener(StreamListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Sets the policy computing the delay before each reconnect.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 second base
         * and a 320 second cap.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Enables or disables reconnecting after the stream drops.
         *
         * <p>Optional. Defaults to {@code true}. When disabled, the supervisor terminates the
         * first time the stream ends.
         *
         * @param reconnect whether to reconnect
         * @return this builder
         */
        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        /**
         * Sets the maximum number of consecutive reconnect attempts.
         *
         * <p>Optional. Defaults to {@code 0} (unlimited).
         *
         * @param maxReconnectAttempts maximum attempts, or 0 for no limit
         * @return this builder
         */
        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        /**
         * Sets how long a subscription must stay up before the attempt counter resets.
         *
         * <p>Optional. Defaults to 60 seconds.
         *
         * @param stableAfter the stability window
         * @return this builder
         */
        public Builder stableAfter(Duration stableAfter) {
            this.stableAfter = stableAfter;
            return this;
        }

        /**
         * Sets the metrics exporter for reconnect and connection-state metrics.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public StreamSupervisor build() {
            return new StreamSupervisor(this);
        }
    }
}
