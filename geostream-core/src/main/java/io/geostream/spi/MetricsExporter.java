package io.geostream.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events read from the stream.
     */
    void incrementEventsReceived();

    /**
     * Increments the count of events that passed the filter.
     */
    void incrementEventsMatched();

    /**
     * Increments the count of events dropped by the filter.
     */
    void incrementEventsSkipped();

    /**
     * Increments the count of records uploaded successfully.
     */
    void incrementArchiveSuccess();

    /**
     * Increments the count of uploads that failed (staged file left on disk).
     */
    void incrementArchiveFailure();

    /**
     * Increments the count of events that could not be written to the staging directory.
     */
    void incrementStageFailure();

    /**
     * Increments the count of reconnect attempts made by the stream supervisor.
     */
    void incrementReconnects();

    /**
     * Increments the count of events dropped because the same id was already being handled.
     */
    default void incrementDuplicateDropped() {
    }

    /**
     * Records whether the stream is currently subscribed.
     *
     * @param connected {@code true} while events can be delivered
     */
    void recordConnected(boolean connected);

    /**
     * Records the depth of the dispatch queue, when a worker pool is used.
     *
     * @param depth number of queued events
     */
    default void recordQueueDepth(int depth) {
    }

    /**
     * Records the duration of one upload.
     *
     * @param durationMs upload time in milliseconds (always non-negative)
     */
    default void recordUploadDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsReceived() {
        }

        @Override
        public void incrementEventsMatched() {
        }

        @Override
        public void incrementEventsSkipped() {
        }

        @Override
        public void incrementArchiveSuccess() {
        }

        @Override
        public void incrementArchiveFailure() {
        }

        @Override
        public void incrementStageFailure() {
        }

        @Override
        public void incrementReconnects() {
        }

        @Override
        public void recordConnected(boolean connected) {
        }
    }
}
