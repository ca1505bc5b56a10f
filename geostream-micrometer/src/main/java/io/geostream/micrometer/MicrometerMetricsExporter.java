package io.geostream.micrometer;

import io.geostream.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code geostream.events.received}: events read from the stream</li>
 *   <li>{@code geostream.events.matched}: events that carried a geo signal</li>
 *   <li>{@code geostream.events.skipped}: events dropped by the filter</li>
 *   <li>{@code geostream.archive.success}: records uploaded</li>
 *   <li>{@code geostream.archive.failure}: failed uploads (staged file kept)</li>
 *   <li>{@code geostream.stage.failure}: events that could not be staged</li>
 *   <li>{@code geostream.stream.reconnects}: reconnect attempts</li>
 *   <li>{@code geostream.dispatch.duplicate}: redeliveries dropped while in flight</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code geostream.queue.depth}: dispatch queue depth</li>
 *   <li>{@code geostream.stream.connected}: 1 while subscribed, else 0</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code geostream.upload.duration.ms}: time spent in one upload</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter eventsReceived;
    private final Counter eventsMatched;
    private final Counter eventsSkipped;
    private final Counter archiveSuccess;
    private final Counter archiveFailure;
    private final Counter stageFailure;
    private final Counter reconnects;
    private final Counter duplicates;
    private final Gauge queueDepthGauge;
    private final Gauge connectedGauge;
    private final DistributionSummary uploadDuration;

    private final AtomicInteger queueDepth = new AtomicInteger();
    private final AtomicInteger connected = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "geostream"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "geostream");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several workers in
     * one process.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "geostream.us"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.eventsReceived = Counter.builder(namePrefix + ".events.received")
                .description("Events read from the stream")
                .register(registry);
        this.eventsMatched = Counter.builder(namePrefix + ".events.matched")
                .description("Events carrying coordinates or a place")
                .register(registry);
        this.eventsSkipped = Counter.builder(namePrefix + ".events.skipped")
                .description("Events without geo signal")
                .register(registry);
        this.archiveSuccess = Counter.builder(namePrefix + ".archive.success")
                .description("Records uploaded to the archive store")
                .register(registry);
        this.archiveFailure = Counter.builder(namePrefix + ".archive.failure")
                .description("Uploads that failed; staged file kept")
                .register(registry);
        this.stageFailure = Counter.builder(namePrefix + ".stage.failure")
                .description("Events that could not be written to the staging directory")
                .register(registry);
        this.reconnects = Counter.builder(namePrefix + ".stream.reconnects")
                .description("Stream reconnect attempts")
                .register(registry);
        this.duplicates = Counter.builder(namePrefix + ".dispatch.duplicate")
                .description("Redelivered events dropped while the same id was in flight")
                .register(registry);

        this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
                .register(registry);
        this.connectedGauge = Gauge.builder(namePrefix + ".stream.connected", connected, AtomicInteger::get)
                .register(registry);

        this.uploadDuration = DistributionSummary.builder(namePrefix + ".upload.duration.ms")
                .description("Upload time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEventsReceived() {
        if (closed) return;
        eventsReceived.increment();
    }

    @Override
    public void incrementEventsMatched() {
        if (closed) return;
        eventsMatched.increment();
    }

    @Override
    public void incrementEventsSkipped() {
        if (closed) return;
        eventsSkipped.increment();
    }

    @Override
    public void incrementArchiveSuccess() {
        if (closed) return;
        archiveSuccess.increment();
    }

    @Override
    public void incrementArchiveFailure() {
        if (closed) return;
        archiveFailure.increment();
    }

    @Override
    public void incrementStageFailure() {
        if (closed) return;
        stageFailure.increment();
    }

    @Override
    public void incrementReconnects() {
        if (closed) return;
        reconnects.increment();
    }

    @Override
    public void incrementDuplicateDropped() {
        if (closed) return;
        duplicates.increment();
    }

    @Override
    public void recordConnected(boolean value) {
        if (closed) return;
        connected.set(value ? 1 : 0);
    }

    @Override
    public void recordQueueDepth(int depth) {
        if (closed) return;
        queueDepth.set(depth);
    }

    @Override
    public void recordUploadDurationMs(long durationMs) {
        if (closed) return;
        uploadDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called when the owning {@link io.geostream.GeoStream} is closed, so a restarted
     * worker does not inherit stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(eventsReceived, eventsMatched, eventsSkipped,
                archiveSuccess, archiveFailure, stageFailure, reconnects, duplicates,
                queueDepthGauge, connectedGauge, uploadDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
