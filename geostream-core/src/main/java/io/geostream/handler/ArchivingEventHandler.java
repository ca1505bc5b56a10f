package io.geostream.handler;

import io.geostream.GeoEvent;
import io.geostream.StreamListener;
import io.geostream.archive.ArchiveUploader;
import io.geostream.filter.EventFilter;
import io.geostream.filter.GeoFilter;
import io.geostream.spi.MetricsExporter;
import io.geostream.stage.StageWriter;
import io.geostream.stage.StagedFile;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-event pipeline: pause, filter, stage, upload, clean up.
 *
 * <p>For each delivered event the handler first sleeps for the inter-event delay, then asks
 * its {@link EventFilter} whether the event qualifies. Qualifying events are written to the
 * staging directory, uploaded to the configured container and removed locally. Any failure
 * is logged at WARNING and reported as a {@link HandleResult.Failed}; nothing is rethrown, so
 * the stream keeps flowing. A failed upload leaves the staged file behind for the next
 * startup sweep.
 *
 * <p>An interrupt during the delay ends the pause early. The event is still processed with
 * the interrupt flag cleared, and the flag is restored before {@code handle} returns.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ArchivingEventHandler implements StreamListener {
    private static final Logger logger = Logger.getLogger(ArchivingEventHandler.class.getName());

    public static final Duration DEFAULT_INTER_EVENT_DELAY = Duration.ofSeconds(5);

    private final StageWriter stageWriter;
    private final ArchiveUploader uploader;
    private final String container;
    private final Duration interEventDelay;
    private final EventFilter filter;
    private final MetricsExporter metrics;
    private final Sleeper sleeper;

    private ArchivingEventHandler(Builder builder) {
        this.stageWriter = Objects.requireNonNull(builder.stageWriter, "stageWriter");
        this.uploader = Objects.requireNonNull(builder.uploader, "uploader");
        this.container = Objects.requireNonNull(builder.container, "container");
        if (container.isBlank()) {
            throw new IllegalArgumentException("container must not be blank");
        }
        Duration delay = Objects.requireNonNull(builder.interEventDelay, "interEventDelay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("interEventDelay must be >= 0, got: " + delay);
        }
        this.interEventDelay = delay;
        this.filter = builder.filter != null ? builder.filter : GeoFilter.INSTANCE;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD_SLEEP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String container() {
        return container;
    }

    public Duration interEventDelay() {
        return interEventDelay;
    }

    /**
     * Processes one event. Never throws for per-event failures.
     *
     * @param event the delivered event
     * @return what happened to the event
     */
    public HandleResult handle(GeoEvent event) {
        Objects.requireNonNull(event, "event");
        boolean interrupted = pause();
        try {
            if (!filter.accept(event)) {
                metrics.incrementEventsSkipped();
                logger.fine(() -> "Skipping event without geo signal: " + event.id());
                return new HandleResult.Skipped(event.id());
            }
            metrics.incrementEventsMatched();

            StagedFile staged;
            try {
                staged = stageWriter.stage(event);
            } catch (RuntimeException e) {
                metrics.incrementStageFailure();
                logger.log(Level.WARNING, "Failed to stage event " + event.id(), e);
                return new HandleResult.Failed(event.id(), HandleResult.FailureStage.STAGE, e);
            }
            return archive(staged);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Uploads an already staged file and removes it on success. Used to resume files left
     * behind by a previous run; no delay is applied.
     *
     * @param staged the staged file
     * @return {@link HandleResult.Archived} or a {@link HandleResult.Failed} at UPLOAD or CLEANUP
     */
    public HandleResult archive(StagedFile staged) {
        Objects.requireNonNull(staged, "staged");
        String key;
        try {
            key = uploader.upload(staged, container);
        } catch (RuntimeException e) {
            metrics.incrementArchiveFailure();
            logger.log(Level.WARNING, "Failed to upload event " + staged.eventId()
                    + "; staged file kept at " + staged.path(), e);
            return new HandleResult.Failed(staged.eventId(), HandleResult.FailureStage.UPLOAD, e);
        }
        metrics.incrementArchiveSuccess();

        try {
            stageWriter.delete(staged);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Archived event " + staged.eventId() + " as " + key
                    + " but could not remove " + staged.path(), e);
            return new HandleResult.Failed(staged.eventId(), HandleResult.FailureStage.CLEANUP, e);
        }
        logger.fine(() -> "Archived event " + staged.eventId() + " to " + container + "/" + key);
        return new HandleResult.Archived(staged.eventId(), key);
    }

    @Override
    public void onEvent(GeoEvent event) {
        handle(event);
    }

    @Override
    public void onError(Throwable error) {
        logger.log(Level.WARNING, "Stream error", error);
    }

    /**
     * @return {@code true} if the pause was cut short by an interrupt
     */
    private boolean pause() {
        if (interEventDelay.isZero()) {
            return Thread.interrupted();
        }
        try {
            sleeper.sleep(interEventDelay);
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    /**
     * Blocking pause between events. Replaced in tests.
     */
    @FunctionalInterface
    interface Sleeper {
        Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Builder for {@link ArchivingEventHandler}.
     */
    public static final class Builder {
        private StageWriter stageWriter;
        private ArchiveUploader uploader;
        private String container;
        private Duration interEventDelay = DEFAULT_INTER_EVENT_DELAY;
        private EventFilter filter;
        private MetricsExporter metrics;
        private Sleeper sleeper;

        private Builder() {
        }

        /**
         * Sets the writer for the local staging directory.
         *
         * <p><b>Required.</b>
         *
         * @param stageWriter the stage writer
         * @return this builder
         */
        public Builder stageWriter(StageWriter stageWriter) {
            this.stageWriter = stageWriter;
            return this;
        }

        /**
         * Sets the uploader to the archive store.
         *
         * <p><b>Required.</b>
         *
         * @param uploader the archive uploader
         * @return this builder
         */
        public Builder uploader(ArchiveUploader uploader) {
            this.uploader = uploader;
            return this;
        }

        /**
         * Sets the container (bucket) that receives archive records.
         *
         * <p><b>Required.</b>
         *
         * @param container the container name
         * @return this builder
         */
        public Builder container(String container) {
            this.container = container;
            return this;
        }

        /**
         * Sets the pause applied before every event, matching or not.
         *
         * <p>Optional. Defaults to 5 seconds; {@link Duration#ZERO} disables it.
         *
         * @param interEventDelay the delay
         * @return this builder
         */
        public Builder interEventDelay(Duration interEventDelay) {
            this.interEventDelay = interEventDelay;
            return this;
        }

        /**
         * Optional. Defaults to {@link GeoFilter#INSTANCE}.
         *
         * @param filter the event filter
         * @return this builder
         */
        public Builder filter(EventFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public ArchivingEventHandler build() {
            return new ArchivingEventHandler(this);
        }
    }
}
