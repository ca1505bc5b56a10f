package io.geostream;

import io.geostream.archive.ArchiveKeyStrategy;
import io.geostream.archive.ArchiveUploader;
import io.geostream.dispatch.EventDispatcher;
import io.geostream.dispatch.InFlightTracker;
import io.geostream.filter.EventFilter;
import io.geostream.handler.ArchivingEventHandler;
import io.geostream.handler.HandleResult;
import io.geostream.spi.ArchiveStore;
import io.geostream.spi.FeedSource;
import io.geostream.spi.MetricsExporter;
import io.geostream.stage.StageException;
import io.geostream.stage.StageWriter;
import io.geostream.stage.StagedFile;
import io.geostream.stream.RetryPolicy;
import io.geostream.stream.StreamSupervisor;
import io.geostream.stream.SupervisorState;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link StreamSupervisor}, an
 * {@link ArchivingEventHandler} (optionally behind an {@link EventDispatcher}) and an
 * {@link ArchiveUploader} into a single {@link AutoCloseable} worker.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (GeoStream geoStream = GeoStream.builder()
 *     .feedSource(feedSource)
 *     .archiveStore(archiveStore)
 *     .stagingDirectory(Path.of("tweets"))
 *     .containerName("earthlab-geolocated-tweets")
 *     .build()) {
 *   geoStream.start();
 *   geoStream.awaitTermination();
 * }
 * }</pre>
 *
 * <p>On {@link #start()}, files left in the staging directory by a previous run are uploaded
 * before the subscription opens, unless {@link Builder#resumeOrphans(boolean)} is off.
 *
 * @see StreamSupervisor
 * @see ArchivingEventHandler
 */
public final class GeoStream implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(GeoStream.class.getName());

  public static final Path DEFAULT_STAGING_DIRECTORY = Path.of("tweets");
  public static final String DEFAULT_CONTAINER_NAME = "earthlab-geolocated-tweets";

  private final StageWriter stageWriter;
  private final ArchiveUploader uploader;
  private final ArchivingEventHandler handler;
  private final EventDispatcher dispatcher;
  private final StreamSupervisor supervisor;
  private final MetricsExporter metrics;
  private final boolean resumeOrphans;
  private final AtomicBoolean started = new AtomicBoolean(false);

  private GeoStream(StageWriter stageWriter, ArchiveUploader uploader,
      ArchivingEventHandler handler, EventDispatcher dispatcher,
      StreamSupervisor supervisor, MetricsExporter metrics, boolean resumeOrphans) {
    this.stageWriter = stageWriter;
    this.uploader = uploader;
    this.handler = handler;
    this.dispatcher = dispatcher;
    this.supervisor = supervisor;
    this.metrics = metrics;
    this.resumeOrphans = resumeOrphans;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Uploads orphaned staged files (if enabled) and starts the subscription.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("GeoStream already started");
    }
    if (resumeOrphans) {
      resumeOrphans();
    }
    supervisor.start();
  }

  /**
   * Uploads every {@code *.json} file left in the staging directory and removes the ones that
   * were archived. Files that fail again stay in place.
   *
   * @return one result per orphaned file, oldest first
   */
  public List<HandleResult> resumeOrphans() {
    List<StagedFile> orphans;
    try {
      orphans = stageWriter.sweep();
    } catch (StageException e) {
      logger.log(Level.WARNING, "Failed to sweep staging directory " + stageWriter.stagingDirectory(), e);
      return List.of();
    }
    if (orphans.isEmpty()) {
      return List.of();
    }
    logger.info("Resuming " + orphans.size() + " staged file(s) from " + stageWriter.stagingDirectory());
    List<HandleResult> results = new ArrayList<>(orphans.size());
    for (StagedFile orphan : orphans) {
      results.add(handler.archive(orphan));
    }
    return results;
  }

  /**
   * Blocks until the subscription has terminated.
   *
   * @throws io.geostream.auth.AuthException if the worker stopped because authentication failed
   * @throws InterruptedException            if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    supervisor.awaitTermination();
  }

  /**
   * @param timeout maximum time to wait
   * @return {@code true} if terminated within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return supervisor.awaitTermination(timeout);
  }

  public SupervisorState state() {
    return supervisor.state();
  }

  public ArchivingEventHandler handler() {
    return handler;
  }

  public StreamSupervisor supervisor() {
    return supervisor;
  }

  /**
   * Shuts down components in order: supervisor, dispatcher, uploader (and its archive store),
   * then the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      supervisor.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (dispatcher != null) {
      try {
        dispatcher.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      uploader.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link GeoStream}.
   */
  public static final class Builder {
    private FeedSource feedSource;
    private ArchiveStore archiveStore;
    private Path stagingDirectory = DEFAULT_STAGING_DIRECTORY;
    private String containerName = DEFAULT_CONTAINER_NAME;
    private Duration interEventDelay = ArchivingEventHandler.DEFAULT_INTER_EVENT_DELAY;
    private BoundingBox boundingBox = BoundingBox.CONTIGUOUS_US;
    private EventFilter filter;
    private ArchiveKeyStrategy keyStrategy;
    private Duration uploadTimeout = Duration.ofSeconds(30);
    private RetryPolicy retryPolicy;
    private boolean reconnect = true;
    private int maxReconnectAttempts;
    private Duration stableAfter = Duration.ofSeconds(60);
    private int workerCount;
    private int queueCapacity = 1000;
    private long drainTimeoutMs = 5000;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private boolean resumeOrphans = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the upstream feed.
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
     * Sets the object store receiving archive records. Closed together with this worker.
     *
     * <p><b>Required.</b>
     *
     * @param archiveStore the archive store
     * @return this builder
     */
    public Builder archiveStore(ArchiveStore archiveStore) {
      this.archiveStore = archiveStore;
      return this;
    }

    /**
     * Optional. Defaults to {@code tweets} relative to the working directory.
     *
     * @param stagingDirectory directory for staged files
     * @return this builder
     */
    public Builder stagingDirectory(Path stagingDirectory) {
      this.stagingDirectory = stagingDirectory;
      return this;
    }

    /**
     * Optional. Defaults to {@code earthlab-geolocated-tweets}.
     *
     * @param containerName the target container or bucket
     * @return this builder
     */
    public Builder containerName(String containerName) {
      this.containerName = containerName;
      return this;
    }

    /**
     * Sets the pause applied before each event.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param interEventDelay the delay
     * @return this builder
     */
    public Builder interEventDelay(Duration interEventDelay) {
      this.interEventDelay = interEventDelay;
      return this;
    }

    /**
     * Sets the subscription-wide geographic filter.
     *
     * <p>Optional. Defaults to {@link BoundingBox#CONTIGUOUS_US}.
     *
     * @param boundingBox the bounding box
     * @return this builder
     */
    public Builder boundingBox(BoundingBox boundingBox) {
      this.boundingBox = boundingBox;
      return this;
    }

    public Builder filter(EventFilter filter) {
      this.filter = filter;
      return this;
    }

    /**
     * Optional. Defaults to {@link ArchiveKeyStrategy#localPath()}.
     *
     * @param keyStrategy how archive keys are derived
     * @return this builder
     */
    public Builder keyStrategy(ArchiveKeyStrategy keyStrategy) {
      this.keyStrategy = keyStrategy;
      return this;
    }

    public Builder uploadTimeout(Duration uploadTimeout) {
      this.uploadTimeout = uploadTimeout;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder reconnect(boolean reconnect) {
      this.reconnect = reconnect;
      return this;
    }

    public Builder maxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
      return this;
    }

    public Builder stableAfter(Duration stableAfter) {
      this.stableAfter = stableAfter;
      return this;
    }

    /**
     * Sets the number of worker threads handling events.
     *
     * <p>Optional. Defaults to {@code 0}: events are handled on the stream thread, one at a
     * time, and the inter-event delay throttles consumption.
     *
     * @param workerCount worker threads, or 0 for synchronous handling
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     *
     * @param resumeOrphans whether {@link GeoStream#start()} uploads files left by a previous run
     * @return this builder
     */
    public Builder resumeOrphans(boolean resumeOrphans) {
      this.resumeOrphans = resumeOrphans;
      return this;
    }

    /**
     * Builds the worker. If a later component fails to build, the earlier ones are closed
     * before rethrowing.
     *
     * @return the composite worker, not yet started
     */
    public GeoStream build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(feedSource, "feedSource");
      Objects.requireNonNull(archiveStore, "archiveStore");
      if (workerCount < 0) {
        throw new IllegalArgumentException("workerCount must be >= 0, got: " + workerCount);
      }
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;

      StageWriter stageWriter = new StageWriter(stagingDirectory);
      ArchiveUploader uploader = ArchiveUploader.builder()
          .archiveStore(archiveStore)
          .keyStrategy(keyStrategy)
          .uploadTimeout(uploadTimeout)
          .metrics(effectiveMetrics)
          .build();

      EventDispatcher dispatcher = null;
      try {
        ArchivingEventHandler handler = ArchivingEventHandler.builder()
            .stageWriter(stageWriter)
            .uploader(uploader)
            .container(containerName)
            .interEventDelay(interEventDelay)
            .filter(filter)
            .metrics(effectiveMetrics)
            .build();

        StreamListener listener = handler;
        if (workerCount > 0) {
          EventDispatcher.Builder db = EventDispatcher.builder()
              .delegate(handler)
              .workerCount(workerCount)
              .queueCapacity(queueCapacity)
              .drainTimeoutMs(drainTimeoutMs)
              .metrics(effectiveMetrics);
          if (inFlightTracker != null) {
            db.inFlightTracker(inFlightTracker);
          }
          dispatcher = db.build();
          listener = dispatcher;
        }

        StreamSupervisor supervisor = StreamSupervisor.builder()
            .feedSource(feedSource)
            .filter(boundingBox)
            .listener(listener)
            .retryPolicy(retryPolicy)
            .reconnect(reconnect)
            .maxReconnectAttempts(maxReconnectAttempts)
            .stableAfter(stableAfter)
            .metrics(effectiveMetrics)
            .build();

        return new GeoStream(stageWriter, uploader, handler, dispatcher, supervisor,
            effectiveMetrics, resumeOrphans);
      } catch (RuntimeException e) {
        if (dispatcher != null) {
          dispatcher.close();
        }
        uploader.close();
        throw e;
      }
    }
  }
}
