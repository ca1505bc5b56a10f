package io.geostream.spring.boot;

import io.geostream.BoundingBox;
import io.geostream.GeoStream;
import io.geostream.archive.ArchiveKeyStrategy;
import io.geostream.archive.FileSystemArchiveStore;
import io.geostream.filter.EventFilter;
import io.geostream.spi.ArchiveStore;
import io.geostream.spi.FeedSource;
import io.geostream.spi.MetricsExporter;
import io.geostream.stream.ExponentialBackoffRetryPolicy;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for the GeoStream archiver.
 *
 * <p>Wires a {@link GeoStream} composite from a {@link FeedSource}, an {@link ArchiveStore}
 * and {@link GeoStreamProperties}. Without a user or adapter-provided store, records go to a
 * {@link FileSystemArchiveStore} under {@code geostream.archive.local-root}.
 *
 * @see GeoStreamProperties
 * @see GeoStreamTwitterAutoConfiguration
 * @see GeoStreamAzureAutoConfiguration
 * @see GeoStreamMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(GeoStream.class)
@ConditionalOnBean(FeedSource.class)
@EnableConfigurationProperties(GeoStreamProperties.class)
public class GeoStreamAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ArchiveStore.class)
  public FileSystemArchiveStore archiveStore(GeoStreamProperties props) {
    return new FileSystemArchiveStore(Path.of(props.getArchive().getLocalRoot()));
  }

  @Bean
  @ConditionalOnMissingBean
  public ArchiveKeyStrategy archiveKeyStrategy(GeoStreamProperties props) {
    return switch (props.getArchive().getKeyStrategy()) {
      case LOCAL_PATH -> ArchiveKeyStrategy.localPath();
      case EVENT_ID -> ArchiveKeyStrategy.eventId(props.getArchive().getKeyPrefix());
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public GeoStream geoStream(GeoStreamProperties props,
      FeedSource feedSource,
      ArchiveStore archiveStore,
      ArchiveKeyStrategy keyStrategy,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EventFilter> filterProvider) {

    var reconnect = props.getReconnect();
    var dispatcher = props.getDispatcher();
    var builder = GeoStream.builder()
        .feedSource(feedSource)
        .archiveStore(archiveStore)
        .stagingDirectory(Path.of(props.getStagingDirectory()))
        .containerName(props.getContainerName())
        .interEventDelay(props.getInterEventDelay())
        .boundingBox(BoundingBox.parse(props.getBoundingBox()))
        .keyStrategy(keyStrategy)
        .uploadTimeout(props.getArchive().getUploadTimeout())
        .retryPolicy(new ExponentialBackoffRetryPolicy(reconnect.getBaseDelayMs(), reconnect.getMaxDelayMs()))
        .reconnect(reconnect.isEnabled())
        .maxReconnectAttempts(reconnect.getMaxAttempts())
        .stableAfter(reconnect.getStableAfter())
        .workerCount(dispatcher.getWorkerCount())
        .queueCapacity(dispatcher.getQueueCapacity())
        .drainTimeoutMs(dispatcher.getDrainTimeout().toMillis())
        .resumeOrphans(props.isResumeOrphans());

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    EventFilter filter = filterProvider.getIfAvailable();
    if (filter != null) {
      builder.filter(filter);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "geostream", name = "auto-start", matchIfMissing = true)
  public GeoStreamLifecycle geoStreamLifecycle(GeoStream geoStream) {
    return new GeoStreamLifecycle(geoStream);
  }
}
