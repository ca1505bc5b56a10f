package io.geostream.sample.worker;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs the archive counters once a minute.
 */
@Component
@EnableScheduling
public class ArchiveReporter {

  private static final Logger log = LoggerFactory.getLogger(ArchiveReporter.class);

  private final MeterRegistry registry;
  private final String prefix;

  public ArchiveReporter(MeterRegistry registry, @Value("${geostream.metrics.name-prefix:geostream}") String prefix) {
    this.registry = registry;
    this.prefix = prefix;
  }

  @Scheduled(fixedDelayString = "${worker.report-interval:PT1M}", initialDelayString = "${worker.report-interval:PT1M}")
  public void report() {
    log.info("received={} matched={} archived={} uploadFailures={} stageFailures={} reconnects={}",
        count("events.received"), count("events.matched"), count("archive.success"),
        count("archive.failure"), count("stage.failure"), count("stream.reconnects"));
  }

  private long count(String name) {
    var counter = registry.find(prefix + "." + name).counter();
    return counter == null ? 0 : (long) counter.count();
  }
}
