package io.geostream.spring.boot;

import io.geostream.GeoStream;

import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Starts streaming once the context is refreshed and closes the {@link GeoStream} on
 * shutdown, before its dependencies are destroyed.
 */
public class GeoStreamLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(GeoStreamLifecycle.class.getName());

  private final GeoStream geoStream;
  private volatile boolean running;

  public GeoStreamLifecycle(GeoStream geoStream) {
    this.geoStream = Objects.requireNonNull(geoStream, "geoStream");
  }

  @Override
  public void start() {
    geoStream.start();
    running = true;
    logger.info("GeoStream started");
  }

  @Override
  public void stop() {
    try {
      geoStream.close();
    } finally {
      running = false;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
