package io.geostream.spring.boot;

import io.geostream.GeoEvent;
import io.geostream.GeoStream;
import io.geostream.Place;
import io.geostream.micrometer.MicrometerMetricsExporter;
import io.geostream.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoStreamMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GeoStreamMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
            assertNotNull(ctx.getBean(MeterRegistry.class).find("geostream.events.received").counter());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("geostream.metrics.name-prefix=geo.us").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("geo.us.archive.success").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("geostream.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void notCreatedWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(GeoStreamMicrometerAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void archivedEventsAreCounted(@TempDir Path tempDir) {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        GeoStreamMicrometerAutoConfiguration.class, GeoStreamAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class, FeedConfig.class)
                .withPropertyValues(
                        "geostream.auto-start=false",
                        "geostream.inter-event-delay=0s",
                        "geostream.staging-directory=" + tempDir.resolve("tweets"),
                        "geostream.archive.local-root=" + tempDir.resolve("archive"))
                .run(ctx -> {
                    var handler = ctx.getBean(GeoStream.class).handler();
                    handler.handle(GeoEvent.builder("42")
                            .place(Place.of("Denver", null))
                            .payloadJson("{\"id_str\":\"42\"}")
                            .build());
                    handler.handle(GeoEvent.ofJson("7", "{\"id_str\":\"7\"}"));

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.get("geostream.archive.success").counter().count());
                    assertEquals(1.0, registry.get("geostream.events.skipped").counter().count());
                });
    }

    @Configuration
    static class FeedConfig {
        @Bean
        StubFeedSource feedSource() {
            return new StubFeedSource();
        }
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
