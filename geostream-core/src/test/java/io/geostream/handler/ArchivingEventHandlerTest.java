package io.geostream.handler;

import io.geostream.BoundingBox;
import io.geostream.GeoEvent;
import io.geostream.Place;
import io.geostream.RecordingMetrics;
import io.geostream.archive.ArchiveKeyStrategy;
import io.geostream.archive.ArchiveUploader;
import io.geostream.archive.RecordingArchiveStore;
import io.geostream.archive.UploadException;
import io.geostream.stage.StageWriter;
import io.geostream.stage.StagedFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchivingEventHandlerTest {
    private static final String CONTAINER = "earthlab-geolocated-tweets";

    @TempDir
    Path tempDir;

    private final RecordingArchiveStore store = new RecordingArchiveStore();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final List<Duration> sleeps = new ArrayList<>();
    private ArchiveUploader uploader;

    @AfterEach
    void closeUploader() {
        if (uploader != null) {
            uploader.close();
        }
    }

    // ── Archiving ───────────────────────────────────────────────────

    @Test
    void placeTaggedEventIsStagedUploadedAndRemoved() {
        Path stagingDir = tempDir.resolve("tweets");
        ArchivingEventHandler handler = newHandler(stagingDir, Duration.ZERO);
        GeoEvent event = GeoEvent.builder("42")
                .place(new Place("Denver", "Denver, CO", "US", new BoundingBox(-105.11, 39.61, -104.6, 39.91)))
                .payloadJson("{\"id_str\":\"42\",\"place\":{\"full_name\":\"Denver, CO\"}}")
                .build();

        HandleResult result = handler.handle(event);

        String expectedKey = ArchiveKeyStrategy.localPath().keyFor(
                new StagedFile("42", stagingDir.resolve("42.json"), 0));
        assertEquals(new HandleResult.Archived("42", expectedKey), result);
        assertTrue(expectedKey.endsWith("tweets/42.json"), expectedKey);
        assertEquals(1, store.puts.size());
        assertEquals(CONTAINER, store.puts.get(0).container());
        assertEquals(event.payloadJson(), store.puts.get(0).content());
        assertFalse(Files.exists(stagingDir.resolve("42.json")));
        assertEquals(1, metrics.matched.get());
        assertEquals(1, metrics.archiveSuccess.get());
    }

    @Test
    void eventWithoutGeoSignalIsSkippedWithoutSideEffects() {
        Path stagingDir = tempDir.resolve("tweets");
        ArchivingEventHandler handler = newHandler(stagingDir, Duration.ZERO);

        HandleResult result = handler.handle(GeoEvent.ofJson("7", "{\"id_str\":\"7\"}"));

        assertEquals(new HandleResult.Skipped("7"), result);
        assertFalse(Files.exists(stagingDir));
        assertEquals(0, store.attempts.get());
        assertEquals(1, metrics.skipped.get());
    }

    // ── Failure handling ────────────────────────────────────────────

    @Test
    void failingUploadKeepsStagedFileAndNextEventIsStillProcessed() {
        store.alwaysFail();
        ArchivingEventHandler handler = newHandler(tempDir, Duration.ZERO);

        HandleResult first = assertDoesNotThrow(() -> handler.handle(geoEvent("1")));
        HandleResult second = assertDoesNotThrow(() -> handler.handle(geoEvent("2")));

        HandleResult.Failed failed = assertInstanceOf(HandleResult.Failed.class, first);
        assertEquals(HandleResult.FailureStage.UPLOAD, failed.stage());
        assertInstanceOf(UploadException.class, failed.cause());
        assertInstanceOf(HandleResult.Failed.class, second);
        assertTrue(Files.exists(tempDir.resolve("1.json")));
        assertTrue(Files.exists(tempDir.resolve("2.json")));
        assertEquals(2, store.attempts.get());
        assertEquals(2, metrics.archiveFailure.get());
    }

    @Test
    void stagingFailureSkipsUpload() throws IOException {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "not a directory");
        ArchivingEventHandler handler = newHandler(blocked, Duration.ZERO);

        HandleResult result = handler.handle(geoEvent("1"));

        HandleResult.Failed failed = assertInstanceOf(HandleResult.Failed.class, result);
        assertEquals(HandleResult.FailureStage.STAGE, failed.stage());
        assertEquals(0, store.attempts.get());
        assertEquals(1, metrics.stageFailure.get());
    }

    @Test
    void cleanupFailureIsReportedAfterSuccessfulUpload() {
        // Replace the staged file with a non-empty directory so it cannot be deleted
        store.onPut((container, key) -> {
            Path staged = tempDir.resolve("3.json");
            Files.delete(staged);
            Files.createDirectories(staged.resolve("child"));
        });
        ArchivingEventHandler handler = newHandler(tempDir, Duration.ZERO);

        HandleResult result = handler.handle(geoEvent("3"));

        HandleResult.Failed failed = assertInstanceOf(HandleResult.Failed.class, result);
        assertEquals(HandleResult.FailureStage.CLEANUP, failed.stage());
        assertEquals(1, store.puts.size());
    }

    @Test
    void onErrorNeverThrows() {
        ArchivingEventHandler handler = newHandler(tempDir, Duration.ZERO);

        assertDoesNotThrow(() -> handler.onError(new IllegalStateException("boom")));
    }

    // ── Throughput ──────────────────────────────────────────────────

    @Test
    void alternatingEventsProduceOneUploadPerMatch() {
        ArchivingEventHandler handler = newHandler(tempDir, Duration.ZERO);

        for (int i = 0; i < 10; i++) {
            String id = String.valueOf(i);
            handler.onEvent(i % 2 == 0 ? geoEvent(id) : GeoEvent.ofJson(id, "{}"));
        }

        assertEquals(5, store.puts.size());
        assertEquals(5, new HashSet<>(store.keys()).size());
        assertEquals(5, metrics.skipped.get());
    }

    @Test
    void delayIsAppliedBeforeEveryEvent() {
        ArchivingEventHandler handler = newHandler(tempDir, Duration.ofSeconds(5));

        handler.handle(geoEvent("1"));
        handler.handle(GeoEvent.ofJson("2", "{}"));

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5)), sleeps);
    }

    @Test
    void interruptedDelayStillProcessesEventAndRestoresFlag() {
        ArchivingEventHandler handler = builder(tempDir)
                .interEventDelay(Duration.ofSeconds(5))
                .sleeper(duration -> {
                    throw new InterruptedException();
                })
                .build();

        HandleResult result = handler.handle(geoEvent("1"));

        assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        assertInstanceOf(HandleResult.Archived.class, result);
        assertEquals(1, store.puts.size());
    }

    @Test
    void customFilterReplacesGeoFilter() {
        ArchivingEventHandler handler = builder(tempDir)
                .interEventDelay(Duration.ZERO)
                .filter(event -> event.id().startsWith("keep"))
                .build();

        assertInstanceOf(HandleResult.Archived.class, handler.handle(GeoEvent.ofJson("keep-1", "{}")));
        assertInstanceOf(HandleResult.Skipped.class, handler.handle(geoEvent("drop-1")));
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> ArchivingEventHandler.builder().build());
        assertThrows(IllegalArgumentException.class, () -> builder(tempDir).container(" ").build());
        assertThrows(IllegalArgumentException.class, () ->
                builder(tempDir).interEventDelay(Duration.ofMillis(-1)).build());
    }

    private ArchivingEventHandler newHandler(Path stagingDir, Duration delay) {
        return builder(stagingDir).interEventDelay(delay).build();
    }

    private ArchivingEventHandler.Builder builder(Path stagingDir) {
        if (uploader == null) {
            uploader = ArchiveUploader.builder().archiveStore(store).uploadTimeout(Duration.ZERO).build();
        }
        return ArchivingEventHandler.builder()
                .stageWriter(new StageWriter(stagingDir))
                .uploader(uploader)
                .container(CONTAINER)
                .metrics(metrics)
                .sleeper(sleeps::add);
    }

    private static GeoEvent geoEvent(String id) {
        return GeoEvent.builder(id).coordinates(39.74, -104.99).payloadJson("{\"id_str\":\"" + id + "\"}").build();
    }
}
