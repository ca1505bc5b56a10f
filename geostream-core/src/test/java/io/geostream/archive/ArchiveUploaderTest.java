package io.geostream.archive;

import io.geostream.RecordingMetrics;
import io.geostream.spi.ArchiveStoreException;
import io.geostream.stage.StagedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveUploaderTest {

    @TempDir
    Path tempDir;

    @Test
    void uploadsStagedBytesUnderStrategyKey() throws IOException {
        RecordingArchiveStore store = new RecordingArchiveStore();
        StagedFile staged = stage("42", "{\"a\":1}");

        try (ArchiveUploader uploader = ArchiveUploader.builder()
                .archiveStore(store)
                .keyStrategy(ArchiveKeyStrategy.eventId("tweets/"))
                .build()) {
            String key = uploader.upload(staged, "bucket");

            assertEquals("tweets/42.json", key);
        }
        assertEquals(1, store.puts.size());
        assertEquals("bucket", store.puts.get(0).container());
        assertEquals("{\"a\":1}", store.puts.get(0).content());
    }

    @Test
    void defaultStrategyUsesLocalPath() throws IOException {
        RecordingArchiveStore store = new RecordingArchiveStore();
        StagedFile staged = stage("7", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder().archiveStore(store).build()) {
            String key = uploader.upload(staged, "bucket");

            assertTrue(key.endsWith("/7.json"), key);
            assertEquals(ArchiveKeyStrategy.localPath().keyFor(staged), key);
        }
    }

    @Test
    void storeFailureIsUploadException() throws IOException {
        RecordingArchiveStore store = new RecordingArchiveStore().alwaysFail();
        StagedFile staged = stage("1", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder()
                .archiveStore(store)
                .keyStrategy(ArchiveKeyStrategy.eventId(""))
                .build()) {
            UploadException e = assertThrows(UploadException.class, () -> uploader.upload(staged, "bucket"));

            assertEquals("1.json", e.key());
            assertInstanceOf(ArchiveStoreException.class, e.getCause());
        }
    }

    @Test
    void missingStagedFileIsUploadException() {
        RecordingArchiveStore store = new RecordingArchiveStore();
        StagedFile staged = new StagedFile("1", tempDir.resolve("1.json"), 2);

        try (ArchiveUploader uploader = ArchiveUploader.builder().archiveStore(store).build()) {
            assertThrows(UploadException.class, () -> uploader.upload(staged, "bucket"));
        }
        assertEquals(0, store.attempts.get());
    }

    @Test
    void slowUploadTimesOut() throws IOException {
        CountDownLatch release = new CountDownLatch(1);
        RecordingArchiveStore store = new RecordingArchiveStore()
                .onPut((container, key) -> release.await(5, TimeUnit.SECONDS));
        StagedFile staged = stage("1", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder()
                .archiveStore(store)
                .uploadTimeout(Duration.ofMillis(100))
                .build()) {
            UploadException e = assertThrows(UploadException.class, () -> uploader.upload(staged, "bucket"));

            assertInstanceOf(TimeoutException.class, e.getCause());
        } finally {
            release.countDown();
        }
    }

    @Test
    void zeroTimeoutUploadsOnCallingThread() throws IOException {
        RecordingArchiveStore store = new RecordingArchiveStore();
        StagedFile staged = stage("1", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder()
                .archiveStore(store)
                .uploadTimeout(Duration.ZERO)
                .build()) {
            uploader.upload(staged, "bucket");
        }
        assertEquals(Thread.currentThread().getName(), store.puts.get(0).threadName());
    }

    @Test
    void timedUploadsRunOnUploadThreads() throws IOException {
        RecordingArchiveStore store = new RecordingArchiveStore();
        StagedFile staged = stage("1", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder().archiveStore(store).build()) {
            uploader.upload(staged, "bucket");
        }
        assertTrue(store.puts.get(0).threadName().startsWith("geostream-upload-"));
    }

    @Test
    void recordsUploadDuration() throws IOException {
        RecordingMetrics metrics = new RecordingMetrics();
        StagedFile staged = stage("1", "{}");

        try (ArchiveUploader uploader = ArchiveUploader.builder()
                .archiveStore(new RecordingArchiveStore())
                .metrics(metrics)
                .build()) {
            uploader.upload(staged, "bucket");
        }
        assertEquals(1, metrics.uploadDurations.size());
        assertTrue(metrics.uploadDurations.get(0) >= 0);
    }

    @Test
    void closeClosesArchiveStore() {
        RecordingArchiveStore store = new RecordingArchiveStore();

        ArchiveUploader.builder().archiveStore(store).build().close();

        assertTrue(store.closed.get());
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> ArchiveUploader.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ArchiveUploader.builder()
                .archiveStore(new RecordingArchiveStore())
                .uploadTimeout(Duration.ofSeconds(-1))
                .build());
    }

    private StagedFile stage(String id, String content) throws IOException {
        Path path = Files.writeString(tempDir.resolve(id + ".json"), content);
        return new StagedFile(id, path, content.length());
    }
}
