package io.geostream.archive;

import io.geostream.spi.ArchiveStore;
import io.geostream.spi.MetricsExporter;
import io.geostream.stage.StagedFile;
import io.geostream.util.DaemonThreadFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Transfers staged files to an {@link ArchiveStore} under a key chosen by an
 * {@link ArchiveKeyStrategy}.
 *
 * <p>Each upload is bounded by the configured timeout; a timed-out upload is cancelled
 * and reported as an {@link UploadException}. There is no retry: the caller decides what
 * to do with the staged file.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to stop its upload threads.
 */
public final class ArchiveUploader implements AutoCloseable {

    private final ArchiveStore archiveStore;
    private final ArchiveKeyStrategy keyStrategy;
    private final Duration uploadTimeout;
    private final MetricsExporter metrics;
    private final ExecutorService uploadExecutor;

    private ArchiveUploader(Builder builder) {
        this.archiveStore = Objects.requireNonNull(builder.archiveStore, "archiveStore");
        this.keyStrategy = builder.keyStrategy != null ? builder.keyStrategy : ArchiveKeyStrategy.localPath();
        Duration timeout = Objects.requireNonNull(builder.uploadTimeout, "uploadTimeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("uploadTimeout must be >= 0");
        }
        this.uploadTimeout = timeout;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.uploadExecutor = timeout.isZero()
                ? null
                : Executors.newCachedThreadPool(new DaemonThreadFactory("geostream-upload-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the key a staged file would be archived under.
     *
     * @param stagedFile the staged file
     * @return the archive key
     */
    public String keyFor(StagedFile stagedFile) {
        String key = keyStrategy.keyFor(stagedFile);
        if (key == null || key.isEmpty()) {
            throw new IllegalStateException("Key strategy returned an empty key for event " + stagedFile.eventId());
        }
        return key;
    }

    /**
     * Uploads the staged file's bytes to {@code container}.
     *
     * @param stagedFile the file to upload
     * @param container  the target container or bucket
     * @return the key the record was stored under
     * @throws UploadException if the file cannot be read, the store rejects the write,
     *                         or the upload exceeds the timeout
     */
    public String upload(StagedFile stagedFile, String container) {
        Objects.requireNonNull(stagedFile, "stagedFile");
        Objects.requireNonNull(container, "container");
        String key = keyFor(stagedFile);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(stagedFile.path());
        } catch (IOException e) {
            throw new UploadException(key, "Cannot read staged file " + stagedFile.path(), e);
        }

        long start = System.nanoTime();
        if (uploadExecutor == null) {
            putDirect(container, key, bytes);
        } else {
            putWithTimeout(container, key, bytes);
        }
        metrics.recordUploadDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return key;
    }

    private void putDirect(String container, String key, byte[] bytes) {
        try {
            archiveStore.put(container, key, bytes);
        } catch (RuntimeException e) {
            throw new UploadException(key, "Upload failed for " + container + "/" + key, e);
        }
    }

    private void putWithTimeout(String container, String key, byte[] bytes) {
        Future<?> future;
        try {
            future = uploadExecutor.submit(() -> archiveStore.put(container, key, bytes));
        } catch (RuntimeException e) {
            throw new UploadException(key, "Upload rejected for " + container + "/" + key, e);
        }
        try {
            future.get(uploadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UploadException(key, "Upload timed out after " + uploadTimeout.toMillis()
                    + " ms for " + container + "/" + key, e);
        } catch (ExecutionException e) {
            throw new UploadException(key, "Upload failed for " + container + "/" + key, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UploadException(key, "Upload interrupted for " + container + "/" + key, e);
        }
    }

    /**
     * Stops the upload threads and closes the archive store.
     */
    @Override
    public void close() {
        if (uploadExecutor != null) {
            uploadExecutor.shutdownNow();
        }
        archiveStore.close();
    }

    /** Builder for {@link ArchiveUploader}. */
    public static final class Builder {
        private ArchiveStore archiveStore;
        private ArchiveKeyStrategy keyStrategy;
        private Duration uploadTimeout = Duration.ofSeconds(30);
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the archive store that receives uploads.
         *
         * <p><b>Required.</b>
         *
         * @param archiveStore the store
         * @return this builder
         */
        public Builder archiveStore(ArchiveStore archiveStore) {
            this.archiveStore = archiveStore;
            return this;
        }

        /**
         * Sets how archive keys are derived from staged files.
         *
         * <p>Optional. Defaults to {@link ArchiveKeyStrategy#localPath()}.
         *
         * @param keyStrategy the key strategy
         * @return this builder
         */
        public Builder keyStrategy(ArchiveKeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        /**
         * Sets the maximum duration of one upload.
         *
         * <p>Optional. Defaults to 30 seconds. {@link Duration#ZERO} disables the timeout
         * and runs uploads on the calling thread.
         *
         * @param uploadTimeout the timeout
         * @return this builder
         */
        public Builder uploadTimeout(Duration uploadTimeout) {
            this.uploadTimeout = uploadTimeout;
            return this;
        }

        /**
         * Sets the metrics exporter for upload durations.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public ArchiveUploader build() {
            return new ArchiveUploader(this);
        }
    }
}
