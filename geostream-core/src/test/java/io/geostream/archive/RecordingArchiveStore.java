package io.geostream.archive;

import io.geostream.spi.ArchiveStore;
import io.geostream.spi.ArchiveStoreException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ArchiveStore} that records every put. Can be told to fail or to run a
 * hook before recording.
 */
public class RecordingArchiveStore implements ArchiveStore {

    public record Put(String container, String key, byte[] bytes, String threadName) {
        public String content() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public final List<Put> puts = new CopyOnWriteArrayList<>();
    public final AtomicInteger attempts = new AtomicInteger();
    public final AtomicBoolean closed = new AtomicBoolean();
    private volatile RuntimeException failure;
    private volatile PutHook hook;

    @FunctionalInterface
    public interface PutHook {
        void beforePut(String container, String key) throws Exception;
    }

    public RecordingArchiveStore failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public RecordingArchiveStore alwaysFail() {
        return failWith(new ArchiveStoreException("store unavailable"));
    }

    public RecordingArchiveStore onPut(PutHook hook) {
        this.hook = hook;
        return this;
    }

    @Override
    public void put(String container, String key, byte[] bytes) {
        attempts.incrementAndGet();
        PutHook h = hook;
        if (h != null) {
            try {
                h.beforePut(container, key);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArchiveStoreException("interrupted", e);
            } catch (Exception e) {
                throw new ArchiveStoreException("hook failed", e);
            }
        }
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
        puts.add(new Put(container, key, bytes.clone(), Thread.currentThread().getName()));
    }

    public List<String> keys() {
        return puts.stream().map(Put::key).toList();
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
