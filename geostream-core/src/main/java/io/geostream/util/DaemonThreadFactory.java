package io.geostream.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory that creates named daemon threads with a sequential suffix.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, and so on. They never keep
 * the JVM alive; the owning component is responsible for joining them on close.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);
    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;

    public DaemonThreadFactory(String prefix) {
        this(prefix, null);
    }

    /**
     * @param prefix                   thread name prefix, e.g. {@code "geostream-upload-"}
     * @param uncaughtExceptionHandler handler installed on every thread; {@code null} keeps the JVM default
     */
    public DaemonThreadFactory(String prefix, Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        if (uncaughtExceptionHandler != null) {
            thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
        }
        return thread;
    }
}
