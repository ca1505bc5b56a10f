package io.geostream.twitter;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bridges the HTTP client's push-style line publisher to the pull-style delivery loop.
 *
 * <p>Demand is one line at a time: the reader calls {@link #requestNext()} after taking a
 * line, so a slow listener backs up into the transport instead of into memory.
 */
final class LineQueue implements Flow.Subscriber<String> {
    static final Object END = new Object();
    static final Object CANCELLED = new Object();

    private final BlockingQueue<Object> items = new LinkedBlockingQueue<>();
    private volatile Flow.Subscription subscription;
    private volatile boolean cancelled;

    /**
     * Terminal transport failure, queued behind any lines already received.
     */
    record Failure(Throwable cause) {
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (cancelled) {
            subscription.cancel();
            return;
        }
        subscription.request(1);
    }

    @Override
    public void onNext(String line) {
        items.add(line);
    }

    @Override
    public void onError(Throwable throwable) {
        items.add(new Failure(throwable));
    }

    @Override
    public void onComplete() {
        items.add(END);
    }

    /**
     * Waits for the next item: a {@code String} line, {@link #END}, {@link #CANCELLED} or a
     * {@link Failure}.
     *
     * @return the item, or {@code null} if nothing arrived within the timeout
     */
    Object poll(long timeout, TimeUnit unit) throws InterruptedException {
        return items.poll(timeout, unit);
    }

    void requestNext() {
        Flow.Subscription s = subscription;
        if (s != null && !cancelled) {
            s.request(1);
        }
    }

    /**
     * Cancels the upstream subscription and wakes a blocked {@link #poll}. Idempotent.
     */
    void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        Flow.Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        items.add(CANCELLED);
    }

    boolean isCancelled() {
        return cancelled;
    }
}
