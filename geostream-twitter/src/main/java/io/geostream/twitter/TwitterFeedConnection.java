package io.geostream.twitter;

import io.geostream.StreamListener;
import io.geostream.spi.FeedConnection;
import io.geostream.stream.SubscriptionException;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An open streaming response. Reads one line at a time, skips keep-alives and control
 * notices, and hands decoded posts to the listener.
 */
final class TwitterFeedConnection implements FeedConnection {
    private static final Logger logger = Logger.getLogger(TwitterFeedConnection.class.getName());

    private final LineQueue lines;
    private final CompletableFuture<HttpResponse<Void>> response;
    private final TweetDecoder decoder;
    private final long stallTimeoutMs;

    TwitterFeedConnection(LineQueue lines, CompletableFuture<HttpResponse<Void>> response,
                          TweetDecoder decoder, Duration stallTimeout) {
        this.lines = Objects.requireNonNull(lines, "lines");
        this.response = Objects.requireNonNull(response, "response");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.stallTimeoutMs = stallTimeout.toMillis();
    }

    @Override
    public void deliver(StreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        while (true) {
            Object item;
            try {
                item = lines.poll(stallTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                return;
            }

            if (item == null) {
                if (lines.isCancelled()) {
                    return;
                }
                close();
                throw new SubscriptionException("Stream stalled: no data for " + stallTimeoutMs + " ms");
            }
            if (item == LineQueue.CANCELLED) {
                return;
            }
            if (item == LineQueue.END) {
                logger.log(Level.INFO, "Stream closed by remote");
                return;
            }
            if (item instanceof LineQueue.Failure failure) {
                if (lines.isCancelled()) {
                    return;
                }
                throw new SubscriptionException("Stream read failed: " + failure.cause().getMessage(), failure.cause());
            }

            String line = (String) item;
            lines.requestNext();
            if (line.isBlank()) {
                continue;
            }
            dispatch(line, listener);
        }
    }

    private void dispatch(String line, StreamListener listener) {
        TwitterMessage message;
        try {
            message = decoder.decode(line);
        } catch (TweetDecodingException e) {
            reportError(listener, e);
            return;
        }

        if (message instanceof TwitterMessage.Tweet tweet) {
            try {
                listener.onEvent(tweet.event());
            } catch (RuntimeException e) {
                reportError(listener, e);
            }
        } else if (message instanceof TwitterMessage.Control control) {
            if ("warning".equals(control.kind()) || "limit".equals(control.kind())) {
                logger.log(Level.INFO, "Stream notice: {0}", control.body());
            } else {
                logger.log(Level.FINE, "Skipping {0} notice", control.kind());
            }
        } else if (message instanceof TwitterMessage.Disconnect disconnect) {
            close();
            throw new SubscriptionException("Disconnected by server: code=" + disconnect.code()
                    + ", reason=" + disconnect.reason());
        }
    }

    private static void reportError(StreamListener listener, Throwable error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Listener onError failed", e);
        }
    }

    @Override
    public void close() {
        lines.cancel();
        response.cancel(true);
    }
}
