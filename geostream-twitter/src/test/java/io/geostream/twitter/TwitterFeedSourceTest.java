package io.geostream.twitter;

import io.geostream.BoundingBox;
import io.geostream.GeoEvent;
import io.geostream.StreamListener;
import io.geostream.auth.AuthException;
import io.geostream.auth.CredentialProvider;
import io.geostream.auth.OAuthCredentials;
import io.geostream.spi.FeedConnection;
import io.geostream.stream.SubscriptionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TwitterFeedSourceTest {
    private static final OAuthCredentials CREDENTIALS =
            new OAuthCredentials("consumer-key", "consumer-secret", "access-token", "access-secret");

    private StreamingEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        endpoint = new StreamingEndpoint();
    }

    @AfterEach
    void tearDown() {
        endpoint.close();
    }

    // ── Request ─────────────────────────────────────────────────────

    @Test
    void postsSignedLocationsFilter() {
        endpoint.respondWith(StreamingEndpoint.lines());

        try (FeedConnection connection = source().connect(BoundingBox.CONTIGUOUS_US)) {
            connection.deliver(new RecordingListener());
        }

        StreamingEndpoint.RecordedRequest request = endpoint.lastRequest.get();
        assertEquals("POST", request.method());
        assertEquals("application/x-www-form-urlencoded", request.contentType());
        assertEquals("locations=-124.848974%2C24.396308%2C-66.885444%2C49.384358", request.body());
        assertTrue(request.authorization().startsWith("OAuth "), request.authorization());
        assertTrue(request.authorization().contains("oauth_consumer_key=\"consumer-key\""));
        assertTrue(request.authorization().contains("oauth_token=\"access-token\""));
        assertTrue(request.authorization().contains("oauth_signature=\""));
    }

    @Test
    void credentialFailureStopsBeforeRequest() {
        TwitterFeedSource source = TwitterFeedSource.builder()
                .endpoint(endpoint.uri())
                .credentialProvider(() -> {
                    throw new AuthException("no credentials");
                })
                .build();

        assertThrows(AuthException.class, () -> source.connect(BoundingBox.CONTIGUOUS_US));
        assertEquals(0, endpoint.requests.get());
    }

    // ── Status mapping ──────────────────────────────────────────────

    @Test
    void unauthorizedIsAuthException() {
        endpoint.respondWith(StreamingEndpoint.status(401, Map.of()));

        assertThrows(AuthException.class, () -> source().connect(BoundingBox.CONTIGUOUS_US));
    }

    @Test
    void forbiddenIsAuthException() {
        endpoint.respondWith(StreamingEndpoint.status(403, Map.of()));

        assertThrows(AuthException.class, () -> source().connect(BoundingBox.CONTIGUOUS_US));
    }

    @Test
    void enhanceYourCalmHonorsRetryAfter() {
        endpoint.respondWith(StreamingEndpoint.status(420, Map.of("Retry-After", "120")));

        SubscriptionException e = assertThrows(SubscriptionException.class,
                () -> source().connect(BoundingBox.CONTIGUOUS_US));

        assertEquals(Duration.ofSeconds(120), e.retryAfter());
    }

    @Test
    void tooManyRequestsDefaultsToOneMinute() {
        endpoint.respondWith(StreamingEndpoint.status(429, Map.of()));

        SubscriptionException e = assertThrows(SubscriptionException.class,
                () -> source().connect(BoundingBox.CONTIGUOUS_US));

        assertEquals(Duration.ofSeconds(60), e.retryAfter());
    }

    @Test
    void serverErrorIsRecoverable() {
        endpoint.respondWith(StreamingEndpoint.status(503, Map.of()));

        SubscriptionException e = assertThrows(SubscriptionException.class,
                () -> source().connect(BoundingBox.CONTIGUOUS_US));

        assertTrue(e.getMessage().contains("503"), e.getMessage());
        assertNull(e.retryAfter());
    }

    @Test
    void unreachableEndpointIsRecoverable() {
        URI dead = endpoint.uri();
        endpoint.close();

        TwitterFeedSource source = TwitterFeedSource.builder()
                .endpoint(dead)
                .credentialProvider(CredentialProvider.of(CREDENTIALS))
                .connectTimeout(Duration.ofSeconds(2))
                .build();

        assertThrows(SubscriptionException.class, () -> source.connect(BoundingBox.CONTIGUOUS_US));
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void deliversPostsAndSkipsNoise() {
        endpoint.respondWith(StreamingEndpoint.lines(
                "",
                Fixtures.line("denver-place"),
                Fixtures.line("delete"),
                "",
                "{not json",
                Fixtures.line("boulder-point"),
                Fixtures.line("limit"),
                Fixtures.line("no-geo")));
        RecordingListener listener = new RecordingListener();

        try (FeedConnection connection = source().connect(BoundingBox.CONTIGUOUS_US)) {
            connection.deliver(listener);
        }

        assertEquals(List.of("42", "9001", "7"), listener.ids());
        assertEquals(1, listener.errors.size());
        assertInstanceOf(TweetDecodingException.class, listener.errors.get(0));
        assertEquals(Fixtures.line("denver-place"), listener.events.get(0).payloadJson());
    }

    @Test
    void listenerFailureDoesNotEndStream() {
        endpoint.respondWith(StreamingEndpoint.lines(
                Fixtures.line("denver-place"), Fixtures.line("boulder-point")));
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onEvent(GeoEvent event) {
                super.onEvent(event);
                if ("42".equals(event.id())) {
                    throw new IllegalStateException("boom");
                }
            }
        };

        try (FeedConnection connection = source().connect(BoundingBox.CONTIGUOUS_US)) {
            connection.deliver(listener);
        }

        assertEquals(List.of("42", "9001"), listener.ids());
        assertEquals("boom", listener.errors.get(0).getMessage());
    }

    @Test
    void disconnectNoticeEndsStream() {
        endpoint.respondWith(StreamingEndpoint.linesThenHold(
                Fixtures.line("denver-place"), Fixtures.line("disconnect"), Fixtures.line("boulder-point")));
        RecordingListener listener = new RecordingListener();

        try (FeedConnection connection = source().connect(BoundingBox.CONTIGUOUS_US)) {
            SubscriptionException e = assertThrows(SubscriptionException.class,
                    () -> connection.deliver(listener));
            assertTrue(e.getMessage().contains("admin logout"), e.getMessage());
        }

        assertEquals(List.of("42"), listener.ids());
    }

    @Test
    void stalledStreamFails() {
        endpoint.respondWith(StreamingEndpoint.linesThenHold(Fixtures.line("denver-place")));
        TwitterFeedSource source = TwitterFeedSource.builder()
                .endpoint(endpoint.uri())
                .credentialProvider(CredentialProvider.of(CREDENTIALS))
                .stallTimeout(Duration.ofMillis(300))
                .build();
        RecordingListener listener = new RecordingListener();

        try (FeedConnection connection = source.connect(BoundingBox.CONTIGUOUS_US)) {
            SubscriptionException e = assertThrows(SubscriptionException.class,
                    () -> connection.deliver(listener));
            assertTrue(e.getMessage().contains("stalled"), e.getMessage());
        }

        assertEquals(List.of("42"), listener.ids());
    }

    @Test
    void keepAlivesResetStallTimer() {
        String[] lines = new String[8];
        lines[0] = Fixtures.line("denver-place");
        for (int i = 1; i < lines.length; i++) {
            lines[i] = "";
        }
        endpoint.respondWith((exchange, ep) -> {
            exchange.sendResponseHeaders(200, 0);
            try {
                for (String line : lines) {
                    exchange.getResponseBody().write((line + "\r\n").getBytes());
                    exchange.getResponseBody().flush();
                    Thread.sleep(100);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        TwitterFeedSource source = TwitterFeedSource.builder()
                .endpoint(endpoint.uri())
                .credentialProvider(CredentialProvider.of(CREDENTIALS))
                .stallTimeout(Duration.ofMillis(500))
                .build();
        RecordingListener listener = new RecordingListener();

        try (FeedConnection connection = source.connect(BoundingBox.CONTIGUOUS_US)) {
            connection.deliver(listener);
        }

        assertEquals(List.of("42"), listener.ids());
    }

    @Test
    void closeAbortsBlockedDelivery() throws InterruptedException {
        endpoint.respondWith(StreamingEndpoint.linesThenHold());
        FeedConnection connection = source().connect(BoundingBox.CONTIGUOUS_US);
        CountDownLatch returned = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            connection.deliver(new RecordingListener());
            returned.countDown();
        });
        reader.start();

        Thread.sleep(100);
        connection.close();

        assertTrue(returned.await(5, TimeUnit.SECONDS));
        connection.close();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void credentialProviderIsRequired() {
        assertThrows(NullPointerException.class, () -> TwitterFeedSource.builder().build());
    }

    @Test
    void timeoutsMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> TwitterFeedSource.builder().stallTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> TwitterFeedSource.builder().connectTimeout(Duration.ofSeconds(-1)));
    }

    @Test
    void defaultsToPublicEndpoint() {
        TwitterFeedSource source = TwitterFeedSource.builder()
                .credentialProvider(CredentialProvider.of(CREDENTIALS))
                .build();

        assertEquals(URI.create("https://stream.twitter.com/1.1/statuses/filter.json"), source.endpoint());
    }

    private TwitterFeedSource source() {
        return TwitterFeedSource.builder()
                .endpoint(endpoint.uri())
                .credentialProvider(CredentialProvider.of(CREDENTIALS))
                .build();
    }

    static class RecordingListener implements StreamListener {
        final List<GeoEvent> events = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onEvent(GeoEvent event) {
            events.add(event);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }

        List<String> ids() {
            return events.stream().map(GeoEvent::id).collect(Collectors.toList());
        }
    }
}
