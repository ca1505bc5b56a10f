package io.geostream.twitter;

import io.geostream.BoundingBox;
import io.geostream.auth.AuthException;
import io.geostream.auth.CredentialProvider;
import io.geostream.auth.OAuthCredentials;
import io.geostream.spi.FeedConnection;
import io.geostream.spi.FeedSource;
import io.geostream.stream.SubscriptionException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FeedSource} for the Twitter v1.1 {@code statuses/filter} streaming endpoint.
 *
 * <p>Each {@link #connect} loads fresh credentials, sends a signed
 * {@code POST locations=west,south,east,north} and waits for the response headers:
 * <ul>
 *   <li>2xx: the body is handed to a {@link TwitterFeedConnection}</li>
 *   <li>401, 403: {@link AuthException}</li>
 *   <li>420, 429: {@link SubscriptionException} with the {@code Retry-After} hint
 *       (default {@value #DEFAULT_RATE_LIMIT_SECONDS} s)</li>
 *   <li>anything else: {@link SubscriptionException}</li>
 * </ul>
 *
 * <p>Create via {@link #builder()}.
 */
public final class TwitterFeedSource implements FeedSource {
    private static final Logger logger = Logger.getLogger(TwitterFeedSource.class.getName());

    public static final URI DEFAULT_ENDPOINT = URI.create("https://stream.twitter.com/1.1/statuses/filter.json");
    public static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofSeconds(90);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final long DEFAULT_RATE_LIMIT_SECONDS = 60;

    private final URI endpoint;
    private final CredentialProvider credentialProvider;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration stallTimeout;
    private final OAuth1Signer signer;
    private final TweetDecoder decoder;

    private TwitterFeedSource(Builder builder) {
        this.endpoint = builder.endpoint;
        this.credentialProvider = Objects.requireNonNull(builder.credentialProvider, "credentialProvider");
        this.connectTimeout = builder.connectTimeout;
        this.stallTimeout = builder.stallTimeout;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(connectTimeout)
                        .build();
        this.signer = builder.signer != null ? builder.signer : new OAuth1Signer();
        this.decoder = builder.decoder != null ? builder.decoder : new TweetDecoder();
    }

    public static Builder builder() {
        return new Builder();
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public FeedConnection connect(BoundingBox filter) {
        Objects.requireNonNull(filter, "filter");
        OAuthCredentials credentials = credentialProvider.credentials();

        String locations = filter.toLocationsParameter();
        String body = "locations=" + OAuth1Signer.percentEncode(locations);
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .header("Authorization", signer.authorizationHeader(
                        "POST", endpoint, Map.of("locations", locations), credentials))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        LineQueue lines = new LineQueue();
        CompletableFuture<HttpResponse.ResponseInfo> head = new CompletableFuture<>();
        HttpResponse.BodyHandler<Void> handler = info -> {
            head.complete(info);
            if (isSuccess(info.statusCode())) {
                return HttpResponse.BodySubscribers.fromLineSubscriber(
                        lines, subscriber -> null, StandardCharsets.UTF_8, null);
            }
            return HttpResponse.BodySubscribers.discarding();
        };

        logger.log(Level.INFO, "Subscribing to {0} with locations={1}", new Object[]{endpoint, locations});
        CompletableFuture<HttpResponse<Void>> response = httpClient.sendAsync(request, handler);
        response.whenComplete((r, error) -> {
            if (error != null) {
                head.completeExceptionally(error);
            }
        });

        HttpResponse.ResponseInfo info = awaitHead(head, response);
        int status = info.statusCode();
        if (isSuccess(status)) {
            return new TwitterFeedConnection(lines, response, decoder, stallTimeout);
        }
        response.cancel(true);
        if (status == 401 || status == 403) {
            throw new AuthException("Stream endpoint rejected credentials: HTTP " + status);
        }
        if (status == 420 || status == 429) {
            Duration retryAfter = retryAfter(info);
            throw SubscriptionException.rateLimited(
                    "Stream endpoint is rate limiting: HTTP " + status, retryAfter);
        }
        throw new SubscriptionException("Stream endpoint returned HTTP " + status);
    }

    private HttpResponse.ResponseInfo awaitHead(CompletableFuture<HttpResponse.ResponseInfo> head,
                                                CompletableFuture<HttpResponse<Void>> response) {
        try {
            return head.get(connectTimeout.toMillis() + stallTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            throw new SubscriptionException("Interrupted while connecting to " + endpoint, e);
        } catch (TimeoutException e) {
            response.cancel(true);
            throw new SubscriptionException("Timed out waiting for response headers from " + endpoint, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IOException) {
                throw new SubscriptionException("Failed to connect to " + endpoint + ": " + cause.getMessage(), cause);
            }
            throw new SubscriptionException("Subscription request failed: " + cause, cause);
        }
    }

    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static Duration retryAfter(HttpResponse.ResponseInfo info) {
        Optional<String> header = info.headers().firstValue("Retry-After");
        if (header.isPresent()) {
            try {
                long seconds = Long.parseLong(header.get().trim());
                if (seconds >= 0) {
                    return Duration.ofSeconds(seconds);
                }
            } catch (NumberFormatException e) {
                logger.log(Level.FINE, "Ignoring non-numeric Retry-After: {0}", header.get());
            }
        }
        return Duration.ofSeconds(DEFAULT_RATE_LIMIT_SECONDS);
    }

    /**
     * Builder for {@link TwitterFeedSource}.
     */
    public static final class Builder {
        private URI endpoint = DEFAULT_ENDPOINT;
        private CredentialProvider credentialProvider;
        private HttpClient httpClient;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration stallTimeout = DEFAULT_STALL_TIMEOUT;
        private OAuth1Signer signer;
        private TweetDecoder decoder;

        private Builder() {
        }

        /**
         * Optional. Defaults to {@link #DEFAULT_ENDPOINT}.
         */
        public Builder endpoint(URI endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        /**
         * Required. Consulted once per connect.
         */
        public Builder credentialProvider(CredentialProvider credentialProvider) {
            this.credentialProvider = Objects.requireNonNull(credentialProvider, "credentialProvider");
            return this;
        }

        /**
         * Optional. Defaults to an HTTP/1.1 client using {@link #connectTimeout}.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        /**
         * Optional. Defaults to 10 seconds.
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Optional. Defaults to 90 seconds. A stream silent for longer (keep-alives included)
         * is treated as dead.
         */
        public Builder stallTimeout(Duration stallTimeout) {
            this.stallTimeout = positive(stallTimeout, "stallTimeout");
            return this;
        }

        public Builder signer(OAuth1Signer signer) {
            this.signer = Objects.requireNonNull(signer, "signer");
            return this;
        }

        public Builder decoder(TweetDecoder decoder) {
            this.decoder = Objects.requireNonNull(decoder, "decoder");
            return this;
        }

        public TwitterFeedSource build() {
            return new TwitterFeedSource(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
            return value;
        }
    }
}
