package io.geostream.twitter;

import io.geostream.auth.OAuthCredentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Signs requests with OAuth 1.0a HMAC-SHA1 and produces the {@code Authorization} header.
 *
 * <p>Signature base string: {@code METHOD&enc(base-url)&enc(sorted-params)}, where the
 * parameters are the {@code oauth_*} protocol parameters plus the query and form body
 * parameters of the request, each percent-encoded per RFC 3986 and sorted by key then value.
 */
public final class OAuth1Signer {
    private static final String SIGNATURE_METHOD = "HMAC-SHA1";
    private static final String VERSION = "1.0";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Supplier<String> nonceSupplier;
    private final LongSupplier epochSecondsSupplier;

    public OAuth1Signer() {
        this(OAuth1Signer::randomNonce, () -> Instant.now().getEpochSecond());
    }

    OAuth1Signer(Supplier<String> nonceSupplier, LongSupplier epochSecondsSupplier) {
        this.nonceSupplier = Objects.requireNonNull(nonceSupplier, "nonceSupplier");
        this.epochSecondsSupplier = Objects.requireNonNull(epochSecondsSupplier, "epochSecondsSupplier");
    }

    /**
     * Builds the {@code Authorization} header value for one request.
     *
     * @param method      HTTP method, e.g. {@code POST}
     * @param uri         the request URI, query included
     * @param formParams  decoded {@code application/x-www-form-urlencoded} body parameters
     * @param credentials the signing secrets
     * @return the header value, starting with {@code OAuth }
     */
    public String authorizationHeader(String method, URI uri, Map<String, String> formParams,
                                      OAuthCredentials credentials) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(formParams, "formParams");
        Objects.requireNonNull(credentials, "credentials");

        Map<String, String> oauth = new TreeMap<>();
        oauth.put("oauth_consumer_key", credentials.consumerKey());
        oauth.put("oauth_nonce", nonceSupplier.get());
        oauth.put("oauth_signature_method", SIGNATURE_METHOD);
        oauth.put("oauth_timestamp", Long.toString(epochSecondsSupplier.getAsLong()));
        oauth.put("oauth_token", credentials.accessToken());
        oauth.put("oauth_version", VERSION);

        List<Map.Entry<String, String>> params = new ArrayList<>(oauth.entrySet());
        params.addAll(queryParameters(uri));
        params.addAll(formParams.entrySet());

        String baseString = signatureBaseString(method, baseUrl(uri), params);
        oauth.put("oauth_signature", sign(baseString, credentials.consumerSecret(), credentials.accessTokenSecret()));

        return "OAuth " + oauth.entrySet().stream()
                .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
                .collect(Collectors.joining(", "));
    }

    /**
     * Builds the signature base string.
     *
     * @param method  HTTP method
     * @param baseUrl normalized URL without query or fragment
     * @param params  all request parameters, not yet encoded
     * @return the base string
     */
    static String signatureBaseString(String method, String baseUrl,
                                      List<? extends Map.Entry<String, String>> params) {
        String normalized = params.stream()
                .map(e -> new AbstractMap.SimpleImmutableEntry<>(percentEncode(e.getKey()), percentEncode(e.getValue())))
                .sorted(Comparator.<Map.Entry<String, String>, String>comparing(Map.Entry::getKey)
                        .thenComparing(Map.Entry::getValue))
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return method.toUpperCase(Locale.ROOT) + "&" + percentEncode(baseUrl) + "&" + percentEncode(normalized);
    }

    /**
     * Computes the base64 HMAC-SHA1 of the base string keyed with
     * {@code enc(consumerSecret)&enc(tokenSecret)}.
     */
    static String sign(String baseString, String consumerSecret, String tokenSecret) {
        String key = percentEncode(consumerSecret) + "&" + percentEncode(tokenSecret);
        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is not available", e);
        }
    }

    /**
     * RFC 3986 percent-encoding: only unreserved characters ({@code A-Z a-z 0-9 - . _ ~})
     * are left as-is.
     */
    static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    static String baseUrl(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path;
    }

    private static List<Map.Entry<String, String>> queryParameters(URI uri) {
        List<Map.Entry<String, String>> result = new ArrayList<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return result;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            result.add(new AbstractMap.SimpleImmutableEntry<>(
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8)));
        }
        return result;
    }

    private static String randomNonce() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
