package io.geostream.auth;

import java.util.Objects;

/**
 * The four opaque secrets used to sign a streaming subscription request.
 *
 * <p>{@link #toString()} masks every value so credentials never end up in logs.
 *
 * @param consumerKey       application key
 * @param consumerSecret    application secret
 * @param accessToken       user access token
 * @param accessTokenSecret user access token secret
 */
public record OAuthCredentials(String consumerKey, String consumerSecret,
                               String accessToken, String accessTokenSecret) {

    public OAuthCredentials {
        requireNonBlank(consumerKey, "consumerKey");
        requireNonBlank(consumerSecret, "consumerSecret");
        requireNonBlank(accessToken, "accessToken");
        requireNonBlank(accessTokenSecret, "accessTokenSecret");
    }

    private static void requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    @Override
    public String toString() {
        return "OAuthCredentials{consumerKey=" + mask(consumerKey)
                + ", consumerSecret=****, accessToken=" + mask(accessToken)
                + ", accessTokenSecret=****}";
    }

    private static String mask(String value) {
        return value.length() <= 4 ? "****" : value.substring(0, 4) + "****";
    }
}
