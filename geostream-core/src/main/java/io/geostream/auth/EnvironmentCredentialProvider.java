package io.geostream.auth;

import java.util.Map;
import java.util.Objects;

/**
 * Reads credentials from environment variables:
 * {@code GEOSTREAM_CONSUMER_KEY}, {@code GEOSTREAM_CONSUMER_SECRET},
 * {@code GEOSTREAM_ACCESS_TOKEN} and {@code GEOSTREAM_ACCESS_TOKEN_SECRET}.
 */
public final class EnvironmentCredentialProvider implements CredentialProvider {
    static final String PREFIX = "GEOSTREAM_";

    private final Map<String, String> environment;

    public EnvironmentCredentialProvider() {
        this(System.getenv());
    }

    EnvironmentCredentialProvider(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public OAuthCredentials credentials() {
        return new OAuthCredentials(
                required("CONSUMER_KEY"),
                required("CONSUMER_SECRET"),
                required("ACCESS_TOKEN"),
                required("ACCESS_TOKEN_SECRET"));
    }

    private String required(String suffix) {
        String name = PREFIX + suffix;
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new AuthException("Environment variable " + name + " is not set");
        }
        return value.trim();
    }
}
