package io.geostream.auth;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Loads credentials from a {@code .properties} file with the keys {@value #CONSUMER_KEY},
 * {@value #CONSUMER_SECRET}, {@value #ACCESS_TOKEN} and {@value #ACCESS_TOKEN_SECRET}.
 *
 * <p>The file is re-read on every call.
 */
public final class PropertiesFileCredentialProvider implements CredentialProvider {
    public static final String CONSUMER_KEY = "consumer_key";
    public static final String CONSUMER_SECRET = "consumer_secret";
    public static final String ACCESS_TOKEN = "access_token";
    public static final String ACCESS_TOKEN_SECRET = "access_token_secret";

    private final Path file;

    public PropertiesFileCredentialProvider(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public OAuthCredentials credentials() {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new AuthException("Cannot read credentials file " + file, e);
        }
        try {
            return new OAuthCredentials(
                    required(props, CONSUMER_KEY),
                    required(props, CONSUMER_SECRET),
                    required(props, ACCESS_TOKEN),
                    required(props, ACCESS_TOKEN_SECRET));
        } catch (IllegalArgumentException e) {
            throw new AuthException("Invalid credentials in " + file + ": " + e.getMessage(), e);
        }
    }

    private String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new AuthException("Missing '" + key + "' in credentials file " + file);
        }
        return value.trim();
    }
}
