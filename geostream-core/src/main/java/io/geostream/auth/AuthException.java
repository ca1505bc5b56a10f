package io.geostream.auth;

/**
 * Credentials were missing, malformed, or rejected by the feed.
 *
 * <p>Fatal: a {@link io.geostream.stream.StreamSupervisor} that sees this exception
 * terminates instead of reconnecting.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
