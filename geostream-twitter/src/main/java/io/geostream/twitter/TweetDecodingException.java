package io.geostream.twitter;

/**
 * A stream line could not be decoded into a {@link TwitterMessage}.
 *
 * <p>Per-line: the connection hands it to the listener's {@code onError} and keeps reading.
 */
public class TweetDecodingException extends RuntimeException {

    public TweetDecodingException(String message) {
        super(message);
    }

    public TweetDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
