package io.geostream.stage;

/**
 * Unchecked exception wrapping local filesystem failures of the {@link StageWriter}:
 * permissions, disk full, or an identifier that cannot be used as a file name.
 */
public final class StageException extends RuntimeException {

    public StageException(String message) {
        super(message);
    }

    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
