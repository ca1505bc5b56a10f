package io.geostream.spi;

/**
 * Unchecked exception thrown by {@link ArchiveStore} implementations when a write fails.
 */
public class ArchiveStoreException extends RuntimeException {

    public ArchiveStoreException(String message) {
        super(message);
    }

    public ArchiveStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
