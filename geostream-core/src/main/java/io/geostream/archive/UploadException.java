package io.geostream.archive;

/**
 * An upload to the archive store failed or timed out. The staged file is left in place.
 */
public final class UploadException extends RuntimeException {
    private final String key;

    public UploadException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Returns the archive key the upload was attempted under.
     *
     * @return the key
     */
    public String key() {
        return key;
    }
}
