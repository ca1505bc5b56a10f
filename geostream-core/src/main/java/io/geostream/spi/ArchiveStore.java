package io.geostream.spi;

/**
 * Durable object storage addressed by container and key.
 *
 * <p>One instance is built at startup and shared by all uploads; implementations must be
 * thread-safe. Only writes are needed: reading, listing and deleting archive records is
 * left to the storage backend's own tooling.
 *
 * @see io.geostream.archive.ArchiveUploader
 * @see io.geostream.archive.FileSystemArchiveStore
 */
public interface ArchiveStore extends AutoCloseable {

    /**
     * Stores the bytes under {@code key} in {@code container}, replacing any existing object.
     *
     * @param container the bucket or container name
     * @param key       path-like object key, unique per event
     * @param bytes     the object content
     * @throws ArchiveStoreException on network, authorization or quota failures
     */
    void put(String container, String key, byte[] bytes);

    /**
     * Releases client resources. The default does nothing.
     */
    @Override
    default void close() {
    }
}
