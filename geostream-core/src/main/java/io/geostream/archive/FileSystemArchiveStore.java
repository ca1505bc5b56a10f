package io.geostream.archive;

import io.geostream.spi.ArchiveStore;
import io.geostream.spi.ArchiveStoreException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * {@link ArchiveStore} that writes records under {@code <root>/<container>/<key>} on a local
 * or mounted filesystem. Intended for development and single-host deployments.
 *
 * <p>Keys may contain {@code /} and become sub-directories; keys that would escape the
 * container directory are rejected.
 */
public final class FileSystemArchiveStore implements ArchiveStore {
    private final Path root;

    public FileSystemArchiveStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Returns where the record for {@code (container, key)} is stored.
     *
     * @param container the container name
     * @param key       the object key
     * @return the absolute file path
     * @throws ArchiveStoreException if the container or key would escape the root
     */
    public Path resolve(String container, String key) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(key, "key");
        if (container.isEmpty() || container.contains("/") || container.contains("\\") || container.startsWith(".")) {
            throw new ArchiveStoreException("Invalid container name: '" + container + "'");
        }
        Path containerDir = root.resolve(container);
        Path target = containerDir.resolve(key).normalize();
        if (!target.startsWith(containerDir) || target.equals(containerDir)) {
            throw new ArchiveStoreException("Key escapes container directory: '" + key + "'");
        }
        return target;
    }

    @Override
    public void put(String container, String key, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        Path target = resolve(container, key);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", ".part");
            try {
                Files.write(temp, bytes);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new ArchiveStoreException("Failed to write " + container + "/" + key + " under " + root, e);
        }
    }
}
