package io.geostream.azure;

import com.azure.core.util.BinaryData;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobStorageException;
import io.geostream.spi.ArchiveStore;
import io.geostream.spi.ArchiveStoreException;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ArchiveStore} backed by Azure Blob Storage.
 *
 * <p>Each record becomes one block blob named by the key, uploaded with overwrite enabled so
 * a re-archived event replaces its earlier copy. With {@code createContainers} on, a missing
 * container is created the first time it is written to.
 *
 * <p>Thread-safe: the underlying {@link BlobServiceClient} is shared by all uploads.
 */
public final class AzureBlobArchiveStore implements ArchiveStore {
    private static final Logger logger = Logger.getLogger(AzureBlobArchiveStore.class.getName());

    private final BlobServiceClient serviceClient;
    private final boolean createContainers;
    private final Set<String> readyContainers = ConcurrentHashMap.newKeySet();

    public AzureBlobArchiveStore(BlobServiceClient serviceClient, boolean createContainers) {
        this.serviceClient = Objects.requireNonNull(serviceClient, "serviceClient");
        this.createContainers = createContainers;
    }

    /**
     * Creates a store from a storage account connection string.
     *
     * @param connectionString the account connection string
     * @param createContainers whether to create missing containers on first use
     * @return a new store
     */
    public static AzureBlobArchiveStore fromConnectionString(String connectionString, boolean createContainers) {
        Objects.requireNonNull(connectionString, "connectionString");
        if (connectionString.isBlank()) {
            throw new IllegalArgumentException("connectionString must not be blank");
        }
        BlobServiceClient client = new BlobServiceClientBuilder()
                .connectionString(connectionString)
                .buildClient();
        return new AzureBlobArchiveStore(client, createContainers);
    }

    @Override
    public void put(String container, String key, byte[] bytes) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(bytes, "bytes");

        BlobContainerClient containerClient = ensureContainer(container);
        try {
            containerClient.getBlobClient(key).upload(BinaryData.fromBytes(bytes), true);
        } catch (BlobStorageException e) {
            throw new ArchiveStoreException("Upload of '" + key + "' to container '" + container
                    + "' failed: HTTP " + e.getStatusCode() + " " + e.getErrorCode(), e);
        } catch (RuntimeException e) {
            throw new ArchiveStoreException("Upload of '" + key + "' to container '" + container
                    + "' failed: " + e.getMessage(), e);
        }
    }

    private BlobContainerClient ensureContainer(String container) {
        try {
            BlobContainerClient containerClient = serviceClient.getBlobContainerClient(container);
            if (createContainers && !readyContainers.contains(container)) {
                if (containerClient.createIfNotExists()) {
                    logger.log(Level.INFO, "Created blob container {0}", container);
                }
                readyContainers.add(container);
            }
            return containerClient;
        } catch (BlobStorageException e) {
            throw new ArchiveStoreException("Cannot create container '" + container + "': HTTP "
                    + e.getStatusCode() + " " + e.getErrorCode(), e);
        } catch (RuntimeException e) {
            throw new ArchiveStoreException("Cannot create container '" + container + "': " + e.getMessage(), e);
        }
    }

    public BlobServiceClient serviceClient() {
        return serviceClient;
    }
}
