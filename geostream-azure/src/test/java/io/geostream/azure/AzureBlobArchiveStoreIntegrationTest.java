package io.geostream.azure;

import com.azure.storage.blob.BlobContainerClient;
import io.geostream.spi.ArchiveStoreException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class AzureBlobArchiveStoreIntegrationTest {

  private static final String ACCOUNT = "geostream";
  private static final String ACCOUNT_KEY = Base64.getEncoder()
      .encodeToString("geostream-azurite-account-key-for-integration-tests".getBytes(StandardCharsets.UTF_8));

  @Container
  static final GenericContainer<?> azurite =
      new GenericContainer<>("mcr.microsoft.com/azure-storage/azurite:3.29.0")
          .withCommand("azurite-blob", "--blobHost", "0.0.0.0", "--blobPort", "10000", "--skipApiVersionCheck")
          .withEnv("AZURITE_ACCOUNTS", ACCOUNT + ":" + ACCOUNT_KEY)
          .withExposedPorts(10000);

  private static AzureBlobArchiveStore store;

  @BeforeAll
  static void connect() {
    String connectionString = "DefaultEndpointsProtocol=http;AccountName=" + ACCOUNT
        + ";AccountKey=" + ACCOUNT_KEY
        + ";BlobEndpoint=http://" + azurite.getHost() + ":" + azurite.getMappedPort(10000) + "/" + ACCOUNT + ";";
    store = AzureBlobArchiveStore.fromConnectionString(connectionString, true);
  }

  @AfterAll
  static void close() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  void createsContainerAndStoresBlob() {
    store.put("earthlab-geolocated-tweets", "tweets/42.json", "{\"id_str\":\"42\"}".getBytes(StandardCharsets.UTF_8));

    BlobContainerClient container = store.serviceClient().getBlobContainerClient("earthlab-geolocated-tweets");
    assertTrue(container.exists());
    assertEquals("{\"id_str\":\"42\"}",
        container.getBlobClient("tweets/42.json").downloadContent().toString());
  }

  @Test
  void overwritesExistingBlob() {
    store.put("overwrite-test", "tweets/7.json", "first".getBytes(StandardCharsets.UTF_8));
    store.put("overwrite-test", "tweets/7.json", "second".getBytes(StandardCharsets.UTF_8));

    BlobContainerClient container = store.serviceClient().getBlobContainerClient("overwrite-test");
    assertEquals("second", container.getBlobClient("tweets/7.json").downloadContent().toString());
  }

  @Test
  void missingContainerFailsWhenCreationDisabled() {
    AzureBlobArchiveStore strict = new AzureBlobArchiveStore(store.serviceClient(), false);

    ArchiveStoreException e = assertThrows(ArchiveStoreException.class,
        () -> strict.put("never-created", "tweets/1.json", new byte[]{'{', '}'}));
    assertTrue(e.getMessage().contains("404"), e.getMessage());
  }

  @Test
  void invalidContainerNameIsArchiveStoreException() {
    assertThrows(ArchiveStoreException.class,
        () -> store.put("Invalid_Name", "tweets/1.json", new byte[]{'{', '}'}));
  }
}
