package io.geostream.archive;

import io.geostream.spi.ArchiveStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemArchiveStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void putWritesUnderContainerAndKey() throws IOException {
        FileSystemArchiveStore store = new FileSystemArchiveStore(tempDir);

        store.put("earthlab-geolocated-tweets", "tweets/42.json", bytes("{\"id\":42}"));

        Path written = tempDir.resolve("earthlab-geolocated-tweets").resolve("tweets").resolve("42.json");
        assertEquals("{\"id\":42}", Files.readString(written));
    }

    @Test
    void putReplacesExistingRecord() throws IOException {
        FileSystemArchiveStore store = new FileSystemArchiveStore(tempDir);

        store.put("c", "k.json", bytes("first"));
        store.put("c", "k.json", bytes("second"));

        assertEquals("second", Files.readString(store.resolve("c", "k.json")));
    }

    @Test
    void keysEscapingContainerAreRejected() {
        FileSystemArchiveStore store = new FileSystemArchiveStore(tempDir);

        assertThrows(ArchiveStoreException.class, () -> store.put("c", "../other/k.json", bytes("x")));
        assertThrows(ArchiveStoreException.class, () -> store.put("c", "", bytes("x")));
    }

    @Test
    void invalidContainerNamesAreRejected() {
        FileSystemArchiveStore store = new FileSystemArchiveStore(tempDir);

        assertThrows(ArchiveStoreException.class, () -> store.put("a/b", "k", bytes("x")));
        assertThrows(ArchiveStoreException.class, () -> store.put("..", "k", bytes("x")));
        assertThrows(ArchiveStoreException.class, () -> store.put("", "k", bytes("x")));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
