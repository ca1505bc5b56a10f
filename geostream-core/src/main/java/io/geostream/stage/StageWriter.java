package io.geostream.stage;

import io.geostream.GeoEvent;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes event payloads to a local staging directory as {@code <id>.json}.
 *
 * <p>Each payload is first written to a temporary file in the same directory and then
 * moved over the destination, so a reader never sees a half-written file and a
 * redelivered event replaces the previous copy. The directory is created on first use.
 *
 * <p>This class holds no mutable state and is safe for concurrent use as long as two
 * threads never stage the same event id at once.
 */
public final class StageWriter {
    private static final Logger logger = Logger.getLogger(StageWriter.class.getName());

    static final String EXTENSION = ".json";
    static final String TEMP_SUFFIX = ".tmp";

    private final Path stagingDirectory;

    /**
     * @param stagingDirectory directory for staged files; kept as given (relative paths stay relative)
     */
    public StageWriter(Path stagingDirectory) {
        this.stagingDirectory = Objects.requireNonNull(stagingDirectory, "stagingDirectory");
    }

    public Path stagingDirectory() {
        return stagingDirectory;
    }

    /**
     * Returns the path an event with the given id is staged at.
     *
     * @param eventId the event identifier
     * @return {@code <stagingDirectory>/<eventId>.json}
     * @throws StageException if the id cannot be used as a file name
     */
    public Path pathFor(String eventId) {
        checkFileName(eventId);
        return stagingDirectory.resolve(eventId + EXTENSION);
    }

    /**
     * Writes the event's raw payload to {@code <stagingDirectory>/<id>.json}, replacing any
     * previous file for the same id.
     *
     * @param event the event to stage
     * @return the staged file
     * @throws StageException on filesystem failure or an unusable id
     */
    public StagedFile stage(GeoEvent event) {
        Objects.requireNonNull(event, "event");
        Path target = pathFor(event.id());
        byte[] payload = event.payloadBytes();
        Path temp = null;
        try {
            Files.createDirectories(stagingDirectory);
            temp = Files.createTempFile(stagingDirectory, event.id() + ".", TEMP_SUFFIX);
            Files.write(temp, payload);
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException | RuntimeException e) {
            throw new StageException("Failed to stage event " + event.id() + " at " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        return new StagedFile(event.id(), target, payload.length);
    }

    /**
     * Removes a staged file. A file that is already gone is not an error.
     *
     * @param stagedFile the file to remove
     * @throws StageException if the file exists but cannot be deleted
     */
    public void delete(StagedFile stagedFile) {
        Objects.requireNonNull(stagedFile, "stagedFile");
        try {
            Files.deleteIfExists(stagedFile.path());
        } catch (IOException e) {
            throw new StageException("Failed to delete staged file " + stagedFile.path(), e);
        }
    }

    /**
     * Collects files left behind by a previous run: staged {@code *.json} files are returned
     * (oldest first) so they can be uploaded again, and abandoned temporary files are deleted.
     *
     * @return orphaned staged files; empty if the staging directory does not exist
     * @throws StageException if the directory cannot be listed
     */
    public List<StagedFile> sweep() {
        if (!Files.isDirectory(stagingDirectory)) {
            return List.of();
        }
        List<StagedFile> orphans = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(stagingDirectory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    deleteQuietly(entry);
                } else if (name.endsWith(EXTENSION) && Files.isRegularFile(entry)) {
                    String eventId = name.substring(0, name.length() - EXTENSION.length());
                    if (!eventId.isEmpty()) {
                        orphans.add(new StagedFile(eventId, entry, Files.size(entry)));
                    }
                }
            }
        } catch (IOException e) {
            throw new StageException("Failed to sweep staging directory " + stagingDirectory, e);
        }
        orphans.sort(Comparator.comparing(StageWriter::lastModifiedMillis));
        return orphans;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static long lastModifiedMillis(StagedFile file) {
        try {
            return Files.getLastModifiedTime(file.path()).toMillis();
        } catch (IOException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void checkFileName(String eventId) {
        Objects.requireNonNull(eventId, "eventId");
        if (eventId.isEmpty() || eventId.equals(".") || eventId.equals("..")
                || eventId.indexOf('/') >= 0 || eventId.indexOf('\\') >= 0 || eventId.indexOf('\0') >= 0) {
            throw new StageException("Event id cannot be used as a file name: '" + eventId + "'");
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to delete temporary file " + path, e);
        }
    }
}
