package io.geostream.stage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A payload written to the staging directory and awaiting upload.
 *
 * @param eventId   identifier of the event the file was written for
 * @param path      location of the file, relative when the staging directory is relative
 * @param sizeBytes number of payload bytes written
 */
public record StagedFile(String eventId, Path path, long sizeBytes) {

    public StagedFile {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(path, "path");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }
}
