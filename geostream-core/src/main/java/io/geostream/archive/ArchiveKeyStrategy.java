package io.geostream.archive;

import io.geostream.stage.StagedFile;

import java.io.File;
import java.util.Objects;

/**
 * Maps a staged file to the key of its archive record.
 *
 * <p>Two strategies are provided:
 * <ul>
 *   <li>{@link #localPath()}: the staged file's path as written, e.g. {@code tweets/42.json}.
 *       Couples the remote namespace to the local layout; kept as the default for
 *       compatibility with existing archives.</li>
 *   <li>{@link #eventId(String)}: {@code <prefix><id>.json}, independent of where files are staged.</li>
 * </ul>
 */
@FunctionalInterface
public interface ArchiveKeyStrategy {

    /**
     * @param stagedFile the staged file about to be uploaded
     * @return the object key; never empty
     */
    String keyFor(StagedFile stagedFile);

    /**
     * Uses the staged path with {@code /} separators. Leading {@code ./} and {@code /}
     * segments are dropped, so an absolute staging directory {@code /var/tweets} yields
     * {@code var/tweets/42.json}. Object keys are always relative to their container.
     *
     * @return the local-path strategy
     */
    static ArchiveKeyStrategy localPath() {
        return stagedFile -> {
            String key = stagedFile.path().toString();
            if (File.separatorChar != '/') {
                key = key.replace(File.separatorChar, '/');
            }
            while (key.startsWith("./") || key.startsWith("/")) {
                key = key.startsWith("./") ? key.substring(2) : key.substring(1);
            }
            return key;
        };
    }

    /**
     * Uses {@code <prefix><eventId>.json}.
     *
     * @param prefix key prefix, e.g. {@code "tweets/"}; may be empty
     * @return the event-id strategy
     */
    static ArchiveKeyStrategy eventId(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return stagedFile -> prefix + stagedFile.eventId() + ".json";
    }
}
