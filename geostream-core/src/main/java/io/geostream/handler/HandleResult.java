package io.geostream.handler;

import java.util.Objects;

/**
 * Outcome of handling one event.
 *
 * <p>Every call to {@link ArchivingEventHandler#handle} returns exactly one of:
 * <ul>
 *   <li>{@link Archived}: uploaded and removed from the staging directory</li>
 *   <li>{@link Skipped}: no geo signal; nothing was written</li>
 *   <li>{@link Failed}: a step failed; see {@link FailureStage}</li>
 * </ul>
 */
public sealed interface HandleResult {

    String eventId();

    /**
     * Step of the pipeline that failed.
     */
    enum FailureStage {
        /** The payload could not be written to the staging directory. */
        STAGE,
        /** The upload failed; the staged file was kept. */
        UPLOAD,
        /** The record was archived but the staged file could not be removed. */
        CLEANUP
    }

    /**
     * @param eventId the event id
     * @param key     the archive key the record was stored under
     */
    record Archived(String eventId, String key) implements HandleResult {
        public Archived {
            Objects.requireNonNull(eventId, "eventId");
            Objects.requireNonNull(key, "key");
        }
    }

    record Skipped(String eventId) implements HandleResult {
        public Skipped {
            Objects.requireNonNull(eventId, "eventId");
        }
    }

    /**
     * @param eventId the event id
     * @param stage   the step that failed
     * @param cause   the failure
     */
    record Failed(String eventId, FailureStage stage, Throwable cause) implements HandleResult {
        public Failed {
            Objects.requireNonNull(eventId, "eventId");
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
