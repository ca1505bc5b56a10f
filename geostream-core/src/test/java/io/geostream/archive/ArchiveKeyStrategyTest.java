package io.geostream.archive;

import io.geostream.stage.StagedFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArchiveKeyStrategyTest {

    @Test
    void localPathKeepsRelativeStagedPath() {
        StagedFile file = new StagedFile("42", Path.of("tweets", "42.json"), 2);

        assertEquals("tweets/42.json", ArchiveKeyStrategy.localPath().keyFor(file));
    }

    @Test
    void localPathDropsLeadingDotSegment() {
        StagedFile file = new StagedFile("42", Path.of("./tweets/42.json"), 2);

        assertEquals("tweets/42.json", ArchiveKeyStrategy.localPath().keyFor(file));
    }

    @Test
    void localPathDropsLeadingSlash() {
        StagedFile file = new StagedFile("42", Path.of("/var/stage/42.json"), 2);

        assertEquals("var/stage/42.json", ArchiveKeyStrategy.localPath().keyFor(file));
    }

    @Test
    void eventIdIgnoresStagingLayout() {
        StagedFile file = new StagedFile("42", Path.of("/var/stage/42.json"), 2);

        assertEquals("tweets/42.json", ArchiveKeyStrategy.eventId("tweets/").keyFor(file));
        assertEquals("42.json", ArchiveKeyStrategy.eventId("").keyFor(file));
    }
}
