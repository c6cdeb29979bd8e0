package org.projectstate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.projectstate.interfaces.SnapshotStore;
import org.projectstate.persistance.FileSnapshotStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotStoreTest {

    @TempDir Path tmp;

    @Test
    void saveThenLoadLatest() throws IOException {
        SnapshotStore store = new FileSnapshotStore(tmp, "projects", 10, new TickingClock());

        store.save("[{\"id\":\"A\"}]");
        Path latest = tmp.resolve("latest.json");
        assertTrue(Files.exists(latest));
        assertEquals("[{\"id\":\"A\"}]", store.load());

        store.save("[{\"id\":\"B\"}]");
        assertEquals("[{\"id\":\"B\"}]", Files.readString(latest, StandardCharsets.UTF_8));
        assertEquals(2, historyCount());
    }

    @Test
    void loadReturnsNullWhenNothingSaved() throws IOException {
        assertNull(new FileSnapshotStore(tmp.resolve("missing"), "projects", 5, Clock.systemUTC()).load());
    }

    @Test
    void historyIsPrunedToLimit() throws IOException {
        SnapshotStore store = new FileSnapshotStore(tmp, "projects", 3, new TickingClock());
        for (int i = 0; i < 6; i++) {
            store.save("[" + i + "]");
        }
        assertEquals(3, historyCount());
        assertEquals("[5]", store.load());
    }

    @Test
    void fallsBackToNewestHistoryFileWithoutLatest() throws IOException {
        SnapshotStore store = new FileSnapshotStore(tmp, "projects", 5, new TickingClock());
        store.save("[1]");
        store.save("[2]");
        Files.delete(tmp.resolve("latest.json"));

        assertEquals("[2]", store.load());
    }

    private long historyCount() throws IOException {
        try (Stream<Path> s = Files.list(tmp)) {
            return s.filter(p -> p.getFileName().toString().startsWith("projects-")
                    && p.toString().endsWith(".json")).count();
        }
    }

    /** Advances one second per read so every save gets its own history file. */
    static final class TickingClock extends Clock {
        private Instant now = Instant.parse("2024-03-05T10:00:00Z");

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public synchronized Instant instant() {
            now = now.plus(Duration.ofSeconds(1));
            return now;
        }
    }
}
