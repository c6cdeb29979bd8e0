package org.projectstate.interfaces;

import java.io.IOException;

/**
 * Durable home for a single JSON document that is rewritten as a whole
 * (the server's project table).
 */
public interface SnapshotStore {

    /** @return the newest stored document, or {@code null} when nothing was saved yet. */
    String load() throws IOException;

    void save(String json) throws IOException;
}
