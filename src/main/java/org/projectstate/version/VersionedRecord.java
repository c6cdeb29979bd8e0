package org.projectstate.version;

import org.projectstate.model.ProjectSnapshot;

/**
 * A remote snapshot together with the last version the client saw and the
 * current durable version.
 */
public record VersionedRecord(String id, ProjectSnapshot snapshot, long localVersion, long serverVersion) {

    public static final long INITIAL_VERSION = 1L;
}
