package org.projectstate.version;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

/** Outcome of a version-checked write: {@link Synced} or {@link Conflict}. */
public interface SyncResult {

    String STATUS_SYNCED = "synced";
    String STATUS_CONFLICT = "conflict";

    record Synced(VersionedRecord record) implements SyncResult {
    }

    /**
     * Both sides of a rejected write. Field names match the conflict payload
     * of the sync endpoint.
     */
    record Conflict(
            String status,
            @SerializedName("local_data") JsonObject localData,
            @SerializedName("server_data") JsonObject serverData,
            @SerializedName("local_version") long localVersion,
            @SerializedName("server_version") long serverVersion) implements SyncResult {

        public Conflict(JsonObject localData, JsonObject serverData, long localVersion, long serverVersion) {
            this(STATUS_CONFLICT, localData, serverData, localVersion, serverVersion);
        }
    }
}
