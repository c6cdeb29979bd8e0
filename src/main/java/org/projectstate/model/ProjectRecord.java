package org.projectstate.model;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.share.SharePermission;
import org.projectstate.version.VersionedRecord;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * A durable project as the backend stores and returns it. Local device storage
 * produces the same shape with {@code serverVersion == 0} and no owner.
 */
public record ProjectRecord(
        String id,
        @SerializedName("user_id") String userId,
        String name,
        String description,
        @SerializedName("project_data") JsonObject projectData,
        List<String> tags,
        @SerializedName("is_public") boolean isPublic,
        @SerializedName("share_id") String shareId,
        @SerializedName("share_permissions") String sharePermissions,
        @SerializedName("requires_auth") boolean requiresAuth,
        @SerializedName("local_version") long localVersion,
        @SerializedName("server_version") long serverVersion,
        @SerializedName("sync_status") String syncStatus,
        @SerializedName("created_at") String createdAt,
        @SerializedName("updated_at") String updatedAt) {

    public static final String SYNCED = "synced";

    public ProjectSnapshot snapshot() throws MalformedSnapshotException {
        return ProjectSnapshot.fromJson(projectData);
    }

    /** {@code updated_at} as an instant; unparseable values sort as the epoch. */
    public Instant updatedInstant() {
        if (updatedAt == null) return Instant.EPOCH;
        try {
            return Instant.parse(updatedAt);
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }

    public SharePermission permission() {
        return SharePermission.fromWire(sharePermissions);
    }

    public VersionedRecord versioned() throws MalformedSnapshotException {
        return new VersionedRecord(id, snapshot(), localVersion, serverVersion);
    }

    /** New content at a new version; both version fields move together once a write is accepted. */
    public ProjectRecord withContent(String newName, JsonObject newData, long version, String now) {
        return new ProjectRecord(id, userId, newName, description, newData, tags, isPublic, shareId,
                sharePermissions, requiresAuth, version, version, SYNCED, createdAt, now);
    }

    public ProjectRecord withDetails(String newDescription, List<String> newTags, String now) {
        return new ProjectRecord(id, userId, name, newDescription, projectData, newTags, isPublic, shareId,
                sharePermissions, requiresAuth, localVersion, serverVersion, syncStatus, createdAt, now);
    }

    public ProjectRecord withSharing(boolean nowPublic, String newShareId, SharePermission perm,
                                     boolean authRequired, String now) {
        return new ProjectRecord(id, userId, name, description, projectData, tags, nowPublic, newShareId,
                perm.wire(), authRequired, localVersion, serverVersion, syncStatus, createdAt, now);
    }
}
