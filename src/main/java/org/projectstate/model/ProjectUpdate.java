package org.projectstate.model;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Partial update; {@code null} fields are left untouched. A non-null
 * {@code localVersion} turns the update into a version-checked write.
 */
public record ProjectUpdate(
        String name,
        String description,
        @SerializedName("project_data") JsonObject projectData,
        List<String> tags,
        @SerializedName("local_version") Long localVersion) {

    public static ProjectUpdate ofSnapshot(ProjectSnapshot snapshot, Long localVersion) {
        return new ProjectUpdate(snapshot.name(), null, snapshot.toJsonTree(), null, localVersion);
    }
}
