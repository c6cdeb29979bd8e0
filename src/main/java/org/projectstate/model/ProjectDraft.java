package org.projectstate.model;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/** Body of a create call. */
public record ProjectDraft(
        String name,
        String description,
        @SerializedName("project_data") JsonObject projectData,
        List<String> tags,
        @SerializedName("is_public") boolean isPublic) {

    public static ProjectDraft of(ProjectSnapshot snapshot, String description, List<String> tags) {
        return new ProjectDraft(snapshot.name(), description, snapshot.toJsonTree(), tags, false);
    }
}
