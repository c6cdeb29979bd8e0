package org.projectstate.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;
import org.projectstate.util.Json;

import java.util.List;

/** List-view projection of a project with counts derived from its snapshot. */
public record ProjectSummary(
        String id,
        String name,
        String description,
        List<String> tags,
        @SerializedName("is_public") boolean isPublic,
        @SerializedName("server_version") long serverVersion,
        @SerializedName("created_at") String createdAt,
        @SerializedName("updated_at") String updatedAt,
        @SerializedName("document_url") String documentUrl,
        @SerializedName("file_type") String fileType,
        @SerializedName("current_page") int currentPage,
        @SerializedName("num_pages") int numPages,
        @SerializedName("current_workflow_step") String currentWorkflowStep,
        @SerializedName("text_boxes_count") int textBoxesCount,
        @SerializedName("images_count") int imagesCount) {

    public static ProjectSummary of(ProjectRecord r) {
        JsonObject data = r.projectData();
        JsonObject doc = Json.object(data, "documentState");
        JsonObject view = Json.object(data, "viewState");
        JsonObject elements = Json.object(data, "elementCollections");
        return new ProjectSummary(
                r.id(), r.name(), r.description(), r.tags(), r.isPublic(), r.serverVersion(),
                r.createdAt(), r.updatedAt(),
                Json.string(doc, "url", null),
                Json.string(doc, "fileType", null),
                Json.integer(doc, "currentPage", 1),
                Json.integer(doc, "numPages", 0),
                Json.string(view, "currentWorkflowStep", null),
                count(elements, "originalTextBoxes"),
                count(elements, "originalImages"));
    }

    private static int count(JsonObject elements, String name) {
        JsonArray arr = Json.array(elements, name);
        return arr == null ? 0 : arr.size();
    }
}
