package org.projectstate.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Portable, JSON-safe form of one editing session. Every nested section is a plain
 * JSON tree; no live containers, functions or cycles survive into this type.
 *
 * <p>Wire layout: {@code {id, name, createdAt, updatedAt, version, documentState,
 * viewState, elementCollections, layerState, editorState, sourceLanguage,
 * desiredLanguage, finalLayoutSettings?}}.</p>
 */
public record ProjectSnapshot(
        String id,
        String name,
        String createdAt,
        String updatedAt,
        @SerializedName("version") String schemaVersion,
        JsonObject documentState,
        JsonObject viewState,
        JsonObject elementCollections,
        JsonObject layerState,
        JsonObject editorState,
        String sourceLanguage,
        String desiredLanguage,
        JsonObject finalLayoutSettings) {

    public static final String SCHEMA_VERSION = "1.0.0";

    private static final Logger logger = LoggerFactory.getLogger(ProjectSnapshot.class);

    public ProjectSnapshot withId(String newId) {
        return new ProjectSnapshot(newId, name, createdAt, updatedAt, schemaVersion, documentState, viewState,
                elementCollections, layerState, editorState, sourceLanguage, desiredLanguage, finalLayoutSettings);
    }

    public ProjectSnapshot withCreatedAt(String newCreatedAt) {
        return new ProjectSnapshot(id, name, newCreatedAt, updatedAt, schemaVersion, documentState, viewState,
                elementCollections, layerState, editorState, sourceLanguage, desiredLanguage, finalLayoutSettings);
    }

    public JsonObject toJsonTree() {
        return Json.GSON.toJsonTree(this).getAsJsonObject();
    }

    public String toJson() {
        return Json.GSON.toJson(this);
    }

    /**
     * Reads a snapshot tree field by field. Only the shape is checked here; required-field
     * validation belongs to the codec. A section of the wrong JSON type reads as absent.
     */
    public static ProjectSnapshot fromJson(JsonElement tree) throws MalformedSnapshotException {
        if (tree == null || !tree.isJsonObject()) {
            throw new MalformedSnapshotException("snapshot is not a JSON object");
        }
        JsonObject o = tree.getAsJsonObject();
        return new ProjectSnapshot(
                Json.string(o, "id", null),
                Json.string(o, "name", null),
                Json.string(o, "createdAt", null),
                Json.string(o, "updatedAt", null),
                Json.string(o, "version", null),
                section(o, "documentState"),
                section(o, "viewState"),
                section(o, "elementCollections"),
                section(o, "layerState"),
                section(o, "editorState"),
                Json.string(o, "sourceLanguage", null),
                Json.string(o, "desiredLanguage", null),
                section(o, "finalLayoutSettings"));
    }

    private static JsonObject section(JsonObject o, String name) {
        JsonElement e = o.get(name);
        if (e == null || e.isJsonNull()) return null;
        if (!e.isJsonObject()) {
            logger.warn("Snapshot section {} is a {}, not an object; ignored", name, kind(e));
            return null;
        }
        return e.getAsJsonObject();
    }

    private static String kind(JsonElement e) {
        if (e.isJsonArray()) return "array";
        return e.getAsJsonPrimitive().isString() ? "string" : "primitive";
    }

    public static ProjectSnapshot fromJson(String json) throws MalformedSnapshotException {
        try {
            return fromJson(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new MalformedSnapshotException("snapshot is not valid JSON", e);
        }
    }
}
