package org.projectstate.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.model.ProjectSnapshot;
import org.projectstate.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Converts between the live {@link EditingSession} and the portable {@link ProjectSnapshot}.
 * <ul>
 *   <li>{@link #serialize} is total. A section that cannot be converted is replaced by
 *       a placeholder object and logged.</li>
 *   <li>{@link #deserialize} requires {@code id}, {@code name} and {@code documentState}
 *       and forces the restored session into a usable state: document loaded, no
 *       selection, every tool mode off.</li>
 * </ul>
 */
public final class SnapshotCodec {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotCodec.class);

    private static final Type OBJECT_MAP = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();
    private static final Type OBJECT_LIST = new TypeToken<ArrayList<Object>>() {}.getType();

    private static final IntKeyedMapConverter<String> BACKGROUNDS =
            IntKeyedMapConverter.ofStrings("detectedPageBackgrounds");
    private static final IntKeyedMapConverter<Boolean> PAGE_TRANSLATED =
            IntKeyedMapConverter.ofBooleans("isPageTranslated");
    private static final IntSetConverter DELETED_PAGES = new IntSetConverter("deletedPages");
    private static final IntSetConverter FINAL_DELETED_PAGES = new IntSetConverter("finalLayoutDeletedPages");

    private final SafeSerializer safe = new SafeSerializer();
    private final Clock clock;

    public SnapshotCodec(Clock clock) {
        this.clock = clock;
    }

    /* ============================ serialize ============================ */

    public ProjectSnapshot serialize(EditingSession s) {
        String now = clock.instant().toString();
        String name = (s.getName() == null || s.getName().isBlank()) ? defaultName() : s.getName();
        String createdAt = s.getCreatedAt() != null ? s.getCreatedAt() : now;

        ViewState view = s.getView() != null ? s.getView() : new ViewState();
        JsonObject finalLayout = null;
        if (view.isFinalLayoutStep() && s.getFinalLayoutSettings() != null) {
            finalLayout = section("finalLayoutSettings", () -> asObject(safe.toTree(s.getFinalLayoutSettings())));
        }

        return new ProjectSnapshot(
                s.getProjectId(),
                name,
                createdAt,
                now,
                ProjectSnapshot.SCHEMA_VERSION,
                section("documentState", () -> documentToJson(s.getDocument())),
                section("viewState", () -> viewToJson(view)),
                section("elementCollections", () -> asObject(safe.toTree(s.getElementCollections()))),
                section("layerState", () -> layersToJson(s.getLayers())),
                section("editorState", () -> editorToJson(s.getEditor())),
                s.getSourceLanguage(),
                s.getDesiredLanguage(),
                finalLayout);
    }

    public String defaultName() {
        return "Project " + LocalDate.now(clock.withZone(ZoneId.systemDefault()));
    }

    private static JsonObject section(String name, Supplier<JsonObject> build) {
        try {
            return build.get();
        } catch (RuntimeException e) {
            logger.warn("Section {} could not be serialized: {}", name, e.toString());
            JsonObject marker = new JsonObject();
            marker.addProperty("value", SafeSerializer.UNSERIALIZABLE);
            return marker;
        }
    }

    private static JsonObject asObject(JsonElement tree) {
        if (tree.isJsonObject()) return tree.getAsJsonObject();
        JsonObject wrapped = new JsonObject();
        wrapped.add("value", tree);
        return wrapped;
    }

    private static JsonObject documentToJson(DocumentState d) {
        DocumentState doc = d != null ? d : new DocumentState();
        JsonObject o = new JsonObject();
        o.addProperty("url", doc.getUrl());
        o.addProperty("fileType", doc.getFileType());
        o.addProperty("numPages", doc.getNumPages());
        o.addProperty("currentPage", doc.getCurrentPage());
        putFinite(o, "documentState.scale", "scale", doc.getScale());
        putFinite(o, "documentState.pageWidth", "pageWidth", doc.getPageWidth());
        putFinite(o, "documentState.pageHeight", "pageHeight", doc.getPageHeight());
        o.addProperty("isDocumentLoaded", doc.isDocumentLoaded());
        o.addProperty("isLoading", doc.isLoading());
        o.addProperty("error", doc.getError());
        o.add("isPageTranslated", PAGE_TRANSLATED.toPortable(doc.getPageTranslated()));
        o.add("detectedPageBackgrounds", BACKGROUNDS.toPortable(doc.getDetectedPageBackgrounds()));
        o.add("deletedPages", DELETED_PAGES.toPortable(doc.getDeletedPages()));
        o.addProperty("finalLayoutUrl", doc.getFinalLayoutUrl());
        o.addProperty("finalLayoutCurrentPage", doc.getFinalLayoutCurrentPage());
        o.add("finalLayoutDeletedPages", FINAL_DELETED_PAGES.toPortable(doc.getFinalLayoutDeletedPages()));
        return o;
    }

    private static JsonObject viewToJson(ViewState v) {
        JsonObject o = new JsonObject();
        o.addProperty("currentView", v.getCurrentView());
        o.addProperty("currentWorkflowStep", v.getCurrentWorkflowStep());
        o.addProperty("activeSidebarTab", v.getActiveSidebarTab());
        o.addProperty("zoomMode", v.getZoomMode());
        putFinite(o, "viewState.containerWidth", "containerWidth", v.getContainerWidth());
        o.addProperty("isSidebarCollapsed", v.isSidebarCollapsed());
        return o;
    }

    /** NaN and infinities have no JSON form; they are written as null and restore to the default. */
    private static void putFinite(JsonObject o, String where, String name, double value) {
        if (Double.isFinite(value)) {
            o.addProperty(name, value);
        } else {
            logger.warn("Non-finite number at {} written as null", where);
            o.add(name, JsonNull.INSTANCE);
        }
    }

    private static JsonObject layersToJson(LayerState l) {
        LayerState layers = l != null ? l : new LayerState();
        JsonObject o = new JsonObject();
        o.add("originalLayerOrder", Json.toArray(layers.getOriginalLayerOrder()));
        o.add("translatedLayerOrder", Json.toArray(layers.getTranslatedLayerOrder()));
        o.add("finalLayoutLayerOrder", Json.toArray(layers.getFinalLayoutLayerOrder()));
        return o;
    }

    /** Selections, tool modes and drag state are not written. */
    private static JsonObject editorToJson(EditorState e) {
        EditorState editor = e != null ? e : new EditorState();
        JsonObject o = new JsonObject();
        o.addProperty("isEditMode", editor.isEditMode());
        o.addProperty("showDeletionRectangles", editor.isShowDeletionRectangles());
        return o;
    }

    /* ============================ deserialize ============================ */

    public SessionPatch deserialize(ProjectSnapshot snap) throws MalformedSnapshotException {
        if (snap == null) {
            throw new MalformedSnapshotException("snapshot is missing");
        }
        if (snap.id() == null || snap.id().isBlank()) {
            throw new MalformedSnapshotException("snapshot has no id");
        }
        if (snap.name() == null) {
            throw new MalformedSnapshotException("snapshot " + snap.id() + " has no name");
        }
        if (snap.documentState() == null) {
            throw new MalformedSnapshotException("snapshot " + snap.id() + " has no documentState");
        }

        ViewState view = viewFromJson(snap.viewState());
        Map<String, Object> finalLayout = null;
        if (snap.finalLayoutSettings() != null) {
            finalLayout = Json.GSON.fromJson(snap.finalLayoutSettings(), OBJECT_MAP);
        }

        return new SessionPatch(
                snap.id(),
                snap.name(),
                snap.createdAt(),
                snap.updatedAt(),
                documentFromJson(snap.documentState()),
                view,
                elementsFromJson(snap.elementCollections()),
                layersFromJson(snap.layerState()),
                editorFromJson(snap.editorState()),
                snap.sourceLanguage(),
                snap.desiredLanguage(),
                finalLayout);
    }

    private static DocumentState documentFromJson(JsonObject o) {
        DocumentState d = new DocumentState();
        d.setUrl(Json.string(o, "url", null));
        d.setFileType(Json.string(o, "fileType", null));
        d.setNumPages(Json.integer(o, "numPages", 0));
        d.setCurrentPage(Json.integer(o, "currentPage", 1));
        d.setScale(Json.decimal(o, "scale", 1.0));
        d.setPageWidth(Json.decimal(o, "pageWidth", 0));
        d.setPageHeight(Json.decimal(o, "pageHeight", 0));
        d.setPageTranslated(PAGE_TRANSLATED.fromPortable(o.get("isPageTranslated")));
        d.setDetectedPageBackgrounds(BACKGROUNDS.fromPortable(o.get("detectedPageBackgrounds")));
        d.setDeletedPages(DELETED_PAGES.fromPortable(o.get("deletedPages")));
        d.setFinalLayoutUrl(Json.string(o, "finalLayoutUrl", null));
        d.setFinalLayoutCurrentPage(Json.integer(o, "finalLayoutCurrentPage", 1));
        d.setFinalLayoutDeletedPages(FINAL_DELETED_PAGES.fromPortable(o.get("finalLayoutDeletedPages")));
        // restored sessions are immediately usable
        d.setDocumentLoaded(true);
        d.setLoading(false);
        d.setError("");
        return d;
    }

    private static ViewState viewFromJson(JsonObject o) {
        ViewState v = new ViewState();
        v.setCurrentView(oneOf(Json.string(o, "currentView", null), ViewState.VIEWS, "original"));
        v.setCurrentWorkflowStep(oneOf(Json.string(o, "currentWorkflowStep", null), ViewState.WORKFLOW_STEPS, "translate"));
        v.setActiveSidebarTab(oneOf(Json.string(o, "activeSidebarTab", null), ViewState.SIDEBAR_TABS, "pages"));
        v.setZoomMode(Json.string(o, "zoomMode", "page"));
        v.setContainerWidth(Json.decimal(o, "containerWidth", 0));
        v.setSidebarCollapsed(Json.bool(o, "isSidebarCollapsed", false));
        return v;
    }

    private static LayerState layersFromJson(JsonObject o) {
        LayerState l = new LayerState();
        l.setOriginalLayerOrder(Json.strings(o, "originalLayerOrder"));
        l.setTranslatedLayerOrder(Json.strings(o, "translatedLayerOrder"));
        l.setFinalLayoutLayerOrder(Json.strings(o, "finalLayoutLayerOrder"));
        return l;
    }

    private static EditorState editorFromJson(JsonObject o) {
        EditorState e = new EditorState();
        e.setEditMode(Json.bool(o, "isEditMode", true));
        e.setShowDeletionRectangles(Json.bool(o, "showDeletionRectangles", false));
        e.resetTransient();
        return e;
    }

    private static Map<String, List<Object>> elementsFromJson(JsonObject o) {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        if (o == null) return out;
        for (Map.Entry<String, JsonElement> e : o.entrySet()) {
            if (e.getValue().isJsonArray()) {
                JsonArray arr = e.getValue().getAsJsonArray();
                out.put(e.getKey(), Json.GSON.fromJson(arr, OBJECT_LIST));
            } else {
                logger.warn("elementCollections.{} is not a list, dropped", e.getKey());
            }
        }
        return out;
    }

    private static String oneOf(String value, Set<String> allowed, String fallback) {
        return value != null && allowed.contains(value) ? value : fallback;
    }
}
