package org.projectstate;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.projectstate.codec.EditingSession;
import org.projectstate.codec.SafeSerializer;
import org.projectstate.codec.SessionPatch;
import org.projectstate.codec.SnapshotCodec;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.model.ProjectSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec(Fixtures.CLOCK);

    @Test
    void backgroundsSerializeAsIntegerKeyedObjectAndDeletedPagesAsArray() {
        EditingSession s = Fixtures.session("Doc A");
        ProjectSnapshot snap = codec.serialize(s);

        JsonObject doc = snap.documentState();
        assertEquals("rgb(250,250,250)", doc.getAsJsonObject("detectedPageBackgrounds").get("2").getAsString());
        assertEquals(2, doc.getAsJsonArray("deletedPages").size());
        assertEquals("1.0.0", snap.schemaVersion());
        assertEquals("1.0.0", snap.toJsonTree().get("version").getAsString());
    }

    @Test
    void roundTripRestoresPersistedFields() throws Exception {
        EditingSession s = Fixtures.session("Doc A");
        s.setProjectId("p1");
        SessionPatch patch = codec.deserialize(codec.serialize(s));

        EditingSession restored = new EditingSession();
        patch.applyTo(restored);

        assertEquals("p1", restored.getProjectId());
        assertEquals("Doc A", restored.getName());
        assertEquals(Map.of(2, "rgb(250,250,250)"), restored.getDocument().getDetectedPageBackgrounds());
        assertEquals(Set.of(4, 7), restored.getDocument().getDeletedPages());
        assertEquals(Map.of(1, true), restored.getDocument().getPageTranslated());
        assertEquals(3, restored.getDocument().getCurrentPage());
        assertEquals(1.25, restored.getDocument().getScale());
        assertEquals("layout", restored.getView().getCurrentWorkflowStep());
        assertEquals(List.of("tb-1"), restored.getLayers().getOriginalLayerOrder());
        assertEquals("fr", restored.getDesiredLanguage());

        @SuppressWarnings("unchecked")
        Map<String, Object> box = (Map<String, Object>) restored.getElementCollections().get("originalTextBoxes").get(0);
        assertEquals("Hello", box.get("value"));
    }

    @Test
    void reserializingRestoredSessionIsEquivalent() throws Exception {
        EditingSession s = Fixtures.session("Doc A");
        s.setProjectId("p1");
        ProjectSnapshot first = codec.serialize(s);

        EditingSession restored = new EditingSession();
        codec.deserialize(first).applyTo(restored);
        ProjectSnapshot second = codec.serialize(restored);

        assertEquals(first.documentState().get("detectedPageBackgrounds"),
                second.documentState().get("detectedPageBackgrounds"));
        assertEquals(first.documentState().get("deletedPages"), second.documentState().get("deletedPages"));
        assertEquals(first.layerState(), second.layerState());
    }

    @Test
    void restoreForcesUsableDocumentAndClearsTransientEditorState() throws Exception {
        EditingSession s = Fixtures.session("Doc A");
        s.setProjectId("p1");
        s.getDocument().setLoading(true);
        s.getDocument().setError("boom");
        s.getEditor().setSelectedFieldId("tb-1");
        s.getEditor().setAddTextBoxMode(true);

        EditingSession restored = new EditingSession();
        codec.deserialize(codec.serialize(s)).applyTo(restored);

        assertTrue(restored.getDocument().isDocumentLoaded());
        assertFalse(restored.getDocument().isLoading());
        assertEquals("", restored.getDocument().getError());
        assertNull(restored.getEditor().getSelectedFieldId());
        assertFalse(restored.getEditor().isAddTextBoxMode());
        assertTrue(restored.getEditor().getSelectedElementIds().isEmpty());
    }

    @Test
    void missingNameFallsBackToDatedDefault() {
        EditingSession s = Fixtures.session(null);
        String name = codec.serialize(s).name();
        assertTrue(name.matches("Project \\d{4}-\\d{2}-\\d{2}"), name);
    }

    @Test
    void finalLayoutSettingsOnlyWrittenAtFinalLayoutStep() {
        EditingSession s = Fixtures.session("Doc A");
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("pageSize", "A4");
        s.setFinalLayoutSettings(settings);

        assertNull(codec.serialize(s).finalLayoutSettings());

        s.getView().setCurrentWorkflowStep("final-layout");
        assertEquals("A4", codec.serialize(s).finalLayoutSettings().get("pageSize").getAsString());
    }

    @Test
    void unserializableElementsBecomePlaceholdersWithoutFailing() {
        EditingSession s = Fixtures.session("Doc A");
        List<Object> odd = new ArrayList<>();
        odd.add(new Object());
        odd.add(odd); // cycle
        s.getElementCollections().put("originalImages", odd);

        ProjectSnapshot snap = assertDoesNotThrow(() -> codec.serialize(s));
        String json = snap.elementCollections().getAsJsonArray("originalImages").toString();
        assertTrue(json.contains(SafeSerializer.UNSERIALIZABLE));
    }

    @Test
    void missingRequiredFieldsAreMalformed() {
        JsonObject noId = Fixtures.snapshotJson(null, "Doc");
        assertThrows(MalformedSnapshotException.class, () -> codec.deserialize(ProjectSnapshot.fromJson(noId)));

        JsonObject noDoc = Fixtures.snapshotJson("p1", "Doc");
        noDoc.remove("documentState");
        assertThrows(MalformedSnapshotException.class, () -> codec.deserialize(ProjectSnapshot.fromJson(noDoc)));

        JsonObject noName = Fixtures.snapshotJson("p1", "Doc");
        noName.remove("name");
        assertThrows(MalformedSnapshotException.class, () -> codec.deserialize(ProjectSnapshot.fromJson(noName)));

        assertThrows(MalformedSnapshotException.class, () -> ProjectSnapshot.fromJson("[1,2]"));
    }

    @Test
    void invalidViewValuesAndMissingLayersRestoreToDefaults() throws Exception {
        JsonObject tree = Fixtures.snapshotJson("p1", "Doc");
        JsonObject view = new JsonObject();
        view.addProperty("currentView", "sideways");
        view.addProperty("currentWorkflowStep", "publish");
        view.addProperty("activeSidebarTab", "chat");
        tree.add("viewState", view);

        SessionPatch patch = codec.deserialize(ProjectSnapshot.fromJson(tree));
        assertEquals("original", patch.view().getCurrentView());
        assertEquals("translate", patch.view().getCurrentWorkflowStep());
        assertEquals("chat", patch.view().getActiveSidebarTab());
        assertTrue(patch.layers().getOriginalLayerOrder().isEmpty());
        assertTrue(patch.layers().getFinalLayoutLayerOrder().isEmpty());
    }

    @Test
    void corruptDeletedPagesDegradeToEmptySet() throws Exception {
        JsonObject tree = Fixtures.snapshotJson("p1", "Doc");
        tree.getAsJsonObject("documentState").addProperty("deletedPages", "3,4");

        SessionPatch patch = codec.deserialize(ProjectSnapshot.fromJson(tree));
        assertTrue(patch.document().getDeletedPages().isEmpty());
    }

    @Test
    void mistypedOptionalSectionsRestoreToDefaults() throws Exception {
        JsonObject tree = Fixtures.snapshotJson("p1", "Doc");
        tree.add("viewState", new JsonArray());
        tree.addProperty("layerState", "x");
        tree.addProperty("editorState", 5);

        ProjectSnapshot snap = ProjectSnapshot.fromJson(tree);
        assertNull(snap.viewState());
        assertNull(snap.layerState());

        SessionPatch patch = codec.deserialize(snap);
        assertEquals("p1", patch.projectId());
        assertEquals("original", patch.view().getCurrentView());
        assertEquals("translate", patch.view().getCurrentWorkflowStep());
        assertTrue(patch.layers().getTranslatedLayerOrder().isEmpty());
        assertTrue(patch.editor().isEditMode());
    }

    @Test
    void mistypedDocumentStateIsStillMalformed() {
        JsonObject tree = Fixtures.snapshotJson("p1", "Doc");
        tree.add("documentState", new JsonArray());
        assertThrows(MalformedSnapshotException.class, () -> codec.deserialize(ProjectSnapshot.fromJson(tree)));
    }

    @Test
    void nonFiniteMeasurementsAreNotWrittenAsNumbers() throws Exception {
        EditingSession s = Fixtures.session("Doc A");
        s.setProjectId("p1");
        s.getDocument().setScale(Double.NaN);
        s.getDocument().setPageWidth(Double.POSITIVE_INFINITY);
        s.getView().setContainerWidth(Double.NEGATIVE_INFINITY);

        ProjectSnapshot snap = codec.serialize(s);
        String json = snap.toJson();
        assertFalse(json.contains("NaN"), json);
        assertFalse(json.contains("Infinity"), json);
        assertFalse(snap.documentState().get("scale").isJsonPrimitive());

        SessionPatch patch = codec.deserialize(ProjectSnapshot.fromJson(json));
        assertEquals(1.0, patch.document().getScale());
        assertEquals(0.0, patch.document().getPageWidth());
        assertEquals(0.0, patch.view().getContainerWidth());
    }
}
