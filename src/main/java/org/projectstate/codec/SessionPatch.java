package org.projectstate.codec;

import java.util.List;
import java.util.Map;

/**
 * A restored session, ready to be installed. Produced only from a snapshot that
 * passed validation, so installing it never leaves a half-restored session.
 */
public record SessionPatch(
        String projectId,
        String name,
        String createdAt,
        String updatedAt,
        DocumentState document,
        ViewState view,
        Map<String, List<Object>> elementCollections,
        LayerState layers,
        EditorState editor,
        String sourceLanguage,
        String desiredLanguage,
        Map<String, Object> finalLayoutSettings) {

    public void applyTo(EditingSession session) {
        session.setProjectId(projectId);
        session.setName(name);
        session.setCreatedAt(createdAt);
        session.setUpdatedAt(updatedAt);
        session.setDocument(document);
        session.setView(view);
        session.setElementCollections(elementCollections);
        session.setLayers(layers);
        session.setEditor(editor);
        session.setSourceLanguage(sourceLanguage);
        session.setDesiredLanguage(desiredLanguage);
        session.setFinalLayoutSettings(finalLayoutSettings);
    }
}
