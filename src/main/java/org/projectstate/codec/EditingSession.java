package org.projectstate.codec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The live, mutable editing session. Element collections and final-layout settings
 * are open-ended trees owned by the editing surface; the codec treats them as
 * arbitrary object graphs.
 */
public final class EditingSession {

    private String projectId;
    private String name;
    private String createdAt;
    private String updatedAt;
    private DocumentState document = new DocumentState();
    private ViewState view = new ViewState();
    private Map<String, List<Object>> elementCollections = new LinkedHashMap<>();
    private LayerState layers = new LayerState();
    private EditorState editor = new EditorState();
    private String sourceLanguage;
    private String desiredLanguage;
    private Map<String, Object> finalLayoutSettings;

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }

    public String getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(String updatedAt) { this.updatedAt = updatedAt; }

    public DocumentState getDocument() { return document; }
    public void setDocument(DocumentState document) { this.document = document; }

    public ViewState getView() { return view; }
    public void setView(ViewState view) { this.view = view; }

    public Map<String, List<Object>> getElementCollections() { return elementCollections; }
    public void setElementCollections(Map<String, List<Object>> elementCollections) {
        this.elementCollections = elementCollections;
    }

    public LayerState getLayers() { return layers; }
    public void setLayers(LayerState layers) { this.layers = layers; }

    public EditorState getEditor() { return editor; }
    public void setEditor(EditorState editor) { this.editor = editor; }

    public String getSourceLanguage() { return sourceLanguage; }
    public void setSourceLanguage(String sourceLanguage) { this.sourceLanguage = sourceLanguage; }

    public String getDesiredLanguage() { return desiredLanguage; }
    public void setDesiredLanguage(String desiredLanguage) { this.desiredLanguage = desiredLanguage; }

    public Map<String, Object> getFinalLayoutSettings() { return finalLayoutSettings; }
    public void setFinalLayoutSettings(Map<String, Object> finalLayoutSettings) {
        this.finalLayoutSettings = finalLayoutSettings;
    }
}
