package org.projectstate.codec;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Editing-surface flags. Only {@code editMode} and {@code showDeletionRectangles}
 * are persisted; selections, tool modes and the drag handle exist for the
 * lifetime of the session only.
 */
public final class EditorState {

    private boolean editMode = true;
    private boolean showDeletionRectangles;

    // transient
    private String selectedFieldId;
    private String selectedShapeId;
    private Set<String> selectedElementIds = new LinkedHashSet<>();
    private boolean addTextBoxMode;
    private boolean textSelectionMode;
    private boolean imageUploadMode;
    private boolean selectionMode;
    private Object dragHandle;

    public boolean isEditMode() { return editMode; }
    public void setEditMode(boolean editMode) { this.editMode = editMode; }

    public boolean isShowDeletionRectangles() { return showDeletionRectangles; }
    public void setShowDeletionRectangles(boolean showDeletionRectangles) {
        this.showDeletionRectangles = showDeletionRectangles;
    }

    public String getSelectedFieldId() { return selectedFieldId; }
    public void setSelectedFieldId(String selectedFieldId) { this.selectedFieldId = selectedFieldId; }

    public String getSelectedShapeId() { return selectedShapeId; }
    public void setSelectedShapeId(String selectedShapeId) { this.selectedShapeId = selectedShapeId; }

    public Set<String> getSelectedElementIds() { return selectedElementIds; }

    public boolean isAddTextBoxMode() { return addTextBoxMode; }
    public void setAddTextBoxMode(boolean addTextBoxMode) { this.addTextBoxMode = addTextBoxMode; }

    public boolean isTextSelectionMode() { return textSelectionMode; }
    public void setTextSelectionMode(boolean textSelectionMode) { this.textSelectionMode = textSelectionMode; }

    public boolean isImageUploadMode() { return imageUploadMode; }
    public void setImageUploadMode(boolean imageUploadMode) { this.imageUploadMode = imageUploadMode; }

    public boolean isSelectionMode() { return selectionMode; }
    public void setSelectionMode(boolean selectionMode) { this.selectionMode = selectionMode; }

    public Object getDragHandle() { return dragHandle; }
    public void setDragHandle(Object dragHandle) { this.dragHandle = dragHandle; }

    /** Clears selections, tool modes and any drag in progress. */
    public void resetTransient() {
        selectedFieldId = null;
        selectedShapeId = null;
        selectedElementIds.clear();
        addTextBoxMode = false;
        textSelectionMode = false;
        imageUploadMode = false;
        selectionMode = false;
        dragHandle = null;
    }
}
