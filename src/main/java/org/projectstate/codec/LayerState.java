package org.projectstate.codec;

import java.util.ArrayList;
import java.util.List;

/** Z-order of element ids, one list per view. */
public final class LayerState {

    private List<String> originalLayerOrder = new ArrayList<>();
    private List<String> translatedLayerOrder = new ArrayList<>();
    private List<String> finalLayoutLayerOrder = new ArrayList<>();

    public List<String> getOriginalLayerOrder() { return originalLayerOrder; }
    public void setOriginalLayerOrder(List<String> originalLayerOrder) { this.originalLayerOrder = originalLayerOrder; }

    public List<String> getTranslatedLayerOrder() { return translatedLayerOrder; }
    public void setTranslatedLayerOrder(List<String> translatedLayerOrder) {
        this.translatedLayerOrder = translatedLayerOrder;
    }

    public List<String> getFinalLayoutLayerOrder() { return finalLayoutLayerOrder; }
    public void setFinalLayoutLayerOrder(List<String> finalLayoutLayerOrder) {
        this.finalLayoutLayerOrder = finalLayoutLayerOrder;
    }
}
