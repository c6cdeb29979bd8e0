package org.projectstate.codec;

import java.util.Set;

/** Which view, workflow step and sidebar tab the editor shows. */
public final class ViewState {

    public static final Set<String> VIEWS = Set.of("original", "translated", "split");
    public static final Set<String> WORKFLOW_STEPS = Set.of("translate", "layout", "final-layout");
    public static final Set<String> SIDEBAR_TABS = Set.of("pages", "tools", "chat");

    public static final String FINAL_LAYOUT = "final-layout";

    private String currentView = "original";
    private String currentWorkflowStep = "translate";
    private String activeSidebarTab = "pages";
    private String zoomMode = "page";
    private double containerWidth;
    private boolean sidebarCollapsed;

    public String getCurrentView() { return currentView; }
    public void setCurrentView(String currentView) { this.currentView = currentView; }

    public String getCurrentWorkflowStep() { return currentWorkflowStep; }
    public void setCurrentWorkflowStep(String currentWorkflowStep) { this.currentWorkflowStep = currentWorkflowStep; }

    public String getActiveSidebarTab() { return activeSidebarTab; }
    public void setActiveSidebarTab(String activeSidebarTab) { this.activeSidebarTab = activeSidebarTab; }

    public String getZoomMode() { return zoomMode; }
    public void setZoomMode(String zoomMode) { this.zoomMode = zoomMode; }

    public double getContainerWidth() { return containerWidth; }
    public void setContainerWidth(double containerWidth) { this.containerWidth = containerWidth; }

    public boolean isSidebarCollapsed() { return sidebarCollapsed; }
    public void setSidebarCollapsed(boolean sidebarCollapsed) { this.sidebarCollapsed = sidebarCollapsed; }

    public boolean isFinalLayoutStep() {
        return FINAL_LAYOUT.equals(currentWorkflowStep);
    }
}
