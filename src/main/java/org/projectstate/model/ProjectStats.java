package org.projectstate.model;

import com.google.gson.annotations.SerializedName;

import java.util.Map;

public record ProjectStats(
        @SerializedName("total_projects") int totalProjects,
        @SerializedName("workflow_step_counts") Map<String, Integer> workflowStepCounts) {
}
