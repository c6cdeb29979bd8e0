package org.projectstate.share;

import org.projectstate.model.ProjectSnapshot;

/** A collaborator's update: the snapshot plus an optional new name. */
public record SharedPatchRequest(String projectId, String shareId, String name, ProjectSnapshot snapshot) {
}
