package org.projectstate.exceptions;

/** Lookup miss, local or remote. Not retried. */
public class NotFoundException extends PersistenceException {

    private final String projectId;

    public NotFoundException(String projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public String projectId() {
        return projectId;
    }
}
