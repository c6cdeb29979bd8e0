package org.projectstate.interfaces;

import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;

import java.util.List;

/**
 * Where a project snapshot lives. Implemented once for device storage and once
 * for the remote backend; both are keyed by project id.
 */
public interface StorageGateway {

    /**
     * Stores a new project. The returned record carries the id assigned by the
     * store; callers must use it for every later operation on the project.
     */
    ProjectRecord create(ProjectDraft draft) throws PersistenceException;

    /** @throws NotFoundException when no project with {@code id} is visible to the caller */
    ProjectRecord read(String id) throws PersistenceException;

    /**
     * Applies the non-null fields of {@code update}.
     *
     * @throws NotFoundException when the project does not exist
     * @throws org.projectstate.exceptions.VersionConflictException when the update carries a
     *         stale local version
     */
    ProjectRecord update(String id, ProjectUpdate update) throws PersistenceException;

    /** Idempotent: deleting an absent project succeeds. */
    void delete(String id) throws PersistenceException;

    List<ProjectSummary> list(int limit, int offset) throws PersistenceException;
}
