package org.projectstate.persistance;

import com.google.gson.JsonObject;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.interfaces.KeyValueStore;
import org.projectstate.interfaces.StorageGateway;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectSnapshot;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.share.SharePermission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps projects on the device. Layout inside the key-value store:
 * <ul>
 *   <li>{@code <prefix>-project-<id>}: the serialized snapshot of one project</li>
 *   <li>{@code <prefix>-current-project}: id of the project last saved or loaded</li>
 * </ul>
 * Local records have no owner and version 0; versions only mean something remotely.
 */
public final class LocalStorageGateway implements StorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageGateway.class);

    public static final String LOCAL_ID_PREFIX = "local-";
    private static final String LOCAL_STATUS = "local";

    private final KeyValueStore store;
    private final String projectPrefix;
    private final String currentKey;
    private final Clock clock;

    public LocalStorageGateway(KeyValueStore store, String keyPrefix, Clock clock) {
        this.store = store;
        this.projectPrefix = keyPrefix + "-project-";
        this.currentKey = keyPrefix + "-current-project";
        this.clock = clock;
    }

    public static boolean isLocalId(String id) {
        return id != null && id.startsWith(LOCAL_ID_PREFIX);
    }

    public String keyFor(String id) {
        return projectPrefix + id;
    }

    @Override
    public ProjectRecord create(ProjectDraft draft) throws PersistenceException {
        ProjectSnapshot snapshot = ProjectSnapshot.fromJson(draft.projectData());
        String id = isLocalId(snapshot.id()) ? snapshot.id() : LOCAL_ID_PREFIX + UUID.randomUUID();
        ProjectSnapshot stored = snapshot.withId(id);
        if (stored.createdAt() == null) {
            stored = stored.withCreatedAt(clock.instant().toString());
        }
        write(id, stored);
        setCurrentProject(id);
        logger.info("Created local project {}", id);
        return toRecord(stored);
    }

    @Override
    public ProjectRecord read(String id) throws PersistenceException {
        return toRecord(readSnapshot(id));
    }

    @Override
    public ProjectRecord update(String id, ProjectUpdate update) throws PersistenceException {
        ProjectSnapshot existing = readSnapshot(id);
        ProjectSnapshot next = existing;
        if (update.projectData() != null) {
            // the stored copy is the authority for creation time
            next = ProjectSnapshot.fromJson(update.projectData()).withId(id).withCreatedAt(existing.createdAt());
        }
        if (update.name() != null && !update.name().equals(next.name())) {
            JsonObject tree = next.toJsonTree();
            tree.addProperty("name", update.name());
            next = ProjectSnapshot.fromJson(tree);
        }
        write(id, next);
        setCurrentProject(id);
        return toRecord(next);
    }

    @Override
    public void delete(String id) throws PersistenceException {
        try {
            store.remove(keyFor(id));
            if (currentProjectId().filter(id::equals).isPresent()) {
                store.remove(currentKey);
            }
        } catch (IOException e) {
            throw new PersistenceException("Local delete failed for " + id, e);
        }
    }

    /** Newest {@code updatedAt} first. Entries that no longer parse are skipped. */
    @Override
    public List<ProjectSummary> list(int limit, int offset) throws PersistenceException {
        List<ProjectRecord> records = new ArrayList<>();
        try {
            for (String key : store.keys(projectPrefix)) {
                String id = key.substring(projectPrefix.length());
                try {
                    records.add(read(id));
                } catch (MalformedSnapshotException e) {
                    logger.warn("Skipping unreadable local project {}: {}", id, e.getMessage());
                } catch (NotFoundException e) {
                    logger.debug("Local project {} vanished while listing", id);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Local listing failed", e);
        }
        return records.stream()
                .sorted(Comparator.comparing(ProjectRecord::updatedInstant).reversed())
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .map(ProjectSummary::of)
                .toList();
    }

    public Optional<String> currentProjectId() throws PersistenceException {
        try {
            return store.get(currentKey);
        } catch (IOException e) {
            throw new PersistenceException("Could not read current project pointer", e);
        }
    }

    public void setCurrentProject(String id) throws PersistenceException {
        try {
            store.put(currentKey, id);
        } catch (IOException e) {
            throw new PersistenceException("Could not write current project pointer", e);
        }
    }

    private ProjectSnapshot readSnapshot(String id) throws PersistenceException {
        Optional<String> json;
        try {
            json = store.get(keyFor(id));
        } catch (IOException e) {
            throw new PersistenceException("Local read failed for " + id, e);
        }
        if (json.isEmpty()) {
            throw new NotFoundException(id);
        }
        return ProjectSnapshot.fromJson(json.get());
    }

    private void write(String id, ProjectSnapshot snapshot) throws PersistenceException {
        try {
            store.put(keyFor(id), snapshot.toJson());
        } catch (IOException e) {
            throw new PersistenceException("Local write failed for " + id, e);
        }
    }

    private static ProjectRecord toRecord(ProjectSnapshot s) {
        return new ProjectRecord(s.id(), null, s.name(), null, s.toJsonTree(), List.of(), false, null,
                SharePermission.VIEWER.wire(), false, 0L, 0L, LOCAL_STATUS, s.createdAt(), s.updatedAt());
    }
}
