package org.projectstate.server;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.projectstate.codec.SnapshotCodec;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.exceptions.UnauthorizedException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.interfaces.SnapshotStore;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectSnapshot;
import org.projectstate.model.ProjectStats;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.model.ShareSettings;
import org.projectstate.share.PatchOutcome;
import org.projectstate.share.RejectionReason;
import org.projectstate.share.SharePermission;
import org.projectstate.util.Json;
import org.projectstate.util.ShareIdGenerator;
import org.projectstate.version.SyncResult;
import org.projectstate.version.VersionReconciler;
import org.projectstate.version.VersionedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * Server-side project table.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>Records live in a {@link ConcurrentHashMap}; writes to one project are serialized
 *       on a per-project monitor, so version checks and content changes apply together.
 *       Different projects never block each other.</li>
 *   <li>Every accepted write goes through {@link VersionReconciler} and raises
 *       {@code server_version} by exactly one.</li>
 *   <li>After each write the whole table is saved through the {@link SnapshotStore}; if
 *       that fails the in-memory change is rolled back and the error propagates.</li>
 *   <li>A project owned by someone else is indistinguishable from a missing one.</li>
 * </ul>
 */
public final class ProjectRepository {

    private static final Logger logger = LoggerFactory.getLogger(ProjectRepository.class);

    private static final Type RECORD_LIST = new TypeToken<List<ProjectRecord>>() {}.getType();

    private final ConcurrentMap<String, ProjectRecord> projects = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();
    private final Object persistLock = new Object();

    private final SnapshotStore store;
    private final Clock clock;
    private final SnapshotCodec codec;
    private final VersionReconciler reconciler = new VersionReconciler();
    private final ShareIdGenerator shareIds = new ShareIdGenerator();

    public ProjectRepository(SnapshotStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.codec = new SnapshotCodec(clock);
    }

    /** Loads the last saved table, if any. */
    public int restore() throws IOException {
        String json = store.load();
        if (json == null || json.isBlank()) return 0;
        List<ProjectRecord> records;
        try {
            records = Json.GSON.fromJson(json, RECORD_LIST);
        } catch (JsonParseException e) {
            throw new IOException("Stored project table is not readable", e);
        }
        if (records == null) return 0;
        for (ProjectRecord r : records) {
            if (r != null && r.id() != null) projects.put(r.id(), r);
        }
        logger.info("Restored {} project(s)", projects.size());
        return projects.size();
    }

    public int size() {
        return projects.size();
    }

    /* ------------------------------ owner reads ------------------------------ */

    public Optional<ProjectRecord> find(String userId, String id) {
        ProjectRecord r = projects.get(id);
        return (r != null && r.userId() != null && r.userId().equals(userId)) ? Optional.of(r) : Optional.empty();
    }

    public Optional<ProjectRecord> findPublic(String id) {
        ProjectRecord r = projects.get(id);
        return (r != null && r.isPublic()) ? Optional.of(r) : Optional.empty();
    }

    /** Newest {@code updated_at} first. */
    public List<ProjectSummary> list(String userId, int limit, int offset) {
        return owned(userId)
                .sorted(Comparator.comparing(ProjectRecord::updatedInstant).reversed())
                .skip(offset)
                .limit(limit)
                .map(ProjectSummary::of)
                .toList();
    }

    /** Case-insensitive substring match on the name. */
    public List<ProjectSummary> search(String userId, String query, int limit) {
        String q = query.toLowerCase(Locale.ROOT);
        return owned(userId)
                .filter(r -> r.name() != null && r.name().toLowerCase(Locale.ROOT).contains(q))
                .sorted(Comparator.comparing(ProjectRecord::updatedInstant).reversed())
                .limit(limit)
                .map(ProjectSummary::of)
                .toList();
    }

    public ProjectStats stats(String userId) {
        Map<String, Integer> steps = new TreeMap<>();
        List<ProjectSummary> all = owned(userId).map(ProjectSummary::of).toList();
        for (ProjectSummary s : all) {
            String step = s.currentWorkflowStep() == null ? "unknown" : s.currentWorkflowStep();
            steps.merge(step, 1, Integer::sum);
        }
        return new ProjectStats(all.size(), steps);
    }

    private Stream<ProjectRecord> owned(String userId) {
        return projects.values().stream().filter(r -> userId.equals(r.userId()));
    }

    /* ------------------------------ owner writes ------------------------------ */

    public ProjectRecord create(String userId, ProjectDraft draft) throws PersistenceException, IOException {
        String id = UUID.randomUUID().toString();
        String now = clock.instant().toString();
        String createdAt = Json.string(draft.projectData(), "createdAt", now);
        JsonObject data = stamp(id, draft.name(), draft.projectData(), createdAt);
        validate(data);

        String shareId = draft.isPublic() ? shareIds.next() : null;
        ProjectRecord record = new ProjectRecord(id, userId, draft.name(), draft.description(), data,
                draft.tags() == null ? List.of() : List.copyOf(draft.tags()), draft.isPublic(), shareId,
                SharePermission.VIEWER.wire(), false,
                VersionedRecord.INITIAL_VERSION, VersionedRecord.INITIAL_VERSION, ProjectRecord.SYNCED,
                createdAt, now);

        synchronized (lockFor(id)) {
            commit(id, null, record);
        }
        logger.info("Created project {} for user {}", id, userId);
        return record;
    }

    /**
     * Applies a partial update. With a local version the write is version-checked;
     * without one it overwrites. Either way an accepted write raises the version by one.
     *
     * @throws VersionConflictException when {@code update.localVersion()} is behind
     */
    public ProjectRecord update(String userId, String id, ProjectUpdate update)
            throws PersistenceException, IOException {
        synchronized (lockFor(id)) {
            ProjectRecord current = find(userId, id).orElseThrow(() -> new NotFoundException(id));
            String now = clock.instant().toString();
            JsonObject data = update.projectData() != null ? update.projectData() : current.projectData();
            String name = update.name() != null ? update.name() : Json.string(data, "name", current.name());
            JsonObject stamped = stamp(id, name, data, current.createdAt());
            ProjectSnapshot incoming = validate(stamped);

            long version = accept(current, incoming, update.localVersion());
            ProjectRecord next = current.withContent(name, stamped, version, now);
            if (update.description() != null || update.tags() != null) {
                next = next.withDetails(
                        update.description() != null ? update.description() : current.description(),
                        update.tags() != null ? List.copyOf(update.tags()) : current.tags(),
                        now);
            }
            commit(id, current, next);
            logger.debug("Project {} now at version {}", id, version);
            return next;
        }
    }

    /** Version-checked write of the snapshot only. */
    public ProjectRecord sync(String userId, String id, JsonObject projectData, long localVersion)
            throws PersistenceException, IOException {
        return update(userId, id, new ProjectUpdate(null, null, projectData, null, localVersion));
    }

    /** @return true when something was removed; deleting an absent project is not an error */
    public boolean delete(String userId, String id) throws IOException {
        synchronized (lockFor(id)) {
            Optional<ProjectRecord> current = find(userId, id);
            if (current.isEmpty()) return false;
            projects.remove(id);
            try {
                persist();
            } catch (IOException e) {
                projects.put(id, current.get());
                throw e;
            }
            locks.remove(id);
            logger.info("Deleted project {}", id);
            return true;
        }
    }

    /**
     * Public projects get a share token (kept if one exists). Going private revokes the
     * token and resets the grant to viewer without auth.
     */
    public ProjectRecord updateShareSettings(String userId, String id, ShareSettings settings)
            throws PersistenceException, IOException {
        SharePermission requested = null;
        if (settings.sharePermissions() != null) {
            requested = SharePermission.parseOrNull(settings.sharePermissions());
            if (requested == null) {
                throw new IllegalArgumentException("share_permissions must be viewer or editor");
            }
        }
        synchronized (lockFor(id)) {
            ProjectRecord current = find(userId, id).orElseThrow(() -> new NotFoundException(id));
            String now = clock.instant().toString();
            boolean makePublic = settings.isPublic() != null ? settings.isPublic() : current.isPublic();

            ProjectRecord next;
            if (!makePublic) {
                next = current.withSharing(false, null, SharePermission.VIEWER, false, now);
            } else {
                next = current.withSharing(true,
                        current.shareId() != null ? current.shareId() : shareIds.next(),
                        requested != null ? requested : current.permission(),
                        settings.requiresAuth() != null ? settings.requiresAuth() : current.requiresAuth(),
                        now);
            }
            commit(id, current, next);
            return next;
        }
    }

    /* ------------------------------ shared access ------------------------------ */

    /**
     * Resolves a share token to its project.
     *
     * @throws NotFoundException     unknown token, or the project is no longer public
     * @throws UnauthorizedException the share requires sign-in and the caller has none
     */
    public ProjectRecord shared(String shareId, boolean callerAuthenticated) throws PersistenceException {
        ProjectRecord r = byShareId(shareId).orElseThrow(() -> new NotFoundException("share " + shareId));
        if (r.requiresAuth() && !callerAuthenticated) {
            throw new UnauthorizedException("This shared project requires sign-in");
        }
        return r;
    }

    /** Per-project write locks currently held in memory. */
    public int lockCount() {
        return locks.size();
    }

    /** True when {@code shareId} names a live share that only grants viewing. */
    public boolean isViewerShare(String shareId) {
        return byShareId(shareId).map(r -> !r.permission().canWrite()).orElse(false);
    }

    /**
     * Collaborator write authorized by the share token alone. Only the name and the
     * snapshot change; ownership, tags and visibility are never touched.
     */
    public PatchOutcome sharedPatch(String projectId, String shareId, String name, JsonObject projectData)
            throws PersistenceException, IOException {
        if (isBlank(shareId) || isBlank(projectId)) {
            return rejected(RejectionReason.INVALID_PAYLOAD);
        }
        Optional<ProjectRecord> byShare = byShareId(shareId);
        if (byShare.isEmpty()) {
            return rejected(RejectionReason.SHARE_NOT_FOUND);
        }
        if (!byShare.get().permission().canWrite()) {
            return rejected(RejectionReason.NO_EDITOR_PERMISSION);
        }
        if (!byShare.get().id().equals(projectId) || projectData == null) {
            return rejected(RejectionReason.INVALID_PAYLOAD);
        }

        synchronized (lockFor(projectId)) {
            // re-read under the lock: the owner may have revoked or downgraded meanwhile
            ProjectRecord current = projects.get(projectId);
            if (current == null || !current.isPublic() || !shareId.equals(current.shareId())) {
                return rejected(RejectionReason.SHARE_NOT_FOUND);
            }
            if (!current.permission().canWrite()) {
                return rejected(RejectionReason.NO_EDITOR_PERMISSION);
            }
            String embeddedId = Json.string(projectData, "id", null);
            if (embeddedId != null && !embeddedId.equals(projectId)) {
                return rejected(RejectionReason.INVALID_PAYLOAD);
            }
            String newName = (!isBlank(name) && name.length() <= 255) ? name : current.name();
            JsonObject stamped = stamp(projectId, newName, projectData, current.createdAt());
            ProjectSnapshot incoming;
            try {
                incoming = validate(stamped);
            } catch (MalformedSnapshotException e) {
                logger.warn("Shared patch for {} rejected: {}", projectId, e.getMessage());
                return rejected(RejectionReason.INVALID_PAYLOAD);
            }

            long version = accept(current, incoming, null);
            String now = clock.instant().toString();
            ProjectRecord next = current.withContent(newName, stamped, version, now);
            commit(projectId, current, next);
            logger.info("Shared editor patched project {} to version {}", projectId, version);
            return new PatchOutcome.Ack(projectId, newName, now, version);
        }
    }

    /* ------------------------------ internals ------------------------------ */

    private long accept(ProjectRecord current, ProjectSnapshot incoming, Long localVersion)
            throws PersistenceException {
        VersionedRecord durable = current.versioned();
        if (localVersion == null) {
            return reconciler.overwrite(durable, incoming).serverVersion();
        }
        SyncResult result = reconciler.reconcile(durable, incoming, localVersion);
        if (result instanceof SyncResult.Conflict conflict) {
            logger.info("Rejected stale write to {}: local {} < server {}",
                    current.id(), localVersion, current.serverVersion());
            throw new VersionConflictException(conflict);
        }
        return ((SyncResult.Synced) result).record().serverVersion();
    }

    private Optional<ProjectRecord> byShareId(String shareId) {
        if (isBlank(shareId)) return Optional.empty();
        return projects.values().stream()
                .filter(r -> r.isPublic() && shareId.equals(r.shareId()))
                .findFirst();
    }

    /** Copy of {@code data} carrying the project's id and name; createdAt filled when absent. */
    private static JsonObject stamp(String id, String name, JsonObject data, String createdAt) {
        JsonObject copy = data == null ? new JsonObject() : data.deepCopy();
        copy.addProperty("id", id);
        if (name != null) copy.addProperty("name", name);
        if (createdAt != null) copy.addProperty("createdAt", createdAt);
        return copy;
    }

    /** A snapshot the server stores must be loadable by the codec. */
    private ProjectSnapshot validate(JsonObject data) throws MalformedSnapshotException {
        ProjectSnapshot snapshot = ProjectSnapshot.fromJson(data);
        codec.deserialize(snapshot);
        return snapshot;
    }

    private void commit(String id, ProjectRecord previous, ProjectRecord next) throws IOException {
        projects.put(id, next);
        try {
            persist();
        } catch (IOException e) {
            if (previous == null) {
                projects.remove(id);
            } else {
                projects.put(id, previous);
            }
            logger.error("Persisting project table failed, change to {} rolled back", id, e);
            throw e;
        }
    }

    private void persist() throws IOException {
        synchronized (persistLock) {
            store.save(Json.GSON.toJson(new ArrayList<>(projects.values()), RECORD_LIST));
        }
    }

    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private static PatchOutcome rejected(RejectionReason reason) {
        return new PatchOutcome.Rejected(reason, reason.message(), false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
