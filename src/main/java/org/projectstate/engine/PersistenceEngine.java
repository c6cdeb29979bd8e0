package org.projectstate.engine;

import org.projectstate.autosave.AutoSaveScheduler;
import org.projectstate.client.ProjectApiClient;
import org.projectstate.client.RemoteStorageGateway;
import org.projectstate.codec.EditingSession;
import org.projectstate.codec.SessionPatch;
import org.projectstate.codec.SnapshotCodec;
import org.projectstate.config.PersistenceConfig;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.http.DefaultHttpHandler;
import org.projectstate.mode.AmbientContext;
import org.projectstate.mode.Credential;
import org.projectstate.mode.Mode;
import org.projectstate.mode.ModeResolver;
import org.projectstate.mode.SharedMarkers;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectSnapshot;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.persistance.FileKeyValueStore;
import org.projectstate.persistance.LocalStorageGateway;
import org.projectstate.persistance.SharedMarkerStore;
import org.projectstate.share.PatchOutcome;
import org.projectstate.share.ShareGrant;
import org.projectstate.share.SharedPatchRequest;
import org.projectstate.share.SharedPatchService;
import org.projectstate.util.Json;
import org.projectstate.util.SimpleRetryExecutor;
import org.projectstate.version.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Saves and loads one editing session.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>The mode is resolved again for every call from the current credential and the
 *       persisted shared-mode markers.</li>
 *   <li>Save and load share one in-flight guard. A call arriving while another is running
 *       completes at once with {@code SKIPPED}; nothing is queued.</li>
 *   <li>The session is only changed once an operation succeeded. Failures leave it as it was.</li>
 *   <li>Results that arrive after {@link #close()} are discarded.</li>
 * </ul>
 */
public class PersistenceEngine implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceEngine.class);

    static final List<String> FALLBACK_TAGS = List.of("manual-save");

    private final EditingSession session;
    private final SnapshotCodec codec;
    private final ModeResolver modes;
    private final Supplier<Credential> credentials;
    private final SharedMarkerStore markers;
    private final LocalStorageGateway local;
    private final RemoteStorageGateway remote;
    private final SharedPatchService patches;
    private final Executor io;
    private final AutoSaveScheduler autoSave;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final List<ExecutorService> owned = new ArrayList<>();

    private long localVersion;   // guarded by this
    private boolean closed;      // guarded by this

    public PersistenceEngine(EditingSession session,
                             SnapshotCodec codec,
                             ModeResolver modes,
                             Supplier<Credential> credentials,
                             SharedMarkerStore markers,
                             LocalStorageGateway local,
                             RemoteStorageGateway remote,
                             SharedPatchService patches,
                             Executor io,
                             ScheduledExecutorService timer,
                             long debounceMs,
                             Clock clock) {
        this.session = session;
        this.codec = codec;
        this.modes = modes;
        this.credentials = credentials;
        this.markers = markers;
        this.local = local;
        this.remote = remote;
        this.patches = patches;
        this.io = io;
        this.clock = clock;
        this.autoSave = new AutoSaveScheduler(timer, debounceMs, this::sharedEditingActive);
    }

    /** Wires an engine from configuration with file-backed local storage and its own threads. */
    public static PersistenceEngine create(PersistenceConfig config, EditingSession session,
                                           Supplier<Credential> credentials) {
        Clock clock = Clock.systemUTC();
        FileKeyValueStore kv = new FileKeyValueStore(Paths.get(config.localDir()));
        SimpleRetryExecutor retry = new SimpleRetryExecutor(config.retryMaxAttempts(), config.retryBaseDelayMs(),
                config.retryMaxDelayMs(), config.retryJitterMs(), e -> e instanceof IOException);
        ProjectApiClient api = new ProjectApiClient(config.clientEndpoint(), retry, new DefaultHttpHandler());

        ExecutorService io = Executors.newSingleThreadExecutor(daemon("project-io"));
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemon("project-autosave"));
        PersistenceEngine engine = new PersistenceEngine(session,
                new SnapshotCodec(clock),
                new ModeResolver(clock),
                credentials,
                new SharedMarkerStore(kv, config.localKeyPrefix()),
                new LocalStorageGateway(kv, config.localKeyPrefix(), clock),
                new RemoteStorageGateway(api, credentials),
                new SharedPatchService(api),
                io, timer, config.autosaveDebounceMs(), clock);
        engine.owned.add(io);
        engine.owned.add(timer);
        return engine;
    }

    /* ------------------------------ mode ------------------------------ */

    public Mode currentMode() throws PersistenceException {
        return resolve(markers.read());
    }

    private Mode resolve(SharedMarkers shared) {
        return modes.resolveMode(new AmbientContext(credentials.get(), shared));
    }

    /** Persists the markers; the next save or load runs in shared-collaborative mode. */
    public void enterSharedMode(ShareGrant grant) throws PersistenceException {
        markers.enter(grant);
        logger.info("Entered shared mode for project {} as {}", grant.projectId(), grant.permission().wire());
    }

    public void exitSharedMode() throws PersistenceException {
        autoSave.cancel();
        markers.exit();
        logger.info("Left shared mode");
    }

    /* ------------------------------ session ------------------------------ */

    public EditingSession session() {
        return session;
    }

    public synchronized long localVersion() {
        return localVersion;
    }

    /**
     * Applies a mutation to the session right away. In shared-collaborative mode with
     * editor permission this also (re)arms the auto-save timer.
     */
    public void edit(Consumer<EditingSession> mutation) {
        synchronized (this) {
            if (closed) return;
            mutation.accept(session);
        }
        autoSave.schedule(this::autoSaveOnce);
    }

    public boolean autoSavePending() {
        return autoSave.isPending();
    }

    private boolean autoSaveOnce() {
        SaveOutcome immediate = save().getNow(null);
        return immediate == null || immediate.status() != SaveOutcome.Status.SKIPPED;
    }

    private boolean sharedEditingActive() {
        try {
            Mode mode = currentMode();
            return mode.isShared() && mode.canSave();
        } catch (PersistenceException e) {
            logger.warn("Could not read shared-mode markers: {}", e.getMessage());
            return false;
        }
    }

    /* ------------------------------ save ------------------------------ */

    public CompletableFuture<SaveOutcome> save() {
        ProjectSnapshot snapshot;
        long baseVersion;
        synchronized (this) {
            if (closed) return CompletableFuture.completedFuture(SaveOutcome.discarded());
            if (!inFlight.compareAndSet(false, true)) {
                logger.debug("Save dropped, another operation is in flight");
                return CompletableFuture.completedFuture(SaveOutcome.skipped());
            }
            snapshot = codec.serialize(session);
            baseVersion = localVersion;
        }
        return guarded(() -> persist(snapshot, baseVersion),
                e -> new SaveAttempt(SaveOutcome.failed(null, snapshot.id(), rootMessage(e)), null, null, null),
                this::install);
    }

    /**
     * Settles a conflict from an earlier owner save. Accept-local resubmits the local
     * snapshot at the server's version; accept-remote installs the server snapshot.
     */
    public CompletableFuture<SaveOutcome> resolveConflict(SyncResult.Conflict conflict, ConflictResolution resolution) {
        String id;
        synchronized (this) {
            if (closed) return CompletableFuture.completedFuture(SaveOutcome.discarded());
            if (!inFlight.compareAndSet(false, true)) {
                return CompletableFuture.completedFuture(SaveOutcome.skipped());
            }
            id = session.getProjectId();
        }
        return guarded(() -> settle(id, conflict, resolution),
                e -> new SaveAttempt(SaveOutcome.failed(Mode.Kind.OWNER, id, rootMessage(e)), null, null, null),
                this::install);
    }

    private SaveAttempt persist(ProjectSnapshot snapshot, long baseVersion) {
        Mode mode = null;
        try {
            SharedMarkers shared = markers.read();
            mode = resolve(shared);
            return switch (mode.kind()) {
                case LOCAL_ONLY -> saveLocal(snapshot);
                case OWNER -> saveOwner(snapshot, baseVersion);
                case SHARED_COLLABORATIVE -> saveShared(mode, shared, snapshot);
            };
        } catch (VersionConflictException e) {
            logger.info("Save of {} conflicts: {}", snapshot.id(), e.getMessage());
            return new SaveAttempt(SaveOutcome.conflict(snapshot.id(), e.conflict()), null, null, null);
        } catch (PersistenceException e) {
            logger.warn("Save of {} failed: {}", snapshot.id(), e.getMessage());
            return new SaveAttempt(SaveOutcome.failed(mode == null ? null : mode.kind(), snapshot.id(),
                    e.getMessage()), null, null, null);
        }
    }

    private SaveAttempt saveLocal(ProjectSnapshot snapshot) throws PersistenceException {
        ProjectRecord r = null;
        if (LocalStorageGateway.isLocalId(snapshot.id())) {
            try {
                r = local.update(snapshot.id(), ProjectUpdate.ofSnapshot(snapshot, null));
            } catch (NotFoundException e) {
                logger.info("Local project {} is gone, storing a new copy", snapshot.id());
            }
        }
        if (r == null) {
            r = local.create(ProjectDraft.of(snapshot, null, List.of()));
        }
        return new SaveAttempt(SaveOutcome.saved(Mode.Kind.LOCAL_ONLY, r.id(), r.serverVersion()),
                r.createdAt(), r.updatedAt(), null);
    }

    private SaveAttempt saveOwner(ProjectSnapshot snapshot, long baseVersion) throws PersistenceException {
        String id = snapshot.id();
        if (id == null || LocalStorageGateway.isLocalId(id)) {
            return createRemote(snapshot);
        }
        ProjectRecord durable;
        try {
            durable = remote.read(id);
        } catch (NotFoundException e) {
            logger.info("Project {} no longer exists remotely, creating it again", id);
            return createRemote(snapshot);
        }
        // creation time always comes from the durable copy
        String createdAt = Json.string(durable.projectData(), "createdAt", durable.createdAt());
        ProjectRecord r = remote.sync(id, snapshot.withCreatedAt(createdAt).toJsonTree(), baseVersion);
        return new SaveAttempt(SaveOutcome.saved(Mode.Kind.OWNER, r.id(), r.serverVersion()),
                createdAt, r.updatedAt(), null);
    }

    private SaveAttempt createRemote(ProjectSnapshot snapshot) throws PersistenceException {
        String description = "Project created on " + LocalDate.now(clock.withZone(ZoneId.systemDefault()));
        ProjectRecord r = remote.create(ProjectDraft.of(snapshot.withId(null), description, FALLBACK_TAGS));
        logger.info("Created remote project {}", r.id());
        return new SaveAttempt(SaveOutcome.saved(Mode.Kind.OWNER, r.id(), r.serverVersion()),
                r.createdAt(), r.updatedAt(), null);
    }

    private SaveAttempt saveShared(Mode mode, SharedMarkers shared, ProjectSnapshot snapshot) {
        PatchOutcome outcome = patches.patch(mode, shared,
                new SharedPatchRequest(shared.projectId(), shared.shareId(), snapshot.name(), snapshot));
        if (outcome instanceof PatchOutcome.Ack ack) {
            return new SaveAttempt(SaveOutcome.saved(Mode.Kind.SHARED_COLLABORATIVE, ack.projectId(),
                    ack.serverVersion()), null, ack.updatedAt(), null);
        }
        PatchOutcome.Rejected rejected = (PatchOutcome.Rejected) outcome;
        return new SaveAttempt(SaveOutcome.rejected(shared.projectId(), rejected.reason(), rejected.message()),
                null, null, null);
    }

    private SaveAttempt settle(String id, SyncResult.Conflict conflict, ConflictResolution resolution) {
        try {
            if (resolution == ConflictResolution.ACCEPT_REMOTE) {
                SessionPatch patch = codec.deserialize(ProjectSnapshot.fromJson(conflict.serverData()));
                return new SaveAttempt(SaveOutcome.saved(Mode.Kind.OWNER, patch.projectId(),
                        conflict.serverVersion()), null, null, patch);
            }
            ProjectRecord r = remote.sync(id, conflict.localData(), conflict.serverVersion());
            return new SaveAttempt(SaveOutcome.saved(Mode.Kind.OWNER, r.id(), r.serverVersion()),
                    r.createdAt(), r.updatedAt(), null);
        } catch (VersionConflictException e) {
            return new SaveAttempt(SaveOutcome.conflict(id, e.conflict()), null, null, null);
        } catch (PersistenceException e) {
            logger.warn("Resolving conflict on {} failed: {}", id, e.getMessage());
            return new SaveAttempt(SaveOutcome.failed(Mode.Kind.OWNER, id, e.getMessage()), null, null, null);
        }
    }

    private SaveOutcome install(SaveAttempt attempt) {
        synchronized (this) {
            if (closed) {
                logger.debug("Session closed, save result discarded");
                return SaveOutcome.discarded();
            }
            SaveOutcome outcome = attempt.outcome();
            if (outcome.isSaved()) {
                if (attempt.patch() != null) {
                    attempt.patch().applyTo(session);
                }
                session.setProjectId(outcome.projectId());
                if (attempt.createdAt() != null) session.setCreatedAt(attempt.createdAt());
                if (attempt.updatedAt() != null) session.setUpdatedAt(attempt.updatedAt());
                localVersion = outcome.serverVersion();
            }
            return outcome;
        }
    }

    /* ------------------------------ load ------------------------------ */

    /** Loads the current local project, or the shared project in shared-collaborative mode. */
    public CompletableFuture<LoadOutcome> loadCurrent() {
        return load(null);
    }

    /**
     * Loads a project and installs it into the session. In shared-collaborative mode the
     * id is taken from the markers and {@code projectId} is ignored.
     */
    public CompletableFuture<LoadOutcome> load(String projectId) {
        synchronized (this) {
            if (closed) return CompletableFuture.completedFuture(LoadOutcome.discarded());
            if (!inFlight.compareAndSet(false, true)) {
                logger.debug("Load dropped, another operation is in flight");
                return CompletableFuture.completedFuture(LoadOutcome.skipped());
            }
        }
        return guarded(() -> fetch(projectId),
                e -> new Fetched(LoadOutcome.of(LoadOutcome.Status.FAILED, null, projectId, rootMessage(e)), null),
                this::install);
    }

    private Fetched fetch(String projectId) {
        Mode.Kind kind = null;
        try {
            SharedMarkers shared = markers.read();
            Mode mode = resolve(shared);
            kind = mode.kind();
            ProjectRecord record = switch (kind) {
                case SHARED_COLLABORATIVE -> {
                    if (shared.shareId() == null || shared.shareId().isBlank()) {
                        throw new NotFoundException("share");
                    }
                    yield remote.readShared(shared.shareId());
                }
                case OWNER -> remote.read(requireId(projectId));
                case LOCAL_ONLY -> {
                    String id = projectId != null ? projectId
                            : local.currentProjectId().orElseThrow(() -> new NotFoundException("current project"));
                    ProjectRecord r = local.read(id);
                    local.setCurrentProject(id);
                    yield r;
                }
            };
            SessionPatch patch = codec.deserialize(record.snapshot());
            return new Fetched(LoadOutcome.loaded(kind, record.id(), record.serverVersion()), patch);
        } catch (MalformedSnapshotException e) {
            logger.warn("Project {} could not be restored: {}", projectId, e.getMessage());
            return new Fetched(LoadOutcome.of(LoadOutcome.Status.MALFORMED, kind, projectId, e.getMessage()), null);
        } catch (NotFoundException e) {
            return new Fetched(LoadOutcome.of(LoadOutcome.Status.NOT_FOUND, kind, projectId, "Project not found"),
                    null);
        } catch (PersistenceException e) {
            logger.warn("Load of {} failed: {}", projectId, e.getMessage());
            return new Fetched(LoadOutcome.of(LoadOutcome.Status.FAILED, kind, projectId, e.getMessage()), null);
        }
    }

    private static String requireId(String projectId) throws NotFoundException {
        if (projectId == null || projectId.isBlank()) {
            throw new NotFoundException("(none)");
        }
        return projectId;
    }

    private LoadOutcome install(Fetched fetched) {
        synchronized (this) {
            if (closed) {
                logger.debug("Session closed, load result discarded");
                return LoadOutcome.discarded();
            }
            if (fetched.outcome().isLoaded()) {
                autoSave.cancel();
                fetched.patch().applyTo(session);
                // the record id wins over whatever the snapshot carried
                session.setProjectId(fetched.outcome().projectId());
                localVersion = fetched.outcome().serverVersion();
            }
            return fetched.outcome();
        }
    }

    /* ------------------------------ listing ------------------------------ */

    /** Local or remote project summaries, depending on the mode. Collaborators see none. */
    public List<ProjectSummary> listProjects(int limit, int offset) throws PersistenceException {
        Mode mode = currentMode();
        return switch (mode.kind()) {
            case OWNER -> remote.list(limit, offset);
            case LOCAL_ONLY -> local.list(limit, offset);
            case SHARED_COLLABORATIVE -> List.of();
        };
    }

    /** Idempotent. Deleting the open project detaches the session from it. */
    public void deleteProject(String id) throws PersistenceException {
        Mode mode = currentMode();
        switch (mode.kind()) {
            case OWNER -> remote.delete(id);
            case LOCAL_ONLY -> local.delete(id);
            case SHARED_COLLABORATIVE -> throw new PersistenceException("Collaborators cannot delete shared projects");
        }
        synchronized (this) {
            if (id != null && id.equals(session.getProjectId())) {
                session.setProjectId(null);
                localVersion = 0;
            }
        }
    }

    /* ------------------------------ lifecycle ------------------------------ */

    /** Cancels the auto-save timer. In-flight calls finish but their results are dropped. */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        autoSave.close();
        owned.forEach(ExecutorService::shutdown);
        logger.debug("Persistence engine closed");
    }

    /* ------------------------------ internals ------------------------------ */

    /**
     * Runs {@code work} on the I/O executor, installs its result and only then releases
     * the in-flight guard.
     */
    private <A, R> CompletableFuture<R> guarded(Supplier<A> work, Function<Throwable, A> onError,
                                                Function<A, R> install) {
        CompletableFuture<A> f;
        try {
            f = CompletableFuture.supplyAsync(work, io);
        } catch (RuntimeException e) {
            logger.error("I/O executor refused work", e);
            f = CompletableFuture.completedFuture(onError.apply(e));
        }
        return f.exceptionally(onError).thenApply(install).whenComplete((r, e) -> inFlight.set(false));
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private record SaveAttempt(SaveOutcome outcome, String createdAt, String updatedAt, SessionPatch patch) {
    }

    private record Fetched(LoadOutcome outcome, SessionPatch patch) {
    }
}
