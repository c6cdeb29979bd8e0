package org.projectstate.persistance;

import org.projectstate.exceptions.PersistenceException;
import org.projectstate.interfaces.KeyValueStore;
import org.projectstate.mode.SharedMarkers;
import org.projectstate.share.ShareGrant;
import org.projectstate.share.SharePermission;

import java.io.IOException;

/**
 * Persists the shared-mode markers so a reload stays in the collaborator's session.
 * Keys: {@code <prefix>-shared-mode}, {@code -shared-project-id},
 * {@code -shared-permissions}, {@code -share-id}.
 */
public final class SharedMarkerStore {

    private final KeyValueStore store;
    private final String modeKey;
    private final String projectKey;
    private final String permissionKey;
    private final String shareKey;

    public SharedMarkerStore(KeyValueStore store, String keyPrefix) {
        this.store = store;
        this.modeKey = keyPrefix + "-shared-mode";
        this.projectKey = keyPrefix + "-shared-project-id";
        this.permissionKey = keyPrefix + "-shared-permissions";
        this.shareKey = keyPrefix + "-share-id";
    }

    public SharedMarkers read() throws PersistenceException {
        try {
            boolean active = store.get(modeKey).map("true"::equals).orElse(false);
            if (!active) {
                return SharedMarkers.inactive();
            }
            return new SharedMarkers(true,
                    store.get(shareKey).orElse(null),
                    store.get(projectKey).orElse(null),
                    SharePermission.fromWire(store.get(permissionKey).orElse(null)));
        } catch (IOException e) {
            throw new PersistenceException("Could not read shared-mode markers", e);
        }
    }

    public void enter(ShareGrant grant) throws PersistenceException {
        try {
            store.put(shareKey, grant.shareId());
            store.put(projectKey, grant.projectId());
            store.put(permissionKey, grant.permission().wire());
            store.put(modeKey, "true");
        } catch (IOException e) {
            throw new PersistenceException("Could not write shared-mode markers", e);
        }
    }

    public void exit() throws PersistenceException {
        try {
            store.remove(modeKey);
            store.remove(shareKey);
            store.remove(projectKey);
            store.remove(permissionKey);
        } catch (IOException e) {
            throw new PersistenceException("Could not clear shared-mode markers", e);
        }
    }
}
