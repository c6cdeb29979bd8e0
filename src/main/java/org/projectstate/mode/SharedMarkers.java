package org.projectstate.mode;

import org.projectstate.share.SharePermission;

/**
 * Shared-mode markers as the client keeps them between reloads. Any field may be
 * missing; the patch path reports which one.
 */
public record SharedMarkers(boolean active, String shareId, String projectId, SharePermission permission) {

    public static SharedMarkers inactive() {
        return new SharedMarkers(false, null, null, null);
    }
}
