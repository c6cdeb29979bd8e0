package org.projectstate.share;

import org.projectstate.model.ProjectRecord;

/** Collaborative access to one project through an opaque share token. */
public record ShareGrant(String shareId, String projectId, SharePermission permission, boolean requiresAuth) {

    public static ShareGrant of(ProjectRecord record) {
        return new ShareGrant(record.shareId(), record.id(), record.permission(), record.requiresAuth());
    }
}
