package org.projectstate.mode;

import org.projectstate.share.SharePermission;

/**
 * The persistence path that services a save or load.
 *
 * @param permission only set for {@link Kind#SHARED_COLLABORATIVE}
 */
public record Mode(Kind kind, SharePermission permission) {

    public enum Kind { OWNER, LOCAL_ONLY, SHARED_COLLABORATIVE }

    private static final Mode OWNER = new Mode(Kind.OWNER, null);
    private static final Mode LOCAL_ONLY = new Mode(Kind.LOCAL_ONLY, null);

    public static Mode owner() {
        return OWNER;
    }

    public static Mode localOnly() {
        return LOCAL_ONLY;
    }

    public static Mode shared(SharePermission permission) {
        return new Mode(Kind.SHARED_COLLABORATIVE, permission == null ? SharePermission.VIEWER : permission);
    }

    public boolean isShared() {
        return kind == Kind.SHARED_COLLABORATIVE;
    }

    /** Owners and local sessions always save; collaborators only with editor permission. */
    public boolean canSave() {
        return kind != Kind.SHARED_COLLABORATIVE || permission.canWrite();
    }
}
