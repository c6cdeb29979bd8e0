package org.projectstate.model;

import com.google.gson.annotations.SerializedName;

/** Owner-side share switches. Null means "leave as is". */
public record ShareSettings(
        @SerializedName("is_public") Boolean isPublic,
        @SerializedName("share_permissions") String sharePermissions,
        @SerializedName("requires_auth") Boolean requiresAuth) {
}
