package org.projectstate.mode;

/**
 * Everything the mode decision depends on, captured as a value so resolution is a
 * pure function. Either part may be {@code null}.
 */
public record AmbientContext(Credential credential, SharedMarkers shared) {

    public static AmbientContext anonymous() {
        return new AmbientContext(null, null);
    }

    public boolean hasSharedMarkers() {
        return shared != null && shared.active();
    }
}
