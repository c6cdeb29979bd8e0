package org.projectstate.share;

/** Permission a share token grants. Unknown or missing values read as {@link #VIEWER}. */
public enum SharePermission {
    VIEWER("viewer"),
    EDITOR("editor");

    private final String wire;

    SharePermission(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public boolean canWrite() {
        return this == EDITOR;
    }

    public static SharePermission fromWire(String value) {
        if (value != null && EDITOR.wire.equalsIgnoreCase(value.trim())) {
            return EDITOR;
        }
        return VIEWER;
    }

    /** Strict variant for request validation: {@code null} when the value is neither role. */
    public static SharePermission parseOrNull(String value) {
        if (value == null) return null;
        for (SharePermission p : values()) {
            if (p.wire.equalsIgnoreCase(value.trim())) return p;
        }
        return null;
    }
}
