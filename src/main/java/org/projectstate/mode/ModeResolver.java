package org.projectstate.mode;

import java.time.Clock;

/**
 * Picks the persistence path for one call. Shared markers win over everything,
 * then a valid credential selects the owner path, otherwise the session is local.
 * The result is never cached: callers resolve again on every save and load.
 */
public final class ModeResolver {

    private final Clock clock;

    public ModeResolver(Clock clock) {
        this.clock = clock;
    }

    public Mode resolveMode(AmbientContext ctx) {
        if (ctx == null) {
            return Mode.localOnly();
        }
        if (ctx.hasSharedMarkers()) {
            return Mode.shared(ctx.shared().permission());
        }
        Credential credential = ctx.credential();
        if (credential != null && credential.isValidAt(clock.instant())) {
            return Mode.owner();
        }
        return Mode.localOnly();
    }
}
