package org.projectstate;

import org.junit.jupiter.api.Test;
import org.projectstate.mode.AmbientContext;
import org.projectstate.mode.Credential;
import org.projectstate.mode.Mode;
import org.projectstate.mode.ModeResolver;
import org.projectstate.mode.SharedMarkers;
import org.projectstate.share.SharePermission;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ModeResolverTest {

    private final ModeResolver resolver = new ModeResolver(Fixtures.CLOCK);
    private final Credential valid = new Credential("t1", Instant.parse("2030-01-01T00:00:00Z"));
    private final Credential expired = new Credential("t1", Instant.parse("2020-01-01T00:00:00Z"));
    private final SharedMarkers editor = new SharedMarkers(true, "s1", "p1", SharePermission.EDITOR);

    @Test
    void sharedMarkersWinEvenWhenSignedIn() {
        Mode m = resolver.resolveMode(new AmbientContext(valid, editor));
        assertEquals(Mode.Kind.SHARED_COLLABORATIVE, m.kind());
        assertEquals(SharePermission.EDITOR, m.permission());
        assertTrue(m.canSave());
    }

    @Test
    void viewerSharedModeCannotSave() {
        SharedMarkers viewer = new SharedMarkers(true, "s1", "p1", SharePermission.VIEWER);
        Mode m = resolver.resolveMode(new AmbientContext(null, viewer));
        assertTrue(m.isShared());
        assertFalse(m.canSave());
    }

    @Test
    void validCredentialWithoutMarkersIsOwner() {
        assertEquals(Mode.owner(), resolver.resolveMode(new AmbientContext(valid, SharedMarkers.inactive())));
        assertEquals(Mode.owner(), resolver.resolveMode(new AmbientContext(new Credential("t", null), null)));
    }

    @Test
    void expiredOrBlankCredentialFallsBackToLocal() {
        assertEquals(Mode.localOnly(), resolver.resolveMode(new AmbientContext(expired, null)));
        assertEquals(Mode.localOnly(), resolver.resolveMode(new AmbientContext(new Credential(" ", null), null)));
        assertEquals(Mode.localOnly(), resolver.resolveMode(AmbientContext.anonymous()));
        assertEquals(Mode.localOnly(), resolver.resolveMode(null));
    }

    @Test
    void inactiveMarkersAreIgnored() {
        SharedMarkers stale = new SharedMarkers(false, "s1", "p1", SharePermission.EDITOR);
        assertEquals(Mode.owner(), resolver.resolveMode(new AmbientContext(valid, stale)));
    }
}
