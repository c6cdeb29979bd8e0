package org.projectstate;

import org.junit.jupiter.api.Test;
import org.projectstate.server.InMemoryTokenAuthenticator;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenAuthenticatorTest {

    @Test
    void parsesTokenListAndSkipsMalformedEntries() {
        long future = Fixtures.CLOCK.instant().plusSeconds(60).getEpochSecond();
        InMemoryTokenAuthenticator auth = InMemoryTokenAuthenticator.fromSpec(
                "t1:alice, t2:bob:" + future + ", broken, t3:carol:soon", Fixtures.CLOCK);

        assertEquals(Optional.of("alice"), auth.authenticate("t1"));
        assertEquals(Optional.of("bob"), auth.authenticate("t2"));
        assertTrue(auth.authenticate("broken").isEmpty());
        assertTrue(auth.authenticate("t3").isEmpty());
        assertTrue(auth.authenticate(null).isEmpty());
    }

    @Test
    void expiredAndRevokedTokensAreRefused() {
        InMemoryTokenAuthenticator auth = new InMemoryTokenAuthenticator(Fixtures.CLOCK);
        auth.register("old", "alice", Instant.parse("2024-01-01T00:00:00Z"));
        auth.register("live", "alice", null);

        assertTrue(auth.authenticate("old").isEmpty());
        assertEquals(Optional.of("alice"), auth.authenticate("live"));

        auth.revoke("live");
        assertTrue(auth.authenticate("live").isEmpty());
    }
}
