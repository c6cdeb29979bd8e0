package org.projectstate.server;

import org.projectstate.interfaces.TokenAuthenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bearer tokens issued out of band, held in memory. Configured as
 * {@code token:user[:epochSecondsExpiry]} entries separated by commas.
 */
public final class InMemoryTokenAuthenticator implements TokenAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenAuthenticator.class);

    private record Grant(String userId, Instant expiresAt) {}

    private final Map<String, Grant> tokens = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenAuthenticator(Clock clock) {
        this.clock = clock;
    }

    public static InMemoryTokenAuthenticator fromSpec(String spec, Clock clock) {
        InMemoryTokenAuthenticator auth = new InMemoryTokenAuthenticator(clock);
        if (spec == null || spec.isBlank()) return auth;
        for (String entry : spec.split(",")) {
            String[] parts = entry.trim().split(":");
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                logger.warn("Ignoring malformed token entry '{}'", entry.trim());
                continue;
            }
            Instant expiry = null;
            if (parts.length > 2) {
                try {
                    expiry = Instant.ofEpochSecond(Long.parseLong(parts[2]));
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring token entry with bad expiry '{}'", entry.trim());
                    continue;
                }
            }
            auth.register(parts[0], parts[1], expiry);
        }
        return auth;
    }

    /** @param expiresAt {@code null} for a token that never expires */
    public void register(String token, String userId, Instant expiresAt) {
        tokens.put(token, new Grant(userId, expiresAt));
    }

    public void revoke(String token) {
        tokens.remove(token);
    }

    @Override
    public Optional<String> authenticate(String bearerToken) {
        if (bearerToken == null) return Optional.empty();
        Grant g = tokens.get(bearerToken);
        if (g == null) return Optional.empty();
        if (g.expiresAt() != null && !clock.instant().isBefore(g.expiresAt())) {
            return Optional.empty();
        }
        return Optional.of(g.userId());
    }
}
