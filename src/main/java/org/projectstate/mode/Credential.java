package org.projectstate.mode;

import java.time.Instant;

/**
 * A user's bearer credential.
 *
 * @param expiresAt {@code null} for tokens without an expiry
 */
public record Credential(String token, Instant expiresAt) {

    public boolean isValidAt(Instant now) {
        if (token == null || token.isBlank()) return false;
        return expiresAt == null || now.isBefore(expiresAt);
    }
}
