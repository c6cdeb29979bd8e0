package org.projectstate.interfaces;

import java.util.Optional;

/** Resolves a bearer token to the user it was issued to. */
public interface TokenAuthenticator {

    /** @return the user id, or empty for unknown or expired tokens */
    Optional<String> authenticate(String bearerToken);
}
