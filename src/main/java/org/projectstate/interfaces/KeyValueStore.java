package org.projectstate.interfaces;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * String-keyed device storage, the client's equivalent of browser local storage.
 * Values are opaque strings (serialized snapshots, markers, pointers).
 */
public interface KeyValueStore {

    Optional<String> get(String key) throws IOException;

    void put(String key, String value) throws IOException;

    /** Removes the key; removing an absent key is not an error. */
    void remove(String key) throws IOException;

    /** All keys starting with {@code prefix}. */
    Set<String> keys(String prefix) throws IOException;
}
