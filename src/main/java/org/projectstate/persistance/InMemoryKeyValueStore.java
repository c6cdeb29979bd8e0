package org.projectstate.persistance;

import org.projectstate.interfaces.KeyValueStore;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Non-durable device storage for tests and embedded use. */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public Set<String> keys(String prefix) {
        Set<String> out = new TreeSet<>();
        for (String k : entries.keySet()) {
            if (k.startsWith(prefix)) out.add(k);
        }
        return out;
    }
}
