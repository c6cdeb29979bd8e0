package org.projectstate.persistance;

import org.projectstate.interfaces.KeyValueStore;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Device storage backed by a directory: one file per key, written through a temp
 * file and an atomic move. File names are the URL-encoded key plus {@code .entry}.
 */
public final class FileKeyValueStore implements KeyValueStore {

    private static final String SUFFIX = ".entry";

    private final Path dir;

    public FileKeyValueStore(Path dir) {
        this.dir = dir;
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        Path p = pathOf(key);
        if (!Files.exists(p)) return Optional.empty();
        return Optional.of(Files.readString(p, StandardCharsets.UTF_8));
    }

    @Override
    public void put(String key, String value) throws IOException {
        Files.createDirectories(dir);
        Path target = pathOf(key);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, value, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public void remove(String key) throws IOException {
        Files.deleteIfExists(pathOf(key));
    }

    @Override
    public Set<String> keys(String prefix) throws IOException {
        Set<String> out = new TreeSet<>();
        if (!Files.exists(dir)) return out;
        try (Stream<Path> s = Files.list(dir)) {
            s.map(p -> p.getFileName().toString())
                    .filter(f -> f.endsWith(SUFFIX))
                    .map(f -> URLDecoder.decode(f.substring(0, f.length() - SUFFIX.length()), StandardCharsets.UTF_8))
                    .filter(k -> k.startsWith(prefix))
                    .forEach(out::add);
        }
        return out;
    }

    private Path pathOf(String key) {
        return dir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
