package org.projectstate.persistance;

import org.projectstate.interfaces.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileSnapshotStore keeps the server's project table as JSON files.
 * <p>
 * Each save writes:
 * <ul>
 *     <li>a timestamped history file (e.g. {@code projects-20261019-103311-256.json})</li>
 *     <li>{@code latest.json}, which always holds the newest table</li>
 * </ul>
 * Both go through a temp file and an atomic move, so a crash never leaves a
 * half-written table behind. History beyond {@code historyLimit} files is pruned,
 * oldest first.
 */
public final class FileSnapshotStore implements SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSnapshotStore.class);

    // Timestamp pattern for unique filenames, ensures lexical ordering by time.
    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final Path dir;
    private final String baseName;
    private final int historyLimit;
    private final Clock clock;

    /**
     * @param dir          directory to store snapshots in
     * @param baseName     prefix for history file names
     * @param historyLimit history files to keep (at least 1)
     */
    public FileSnapshotStore(Path dir, String baseName, int historyLimit, Clock clock) {
        this.dir = dir;
        this.baseName = baseName;
        this.historyLimit = Math.max(1, historyLimit);
        this.clock = clock;
    }

    private Path latestPath() {
        return dir.resolve("latest.json");
    }

    /**
     * Loads {@code latest.json}, or the newest history file when it is missing.
     *
     * @return snapshot JSON, or {@code null} if nothing was saved yet
     */
    @Override
    public String load() throws IOException {
        Path latest = latestPath();
        if (Files.exists(latest)) {
            return Files.readString(latest, StandardCharsets.UTF_8);
        }
        if (!Files.exists(dir)) return null;

        List<Path> history = history();
        if (history.isEmpty()) return null;
        Path newest = history.get(history.size() - 1);
        logger.info("latest.json missing, restoring from {}", newest.getFileName());
        return Files.readString(newest, StandardCharsets.UTF_8);
    }

    @Override
    public synchronized void save(String json) throws IOException {
        Files.createDirectories(dir);

        String stamp = LocalDateTime.now(clock).format(TS);
        Path unique = dir.resolve(baseName + "-" + stamp + ".json");
        writeAtomically(unique, json);
        writeAtomically(latestPath(), json);

        prune();
    }

    private static void writeAtomically(Path target, String json) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, json, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /** History files, oldest first (lexical order of the timestamp pattern is chronological). */
    private List<Path> history() throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> {
                        String f = p.getFileName().toString();
                        return f.startsWith(baseName + "-") && f.endsWith(".json");
                    })
                    .sorted(Comparator.comparing(Path::getFileName))
                    .collect(Collectors.toList());
        }
    }

    private void prune() throws IOException {
        List<Path> history = history();
        for (int i = 0; i < history.size() - historyLimit; i++) {
            Files.deleteIfExists(history.get(i));
        }
    }
}
