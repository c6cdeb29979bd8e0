package org.projectstate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings from {@code projectstate.properties} on the classpath. A JVM system
 * property with the same key wins over the file, e.g. {@code -Dserver.port=5000}.
 */
public final class PersistenceConfig {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceConfig.class);

    public static final String RESOURCE = "projectstate.properties";

    private final Properties props;

    public PersistenceConfig(Properties props) {
        this.props = props;
    }

    public static PersistenceConfig load() {
        return load(RESOURCE);
    }

    public static PersistenceConfig load(String resource) {
        Properties p = new Properties();
        try (InputStream in = PersistenceConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("{} not found on classpath, using defaults", resource);
            } else {
                p.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
        return new PersistenceConfig(p);
    }

    public String string(String key, String def) {
        String v = System.getProperty(key);
        if (v == null) v = props.getProperty(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    public int integer(String key, int def) {
        String v = string(key, null);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}={}", key, v);
            return def;
        }
    }

    public long longValue(String key, long def) {
        String v = string(key, null);
        if (v == null) return def;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}={}", key, v);
            return def;
        }
    }

    /* ---------------- typed accessors ---------------- */

    public int serverPort() { return integer("server.port", 4567); }
    public String serverDataDir() { return string("server.dataDir", "data"); }
    public int serverHistoryLimit() { return integer("server.historyLimit", 20); }
    public String serverTokens() { return string("server.tokens", ""); }

    public String clientEndpoint() { return string("client.endpoint", "localhost:4567"); }
    public int retryMaxAttempts() { return integer("client.retry.maxAttempts", 4); }
    public long retryBaseDelayMs() { return longValue("client.retry.baseDelayMs", 200); }
    public long retryMaxDelayMs() { return longValue("client.retry.maxDelayMs", 1600); }
    public long retryJitterMs() { return longValue("client.retry.jitterMs", 100); }

    public long autosaveDebounceMs() { return longValue("autosave.debounceMs", 5000); }
    public String localKeyPrefix() { return string("local.keyPrefix", "pdf-editor"); }
    public String localDir() { return string("local.dir", ".project-state"); }
}
