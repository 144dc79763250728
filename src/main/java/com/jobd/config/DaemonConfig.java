package com.jobd.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Daemon and client settings.
 * <p>
 * Layers, later ones winning: {@code /application.properties} on the classpath, the file
 * named by {@code jobd.config} (system property) or {@code JOBD_CONFIG} (environment),
 * system properties, then {@code JOBD_*} environment variables where
 * {@code daemon.socket.path} becomes {@code JOBD_DAEMON_SOCKET_PATH}.
 */
public class DaemonConfig {
    public static final String SOCKET_PATH = "daemon.socket.path";
    public static final String CHECK_INTERVAL_MS = "daemon.check.interval.ms";
    public static final String REQUEST_TIMEOUT_MS = "daemon.request.timeout.ms";
    public static final String MAX_BUFFER_BYTES = "daemon.max.buffer.bytes";
    public static final String LIST_LIMIT = "daemon.list.limit";
    public static final String CLEANUP_MAX_AGE_HOURS = "daemon.cleanup.max.age.hours";
    public static final String STORE_TYPE = "store.type";
    public static final String MAX_EXECUTIONS_PER_JOB = "store.max.executions.per.job";
    public static final String SHELL = "executor.shell";
    public static final String OUTPUT_LIMIT_BYTES = "executor.output.limit.bytes";
    public static final String RETRY_BACKOFF_MS = "executor.retry.backoff.ms";
    public static final String DB_URL = "db.url";
    public static final String DB_USER = "db.user";
    public static final String DB_PASSWORD = "db.password";
    public static final String DB_POOL_SIZE = "db.pool.size";
    public static final String DB_SCHEMA_INIT = "db.schema.init";
    public static final String AUDIT_ENABLED = "audit.enabled";

    private final Properties props;

    private DaemonConfig(Properties props) {
        this.props = props;
    }

    public static DaemonConfig load() {
        Properties p = new Properties();
        try (InputStream in = DaemonConfig.class.getResourceAsStream("/application.properties")) {
            if (in == null) throw new IllegalStateException("application.properties not found on classpath");
            p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load application.properties", e);
        }

        String external = System.getProperty("jobd.config", System.getenv("JOBD_CONFIG"));
        if (external != null && !external.isBlank()) {
            Path path = Path.of(external);
            try (InputStream in = Files.newInputStream(path)) {
                p.load(in);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config file " + path, e);
            }
        }

        for (String key : p.stringPropertyNames()) {
            String sys = System.getProperty(key);
            if (sys != null) p.setProperty(key, sys);
            String env = System.getenv(envName(key));
            if (env != null && !env.isEmpty()) p.setProperty(key, env);
        }
        return new DaemonConfig(p);
    }

    public static DaemonConfig of(Properties props) {
        Properties copy = new Properties();
        copy.putAll(props);
        return new DaemonConfig(copy);
    }

    /** Returns a copy of this config with {@code overrides} applied. */
    public DaemonConfig with(Map<String, String> overrides) {
        Properties copy = new Properties();
        copy.putAll(props);
        overrides.forEach(copy::setProperty);
        return new DaemonConfig(copy);
    }

    static String envName(String key) {
        return "JOBD_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public String get(String key) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    public String get(String key, String defaultValue) {
        String v = get(key);
        return v == null ? defaultValue : v;
    }

    public int getInt(String key, int defaultValue) {
        String v = get(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + v, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String v = get(key);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": " + v, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key);
        return v == null ? defaultValue : Boolean.parseBoolean(v);
    }

    public String socketPath() {
        return get(SOCKET_PATH, defaultSocketPath());
    }

    public static String defaultSocketPath() {
        String user = System.getProperty("user.name", "default");
        return "/tmp/jobd-" + user + ".sock";
    }

    public Duration checkInterval() {
        return Duration.ofMillis(getLong(CHECK_INTERVAL_MS, 10_000));
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(getLong(REQUEST_TIMEOUT_MS, 10_000));
    }

    public int maxBufferBytes() {
        return getInt(MAX_BUFFER_BYTES, 1024 * 1024);
    }

    public int listLimit() {
        return getInt(LIST_LIMIT, 100);
    }

    public int cleanupMaxAgeHours() {
        return getInt(CLEANUP_MAX_AGE_HOURS, 24);
    }

    public String storeType() {
        return get(STORE_TYPE, "memory").toLowerCase(Locale.ROOT);
    }

    public int maxExecutionsPerJob() {
        return getInt(MAX_EXECUTIONS_PER_JOB, 100);
    }

    public String shell() {
        return get(SHELL, "bash");
    }

    public int outputLimitBytes() {
        return getInt(OUTPUT_LIMIT_BYTES, 64 * 1024);
    }

    public Duration retryBackoff() {
        return Duration.ofMillis(getLong(RETRY_BACKOFF_MS, 1000));
    }

    public boolean auditEnabled() {
        return getBoolean(AUDIT_ENABLED, false);
    }
}
