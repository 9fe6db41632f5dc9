package ai.symgraph.analyzer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables for extraction, read from {@code symgraph.properties} on the class path. Any key can be overridden with a
 * JVM system property of the same name, e.g. {@code -Dsymgraph.workers=4}.
 *
 * @param workers worker threads of the batch pool; 0 selects a count from the available processors
 * @param progressInterval log batch progress every this many completed files; 0 disables progress logging
 * @param batchTimeout deadline for a whole batch, or null for none
 * @param maxFileBytes files larger than this are not parsed
 */
public record ExtractionSettings(
        int workers, int progressInterval, @Nullable Duration batchTimeout, long maxFileBytes) {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionSettings.class);

    public static final String RESOURCE = "symgraph.properties";
    public static final String KEY_WORKERS = "symgraph.workers";
    public static final String KEY_PROGRESS_INTERVAL = "symgraph.progressInterval";
    public static final String KEY_BATCH_TIMEOUT_SECONDS = "symgraph.batchTimeoutSeconds";
    public static final String KEY_MAX_FILE_BYTES = "symgraph.maxFileBytes";

    public static final int MAX_DEFAULT_WORKERS = 16;
    public static final long DEFAULT_MAX_FILE_BYTES = 10L * 1024 * 1024;

    public static final ExtractionSettings DEFAULTS = new ExtractionSettings(0, 100, null, DEFAULT_MAX_FILE_BYTES);

    public ExtractionSettings {
        if (workers < 0) throw new IllegalArgumentException("workers must be >= 0, was " + workers);
        if (progressInterval < 0) throw new IllegalArgumentException("progressInterval must be >= 0");
        if (maxFileBytes <= 0) throw new IllegalArgumentException("maxFileBytes must be > 0");
        if (batchTimeout != null && (batchTimeout.isNegative() || batchTimeout.isZero())) {
            throw new IllegalArgumentException("batchTimeout must be positive");
        }
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(batchTimeout);
    }

    /** Worker count to use: the configured one, or {@code min(availableProcessors, 16)}. */
    public int effectiveWorkers() {
        if (workers > 0) {
            return workers;
        }
        return Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_WORKERS);
    }

    public ExtractionSettings withWorkers(int workers) {
        return new ExtractionSettings(workers, progressInterval, batchTimeout, maxFileBytes);
    }

    public ExtractionSettings withBatchTimeout(@Nullable Duration batchTimeout) {
        return new ExtractionSettings(workers, progressInterval, batchTimeout, maxFileBytes);
    }

    public ExtractionSettings withMaxFileBytes(long maxFileBytes) {
        return new ExtractionSettings(workers, progressInterval, batchTimeout, maxFileBytes);
    }

    /** Class-path defaults overlaid with system properties. */
    public static ExtractionSettings load() {
        var props = new Properties();
        try (InputStream in = ExtractionSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to load {}: {}", RESOURCE, e.getMessage());
        }
        for (var key : List.of(KEY_WORKERS, KEY_PROGRESS_INTERVAL, KEY_BATCH_TIMEOUT_SECONDS, KEY_MAX_FILE_BYTES)) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static ExtractionSettings fromProperties(Properties props) {
        int workers = getInt(props, KEY_WORKERS, DEFAULTS.workers());
        int progress = getInt(props, KEY_PROGRESS_INTERVAL, DEFAULTS.progressInterval());
        long timeoutSeconds = getLong(props, KEY_BATCH_TIMEOUT_SECONDS, 0L);
        long maxBytes = getLong(props, KEY_MAX_FILE_BYTES, DEFAULTS.maxFileBytes());
        return new ExtractionSettings(
                Math.max(0, workers),
                Math.max(0, progress),
                timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null,
                maxBytes > 0 ? maxBytes : DEFAULT_MAX_FILE_BYTES);
    }

    private static int getInt(Properties props, String key, int def) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}", raw, key);
            return def;
        }
    }

    private static long getLong(Properties props, String key, long def) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}", raw, key);
            return def;
        }
    }
}
