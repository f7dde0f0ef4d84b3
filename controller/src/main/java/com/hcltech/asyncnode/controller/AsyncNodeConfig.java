package com.hcltech.asyncnode.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of one controller instance.
 *
 * @param maxWaitingOperations backpressure threshold: pending operations allowed before a forced drain (>0)
 * @param maxWaitTime          bound on one forced drain (>0)
 * @param anchorOutputs        emitted outputs are causally linked to the inputs they came from
 * @param hasDependants        outputs are emitted at all; when false groups are only acknowledged
 * @param tickInterval         period of the host's tick signal (>0)
 */
public record AsyncNodeConfig(
        int maxWaitingOperations,
        Duration maxWaitTime,
        boolean anchorOutputs,
        boolean hasDependants,
        Duration tickInterval
) implements Serializable {

    private static final Logger log = LoggerFactory.getLogger(AsyncNodeConfig.class);

    public static final String RESOURCE = "asyncnode.properties";

    public static final int DEFAULT_MAX_WAITING_OPERATIONS = 10;
    public static final Duration DEFAULT_MAX_WAIT_TIME = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);

    public AsyncNodeConfig {
        if (maxWaitingOperations <= 0) {
            throw new IllegalArgumentException("maxWaitingOperations must be > 0");
        }
        Objects.requireNonNull(maxWaitTime, "maxWaitTime");
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (maxWaitTime.isNegative() || maxWaitTime.isZero()) {
            throw new IllegalArgumentException("maxWaitTime must be > 0");
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
    }

    public static AsyncNodeConfig defaults() {
        return new AsyncNodeConfig(DEFAULT_MAX_WAITING_OPERATIONS, DEFAULT_MAX_WAIT_TIME, false, true, DEFAULT_TICK_INTERVAL);
    }

    /** Reads {@value #RESOURCE} from the classpath; missing keys (or a missing file) take the defaults. */
    public static AsyncNodeConfig load() {
        Properties props = new Properties();
        try (InputStream is = AsyncNodeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) props.load(is);
            else log.info("No {} on classpath, using defaults", RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static AsyncNodeConfig fromProperties(Properties p) {
        AsyncNodeConfig cfg = new AsyncNodeConfig(
                Integer.parseInt(get(p, "asyncnode.maxWaitingOperations", String.valueOf(DEFAULT_MAX_WAITING_OPERATIONS))),
                Duration.ofMillis(Long.parseLong(get(p, "asyncnode.maxWaitTimeMillis", String.valueOf(DEFAULT_MAX_WAIT_TIME.toMillis())))),
                Boolean.parseBoolean(get(p, "asyncnode.anchorOutputs", "false")),
                Boolean.parseBoolean(get(p, "asyncnode.hasDependants", "true")),
                Duration.ofMillis(Long.parseLong(get(p, "asyncnode.tickIntervalMillis", String.valueOf(DEFAULT_TICK_INTERVAL.toMillis()))))
        );
        log.info("Loaded {}", cfg);
        return cfg;
    }

    public AsyncNodeConfig withMaxWaitingOperations(int max) {
        return new AsyncNodeConfig(max, maxWaitTime, anchorOutputs, hasDependants, tickInterval);
    }

    public AsyncNodeConfig withMaxWaitTime(Duration wait) {
        return new AsyncNodeConfig(maxWaitingOperations, wait, anchorOutputs, hasDependants, tickInterval);
    }

    public AsyncNodeConfig withAnchorOutputs(boolean anchor) {
        return new AsyncNodeConfig(maxWaitingOperations, maxWaitTime, anchor, hasDependants, tickInterval);
    }

    public AsyncNodeConfig withHasDependants(boolean dependants) {
        return new AsyncNodeConfig(maxWaitingOperations, maxWaitTime, anchorOutputs, dependants, tickInterval);
    }

    public AsyncNodeConfig withTickInterval(Duration interval) {
        return new AsyncNodeConfig(maxWaitingOperations, maxWaitTime, anchorOutputs, hasDependants, interval);
    }

    private static String get(Properties p, String key, String def) {
        String v = p.getProperty(key);
        return v == null || v.isBlank() ? def : v.trim();
    }
}
