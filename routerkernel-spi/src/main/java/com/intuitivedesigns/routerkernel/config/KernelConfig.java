/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Kernel configuration backed by a flat properties file.
 * The process-wide instance loads from -Drk.config.path or ENV 'RK_CONFIG_PATH'.
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    private static final String PROP_PATH = "rk.config.path";
    private static final String ENV_PATH = "RK_CONFIG_PATH";

    private static volatile KernelConfig instance;

    private final Properties props;

    private KernelConfig(Properties props) {
        this.props = props;
    }

    public static KernelConfig get() {
        KernelConfig current = instance;
        if (current == null) {
            synchronized (KernelConfig.class) {
                current = instance;
                if (current == null) {
                    current = new KernelConfig(loadFromEnvironment());
                    instance = current;
                }
            }
        }
        return current;
    }

    /**
     * Builds a detached configuration (tests, embedding). The properties are copied.
     */
    public static KernelConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new KernelConfig(copy);
    }

    public static KernelConfig of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Properties p = new Properties();
        values.forEach(p::setProperty);
        return new KernelConfig(p);
    }

    public static KernelConfig empty() {
        return new KernelConfig(new Properties());
    }

    private static Properties loadFromEnvironment() {
        final Properties p = new Properties();

        // 1. System property first, then environment
        String path = System.getProperty(PROP_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/routerkernel.properties", PROP_PATH);
            return p;
        }

        log.info("Loading configuration from: {}", path);
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            p.load(is);
            log.info("Loaded {} properties.", p.size());
        } catch (IOException e) {
            log.error("FAILED to load config file: {}", path, e);
        }
        return p;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': {}", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for '{}': {}", key, val);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public Duration getSeconds(String key, Duration defaultValue) {
        long seconds = getLong(key, -1L);
        return seconds < 0 ? defaultValue : Duration.ofSeconds(seconds);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
