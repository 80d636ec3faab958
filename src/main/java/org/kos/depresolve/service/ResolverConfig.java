package org.kos.depresolve.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for dependency resolution.
 *
 * Defaults come from {@code /kpm-resolver.properties} on the classpath when
 * present, otherwise from the built-in values below.
 */
public class ResolverConfig {
    private static final Logger logger = LoggerFactory.getLogger(ResolverConfig.class);

    public static final String RESOURCE = "/kpm-resolver.properties";

    public static final String MAX_DEPTH_KEY = "resolver.max-depth";
    public static final String INCLUDE_INSTALLED_KEY = "resolver.include-installed";
    public static final String BREAK_CYCLES_KEY = "resolver.break-cycles";
    public static final String CACHE_METADATA_KEY = "resolver.cache-metadata";

    public static final int DEFAULT_MAX_DEPTH = 20;

    private final int maxDepth;
    private final boolean includeInstalled;
    private final boolean breakCycles;
    private final boolean cacheMetadata;

    private ResolverConfig(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.includeInstalled = builder.includeInstalled;
        this.breakCycles = builder.breakCycles;
        this.cacheMetadata = builder.cacheMetadata;
    }

    /**
     * Built-in defaults, ignoring any properties resource.
     */
    public static ResolverConfig defaults() {
        return builder().build();
    }

    /**
     * Load settings from the classpath resource, falling back to defaults.
     */
    public static ResolverConfig load() {
        Properties props = new Properties();
        try (InputStream is = ResolverConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            } else {
                logger.debug("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", RESOURCE, e.getMessage());
        }
        return fromProperties(props);
    }

    /**
     * Build settings from properties. Missing or invalid values keep their defaults.
     */
    public static ResolverConfig fromProperties(Properties props) {
        Builder builder = builder();

        String maxDepth = props.getProperty(MAX_DEPTH_KEY);
        if (maxDepth != null) {
            try {
                builder.maxDepth(Integer.parseInt(maxDepth.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {} value '{}', using default {}", MAX_DEPTH_KEY, maxDepth, DEFAULT_MAX_DEPTH);
            }
        }

        builder.includeInstalled(parseBoolean(props, INCLUDE_INSTALLED_KEY, builder.includeInstalled));
        builder.breakCycles(parseBoolean(props, BREAK_CYCLES_KEY, builder.breakCycles));
        builder.cacheMetadata(parseBoolean(props, CACHE_METADATA_KEY, builder.cacheMetadata));
        return builder.build();
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
        return defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Deepest dependency level expanded below a requested package.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Whether installed packages are consulted when repositories lack a package.
     */
    public boolean isIncludeInstalled() {
        return includeInstalled;
    }

    /**
     * Whether optional edges may be removed to break cycles.
     */
    public boolean isBreakCycles() {
        return breakCycles;
    }

    /**
     * Whether metadata lookups are memoized across resolutions.
     */
    public boolean isCacheMetadata() {
        return cacheMetadata;
    }

    @Override
    public String toString() {
        return "ResolverConfig{" +
                "maxDepth=" + maxDepth +
                ", includeInstalled=" + includeInstalled +
                ", breakCycles=" + breakCycles +
                ", cacheMetadata=" + cacheMetadata +
                '}';
    }

    /**
     * Builder for ResolverConfig.
     */
    public static class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean includeInstalled = true;
        private boolean breakCycles = true;
        private boolean cacheMetadata = false;

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder includeInstalled(boolean includeInstalled) {
            this.includeInstalled = includeInstalled;
            return this;
        }

        public Builder breakCycles(boolean breakCycles) {
            this.breakCycles = breakCycles;
            return this;
        }

        public Builder cacheMetadata(boolean cacheMetadata) {
            this.cacheMetadata = cacheMetadata;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(this);
        }
    }
}
