package com.arbor.synth.search;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Bounds and hole selection for one enumeration.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} and {@link #loadFromProperties(String)} read
 * {@code SEARCH_<PROPERTY_NAME>} variables, which take precedence over
 * properties file values:
 * <pre>
 * SEARCH_MAX_DEPTH=4
 * SEARCH_MAX_SIZE=7
 * SEARCH_MAX_ENUMERATIONS=100000
 * SEARCH_HOLE_HEURISTIC=LEFTMOST
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SearchConfig config = SearchConfig.builder()
 *     .maxDepth(4)
 *     .maxSize(7)
 *     .build();
 *
 * // Start from search.properties and tighten one bound
 * SearchConfig tuned = SearchConfig.loadDefault()
 *     .toBuilder()
 *     .maxEnumerations(1_000)
 *     .build();
 * }</pre>
 *
 * <p>A {@code null} heuristic lets each iterator pick its own: level order
 * for breadth-first search, leftmost for depth-first search.
 */
public final class SearchConfig {

    private static final Logger logger = Logger.getLogger(SearchConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_MAX_DEPTH = "SEARCH_MAX_DEPTH";
    private static final String ENV_MAX_SIZE = "SEARCH_MAX_SIZE";
    private static final String ENV_MAX_ENUMERATIONS = "SEARCH_MAX_ENUMERATIONS";
    private static final String ENV_HOLE_HEURISTIC = "SEARCH_HOLE_HEURISTIC";

    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final int maxDepth;
    private final int maxSize;
    private final long maxEnumerations;
    private final HoleHeuristic holeHeuristic;

    private SearchConfig(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.maxSize = builder.maxSize;
        this.maxEnumerations = builder.maxEnumerations;
        this.holeHeuristic = builder.holeHeuristic;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Bounded search with the iterator's own hole heuristic.
     */
    public static SearchConfig of(int maxDepth, int maxSize) {
        return builder().maxDepth(maxDepth).maxSize(maxSize).build();
    }

    /**
     * Defaults overridden by environment variables.
     */
    public static SearchConfig fromEnvironment() {
        return builder().loadEnvironment().build();
    }

    /**
     * Loads {@code search.properties}; environment variables override it.
     */
    public static SearchConfig loadDefault() {
        return loadFromProperties("search.properties");
    }

    /**
     * Loads a properties file from the classpath, then from the file system.
     * Environment variables override its values. A missing file yields the
     * defaults.
     *
     * <p><b>Example search.properties:</b>
     * <pre>
     * search.max.depth=4
     * search.max.size=9
     * search.max.enumerations=50000
     * search.hole.heuristic=LEVEL_ORDER
     * </pre>
     */
    public static SearchConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading search configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = SearchConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builderFromProperties(props).loadEnvironment().build();
    }

    private static Builder builderFromProperties(Properties props) {
        Builder builder = builder();

        String maxDepth = props.getProperty("search.max.depth");
        if (maxDepth != null) {
            builder.maxDepth = parseInt("search.max.depth", maxDepth, builder.maxDepth);
        }

        String maxSize = props.getProperty("search.max.size");
        if (maxSize != null) {
            builder.maxSize = parseInt("search.max.size", maxSize, builder.maxSize);
        }

        String maxEnumerations = props.getProperty("search.max.enumerations");
        if (maxEnumerations != null) {
            try {
                builder.maxEnumerations = Long.parseLong(maxEnumerations.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid search.max.enumerations in properties: " + maxEnumerations);
            }
        }

        String heuristic = props.getProperty("search.hole.heuristic");
        if (heuristic != null) {
            try {
                builder.holeHeuristic = HoleHeuristic.valueOf(heuristic.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid search.hole.heuristic in properties: " + heuristic);
            }
        }

        return builder;
    }

    private static int parseInt(String key, String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + key + " in properties: " + value);
            return fallback;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxDepth = this.maxDepth;
        builder.maxSize = this.maxSize;
        builder.maxEnumerations = this.maxEnumerations;
        builder.holeHeuristic = this.holeHeuristic;
        return builder;
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (maxEnumerations <= 0) {
            throw new IllegalArgumentException("maxEnumerations must be positive: " + maxEnumerations);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int maxDepth() {
        return maxDepth;
    }

    public int maxSize() {
        return maxSize;
    }

    public long maxEnumerations() {
        return maxEnumerations;
    }

    /**
     * The configured heuristic, or {@code fallback} when none was set.
     */
    public HoleHeuristic holeHeuristicOr(HoleHeuristic fallback) {
        return holeHeuristic != null ? holeHeuristic : fallback;
    }

    public Optional<HoleHeuristic> holeHeuristic() {
        return Optional.ofNullable(holeHeuristic);
    }

    @Override
    public String toString() {
        return "SearchConfig{" +
                "maxDepth=" + (maxDepth == UNBOUNDED ? "unbounded" : maxDepth) +
                ", maxSize=" + (maxSize == UNBOUNDED ? "unbounded" : maxSize) +
                ", maxEnumerations=" + (maxEnumerations == UNLIMITED ? "unlimited" : maxEnumerations) +
                ", holeHeuristic=" + (holeHeuristic == null ? "default" : holeHeuristic) +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private int maxDepth = UNBOUNDED;
        private int maxSize = UNBOUNDED;
        private long maxEnumerations = UNLIMITED;
        private HoleHeuristic holeHeuristic;

        private Builder() {
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxEnumerations(long maxEnumerations) {
            this.maxEnumerations = maxEnumerations;
            return this;
        }

        public Builder holeHeuristic(HoleHeuristic holeHeuristic) {
            this.holeHeuristic = holeHeuristic;
            return this;
        }

        Builder loadEnvironment() {
            getEnvInt(ENV_MAX_DEPTH).ifPresent(v -> this.maxDepth = v);
            getEnvInt(ENV_MAX_SIZE).ifPresent(v -> this.maxSize = v);
            getEnvLong(ENV_MAX_ENUMERATIONS).ifPresent(v -> this.maxEnumerations = v);
            getEnv(ENV_HOLE_HEURISTIC).ifPresent(val -> {
                try {
                    this.holeHeuristic = HoleHeuristic.valueOf(val.toUpperCase());
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid hole heuristic for " + ENV_HOLE_HEURISTIC + ": " + val);
                }
            });
            return this;
        }

        public SearchConfig build() {
            return new SearchConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
