package com.knowledge.resolution.api;

import com.knowledge.resolution.graph.CanonicalSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for one entity resolution run.
 * Every value is validated when the config is built, never mid-build.
 */
public class EntityResolutionConfig {
    private static final Logger log = LoggerFactory.getLogger(EntityResolutionConfig.class);

    public static final String DEFAULT_RESOURCE = "entity-resolution.properties";

    public static final String SIMILARITY_THRESHOLD = "erg.similarity-threshold";
    public static final String REQUIRE_TYPE_OVERLAP = "erg.require-type-overlap";
    public static final String CANONICAL_SELECTION = "erg.canonical-selection";
    public static final String BLOCKING_ENABLED = "erg.blocking.enabled";
    public static final String BLOCKING_MIN_ENTITIES = "erg.blocking.min-entities";
    public static final String MAX_BLOCK_SIZE = "erg.blocking.max-block-size";

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    private static final int DEFAULT_BLOCKING_MIN_ENTITIES = 50;
    private static final int DEFAULT_MAX_BLOCK_SIZE = 50;

    private final double similarityThreshold;
    private final boolean requireTypeOverlap;
    private final CanonicalSelection canonicalSelection;
    private final boolean blockingEnabled;
    private final int blockingMinEntities;
    private final int maxBlockSize;

    private EntityResolutionConfig(Builder builder) {
        this.similarityThreshold = builder.similarityThreshold;
        this.requireTypeOverlap = builder.requireTypeOverlap;
        this.canonicalSelection = builder.canonicalSelection;
        this.blockingEnabled = builder.blockingEnabled;
        this.blockingMinEntities = builder.blockingMinEntities;
        this.maxBlockSize = builder.maxBlockSize;
    }

    /**
     * Minimum embedding cosine similarity for two mentions to match.
     */
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /**
     * Whether a match also needs at least one shared type.
     */
    public boolean isRequireTypeOverlap() {
        return requireTypeOverlap;
    }

    public CanonicalSelection getCanonicalSelection() {
        return canonicalSelection;
    }

    public boolean isBlockingEnabled() {
        return blockingEnabled;
    }

    public int getBlockingMinEntities() {
        return blockingMinEntities;
    }

    public int getMaxBlockSize() {
        return maxBlockSize;
    }

    public static EntityResolutionConfig defaults() {
        return builder().build();
    }

    /**
     * Raises the embedding threshold to 1.0: with a provider present, only vectors pointing
     * in the same direction add matches beyond exact and containment.
     */
    public static EntityResolutionConfig lexicalOnly() {
        return builder().similarityThreshold(1.0).build();
    }

    /**
     * Reads settings from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value does not parse or is out of range
     */
    public static EntityResolutionConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String threshold = trimmed(properties, SIMILARITY_THRESHOLD);
        if (threshold != null) {
            builder.similarityThreshold(parseDouble(SIMILARITY_THRESHOLD, threshold));
        }
        String typeOverlap = trimmed(properties, REQUIRE_TYPE_OVERLAP);
        if (typeOverlap != null) {
            builder.requireTypeOverlap(parseBoolean(REQUIRE_TYPE_OVERLAP, typeOverlap));
        }
        String selection = trimmed(properties, CANONICAL_SELECTION);
        if (selection != null) {
            try {
                builder.canonicalSelection(CanonicalSelection.valueOf(selection.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(CANONICAL_SELECTION + " has unknown value '" + selection + "'", e);
            }
        }
        String blocking = trimmed(properties, BLOCKING_ENABLED);
        if (blocking != null) {
            builder.blockingEnabled(parseBoolean(BLOCKING_ENABLED, blocking));
        }
        String minEntities = trimmed(properties, BLOCKING_MIN_ENTITIES);
        if (minEntities != null) {
            builder.blockingMinEntities(parseInt(BLOCKING_MIN_ENTITIES, minEntities));
        }
        String maxBlock = trimmed(properties, MAX_BLOCK_SIZE);
        if (maxBlock != null) {
            builder.maxBlockSize(parseInt(MAX_BLOCK_SIZE, maxBlock));
        }
        return builder.build();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns defaults when it is absent.
     */
    public static EntityResolutionConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static EntityResolutionConfig load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EntityResolutionConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("config.resource.missing resource={} using=defaults", resource);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            EntityResolutionConfig config = fromProperties(properties);
            log.info("config.loaded resource={} config={}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    public Builder toBuilder() {
        return builder()
                .similarityThreshold(similarityThreshold)
                .requireTypeOverlap(requireTypeOverlap)
                .canonicalSelection(canonicalSelection)
                .blockingEnabled(blockingEnabled)
                .blockingMinEntities(blockingMinEntities)
                .maxBlockSize(maxBlockSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private boolean requireTypeOverlap = true;
        private CanonicalSelection canonicalSelection = CanonicalSelection.FIRST_SEEN;
        private boolean blockingEnabled = false;
        private int blockingMinEntities = DEFAULT_BLOCKING_MIN_ENTITIES;
        private int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;

        public Builder similarityThreshold(double similarityThreshold) {
            if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder requireTypeOverlap(boolean requireTypeOverlap) {
            this.requireTypeOverlap = requireTypeOverlap;
            return this;
        }

        public Builder canonicalSelection(CanonicalSelection canonicalSelection) {
            if (canonicalSelection == null) {
                throw new IllegalArgumentException("canonicalSelection is required");
            }
            this.canonicalSelection = canonicalSelection;
            return this;
        }

        public Builder blockingEnabled(boolean blockingEnabled) {
            this.blockingEnabled = blockingEnabled;
            return this;
        }

        public Builder blockingMinEntities(int blockingMinEntities) {
            if (blockingMinEntities < 2) {
                throw new IllegalArgumentException("blockingMinEntities must be >= 2");
            }
            this.blockingMinEntities = blockingMinEntities;
            return this;
        }

        public Builder maxBlockSize(int maxBlockSize) {
            if (maxBlockSize <= 1) {
                throw new IllegalArgumentException("maxBlockSize must be > 1");
            }
            this.maxBlockSize = maxBlockSize;
            return this;
        }

        public EntityResolutionConfig build() {
            return new EntityResolutionConfig(this);
        }
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }

    @Override
    public String toString() {
        return "EntityResolutionConfig{" +
                "similarityThreshold=" + similarityThreshold +
                ", requireTypeOverlap=" + requireTypeOverlap +
                ", canonicalSelection=" + canonicalSelection +
                ", blockingEnabled=" + blockingEnabled +
                ", blockingMinEntities=" + blockingMinEntities +
                ", maxBlockSize=" + maxBlockSize +
                '}';
    }
}
