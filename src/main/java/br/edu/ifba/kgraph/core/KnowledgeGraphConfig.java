package br.edu.ifba.kgraph.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Configuration for typed knowledge graph construction and retrieval.
 *
 * <p>All properties are read with the prefix "kg". Every feature is gated behind the
 * master switch {@code kg.enabled}; with the switch off the library runs in legacy mode
 * (no canonicalization, untyped relationships, sequential ingestion).</p>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * kg.enabled=true
 * kg.canonicalization.entity-distance-threshold=0.9
 * kg.relationships.min-confidence=0.3
 * kg.relationships.max-edges-per-entity=50
 * kg.parallel.max-workers=8
 * kg.parallel.chunk-timeout=PT30S
 * }</pre>
 *
 * <p>Instances are obtained from {@link KnowledgeGraphConfigLoader} once per processing
 * session and handed to every component at construction.</p>
 */
@ConfigMapping(prefix = "kg")
public interface KnowledgeGraphConfig {

    /**
     * Threshold used by the fuzzy entity match when the master switch is off.
     */
    double LEGACY_ENTITY_THRESHOLD = 0.1;

    /**
     * Threshold used by the fuzzy entity match when the master switch is on and no
     * explicit threshold is configured.
     */
    double ENHANCED_ENTITY_THRESHOLD = 0.85;

    /**
     * Master switch for all enhanced knowledge graph features.
     *
     * @return true if enhanced features are enabled
     */
    @WithDefault("false")
    boolean enabled();

    Canonicalization canonicalization();

    Relationships relationships();

    Parallel parallel();

    Retrieval retrieval();

    /**
     * Features that can be toggled individually below the master switch.
     */
    enum Feature {
        CANONICALIZATION,
        TYPED_RELATIONSHIPS,
        SYMMETRIC_RELATIONSHIPS,
        PARALLEL_PROCESSING
    }

    /**
     * Checks whether a feature is active. Always false when the master switch is off.
     *
     * @param feature the feature to check
     * @return true if the feature is enabled
     */
    default boolean isFeatureEnabled(Feature feature) {
        if (!enabled()) {
            return false;
        }
        return switch (feature) {
            case CANONICALIZATION -> canonicalization().enabled();
            case TYPED_RELATIONSHIPS -> relationships().typedEnabled();
            case SYMMETRIC_RELATIONSHIPS -> relationships().symmetricEnabled();
            case PARALLEL_PROCESSING -> parallel().enabled();
        };
    }

    /**
     * Returns the similarity threshold for fuzzy entity merging.
     * Legacy mode always uses {@link #LEGACY_ENTITY_THRESHOLD}.
     */
    default double effectiveEntityThreshold() {
        if (!enabled()) {
            return LEGACY_ENTITY_THRESHOLD;
        }
        return canonicalization().entityDistanceThreshold().orElse(ENHANCED_ENTITY_THRESHOLD);
    }

    /**
     * Returns the worker pool size: the configured value, or CPU count + 4.
     */
    default int workerCount() {
        OptionalInt configured = parallel().maxWorkers();
        if (configured.isPresent()) {
            return configured.getAsInt();
        }
        return Runtime.getRuntime().availableProcessors() + 4;
    }

    /**
     * Validates configuration before a processing session starts.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        Optional<Double> threshold = canonicalization().entityDistanceThreshold();
        if (threshold.isPresent() && (threshold.get() < 0.0 || threshold.get() > 1.0)) {
            throw new IllegalArgumentException(
                String.format("Entity distance threshold must be in [0.0, 1.0], got %.3f", threshold.get())
            );
        }

        double minConfidence = relationships().minConfidence();
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException(
                String.format("Minimum relationship confidence must be in [0.0, 1.0], got %.3f", minConfidence)
            );
        }

        if (relationships().maxEdgesPerEntity() < 1) {
            throw new IllegalArgumentException(
                String.format("Max edges per entity must be positive, got %d", relationships().maxEdgesPerEntity())
            );
        }

        if (parallel().maxWorkers().isPresent() && parallel().maxWorkers().getAsInt() < 1) {
            throw new IllegalArgumentException(
                String.format("Max workers must be positive, got %d", parallel().maxWorkers().getAsInt())
            );
        }

        Duration timeout = parallel().chunkTimeout();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Chunk timeout must be positive, got " + timeout);
        }

        if (parallel().progressInterval() < 1) {
            throw new IllegalArgumentException(
                String.format("Progress interval must be positive, got %d", parallel().progressInterval())
            );
        }

        double seedThreshold = retrieval().seedSimilarityThreshold();
        if (seedThreshold < -1.0 || seedThreshold > 1.0) {
            throw new IllegalArgumentException(
                String.format("Seed similarity threshold must be in [-1.0, 1.0], got %.3f", seedThreshold)
            );
        }

        if (retrieval().maxSeeds() < 1) {
            throw new IllegalArgumentException(
                String.format("Max seeds must be positive, got %d", retrieval().maxSeeds())
            );
        }

        double decay = retrieval().hopDecay();
        if (decay <= 0.0 || decay > 1.0) {
            throw new IllegalArgumentException(
                String.format("Hop decay must be in (0.0, 1.0], got %.3f", decay)
            );
        }
    }

    /**
     * Entity canonicalization configuration.
     */
    interface Canonicalization {
        /**
         * Enable entity name normalization and fuzzy merging.
         * Default: true (only effective with the master switch on)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Cosine similarity threshold for fuzzy entity merging [0.0, 1.0].
         * Unset: 0.85 in enhanced mode.
         */
        @WithName("entity-distance-threshold")
        Optional<Double> entityDistanceThreshold();

        /**
         * Entity names that keep their original case (domain abbreviations).
         */
        @WithName("preserve-case-entities")
        @WithDefault("ICU,ARDS,ECMO,IABP,CVP,PCWP,SVR,MAP,SOFA,APACHE,SIRS,MODS,DIC,AKI,CKD,"
            + "IV,IM,SQ,PO,PR,SL,ET,IO,ACE,ARB,CCB,NSAID,SSRI,MAOI,MAO,COMT,"
            + "FDA,WHO,ACCP,SCCM,AHA,ESC,NICE,SQL,API,JSON,XML,HTTP,HTTPS")
        Set<String> preserveCaseEntities();
    }

    /**
     * Relationship typing and quality guardrails.
     */
    interface Relationships {
        /**
         * Enable semantic relationship types in weight computation.
         * Default: true
         */
        @WithName("typed-enabled")
        @WithDefault("true")
        boolean typedEnabled();

        /**
         * Materialize inverse edges for symmetric types.
         * Default: true
         */
        @WithName("symmetric-enabled")
        @WithDefault("true")
        boolean symmetricEnabled();

        /**
         * Minimum confidence for a relationship to be stored (inclusive).
         * Default: 0.3
         */
        @WithName("min-confidence")
        @WithDefault("0.3")
        double minConfidence();

        /**
         * Maximum outgoing edges per entity.
         * Default: 50
         */
        @WithName("max-edges-per-entity")
        @WithDefault("50")
        int maxEdgesPerEntity();
    }

    /**
     * Parallel chunk processing configuration.
     */
    interface Parallel {
        /**
         * Enable parallel chunk processing.
         * Default: true
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Worker pool size. Unset: CPU count + 4.
         */
        @WithName("max-workers")
        OptionalInt maxWorkers();

        /**
         * End-to-end budget for one chunk.
         * Default: 30 seconds
         */
        @WithName("chunk-timeout")
        @WithDefault("PT30S")
        Duration chunkTimeout();

        /**
         * Log progress every N completed chunks.
         * Default: 10
         */
        @WithName("progress-interval")
        @WithDefault("10")
        int progressInterval();
    }

    /**
     * Weighted retrieval configuration.
     */
    interface Retrieval {
        /**
         * Minimum cosine similarity between query and entity for seeding.
         * Default: 0.3
         */
        @WithName("seed-similarity-threshold")
        @WithDefault("0.3")
        double seedSimilarityThreshold();

        /**
         * Maximum number of seed entities.
         * Default: 10
         */
        @WithName("max-seeds")
        @WithDefault("10")
        int maxSeeds();

        /**
         * Score multiplier applied per hop.
         * Default: 0.8
         */
        @WithName("hop-decay")
        @WithDefault("0.8")
        double hopDecay();

        /**
         * Traversal depth used when the caller does not give one.
         * Default: 2
         */
        @WithName("default-depth")
        @WithDefault("2")
        int defaultDepth();
    }
}
