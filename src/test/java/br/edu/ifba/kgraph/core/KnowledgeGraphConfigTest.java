package br.edu.ifba.kgraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests configuration loading, feature gating and validation.
 */
class KnowledgeGraphConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should load defaults in legacy mode")
        void legacyDefaults() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of());

            assertFalse(config.enabled());
            assertEquals(0.3, config.relationships().minConfidence(), 1e-9);
            assertEquals(50, config.relationships().maxEdgesPerEntity());
            assertEquals(Duration.ofSeconds(30), config.parallel().chunkTimeout());
            assertEquals(10, config.parallel().progressInterval());
            assertEquals(0.3, config.retrieval().seedSimilarityThreshold(), 1e-9);
            assertEquals(10, config.retrieval().maxSeeds());
            assertEquals(0.8, config.retrieval().hopDecay(), 1e-9);
            assertEquals(2, config.retrieval().defaultDepth());
            assertTrue(config.canonicalization().entityDistanceThreshold().isEmpty());
        }

        @Test
        @DisplayName("should disable every feature when the master switch is off")
        void masterSwitchOff() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of());

            for (KnowledgeGraphConfig.Feature feature : KnowledgeGraphConfig.Feature.values()) {
                assertFalse(config.isFeatureEnabled(feature), feature.name());
            }
            assertEquals(KnowledgeGraphConfig.LEGACY_ENTITY_THRESHOLD, config.effectiveEntityThreshold(), 1e-9);
        }

        @Test
        @DisplayName("should include common abbreviations in the preserve-case list")
        void preserveCaseDefaults() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of());

            assertTrue(config.canonicalization().preserveCaseEntities().contains("API"));
            assertTrue(config.canonicalization().preserveCaseEntities().contains("ICU"));
            assertTrue(config.canonicalization().preserveCaseEntities().contains("HTTPS"));
        }

        @Test
        @DisplayName("should size the worker pool from CPU count when unset")
        void workerCountDefault() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of());

            assertEquals(Runtime.getRuntime().availableProcessors() + 4, config.workerCount());
        }
    }

    @Nested
    @DisplayName("Enhanced mode")
    class EnhancedMode {

        @Test
        @DisplayName("should enable every feature under the master switch")
        void allFeaturesOn() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of("kg.enabled", "true"));

            for (KnowledgeGraphConfig.Feature feature : KnowledgeGraphConfig.Feature.values()) {
                assertTrue(config.isFeatureEnabled(feature), feature.name());
            }
            assertEquals(KnowledgeGraphConfig.ENHANCED_ENTITY_THRESHOLD, config.effectiveEntityThreshold(), 1e-9);
        }

        @Test
        @DisplayName("should honor individual toggles and explicit values")
        void overrides() {
            KnowledgeGraphConfig config = KnowledgeGraphConfigLoader.load(Map.of(
                "kg.enabled", "true",
                "kg.canonicalization.entity-distance-threshold", "0.9",
                "kg.relationships.symmetric-enabled", "false",
                "kg.parallel.max-workers", "8",
                "kg.parallel.chunk-timeout", "PT5S"
            ));

            assertEquals(0.9, config.effectiveEntityThreshold(), 1e-9);
            assertFalse(config.isFeatureEnabled(KnowledgeGraphConfig.Feature.SYMMETRIC_RELATIONSHIPS));
            assertTrue(config.isFeatureEnabled(KnowledgeGraphConfig.Feature.TYPED_RELATIONSHIPS));
            assertEquals(8, config.workerCount());
            assertEquals(Duration.ofSeconds(5), config.parallel().chunkTimeout());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject confidence outside [0, 1]")
        void rejectsMinConfidence() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.relationships.min-confidence", "1.5")));
            assertTrue(e.getMessage().contains("confidence"));
        }

        @Test
        @DisplayName("should reject an out-of-range entity threshold")
        void rejectsThreshold() {
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.canonicalization.entity-distance-threshold", "-0.1")));
        }

        @Test
        @DisplayName("should reject non-positive sizes and durations")
        void rejectsNonPositive() {
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.relationships.max-edges-per-entity", "0")));
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.parallel.max-workers", "0")));
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.parallel.chunk-timeout", "PT0S")));
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.retrieval.max-seeds", "0")));
        }

        @Test
        @DisplayName("should reject hop decay outside (0, 1]")
        void rejectsHopDecay() {
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.retrieval.hop-decay", "0")));
            assertThrows(IllegalArgumentException.class,
                () -> KnowledgeGraphConfigLoader.load(Map.of("kg.retrieval.hop-decay", "1.2")));
        }
    }
}
