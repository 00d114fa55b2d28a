package br.edu.ifba.kgraph.core;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds a {@link KnowledgeGraphConfig} outside of a container.
 *
 * <p>Sources, highest priority first: explicit overrides, system properties,
 * environment variables (e.g. {@code KG_ENABLED}), and
 * {@code META-INF/microprofile-config.properties}. Call once per processing session
 * and pass the result to every component.</p>
 */
public final class KnowledgeGraphConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphConfigLoader.class);

    private static final String OVERRIDES_SOURCE = "kg-overrides";
    private static final int OVERRIDES_ORDINAL = 500;

    private KnowledgeGraphConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Loads configuration from the default sources.
     */
    @NotNull
    public static KnowledgeGraphConfig load() {
        return load(Map.of());
    }

    /**
     * Loads configuration with explicit overrides applied on top of the default sources.
     *
     * @param overrides property overrides, keys with the {@code kg.} prefix
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    @NotNull
    public static KnowledgeGraphConfig load(@NotNull Map<String, String> overrides) {
        SmallRyeConfig smallRyeConfig = new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDefaultInterceptors()
            .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL))
            .withMapping(KnowledgeGraphConfig.class)
            .build();

        KnowledgeGraphConfig config = smallRyeConfig.getConfigMapping(KnowledgeGraphConfig.class);
        config.validate();

        logger.info("Knowledge graph config loaded: enabled={}, canonicalization={}, typed={}, symmetric={}, parallel={} (workers={}), minConfidence={}, maxEdges={}",
            config.enabled(),
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.CANONICALIZATION),
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.TYPED_RELATIONSHIPS),
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.SYMMETRIC_RELATIONSHIPS),
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.PARALLEL_PROCESSING),
            config.workerCount(),
            config.relationships().minConfidence(),
            config.relationships().maxEdgesPerEntity());
        return config;
    }
}
