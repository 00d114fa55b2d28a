package br.edu.ifba.kgraph.extraction;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entity candidate as produced by the extractor, before canonicalization.
 */
public record ExtractedEntity(
        @Nullable String name,
        @Nullable String description,
        @Nullable String entityType,
        @NotNull Map<String, Object> metadata) {

    public ExtractedEntity {
        metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of();
    }

    public ExtractedEntity(@Nullable String name, @Nullable String description) {
        this(name, description, null, Map.of());
    }
}
