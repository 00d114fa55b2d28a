package br.edu.ifba.kgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Semantic category of a relationship between two entities.
 *
 * <p>Each type carries a base weight used to rank traversal paths. Hierarchical
 * relations rank highest, references and untyped relations lowest.</p>
 *
 * <h2>Base weights:</h2>
 * <pre>
 * HYPERNYM, HYPONYM            1.00
 * SYNONYM                      0.95
 * MERONYM, HOLONYM, ANTONYM    0.90
 * DEPENDENCY                   0.85
 * CAUSAL                       0.80
 * TEMPORAL                     0.70
 * REFERENCE                    0.60
 * GENERIC                      0.50
 * </pre>
 */
public enum RelationshipType {

    /** "is a type of" (A is a kind of B). */
    HYPERNYM(1.0, false),

    /** "has subtype" (A has subtype B). */
    HYPONYM(1.0, false),

    /** "is part of". */
    MERONYM(0.9, false),

    /** "contains". */
    HOLONYM(0.9, false),

    /** Same meaning. Symmetric. */
    SYNONYM(0.95, true),

    /** Opposite meaning. Symmetric. */
    ANTONYM(0.9, true),

    /** "causes" or "leads to". */
    CAUSAL(0.8, false),

    /** "happens before/after". */
    TEMPORAL(0.7, false),

    /** "depends on" or "requires". */
    DEPENDENCY(0.85, false),

    /** "mentions" or "refers to". */
    REFERENCE(0.6, false),

    /** Any other or unrecognized relation. */
    GENERIC(0.5, false);

    private final double baseWeight;
    private final boolean symmetric;

    RelationshipType(double baseWeight, boolean symmetric) {
        this.baseWeight = baseWeight;
        this.symmetric = symmetric;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    /**
     * True if A→B implies B→A with the same meaning.
     */
    public boolean isSymmetric() {
        return symmetric;
    }

    /**
     * Parses a type from the extractor's free-form output, case-insensitive.
     * Blank or unknown values map to {@link #GENERIC}; this never throws.
     *
     * @param value the raw type string
     * @return the matching type
     */
    @NotNull
    public static RelationshipType fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
