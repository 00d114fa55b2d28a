package br.edu.ifba.kgraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RelationshipTyper} and {@link RelationshipType}.
 */
class RelationshipTyperTest {

    private final RelationshipTyper typer = new RelationshipTyper(true);

    @ParameterizedTest(name = "{0} at {1} -> {2}")
    @CsvSource({
        "HYPERNYM, 0.9, 9.0",
        "GENERIC, 0.8, 4.0",
        "SYNONYM, 0.95, 9.025",
        "CAUSAL, 1.0, 8.0",
        "REFERENCE, 1.0, 6.0",
        "TEMPORAL, 0.5, 3.5",
        "DEPENDENCY, 1.0, 8.5",
        "MERONYM, 1.0, 9.0"
    })
    void computesWeight(RelationshipType type, double confidence, double expected) {
        assertEquals(expected, typer.weight(type, confidence), 1e-9);
    }

    @Test
    @DisplayName("should clamp confidence into [0, 1]")
    void clampsConfidence() {
        assertEquals(10.0, typer.weight(RelationshipType.HYPONYM, 1.7), 1e-9);
        assertEquals(0.0, typer.weight(RelationshipType.HYPONYM, -0.2), 1e-9);
        assertEquals(0.0, typer.weight(RelationshipType.HYPONYM, Double.NaN), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(RelationshipType.class)
    void onlySynonymAndAntonymAreSymmetric(RelationshipType type) {
        boolean expected = type == RelationshipType.SYNONYM || type == RelationshipType.ANTONYM;
        assertEquals(expected, typer.isSymmetric(type));
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
        "hypernym|HYPERNYM",
        "  Synonym |SYNONYM",
        "CAUSAL|CAUSAL",
        "is_part_of|GENERIC",
        "''|GENERIC"
    })
    void parsesTypesLeniently(String raw, RelationshipType expected) {
        assertEquals(expected, typer.resolveType(raw));
    }

    @Test
    @DisplayName("should parse null as GENERIC")
    void nullTypeIsGeneric() {
        assertEquals(RelationshipType.GENERIC, RelationshipType.fromString(null));
    }

    @Test
    @DisplayName("should treat every type as GENERIC when typing is disabled")
    void untypedMode() {
        RelationshipTyper untyped = new RelationshipTyper(false);
        RelationshipType type = untyped.resolveType("hypernym");

        assertEquals(RelationshipType.GENERIC, type);
        assertEquals(4.5, untyped.weight(type, 0.9), 1e-9);
    }
}
