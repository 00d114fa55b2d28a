package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.utils.EmbeddingUtil;
import br.edu.ifba.kgraph.utils.HashUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps entity names to stable canonical ids and decides when two entities are the
 * same concept.
 *
 * <h2>Normalization (canonicalization enabled):</h2>
 * <ol>
 *   <li>NFKC Unicode normalization</li>
 *   <li>Lowercase</li>
 *   <li>Remove punctuation except hyphens</li>
 *   <li>Trim and collapse whitespace</li>
 * </ol>
 *
 * <p>Names listed as case-preserved (domain abbreviations such as "API" or "ICU")
 * only get NFKC and whitespace collapsing. With canonicalization disabled the name is
 * only trimmed and whitespace-collapsed.</p>
 *
 * <p>All methods are pure and thread-safe.</p>
 */
public class EntityCanonicalizer {

    /**
     * Number of description characters mixed into the canonical id.
     */
    public static final int DESCRIPTION_PREFIX_LENGTH = 100;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s\\-]", Pattern.UNICODE_CHARACTER_CLASS);

    private final boolean canonicalizationEnabled;
    private final double mergeThreshold;
    private final Set<String> preserveCaseEntities;

    public EntityCanonicalizer(@NotNull KnowledgeGraphConfig config) {
        this(
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.CANONICALIZATION),
            config.effectiveEntityThreshold(),
            config.canonicalization().preserveCaseEntities()
        );
    }

    public EntityCanonicalizer(boolean canonicalizationEnabled, double mergeThreshold, @NotNull Set<String> preserveCaseEntities) {
        this.canonicalizationEnabled = canonicalizationEnabled;
        this.mergeThreshold = mergeThreshold;
        this.preserveCaseEntities = Set.copyOf(Objects.requireNonNull(preserveCaseEntities, "preserveCaseEntities must not be null"));
    }

    /**
     * Normalizes an entity name for identity comparison.
     *
     * @param name raw entity name
     * @return normalized name, possibly empty
     */
    @NotNull
    public String normalize(@NotNull String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!canonicalizationEnabled) {
            return collapseWhitespace(name);
        }

        String folded = Normalizer.normalize(name, Normalizer.Form.NFKC);
        String collapsed = collapseWhitespace(folded);
        if (preserveCaseEntities.contains(collapsed)) {
            return collapsed;
        }

        String lowered = collapsed.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lowered).replaceAll("");
        return collapseWhitespace(stripped);
    }

    /**
     * Computes the canonical id: first 16 hex chars of
     * SHA-256({@code normalize(name) + "::" + description[0..100)}).
     *
     * @param name raw entity name
     * @param description entity description, null treated as empty
     * @return 16-char lowercase hex id
     */
    @NotNull
    public String canonicalId(@NotNull String name, @Nullable String description) {
        String desc = description != null ? description : "";
        String prefix = desc.length() > DESCRIPTION_PREFIX_LENGTH ? desc.substring(0, DESCRIPTION_PREFIX_LENGTH) : desc;
        return HashUtil.shortId(normalize(name) + "::" + prefix);
    }

    /**
     * Decides whether a candidate is the same concept as an existing entity.
     * An exact canonical id match always merges without touching embeddings.
     * Otherwise both sides need embeddings and a cosine similarity at or above the
     * merge threshold; fuzzy matching is off when canonicalization is disabled.
     */
    public boolean shouldMerge(@NotNull Entity existing, @NotNull Entity candidate) {
        if (existing.getCanonicalId().equals(candidate.getCanonicalId())) {
            return true;
        }
        return isSimilarEnough(existing.getEmbedding(), candidate.getEmbedding());
    }

    /**
     * Embedding part of {@link #shouldMerge(Entity, Entity)}.
     */
    public boolean isSimilarEnough(@Nullable float[] existing, @Nullable float[] candidate) {
        if (!fuzzyMatchingEnabled() || existing == null || candidate == null || existing.length != candidate.length) {
            return false;
        }
        return EmbeddingUtil.cosineSimilarity(existing, candidate) >= mergeThreshold;
    }

    public boolean fuzzyMatchingEnabled() {
        return canonicalizationEnabled;
    }

    public double getMergeThreshold() {
        return mergeThreshold;
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}
