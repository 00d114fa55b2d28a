package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.embedding.EmbeddingFunction;
import br.edu.ifba.kgraph.extraction.ExtractedEntity;
import br.edu.ifba.kgraph.extraction.ExtractedGraph;
import br.edu.ifba.kgraph.extraction.ExtractedRelationship;
import br.edu.ifba.kgraph.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single writer of the knowledge graph.
 *
 * <p>Applies one chunk's extracted fragment in five steps, all under the keyed locks
 * of the chunk and every entity it touches:</p>
 * <ol>
 *   <li>Idempotency: a chunk that already has relationships is a no-op.</li>
 *   <li>Entities: canonicalize, then merge into an existing entity (exact canonical id,
 *       else embedding similarity) or insert.</li>
 *   <li>Relationships: resolve endpoints against this chunk's entities, drop unresolved,
 *       self loops and low confidence, compute weight, persist.</li>
 *   <li>Degree cap: evict the lowest weight outgoing edges (then lowest id) of every
 *       touched source above the cap.</li>
 *   <li>Symmetric mirroring: a SYNONYM/ANTONYM pair extracted in one direction only
 *       carries one mirror edge, the inverse of its earliest extracted edge; the mirror
 *       sources are then capped.</li>
 * </ol>
 *
 * <p>Writes under the locks are journaled; if the store fails partway they are undone
 * before the exception is rethrown.</p>
 *
 * <p>Embedding calls and the fuzzy candidate lookup happen before the locks are taken;
 * fuzzy matches are re-verified inside them.</p>
 */
public class GraphMutationGate {

    private static final Logger logger = LoggerFactory.getLogger(GraphMutationGate.class);

    public static final String CHUNK_LOCK_PREFIX = "chunk::";

    /**
     * Metadata key set on mirrored edges, pointing to the edge they mirror.
     */
    public static final String MIRRORED_FROM = "mirrored_from";

    private static final Comparator<Relationship> EVICTION_ORDER =
        Comparator.comparingDouble(Relationship::getWeight).thenComparing(Relationship::getId);

    private static final Comparator<Relationship> MIRROR_ORIGIN_ORDER =
        Comparator.comparing(Relationship::getChunkId).thenComparing(Relationship::getId);

    private final GraphStore store;
    private final EntityCanonicalizer canonicalizer;
    private final RelationshipTyper typer;
    @Nullable
    private final EmbeddingFunction embeddingFunction;
    private final double minConfidence;
    private final int maxEdgesPerEntity;
    private final boolean symmetricEnabled;

    public GraphMutationGate(
            @NotNull KnowledgeGraphConfig config,
            @NotNull GraphStore store,
            @Nullable EmbeddingFunction embeddingFunction) {
        this(
            store,
            new EntityCanonicalizer(config),
            new RelationshipTyper(config),
            embeddingFunction,
            config.relationships().minConfidence(),
            config.relationships().maxEdgesPerEntity(),
            config.isFeatureEnabled(KnowledgeGraphConfig.Feature.SYMMETRIC_RELATIONSHIPS)
        );
    }

    public GraphMutationGate(
            @NotNull GraphStore store,
            @NotNull EntityCanonicalizer canonicalizer,
            @NotNull RelationshipTyper typer,
            @Nullable EmbeddingFunction embeddingFunction,
            double minConfidence,
            int maxEdgesPerEntity,
            boolean symmetricEnabled) {
        if (maxEdgesPerEntity < 1) {
            throw new IllegalArgumentException("maxEdgesPerEntity must be positive, got " + maxEdgesPerEntity);
        }
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer must not be null");
        this.typer = Objects.requireNonNull(typer, "typer must not be null");
        this.embeddingFunction = embeddingFunction;
        this.minConfidence = minConfidence;
        this.maxEdgesPerEntity = maxEdgesPerEntity;
        this.symmetricEnabled = symmetricEnabled;
    }

    /**
     * Applies an extracted graph for a chunk.
     */
    @NotNull
    public MutationResult apply(@NotNull String chunkId, @NotNull ExtractedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        return apply(chunkId, graph.entities(), graph.relationships());
    }

    /**
     * Applies an extracted graph for a chunk, giving up before any write once the
     * deadline has passed.
     *
     * @param deadlineNanos absolute deadline on the {@link System#nanoTime()} clock
     * @throws TimeoutException if embedding the candidates does not finish before the deadline
     * @throws InterruptedException if interrupted while waiting for embeddings
     */
    @NotNull
    public MutationResult apply(@NotNull String chunkId, @NotNull ExtractedGraph graph, long deadlineNanos)
            throws TimeoutException, InterruptedException {
        Objects.requireNonNull(graph, "graph must not be null");
        return applyWithin(chunkId, graph.entities(), graph.relationships(), deadlineNanos, true);
    }

    /**
     * Applies candidate entities and relationships extracted from a chunk.
     *
     * <p>All writes of one call are undone if the store fails partway, so a failed
     * chunk leaves no relationships behind and can be retried.</p>
     *
     * @param chunkId provenance of the fragment; also the idempotency key
     * @param candidateEntities extracted entities, possibly with duplicates or blank names
     * @param candidateRelationships extracted relationships referencing entities by name
     * @return what was stored
     * @throws br.edu.ifba.kgraph.storage.GraphStoreException if the store fails
     */
    @NotNull
    public MutationResult apply(
            @NotNull String chunkId,
            @Nullable List<ExtractedEntity> candidateEntities,
            @Nullable List<ExtractedRelationship> candidateRelationships) {
        try {
            return applyWithin(chunkId, candidateEntities, candidateRelationships, 0L, false);
        } catch (TimeoutException e) {
            // unreachable without a deadline
            throw new IllegalStateException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private MutationResult applyWithin(
            String chunkId,
            @Nullable List<ExtractedEntity> candidateEntities,
            @Nullable List<ExtractedRelationship> candidateRelationships,
            long deadlineNanos,
            boolean bounded) throws TimeoutException, InterruptedException {
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        List<ExtractedEntity> entities = candidateEntities != null ? candidateEntities : List.of();
        List<ExtractedRelationship> relationships = candidateRelationships != null ? candidateRelationships : List.of();

        if (!store.listRelationshipsByChunk(chunkId).isEmpty()) {
            logger.debug("Chunk {} already has relationships, skipping", chunkId);
            return MutationResult.alreadyProcessed(chunkId);
        }

        Counters counters = new Counters();
        CandidateBatch batch = canonicalize(chunkId, entities, counters);
        attachEmbeddings(batch, deadlineNanos, bounded);
        Map<String, String> fuzzyTargets = preResolveFuzzyMatches(batch);

        if (bounded && System.nanoTime() - deadlineNanos > 0) {
            throw new TimeoutException("Deadline passed before graph mutation of chunk " + chunkId);
        }

        Set<String> lockKeys = new TreeSet<>();
        lockKeys.add(CHUNK_LOCK_PREFIX + chunkId);
        lockKeys.addAll(batch.candidates.keySet());
        lockKeys.addAll(fuzzyTargets.values());

        return store.executeAtomically(lockKeys, () -> {
            WriteJournal journal = new WriteJournal();
            try {
                return applyLocked(chunkId, batch, fuzzyTargets, relationships, counters, journal);
            } catch (RuntimeException e) {
                rollback(chunkId, journal, e);
                throw e;
            }
        });
    }

    // ===== Phase A: outside the locks =====

    private CandidateBatch canonicalize(String chunkId, List<ExtractedEntity> entities, Counters counters) {
        CandidateBatch batch = new CandidateBatch();
        for (ExtractedEntity extracted : entities) {
            if (extracted == null || extracted.name() == null || extracted.name().isBlank()) {
                counters.droppedMalformed++;
                logger.debug("Dropping entity without a name in chunk {}", chunkId);
                continue;
            }

            String name = extracted.name().trim();
            String canonicalId = canonicalizer.canonicalId(name, extracted.description());
            Entity candidate = Entity.builder()
                .name(name)
                .canonicalId(canonicalId)
                .description(extracted.description())
                .entityType(extracted.entityType())
                .metadata(extracted.metadata())
                .addSourceChunkId(chunkId)
                .build();

            Entity sameConcept = batch.candidates.get(canonicalId);
            batch.candidates.put(canonicalId, sameConcept != null ? sameConcept.mergeWith(candidate) : candidate);
            batch.nameIndex.putIfAbsent(name, canonicalId);
            batch.nameIndex.putIfAbsent(canonicalizer.normalize(name), canonicalId);
        }
        return batch;
    }

    private void attachEmbeddings(CandidateBatch batch, long deadlineNanos, boolean bounded)
            throws TimeoutException, InterruptedException {
        if (embeddingFunction == null || batch.candidates.isEmpty()) {
            return;
        }

        List<String> ids = new ArrayList<>(batch.candidates.keySet());
        List<String> texts = new ArrayList<>(ids.size());
        for (String id : ids) {
            Entity candidate = batch.candidates.get(id);
            texts.add(candidate.getName() + ": " + candidate.getDescription());
        }

        CompletableFuture<List<float[]>> pending = embeddingFunction.embed(texts);
        List<float[]> vectors;
        if (!bounded) {
            vectors = pending.join();
        } else {
            try {
                vectors = pending.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                throw new CompletionException(e.getCause() != null ? e.getCause() : e);
            }
        }
        if (vectors == null || vectors.size() != ids.size()) {
            throw new IllegalStateException(String.format(
                "Embedding function returned %d vectors for %d texts",
                vectors == null ? 0 : vectors.size(), ids.size()));
        }
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            batch.candidates.put(id, batch.candidates.get(id).withEmbedding(vectors.get(i)));
        }
    }

    private Map<String, String> preResolveFuzzyMatches(CandidateBatch batch) {
        Map<String, String> fuzzyTargets = new HashMap<>();
        if (!canonicalizer.fuzzyMatchingEnabled()) {
            return fuzzyTargets;
        }
        for (Entity candidate : batch.candidates.values()) {
            float[] embedding = candidate.getEmbedding();
            if (embedding == null || store.findByCanonicalId(candidate.getCanonicalId()).isPresent()) {
                continue;
            }
            List<GraphStore.EntityMatch> matches =
                store.findSimilarEntities(embedding, canonicalizer.getMergeThreshold(), 1);
            if (!matches.isEmpty()) {
                String targetId = matches.get(0).entity().getCanonicalId();
                if (!targetId.equals(candidate.getCanonicalId())) {
                    fuzzyTargets.put(candidate.getCanonicalId(), targetId);
                }
            }
        }
        return fuzzyTargets;
    }

    // ===== Phase B: inside the locks =====

    private MutationResult applyLocked(
            String chunkId,
            CandidateBatch batch,
            Map<String, String> fuzzyTargets,
            List<ExtractedRelationship> candidateRelationships,
            Counters counters,
            WriteJournal journal) {
        if (!store.listRelationshipsByChunk(chunkId).isEmpty()) {
            logger.debug("Chunk {} was applied concurrently, skipping", chunkId);
            return MutationResult.alreadyProcessed(chunkId);
        }

        Map<String, String> resolvedIds = resolveEntities(batch, fuzzyTargets, counters, journal);
        List<Relationship> accepted =
            persistRelationships(chunkId, batch, resolvedIds, candidateRelationships, counters, journal);

        Set<String> touchedSources = new LinkedHashSet<>();
        for (Relationship relationship : accepted) {
            touchedSources.add(relationship.getSourceEntityId());
        }
        Set<String> evicted = enforceDegreeCap(touchedSources, counters, journal);

        List<Relationship> stored = new ArrayList<>();
        for (Relationship relationship : accepted) {
            if (!evicted.contains(relationship.getId())) {
                stored.add(relationship);
            }
        }

        if (symmetricEnabled) {
            List<Relationship> mirrors = reconcileMirrors(stored, counters, journal);
            Set<String> mirrorSources = new LinkedHashSet<>();
            for (Relationship mirror : mirrors) {
                mirrorSources.add(mirror.getSourceEntityId());
            }
            Set<String> evictedAfterMirroring = enforceDegreeCap(mirrorSources, counters, journal);
            stored.addAll(mirrors);
            stored.removeIf(r -> evictedAfterMirroring.contains(r.getId()));
        }

        List<Entity> storedEntities = new ArrayList<>();
        for (String entityId : new LinkedHashSet<>(resolvedIds.values())) {
            store.findByCanonicalId(entityId).ifPresent(storedEntities::add);
        }

        MutationResult result = new MutationResult(
            MutationResult.Status.APPLIED,
            chunkId,
            storedEntities,
            stored,
            counters.inserted,
            counters.merged,
            counters.droppedMalformed,
            counters.droppedUnresolved,
            counters.droppedSelfLoops,
            counters.droppedLowConfidence,
            counters.evicted,
            counters.mirrored
        );
        logger.debug("Applied {}", result.summary());
        return result;
    }

    /**
     * Undoes every write recorded in the journal: new edges go, deleted edges come back,
     * entities return to their state before this call.
     */
    private void rollback(String chunkId, WriteJournal journal, RuntimeException failure) {
        try {
            store.deleteEdges(journal.insertedEdges);
            for (Relationship deleted : journal.deletedEdges.values()) {
                if (!journal.insertedEdges.contains(deleted.getId())) {
                    store.upsertRelationship(deleted);
                }
            }
            for (Map.Entry<String, Optional<Entity>> snapshot : journal.entitySnapshots.entrySet()) {
                if (snapshot.getValue().isPresent()) {
                    store.upsertEntity(snapshot.getValue().get());
                } else {
                    store.deleteEntity(snapshot.getKey());
                }
            }
            logger.warn("Rolled back chunk {} after failure: {} edges removed, {} edges restored, {} entities restored",
                chunkId, journal.insertedEdges.size(), journal.deletedEdges.size(), journal.entitySnapshots.size());
        } catch (RuntimeException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
            logger.error("Rollback of chunk {} failed, the graph may hold part of its fragment", chunkId, rollbackFailure);
        }
    }

    /**
     * Merges or inserts every candidate.
     *
     * @return candidate canonical id to stored entity id
     */
    private Map<String, String> resolveEntities(
            CandidateBatch batch, Map<String, String> fuzzyTargets, Counters counters, WriteJournal journal) {
        Map<String, String> resolvedIds = new LinkedHashMap<>();
        for (Entity candidate : batch.candidates.values()) {
            String candidateId = candidate.getCanonicalId();

            Optional<Entity> exact = store.findByCanonicalId(candidateId);
            if (exact.isPresent()) {
                journal.beforeEntityWrite(candidateId, exact);
                store.upsertEntity(merge(exact.get(), candidate));
                counters.merged++;
                resolvedIds.put(candidateId, candidateId);
                continue;
            }

            String targetId = fuzzyTargets.get(candidateId);
            if (targetId != null) {
                Optional<Entity> fuzzy = store.findByCanonicalId(targetId);
                if (fuzzy.isPresent() && canonicalizer.shouldMerge(fuzzy.get(), candidate)) {
                    logger.debug("Merging '{}' into similar entity '{}' ({})",
                        candidate.getName(), fuzzy.get().getName(), targetId);
                    journal.beforeEntityWrite(targetId, fuzzy);
                    store.upsertEntity(merge(fuzzy.get(), candidate));
                    counters.merged++;
                    resolvedIds.put(candidateId, targetId);
                    continue;
                }
            }

            journal.beforeEntityWrite(candidateId, Optional.empty());
            store.upsertEntity(candidate);
            counters.inserted++;
            resolvedIds.put(candidateId, candidateId);
        }
        return resolvedIds;
    }

    private Entity merge(Entity existing, Entity candidate) {
        if (logger.isDebugEnabled()) {
            for (Map.Entry<String, Object> entry : candidate.getMetadata().entrySet()) {
                String key = entry.getKey();
                if (existing.getMetadata().containsKey(key)
                        && !Objects.equals(existing.getMetadata().get(key), entry.getValue())) {
                    logger.debug("Metadata conflict on entity {} key '{}': '{}' replaced by '{}'",
                        existing.getCanonicalId(), key, existing.getMetadata().get(key), entry.getValue());
                }
            }
        }
        return existing.mergeWith(candidate);
    }

    private List<Relationship> persistRelationships(
            String chunkId,
            CandidateBatch batch,
            Map<String, String> resolvedIds,
            List<ExtractedRelationship> candidates,
            Counters counters,
            WriteJournal journal) {
        Map<String, Relationship> accepted = new LinkedHashMap<>();
        for (ExtractedRelationship candidate : candidates) {
            if (candidate == null) {
                counters.droppedUnresolved++;
                continue;
            }

            String sourceId = resolveEndpoint(batch, resolvedIds, candidate.sourceEntity());
            String targetId = resolveEndpoint(batch, resolvedIds, candidate.targetEntity());
            if (sourceId == null || targetId == null) {
                counters.droppedUnresolved++;
                logger.debug("Dropping relationship {} -> {} in chunk {}: unresolved endpoint",
                    candidate.sourceEntity(), candidate.targetEntity(), chunkId);
                continue;
            }
            if (sourceId.equals(targetId)) {
                counters.droppedSelfLoops++;
                logger.debug("Dropping self-loop on {} in chunk {}", sourceId, chunkId);
                continue;
            }

            double confidence = candidate.confidence();
            if (Double.isNaN(confidence) || confidence < minConfidence) {
                counters.droppedLowConfidence++;
                logger.debug("Dropping relationship {} -> {} in chunk {}: confidence {} below {}",
                    candidate.sourceEntity(), candidate.targetEntity(), chunkId, confidence, minConfidence);
                continue;
            }

            RelationshipType type = typer.resolveType(candidate.relationshipType());
            double clamped = RelationshipTyper.clamp(confidence);
            Relationship relationship = Relationship.builder()
                .sourceEntityId(sourceId)
                .targetEntityId(targetId)
                .description(candidate.description())
                .relationshipType(type)
                .confidence(clamped)
                .weight(typer.weight(type, clamped))
                .chunkId(chunkId)
                .metadata(candidate.metadata())
                .build();

            Relationship duplicate = accepted.get(relationship.getId());
            if (duplicate == null || duplicate.getWeight() < relationship.getWeight()) {
                accepted.put(relationship.getId(), relationship);
            }
        }

        for (Relationship relationship : accepted.values()) {
            journal.insertedEdges.add(relationship.getId());
            store.upsertRelationship(relationship);
        }
        return new ArrayList<>(accepted.values());
    }

    @Nullable
    private String resolveEndpoint(CandidateBatch batch, Map<String, String> resolvedIds, @Nullable String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return null;
        }
        String name = rawName.trim();
        String candidateId = batch.nameIndex.get(name);
        if (candidateId == null) {
            candidateId = batch.nameIndex.get(canonicalizer.normalize(name));
        }
        return candidateId != null ? resolvedIds.get(candidateId) : null;
    }

    /**
     * Evicts the lowest weight outgoing edges of each source above the cap.
     *
     * @return ids of evicted relationships
     */
    private Set<String> enforceDegreeCap(Set<String> sourceIds, Counters counters, WriteJournal journal) {
        Set<String> evicted = new LinkedHashSet<>();
        for (String sourceId : sourceIds) {
            int count = store.countOutgoingEdges(sourceId);
            if (count <= maxEdgesPerEntity) {
                continue;
            }
            List<Relationship> outgoing = new ArrayList<>(store.listOutgoingEdges(sourceId));
            outgoing.sort(EVICTION_ORDER);
            int deleted = deleteEdges(outgoing.subList(0, outgoing.size() - maxEdgesPerEntity), journal);
            counters.evicted += deleted;
            for (int i = 0; i < outgoing.size() - maxEdgesPerEntity; i++) {
                evicted.add(outgoing.get(i).getId());
            }
            logger.debug("Entity {} exceeded {} outgoing edges, evicted {}", sourceId, maxEdgesPerEntity, deleted);
        }
        return evicted;
    }

    /**
     * Brings the mirrors of every symmetric pair touched by this chunk to the state
     * that depends only on the pair's extracted edges, never on arrival order.
     *
     * <p>A pair with extracted edges in one direction only gets exactly one mirror: the
     * inverse of its earliest edge by chunk id, then id. A pair with extracted edges in
     * both directions needs no mirror. Any other mirror of the pair is deleted.</p>
     *
     * @return mirrors added by this call
     */
    private List<Relationship> reconcileMirrors(List<Relationship> stored, Counters counters, WriteJournal journal) {
        Set<SymmetricPair> pairs = new LinkedHashSet<>();
        for (Relationship relationship : stored) {
            if (typer.isSymmetric(relationship.getRelationshipType())) {
                pairs.add(SymmetricPair.of(relationship));
            }
        }

        List<Relationship> added = new ArrayList<>();
        for (SymmetricPair pair : pairs) {
            List<Relationship> forward = edgesBetween(pair.first(), pair.second(), pair.type());
            List<Relationship> backward = edgesBetween(pair.second(), pair.first(), pair.type());

            List<Relationship> mirrors = new ArrayList<>();
            List<Relationship> forwardExtracted = new ArrayList<>();
            List<Relationship> backwardExtracted = new ArrayList<>();
            split(forward, forwardExtracted, mirrors);
            split(backward, backwardExtracted, mirrors);

            Relationship desired = null;
            if (!forwardExtracted.isEmpty() && backwardExtracted.isEmpty()) {
                desired = mirrorOf(forwardExtracted);
            } else if (forwardExtracted.isEmpty() && !backwardExtracted.isEmpty()) {
                desired = mirrorOf(backwardExtracted);
            }

            List<Relationship> stale = new ArrayList<>();
            boolean present = false;
            for (Relationship mirror : mirrors) {
                if (desired != null && mirror.getId().equals(desired.getId())) {
                    present = true;
                } else {
                    stale.add(mirror);
                }
            }
            if (!stale.isEmpty()) {
                deleteEdges(stale, journal);
                logger.debug("Removed {} superseded mirrors between {} and {}", stale.size(), pair.first(), pair.second());
            }
            if (desired != null && !present) {
                journal.insertedEdges.add(desired.getId());
                store.upsertRelationship(desired);
                added.add(desired);
                counters.mirrored++;
            }
        }
        return added;
    }

    private List<Relationship> edgesBetween(String sourceId, String targetId, RelationshipType type) {
        List<Relationship> edges = new ArrayList<>();
        for (Relationship relationship : store.listOutgoingEdges(sourceId)) {
            if (relationship.getTargetEntityId().equals(targetId) && relationship.getRelationshipType() == type) {
                edges.add(relationship);
            }
        }
        return edges;
    }

    private static void split(List<Relationship> edges, List<Relationship> extracted, List<Relationship> mirrors) {
        for (Relationship edge : edges) {
            if (edge.getMetadata().containsKey(MIRRORED_FROM)) {
                mirrors.add(edge);
            } else {
                extracted.add(edge);
            }
        }
    }

    private static Relationship mirrorOf(List<Relationship> extracted) {
        Relationship origin = extracted.stream().min(MIRROR_ORIGIN_ORDER).orElseThrow();
        return origin.inverse(Map.of(MIRRORED_FROM, origin.getId()));
    }

    private int deleteEdges(List<Relationship> victims, WriteJournal journal) {
        List<String> ids = new ArrayList<>(victims.size());
        for (Relationship victim : victims) {
            journal.deletedEdges.putIfAbsent(victim.getId(), victim);
            ids.add(victim.getId());
        }
        return store.deleteEdges(ids);
    }

    /**
     * Unordered entity pair with a symmetric type; {@code first} sorts before {@code second}.
     */
    private record SymmetricPair(String first, String second, RelationshipType type) {
        static SymmetricPair of(Relationship relationship) {
            String source = relationship.getSourceEntityId();
            String target = relationship.getTargetEntityId();
            return source.compareTo(target) <= 0
                ? new SymmetricPair(source, target, relationship.getRelationshipType())
                : new SymmetricPair(target, source, relationship.getRelationshipType());
        }
    }

    /**
     * Writes made under the locks, kept so a failed apply can be undone.
     */
    private static final class WriteJournal {
        // canonicalId -> entity before its first write in this apply, empty if it was new
        final Map<String, Optional<Entity>> entitySnapshots = new LinkedHashMap<>();
        final Set<String> insertedEdges = new LinkedHashSet<>();
        final Map<String, Relationship> deletedEdges = new LinkedHashMap<>();

        void beforeEntityWrite(String canonicalId, Optional<Entity> previous) {
            entitySnapshots.putIfAbsent(canonicalId, previous);
        }
    }

    private static final class CandidateBatch {
        // canonicalId -> candidate, in extraction order
        final Map<String, Entity> candidates = new LinkedHashMap<>();
        // raw and normalized name -> canonicalId
        final Map<String, String> nameIndex = new HashMap<>();
    }

    private static final class Counters {
        int inserted;
        int merged;
        int droppedMalformed;
        int droppedUnresolved;
        int droppedSelfLoops;
        int droppedLowConfidence;
        int evicted;
        int mirrored;
    }
}
