package br.edu.ifba.kgraph.ingest;

import br.edu.ifba.kgraph.core.GraphMutationGate;
import br.edu.ifba.kgraph.core.KnowledgeGraphConfig;
import br.edu.ifba.kgraph.core.MutationResult;
import br.edu.ifba.kgraph.extraction.ExtractedGraph;
import br.edu.ifba.kgraph.extraction.GraphExtractionException;
import br.edu.ifba.kgraph.extraction.GraphExtractor;
import br.edu.ifba.kgraph.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs extraction and graph mutation for a batch of chunks.
 *
 * <p>Each chunk is isolated: a failure or timeout is reported in that chunk's
 * {@link ChunkResult} and never aborts the batch. Chunks that already have
 * relationships in the graph are skipped without calling the extractor. Results are
 * returned in input order.</p>
 *
 * <p>Batches run on a fixed pool sized {@code min(maxParallelism, chunks)} that lives
 * only for the call. A single chunk, a parallelism of 1 or a disabled parallel feature
 * use the sequential path with the same semantics.</p>
 *
 * <p>The chunk timeout bounds extraction and the embedding wait of the mutation. A
 * timed out chunk is reported as {@code TIMED_OUT} and nothing of it is written.</p>
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>kg.chunkId</code> - The chunk being processed</li>
 * </ul>
 */
public class IngestionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IngestionScheduler.class);

    public static final String MDC_CHUNK_ID = "kg.chunkId";

    private final GraphExtractor extractor;
    private final GraphMutationGate gate;
    private final GraphStore store;
    private final boolean parallelEnabled;
    private final int defaultParallelism;
    private final Duration chunkTimeout;
    private final int progressInterval;

    /**
     * Creates a scheduler from configuration.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public IngestionScheduler(
            @NotNull KnowledgeGraphConfig config,
            @NotNull GraphExtractor extractor,
            @NotNull GraphMutationGate gate,
            @NotNull GraphStore store) {
        this(
            extractor,
            gate,
            store,
            validated(config).isFeatureEnabled(KnowledgeGraphConfig.Feature.PARALLEL_PROCESSING),
            config.workerCount(),
            config.parallel().chunkTimeout(),
            config.parallel().progressInterval()
        );
    }

    public IngestionScheduler(
            @NotNull GraphExtractor extractor,
            @NotNull GraphMutationGate gate,
            @NotNull GraphStore store,
            boolean parallelEnabled,
            int defaultParallelism,
            @NotNull Duration chunkTimeout,
            int progressInterval) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.chunkTimeout = Objects.requireNonNull(chunkTimeout, "chunkTimeout must not be null");
        if (defaultParallelism < 1) {
            throw new IllegalArgumentException("defaultParallelism must be positive, got " + defaultParallelism);
        }
        if (chunkTimeout.isNegative() || chunkTimeout.isZero()) {
            throw new IllegalArgumentException("chunkTimeout must be positive, got " + chunkTimeout);
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be positive, got " + progressInterval);
        }
        this.parallelEnabled = parallelEnabled;
        this.defaultParallelism = defaultParallelism;
        this.progressInterval = progressInterval;
    }

    /**
     * Processes chunks with the configured worker count.
     */
    @NotNull
    public List<ChunkResult> process(@NotNull List<Chunk> chunks) {
        return process(chunks, defaultParallelism);
    }

    /**
     * Processes chunks with at most {@code maxParallelism} concurrent workers.
     *
     * @param chunks chunks to ingest
     * @param maxParallelism worker bound, at least 1
     * @return one result per chunk, in input order
     * @throws IllegalArgumentException if the list or a chunk is null, or maxParallelism is below 1
     */
    @NotNull
    public List<ChunkResult> process(@NotNull List<Chunk> chunks, int maxParallelism) {
        validateRequest(chunks, maxParallelism);
        if (chunks.isEmpty()) {
            return List.of();
        }

        long start = System.nanoTime();
        boolean sequential = !parallelEnabled || chunks.size() == 1 || maxParallelism <= 1;
        logger.info("Processing {} chunks {}", chunks.size(),
            sequential ? "sequentially" : "in parallel with " + Math.min(maxParallelism, chunks.size()) + " workers");

        List<ChunkResult> results = sequential
            ? processSequential(chunks)
            : processParallel(chunks, maxParallelism);

        logBatchSummary(results, Duration.ofNanos(System.nanoTime() - start));
        return results;
    }

    private List<ChunkResult> processSequential(List<Chunk> chunks) {
        ExecutorService callExecutor = Executors.newCachedThreadPool(new IngestThreadFactory("kg-extract"));
        try {
            List<ChunkResult> results = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                results.add(processChunk(chunks.get(i), callExecutor));
                reportProgress(i + 1, chunks.size());
            }
            return results;
        } finally {
            callExecutor.shutdownNow();
        }
    }

    private List<ChunkResult> processParallel(List<Chunk> chunks, int maxParallelism) {
        int poolSize = Math.min(maxParallelism, chunks.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new IngestThreadFactory("kg-ingest"));
        ExecutorService callExecutor = Executors.newCachedThreadPool(new IngestThreadFactory("kg-extract"));
        ChunkResult[] results = new ChunkResult[chunks.size()];
        AtomicInteger completed = new AtomicInteger();

        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                int index = i;
                Chunk chunk = chunks.get(i);
                futures.add(CompletableFuture.runAsync(() -> {
                    results[index] = processChunk(chunk, callExecutor);
                    reportProgress(completed.incrementAndGet(), chunks.size());
                }, executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdownNow();
            callExecutor.shutdownNow();
        }

        return Arrays.asList(results);
    }

    /**
     * Processes one chunk; never throws for chunk-level failures.
     *
     * @param chunk the chunk
     * @return the chunk's outcome
     */
    @NotNull
    public ChunkResult processChunk(@NotNull Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        ExecutorService callExecutor = Executors.newCachedThreadPool(new IngestThreadFactory("kg-extract"));
        try {
            return processChunk(chunk, callExecutor);
        } finally {
            callExecutor.shutdownNow();
        }
    }

    /**
     * Extraction is started on {@code callExecutor} so an extractor that blocks before
     * returning its future is bounded by the same deadline as one that never completes.
     * The deadline also bounds the embedding wait inside the gate.
     */
    private ChunkResult processChunk(Chunk chunk, ExecutorService callExecutor) {
        long start = System.nanoTime();
        long deadline = start + chunkTimeout.toNanos();
        MDC.put(MDC_CHUNK_ID, chunk.id());
        try {
            if (!store.listRelationshipsByChunk(chunk.id()).isEmpty()) {
                logger.debug("Chunk {} already processed, skipping", chunk.id());
                return ChunkResult.alreadyProcessed(chunk.id(), elapsedSince(start));
            }

            AtomicReference<CompletableFuture<ExtractedGraph>> started = new AtomicReference<>();
            CompletableFuture<ExtractedGraph> extraction = CompletableFuture
                .supplyAsync(() -> startExtraction(chunk, started), callExecutor)
                .thenCompose(Function.identity());

            ExtractedGraph graph;
            try {
                graph = extraction.get(remaining(deadline), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                extraction.cancel(true);
                CompletableFuture<ExtractedGraph> inFlight = started.get();
                if (inFlight != null) {
                    inFlight.cancel(true);
                }
                logger.warn("Chunk {} timed out after {} during extraction", chunk.id(), chunkTimeout);
                return ChunkResult.timedOut(chunk.id(), chunkTimeout, elapsedSince(start));
            } catch (ExecutionException e) {
                Throwable cause = unwrap(e);
                return fail(chunk, "Extraction failed: " + describe(cause), start, cause);
            }

            if (graph == null) {
                return fail(chunk, "Extractor returned a null graph", start, null);
            }

            MutationResult mutation;
            try {
                mutation = gate.apply(chunk.id(), graph, deadline);
            } catch (TimeoutException e) {
                logger.warn("Chunk {} timed out after {} before graph mutation", chunk.id(), chunkTimeout);
                return ChunkResult.timedOut(chunk.id(), chunkTimeout, elapsedSince(start));
            }
            if (mutation.isAlreadyProcessed()) {
                return ChunkResult.alreadyProcessed(chunk.id(), elapsedSince(start));
            }
            logger.debug("Processed {}", mutation.summary());
            return ChunkResult.processed(chunk.id(), mutation, elapsedSince(start));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(chunk, "Interrupted", start, e);
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            return fail(chunk, describe(cause), start, cause);
        } finally {
            MDC.remove(MDC_CHUNK_ID);
        }
    }

    private CompletableFuture<ExtractedGraph> startExtraction(
            Chunk chunk, AtomicReference<CompletableFuture<ExtractedGraph>> started) {
        CompletableFuture<ExtractedGraph> extraction = extractor.extract(chunk.text());
        if (extraction == null) {
            throw new GraphExtractionException("Extractor returned no result");
        }
        started.set(extraction);
        return extraction;
    }

    private ChunkResult fail(Chunk chunk, String reason, long start, Throwable cause) {
        if (cause != null) {
            logger.error("Failed to process chunk {}: {}", chunk.id(), reason, cause);
        } else {
            logger.warn("Failed to process chunk {}: {}", chunk.id(), reason);
        }
        return ChunkResult.failed(chunk.id(), reason, elapsedSince(start));
    }

    private void reportProgress(int completed, int total) {
        if (completed % progressInterval == 0) {
            logger.info("Ingestion progress: {}/{} chunks", completed, total);
        }
    }

    private void logBatchSummary(List<ChunkResult> results, Duration elapsed) {
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        int timedOut = 0;
        for (ChunkResult result : results) {
            switch (result.status()) {
                case PROCESSED -> processed++;
                case ALREADY_PROCESSED -> skipped++;
                case FAILED -> failed++;
                case TIMED_OUT -> timedOut++;
            }
        }
        logger.info("Ingestion complete in {} ms: {} processed, {} already processed, {} failed, {} timed out",
            elapsed.toMillis(), processed, skipped, failed, timedOut);
    }

    private static void validateRequest(List<Chunk> chunks, int maxParallelism) {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be at least 1, got " + maxParallelism);
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i) == null) {
                throw new IllegalArgumentException("chunk at index " + i + " is null");
            }
        }
    }

    private static KnowledgeGraphConfig validated(KnowledgeGraphConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        return config;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null
            ? throwable.getClass().getSimpleName() + ": " + message
            : throwable.getClass().getSimpleName();
    }

    private static long remaining(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class IngestThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final String prefix;
        private final int poolId = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        IngestThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(@NotNull Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
