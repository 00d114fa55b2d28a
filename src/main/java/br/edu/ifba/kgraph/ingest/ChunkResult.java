package br.edu.ifba.kgraph.ingest;

import br.edu.ifba.kgraph.core.MutationResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * Per-chunk outcome of an ingestion batch.
 *
 * @param chunkId the chunk
 * @param status what happened
 * @param mutation what the graph gate stored, present only for PROCESSED
 * @param failureReason why the chunk failed, present only for FAILED and TIMED_OUT
 * @param elapsed wall time spent on the chunk
 */
public record ChunkResult(
    @NotNull String chunkId,
    @NotNull Status status,
    @Nullable MutationResult mutation,
    @Nullable String failureReason,
    @NotNull Duration elapsed
) {

    public enum Status {
        /** Extracted and applied to the graph. */
        PROCESSED,
        /** Skipped: the graph already has relationships for this chunk. */
        ALREADY_PROCESSED,
        /** Extraction or graph mutation failed. */
        FAILED,
        /** Did not finish within the chunk timeout. */
        TIMED_OUT
    }

    public ChunkResult {
        if (chunkId == null) {
            throw new IllegalArgumentException("chunkId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public static ChunkResult processed(@NotNull String chunkId, @NotNull MutationResult mutation, @NotNull Duration elapsed) {
        return new ChunkResult(chunkId, Status.PROCESSED, mutation, null, elapsed);
    }

    public static ChunkResult alreadyProcessed(@NotNull String chunkId, @NotNull Duration elapsed) {
        return new ChunkResult(chunkId, Status.ALREADY_PROCESSED, null, null, elapsed);
    }

    public static ChunkResult failed(@NotNull String chunkId, @NotNull String reason, @NotNull Duration elapsed) {
        return new ChunkResult(chunkId, Status.FAILED, null, reason, elapsed);
    }

    public static ChunkResult timedOut(@NotNull String chunkId, @NotNull Duration timeout, @NotNull Duration elapsed) {
        return new ChunkResult(chunkId, Status.TIMED_OUT, null, "Chunk did not finish within " + timeout, elapsed);
    }

    /**
     * True for PROCESSED and ALREADY_PROCESSED.
     */
    public boolean isSuccess() {
        return status == Status.PROCESSED || status == Status.ALREADY_PROCESSED;
    }

    public String summary() {
        return switch (status) {
            case PROCESSED -> mutation != null ? mutation.summary() : "chunk " + chunkId + " processed";
            case ALREADY_PROCESSED -> "chunk " + chunkId + " already processed";
            case FAILED, TIMED_OUT -> "chunk " + chunkId + " " + status + ": " + failureReason;
        };
    }
}
