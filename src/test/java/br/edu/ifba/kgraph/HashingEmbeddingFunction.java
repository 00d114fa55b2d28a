package br.edu.ifba.kgraph;

import br.edu.ifba.kgraph.embedding.EmbeddingFunction;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedding for tests: each lowercase token adds 1 to the
 * bucket {@code hashCode mod dimensions}. Texts sharing words get a positive cosine.
 */
public class HashingEmbeddingFunction implements EmbeddingFunction {

    private final int dimensions;
    private final AtomicInteger calls = new AtomicInteger();

    public HashingEmbeddingFunction() {
        this(256);
    }

    public HashingEmbeddingFunction(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull List<String> texts) {
        calls.incrementAndGet();
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorOf(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    public float[] vectorOf(String text) {
        float[] vector = new float[dimensions];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0f;
            }
        }
        return vector;
    }

    public int getCalls() {
        return calls.get();
    }
}
