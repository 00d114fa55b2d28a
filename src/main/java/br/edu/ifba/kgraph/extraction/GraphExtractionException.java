package br.edu.ifba.kgraph.extraction;

/**
 * Thrown when the extractor's output cannot be turned into a graph.
 */
public class GraphExtractionException extends RuntimeException {

    public GraphExtractionException(String message) {
        super(message);
    }

    public GraphExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
