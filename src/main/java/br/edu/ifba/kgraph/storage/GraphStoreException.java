package br.edu.ifba.kgraph.storage;

/**
 * Thrown when the graph store cannot complete an operation.
 * Propagated out of a graph mutation; the ingestion scheduler isolates it per chunk.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
