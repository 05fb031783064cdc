package eu.virtualparadox.lexqa.rag.embed;

/**
 * The embedding model could not produce a vector.
 */
public class EmbeddingException extends Exception {

    public EmbeddingException(final String message) {
        super(message);
    }

    public EmbeddingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
