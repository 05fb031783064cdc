package eu.virtualparadox.lexqa.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for chunk texts and queries.
 * <p>
 * The same instance embeds documents and queries. {@link #modelVersion()} identifies the model
 * so that an index built with another model can be detected.
 */
public interface EmbeddingService {

    /**
     * Embeds a single text, typically a query.
     *
     * @param text text to embed (non-null, non-blank)
     * @return L2-normalized vector
     * @throws EmbeddingException on inference failure
     */
    float[] embed(String text) throws EmbeddingException;

    /**
     * Embeds several texts in one inference call.
     *
     * @param texts texts to embed
     * @return one vector per text, same order
     * @throws EmbeddingException if the batch fails as a whole
     */
    List<float[]> embedBatch(List<String> texts) throws EmbeddingException;

    /**
     * @return stable identifier of the model, e.g. {@code law-ai/InLegalBERT@3f2a9c01d4e7}
     */
    String modelVersion();

    /**
     * @return vector dimension
     * @throws EmbeddingException if the model cannot be loaded
     */
    int dimension() throws EmbeddingException;
}
