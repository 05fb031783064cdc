package eu.virtualparadox.lexqa.rag.index;

import java.io.IOException;
import java.util.List;

/**
 * Approximate nearest-neighbour index over chunk embeddings.
 * <p>
 * Adds are keyed by chunk id and become searchable after {@link #commit()}. Scores are cosine
 * similarities mapped to {@code [0, 1]}.
 */
public interface DenseIndex {

    /**
     * Adds or replaces the vector of one chunk.
     *
     * @throws IllegalArgumentException if the vector dimension differs from the index dimension
     */
    void add(String chunkId, String docId, float[] vector) throws IOException;

    /**
     * Makes pending adds and deletes durable and visible to search.
     */
    void commit() throws IOException;

    /**
     * @return up to {@code k} hits, best first; empty for an empty index
     */
    List<ScoredChunk> search(float[] query, int k) throws IOException;

    void deleteByDocId(String docId) throws IOException;

    /**
     * @return number of searchable chunks
     */
    int size() throws IOException;

    /**
     * Removes every chunk.
     */
    void clear() throws IOException;
}
