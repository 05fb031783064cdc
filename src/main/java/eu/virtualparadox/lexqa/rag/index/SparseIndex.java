package eu.virtualparadox.lexqa.rag.index;

import java.io.IOException;
import java.util.List;

/**
 * BM25 index over the tokens of each chunk. Tokens come from
 * {@link eu.virtualparadox.lexqa.ingest.normalize.LegalTokenizer}; the index does no analysis of its own.
 */
public interface SparseIndex {

    void add(String chunkId, String docId, List<String> tokens) throws IOException;

    void commit() throws IOException;

    /**
     * @param queryTokens query tokens, duplicates weigh the term higher
     * @param k           maximum number of hits
     * @return up to {@code k} hits, best first; empty for an empty index or no tokens
     */
    List<ScoredChunk> search(List<String> queryTokens, int k) throws IOException;

    void deleteByDocId(String docId) throws IOException;

    int size() throws IOException;

    void clear() throws IOException;
}
