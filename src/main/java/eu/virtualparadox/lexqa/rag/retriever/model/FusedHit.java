package eu.virtualparadox.lexqa.rag.retriever.model;

/**
 * A chunk ranked by the hybrid retriever.
 *
 * @param chunkId          chunk identifier
 * @param docId            parent document identifier
 * @param denseScore       raw dense similarity, {@code null} if the chunk was not a dense candidate
 * @param sparseScore      raw BM25 score, {@code null} if the chunk was not a sparse candidate
 * @param normalizedDense  dense score scaled to [0, 1], 0 when absent
 * @param normalizedSparse sparse score scaled to [0, 1], 0 when absent
 * @param combinedScore    weighted sum of the normalized scores
 */
public record FusedHit(String chunkId,
                       String docId,
                       Double denseScore,
                       Double sparseScore,
                       double normalizedDense,
                       double normalizedSparse,
                       double combinedScore) {

    public double bestNormalized() {
        return Math.max(normalizedDense, normalizedSparse);
    }
}
