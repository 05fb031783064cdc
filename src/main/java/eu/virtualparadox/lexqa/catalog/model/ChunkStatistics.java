package eu.virtualparadox.lexqa.catalog.model;

/**
 * Chunk counts of one document.
 *
 * @param docId         document id
 * @param chunkCount    number of stored chunks
 * @param averageTokens mean token count per chunk, 0 without chunks
 * @param minTokens     smallest chunk, 0 without chunks
 * @param maxTokens     largest chunk, 0 without chunks
 */
public record ChunkStatistics(String docId, int chunkCount, double averageTokens, int minTokens, int maxTokens) {
}
