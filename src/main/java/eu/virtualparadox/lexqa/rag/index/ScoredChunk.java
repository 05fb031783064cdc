package eu.virtualparadox.lexqa.rag.index;

/**
 * One hit of an index search.
 *
 * @param chunkId chunk identifier
 * @param docId   parent document identifier
 * @param score   index-specific similarity, higher is closer
 */
public record ScoredChunk(String chunkId, String docId, float score) {
}
