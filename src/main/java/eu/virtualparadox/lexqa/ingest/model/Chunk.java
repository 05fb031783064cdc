package eu.virtualparadox.lexqa.ingest.model;

/**
 * Immutable window of document text, the unit of retrieval.
 *
 * @param docId      parent document id
 * @param chunkId    deterministic id, {@code <docId>_<sequence>_p<from>-<to>}
 * @param sequence   zero-based position of the chunk in its document
 * @param start      inclusive start offset of the span in the document text
 * @param end        exclusive end offset of the span in the document text
 * @param pageStart  first one-based page the chunk text comes from
 * @param pageEnd    last one-based page the chunk text comes from
 * @param text       chunk text
 * @param tokenCount number of whitespace tokens in the chunk
 */
public record Chunk(String docId,
                    String chunkId,
                    int sequence,
                    int start,
                    int end,
                    int pageStart,
                    int pageEnd,
                    String text,
                    int tokenCount) {
}
