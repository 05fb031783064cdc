package eu.virtualparadox.lexqa.query.model;

/**
 * A retrieved chunk ready to be shown to an answer generator.
 *
 * @param marker        1-based citation marker, rendered as {@code [marker]}
 * @param chunkId       chunk identifier
 * @param docId         parent document
 * @param title         document title
 * @param pages         pages the chunk text comes from
 * @param text          chunk text
 * @param combinedScore fused retrieval score
 */
public record Passage(int marker,
                      String chunkId,
                      String docId,
                      String title,
                      PageRange pages,
                      String text,
                      double combinedScore) {

    public String label() {
        return "[" + marker + "]";
    }
}
