package eu.virtualparadox.lexqa.rag.retriever.model;

public enum ERetrievalOutcome {
    /** Both indexes answered. */
    OK,
    /** The embedder or the dense index failed; ranking uses lexical matches only. */
    DEGRADED_SPARSE_ONLY,
    /** The sparse index failed; ranking uses semantic matches only. */
    DEGRADED_DENSE_ONLY,
    /** Both sides failed. */
    UNAVAILABLE,
    /** Nothing has been ingested yet. */
    NO_SOURCES;

    public boolean isDegraded() {
        return this == DEGRADED_SPARSE_ONLY || this == DEGRADED_DENSE_ONLY || this == UNAVAILABLE;
    }
}
