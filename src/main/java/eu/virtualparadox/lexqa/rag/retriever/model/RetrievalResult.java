package eu.virtualparadox.lexqa.rag.retriever.model;

import java.util.List;

/**
 * Ranked hits of one query and how they were obtained.
 *
 * @param hits    best first
 * @param outcome which sources contributed
 */
public record RetrievalResult(List<FusedHit> hits, ERetrievalOutcome outcome) {

    public RetrievalResult {
        hits = List.copyOf(hits);
    }

    public static RetrievalResult noSources() {
        return new RetrievalResult(List.of(), ERetrievalOutcome.NO_SOURCES);
    }

    public boolean degraded() {
        return outcome.isDegraded();
    }
}
