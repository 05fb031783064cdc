package eu.virtualparadox.lexqa.ingest.lifecycle;

/**
 * Result of one file in a batch ingestion; exactly one of {@code document} and
 * {@code failureCode} is set.
 */
public record IngestionOutcome(String filename, IngestedDocument document, String failureCode) {

    public static IngestionOutcome success(final IngestedDocument document) {
        return new IngestionOutcome(document.filename(), document, null);
    }

    public static IngestionOutcome failure(final String filename, final String failureCode) {
        return new IngestionOutcome(filename, null, failureCode);
    }

    public boolean succeeded() {
        return document != null;
    }
}
