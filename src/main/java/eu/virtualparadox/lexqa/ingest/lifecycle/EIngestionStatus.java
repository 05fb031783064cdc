package eu.virtualparadox.lexqa.ingest.lifecycle;

public enum EIngestionStatus {
    QUEUED,
    EXTRACTING,
    INDEXING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
