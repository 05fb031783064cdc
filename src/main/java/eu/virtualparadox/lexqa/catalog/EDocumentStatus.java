package eu.virtualparadox.lexqa.catalog;

public enum EDocumentStatus {
    QUEUED,
    PROCESSING,
    INDEXED,
    FAILED
}
