package eu.virtualparadox.lexqa.ingest.extractor.model;

public enum EPageOutcome {
    /** A backend produced text. */
    EXTRACTED,
    /** Every backend failed, was unready or returned nothing. */
    NO_TEXT,
    /** The page could not be rasterized. */
    RENDER_FAILED,
    /** Ingestion was cancelled before the page was scheduled. */
    NOT_ATTEMPTED
}
