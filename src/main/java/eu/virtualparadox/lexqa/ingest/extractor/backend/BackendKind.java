package eu.virtualparadox.lexqa.ingest.extractor.backend;

/**
 * The closed set of extraction engines a page can be sent to.
 */
public enum BackendKind {
    /** OCR-free document understanding transformer (Donut). */
    DOCUMENT_UNDERSTANDING,
    /** Screenshot parsing / visual question answering transformer (Pix2Struct). */
    VISUAL_QA,
    /** Hosted multimodal chat model. */
    REMOTE_VISION,
    /** Classic OCR engine used as the last resort. */
    OCR
}
