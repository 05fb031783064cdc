package eu.virtualparadox.lexqa.ingest.extractor.backend;

import java.awt.image.BufferedImage;

/**
 * One vision-language or OCR engine turning a page image into text.
 * <p>
 * Backends initialize lazily. {@link #isReady()} triggers the initialization and reports
 * whether the engine can be used; an unready backend is skipped by the orchestrator.
 * Implementations must be safe to call from several page workers at once.
 */
public interface ExtractorBackend {

    /** Configuration name, e.g. {@code donut}. */
    String name();

    BackendKind kind();

    boolean isReady();

    /**
     * @param image     rendered page
     * @param pageIndex zero-based page index, for logging
     * @return extracted text and confidence
     * @throws ExtractionException if the engine cannot produce a result for this page
     */
    ExtractedText extract(BufferedImage image, int pageIndex) throws ExtractionException;
}
