package eu.virtualparadox.lexqa.ingest.extractor.backend;

import lombok.Getter;

/**
 * A single backend failed on a single page: model unavailable, inference error,
 * malformed image or timeout. The orchestrator moves on to the next backend.
 */
@Getter
public class ExtractionException extends Exception {

    private final String backend;

    public ExtractionException(final String backend, final String message) {
        super(message);
        this.backend = backend;
    }

    public ExtractionException(final String backend, final String message, final Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }
}
