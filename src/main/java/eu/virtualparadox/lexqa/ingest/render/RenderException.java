package eu.virtualparadox.lexqa.ingest.render;

import lombok.Getter;

/**
 * Raised when a PDF or one of its pages cannot be rasterized.
 */
@Getter
public class RenderException extends Exception {

    public enum Reason {
        PAGE_OUT_OF_RANGE,
        CORRUPT,
        ENCRYPTED,
        RENDERING
    }

    private final Reason reason;
    /** Zero-based page index, or -1 when the whole document is affected. */
    private final int pageIndex;

    public RenderException(final Reason reason, final int pageIndex, final String message) {
        super(message);
        this.reason = reason;
        this.pageIndex = pageIndex;
    }

    public RenderException(final Reason reason, final int pageIndex, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.pageIndex = pageIndex;
    }
}
