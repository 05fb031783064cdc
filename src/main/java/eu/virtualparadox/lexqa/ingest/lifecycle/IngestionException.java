package eu.virtualparadox.lexqa.ingest.lifecycle;

/**
 * Ingestion of one document failed. The reason travels as a stable code; nothing of the
 * document is left in the catalog or the indexes.
 */
public class IngestionException extends Exception {

    public enum Reason {
        UNREADABLE_PDF("unreadable_pdf"),
        NO_TEXT_EXTRACTED("no_text_extracted"),
        STORAGE_FAILURE("storage_failure"),
        CANCELLED("cancelled");

        private final String code;

        Reason(final String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Reason reason;

    public IngestionException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public IngestionException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public String code() {
        return reason.code();
    }
}
