package eu.virtualparadox.lexqa.rag.index;

/**
 * An on-disk index cannot be used: it is corrupt or was built with another embedding model.
 * Raised at startup; the indexes must then be rebuilt from the chunk store.
 */
public class IndexIntegrityException extends RuntimeException {

    static final String REBUILD_HINT = "restart with lexqa.index-settings.rebuild-on-startup=true to rebuild it from stored chunks";

    public IndexIntegrityException(final String message) {
        super(message + "; " + REBUILD_HINT);
    }

    public IndexIntegrityException(final String message, final Throwable cause) {
        super(message + "; " + REBUILD_HINT, cause);
    }
}
