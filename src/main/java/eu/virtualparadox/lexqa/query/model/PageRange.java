package eu.virtualparadox.lexqa.query.model;

/**
 * Inclusive one-based page range.
 */
public record PageRange(int fromPage, int toPage) {

    public PageRange {
        if (fromPage > toPage) {
            throw new IllegalArgumentException("fromPage " + fromPage + " > toPage " + toPage);
        }
    }

    public String asString() {
        return fromPage == toPage ? String.valueOf(fromPage) : fromPage + "-" + toPage;
    }
}
