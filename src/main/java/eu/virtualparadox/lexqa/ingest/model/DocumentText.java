package eu.virtualparadox.lexqa.ingest.model;

import java.util.List;

/**
 * Normalized text of a whole document together with the span every page occupies in it.
 *
 * @param text  page texts joined by single spaces
 * @param pages one span per page, in page order
 */
public record DocumentText(String text, List<PageSpan> pages) {

    public DocumentText {
        pages = List.copyOf(pages);
    }

    /**
     * @param offset character offset into {@link #text()}
     * @return the one-based page holding the offset, or 0 if no page does
     */
    public int pageAt(final int offset) {
        int lo = 0;
        int hi = pages.size() - 1;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            final PageSpan span = pages.get(mid);
            if (offset < span.start()) {
                hi = mid - 1;
            } else if (offset >= span.end()) {
                lo = mid + 1;
            } else {
                return span.pageNumber();
            }
        }
        return 0;
    }
}
